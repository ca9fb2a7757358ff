package com.umitunal.qworker.workers;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Matches recipients against the e-mail gateway pattern, a literal address
 * with one {@code %s} placeholder such as {@code %s@example.com}.
 */
final class EmailGatewayAddress {
    static final String PLACEHOLDER = "%s";
    static final String MISSED_MESSAGE_PREFIX = "mm";
    static final int MISSED_MESSAGE_TOKEN_LENGTH = 32;

    private final Pattern pattern;

    EmailGatewayAddress(String gatewayPattern) {
        this.pattern = compile(gatewayPattern);
    }

    /**
     * The part of the address standing for the placeholder, if it matches.
     */
    Optional<String> messageString(String address) {
        if (pattern == null || address == null) {
            return Optional.empty();
        }
        Matcher matcher = pattern.matcher(address);
        return matcher.matches() ? Optional.of(matcher.group(1)) : Optional.empty();
    }

    /**
     * Reply addresses of missed-message e-mails carry {@code mm} and a 32 character token.
     */
    boolean isMissedMessageAddress(String address) {
        return messageString(address)
                .filter(s -> s.startsWith(MISSED_MESSAGE_PREFIX)
                        && s.length() == MISSED_MESSAGE_PREFIX.length() + MISSED_MESSAGE_TOKEN_LENGTH)
                .isPresent();
    }

    private static Pattern compile(String gatewayPattern) {
        if (gatewayPattern == null || !gatewayPattern.contains(PLACEHOLDER)) {
            return null;
        }
        int at = gatewayPattern.indexOf(PLACEHOLDER);
        String prefix = gatewayPattern.substring(0, at);
        String suffix = gatewayPattern.substring(at + PLACEHOLDER.length());
        return Pattern.compile(Pattern.quote(prefix) + "(.*?)" + Pattern.quote(suffix), Pattern.CASE_INSENSITIVE);
    }
}
