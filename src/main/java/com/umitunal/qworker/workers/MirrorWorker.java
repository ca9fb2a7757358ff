package com.umitunal.qworker.workers;

import com.umitunal.qworker.core.Job;
import com.umitunal.qworker.ratelimit.RateLimitRule;
import com.umitunal.qworker.ratelimit.RateLimitedTenantMirror;
import com.umitunal.qworker.ratelimit.RateLimiter;
import com.umitunal.qworker.worker.ProcessingResult;
import com.umitunal.qworker.worker.QueueProcessingWorker;
import com.umitunal.qworker.worker.WorkerContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Mirrors inbound e-mail into tenant streams, limited per tenant.
 *
 * A rate-limited e-mail is dropped and reported as handled, so it is neither
 * retried nor quarantined. Replies to missed-message e-mails bypass the limiter.
 */
public class MirrorWorker extends QueueProcessingWorker {
    private static final Logger log = LoggerFactory.getLogger(MirrorWorker.class);

    public static final String QUEUE_NAME = "email_mirror";

    private final EmailMirror mirror;
    private final RateLimiter rateLimiter;
    private final List<RateLimitRule> rules;
    private final EmailGatewayAddress gatewayAddress;

    public MirrorWorker(WorkerContext context, EmailMirror mirror, RateLimiter rateLimiter) {
        super(context);
        this.mirror = Objects.requireNonNull(mirror, "mirror");
        this.rateLimiter = Objects.requireNonNull(rateLimiter, "rateLimiter");
        this.rules = context.getConfig().getMirrorRateLimitRules();
        this.gatewayAddress = new EmailGatewayAddress(context.getConfig().getEmailGatewayPattern());
    }

    @Override
    protected ProcessingResult consume(Job job) throws Exception {
        String recipient = Payloads.requireString(job, "rcpt_to");
        if (!gatewayAddress.isMissedMessageAddress(recipient)) {
            String tenant = mirror.tenantFor(recipient);
            if (rateLimiter.rateLimit(new RateLimitedTenantMirror(tenant, rules))) {
                log.warn("Rejecting an email from {} to tenant {}: rate limited",
                        Payloads.optionalString(job, "mail_from"), tenant);
                return ProcessingResult.success();
            }
        }
        mirror.mirror(job.getPayload());
        return ProcessingResult.success();
    }
}
