package com.umitunal.qworker.workers;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * {@link MailingListClient} posting JSON members to a list's member endpoint
 * with basic authentication.
 */
public class HttpMailingListClient implements MailingListClient {
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final URI membersEndpoint;
    private final String listId;
    private final String apiKey;
    private final HttpClient httpClient;
    private final ObjectMapper mapper;
    private final Duration timeout;

    public HttpMailingListClient(URI membersEndpoint, String listId, String apiKey) {
        this(membersEndpoint, listId, apiKey,
                HttpClient.newBuilder().connectTimeout(DEFAULT_TIMEOUT).build(), DEFAULT_TIMEOUT);
    }

    public HttpMailingListClient(URI membersEndpoint, String listId, String apiKey,
                                 HttpClient httpClient, Duration timeout) {
        this.membersEndpoint = membersEndpoint;
        this.listId = listId;
        this.apiKey = apiKey;
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.timeout = timeout;
    }

    /**
     * Client for a Mailchimp list; the data center is the API key's suffix after '-'.
     */
    public static HttpMailingListClient forMailchimp(String apiKey, String listId) {
        int dash = apiKey == null ? -1 : apiKey.lastIndexOf('-');
        if (dash < 0 || dash == apiKey.length() - 1) {
            throw new IllegalArgumentException("API key has no data center suffix");
        }
        String dataCenter = apiKey.substring(dash + 1);
        URI endpoint = URI.create("https://" + dataCenter + ".api.mailchimp.com/3.0/lists/" + listId + "/members");
        return new HttpMailingListClient(endpoint, listId, apiKey);
    }

    @Override
    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public MailingListResponse subscribe(Map<String, Object> member) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>(member);
        if (listId != null) {
            body.put("list_id", listId);
        }

        HttpRequest request = HttpRequest.newBuilder(membersEndpoint)
                .timeout(timeout)
                .header("Content-Type", "application/json")
                .header("Authorization", basicAuth())
                .POST(HttpRequest.BodyPublishers.ofByteArray(mapper.writeValueAsBytes(body)))
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request,
                    HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return new MailingListResponse(response.statusCode(), response.body());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted posting to " + membersEndpoint, e);
        }
    }

    private String basicAuth() {
        String credentials = "apikey:" + apiKey;
        return "Basic " + Base64.getEncoder().encodeToString(credentials.getBytes(StandardCharsets.UTF_8));
    }
}
