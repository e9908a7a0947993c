package com.ryuqq.pipeline.adapter.runner.transport;

import com.ryuqq.pipeline.core.contract.ModuleName;
import com.ryuqq.pipeline.core.spi.DirectDelivery;
import com.ryuqq.pipeline.core.spi.DirectDeliveryException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * {@link DirectDelivery} over HTTP.
 *
 * <p>POSTs the encoded envelope as {@code application/json} to the module endpoint. Any 2xx
 * response is the acknowledgment; every other status, I/O error or timeout is a failed attempt.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class HttpDirectDelivery implements DirectDelivery {

    private static final Logger log = LoggerFactory.getLogger(HttpDirectDelivery.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient httpClient;
    private final Duration requestTimeout;

    public HttpDirectDelivery() {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(5)).build(), DEFAULT_TIMEOUT);
    }

    /**
     * @param httpClient client to send with
     * @param requestTimeout per-request timeout
     */
    public HttpDirectDelivery(HttpClient httpClient, Duration requestTimeout) {
        if (httpClient == null) {
            throw new IllegalArgumentException("httpClient cannot be null");
        }
        if (requestTimeout == null || requestTimeout.isNegative() || requestTimeout.isZero()) {
            throw new IllegalArgumentException("requestTimeout must be positive");
        }
        this.httpClient = httpClient;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public void deliver(ModuleName target, URI endpoint, String wireEnvelope) {
        if (target == null || endpoint == null || wireEnvelope == null) {
            throw new IllegalArgumentException("target, endpoint and wireEnvelope cannot be null");
        }
        HttpRequest request = HttpRequest.newBuilder()
            .uri(endpoint)
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(wireEnvelope, StandardCharsets.UTF_8))
            .build();

        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new DirectDeliveryException("POST to " + endpoint + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DirectDeliveryException("POST to " + endpoint + " interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new DirectDeliveryException(
                "POST to " + endpoint + " returned HTTP " + status, status, null);
        }
        log.debug("Delivered to {} at {} (HTTP {})", target.wireName(), endpoint, status);
    }
}
