package com.flashtasks.search.ingest;

import com.flashtasks.search.common.UnauthorizedException;
import com.flashtasks.search.config.IndexingProperties;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;

/**
 * Optional shared-secret check for webhook deliveries. Disabled when no secret is configured.
 */
@Component
public class WebhookAuthenticator {
    private static final Logger logger = LoggerFactory.getLogger(WebhookAuthenticator.class);

    private final IndexingProperties properties;

    public WebhookAuthenticator(IndexingProperties properties) {
        this.properties = properties;
    }

    public void verify(HttpHeaders headers) {
        String expected = properties.getWebhookSecret();
        if (expected == null || expected.isBlank()) {
            return;
        }
        String provided = headers == null ? null : headers.getFirst("x-webhook-secret");
        if (provided == null && headers != null) {
            provided = headers.getFirst("x-webhook-token");
        }
        if (provided == null || !MessageDigest.isEqual(
            expected.getBytes(StandardCharsets.UTF_8),
            provided.getBytes(StandardCharsets.UTF_8)
        )) {
            logger.warn("webhook_rejected reason=secret_mismatch");
            throw new UnauthorizedException("webhook secret mismatch");
        }
    }
}
