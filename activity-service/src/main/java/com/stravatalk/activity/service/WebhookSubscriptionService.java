package com.stravatalk.activity.service;

import com.stravatalk.activity.config.ActivityServiceProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Makes sure the application has a push subscription pointing at this service.
 * Strava allows one subscription per application.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WebhookSubscriptionService {

    private final StravaApiClient stravaApiClient;
    private final ActivityServiceProperties properties;

    /**
     * @return the existing or newly created subscription as returned by Strava
     */
    public Map<String, Object> ensureSubscription() {
        ActivityServiceProperties.Webhook webhook = properties.getWebhook();
        if (webhook.getCallbackUrl() == null || webhook.getCallbackUrl().isBlank()) {
            throw new IllegalStateException("activity-service.webhook.callback-url is not configured");
        }
        if (webhook.getVerifyToken() == null || webhook.getVerifyToken().isBlank()) {
            throw new IllegalStateException("activity-service.webhook.verify-token is not configured");
        }

        List<Map<String, Object>> existing = stravaApiClient.listSubscriptions();
        if (!existing.isEmpty()) {
            Map<String, Object> subscription = existing.get(0);
            Object callback = subscription.get("callback_url");
            if (!webhook.getCallbackUrl().equals(callback)) {
                log.warn("Existing subscription {} points at {}, not {}",
                        subscription.get("id"), callback, webhook.getCallbackUrl());
            } else {
                log.info("Webhook subscription {} already registered", subscription.get("id"));
            }
            return subscription;
        }

        log.info("Creating webhook subscription for {}", webhook.getCallbackUrl());
        Map<String, Object> created = stravaApiClient.createSubscription(webhook.getCallbackUrl(), webhook.getVerifyToken());
        log.info("Webhook subscription {} created", created == null ? null : created.get("id"));
        return created;
    }
}
