package com.stravatalk.activity.scheduler;

import com.stravatalk.activity.config.ActivityServiceProperties;
import com.stravatalk.activity.service.WebhookSubscriptionService;
import com.stravatalk.activity.store.SchemaInitializer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * On application startup:
 *  1. Ensure the database schema exists (unless disabled)
 *  2. Once ready, optionally register the webhook subscription
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StartupTasks {

    private final SchemaInitializer schemaInitializer;
    private final WebhookSubscriptionService subscriptionService;
    private final ActivityServiceProperties properties;

    @PostConstruct
    public void onStartup() {
        if (properties.getSchema().isInitialize()) {
            schemaInitializer.ensureSchema();
        } else {
            log.info("Schema initialisation disabled; expecting tables to exist");
        }
    }

    /** Runs once the server accepts requests; Strava verifies the callback synchronously. */
    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (!properties.getWebhook().isEnsureSubscriptionOnStartup()) {
            return;
        }
        try {
            subscriptionService.ensureSubscription();
        } catch (Exception e) {
            log.error("Could not ensure webhook subscription: {}", e.getMessage(), e);
        }
    }
}
