package com.stravatalk.activity.web;

import com.stravatalk.activity.config.ActivityServiceProperties;
import com.stravatalk.activity.error.ForeignSubscriptionException;
import com.stravatalk.activity.model.WebhookEvent;
import com.stravatalk.activity.service.WebhookEventRouter;
import com.stravatalk.activity.service.WebhookSubscriptionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class WebhookController {

    private final WebhookEventRouter router;
    private final WebhookSubscriptionService subscriptionService;
    private final ActivityServiceProperties properties;

    // ── Subscription verification ─────────────────────────────────────────────

    /**
     * Echo the challenge when Strava verifies the callback URL.
     *
     * GET /webhook?hub.mode=subscribe&hub.challenge=abc&hub.verify_token=secret
     *
     * Plain parameter names (mode, challenge, verify_token) are accepted too.
     */
    @GetMapping("/webhook")
    public ResponseEntity<Map<String, String>> verify(
            @RequestParam(name = "hub.mode", required = false) String hubMode,
            @RequestParam(name = "hub.challenge", required = false) String hubChallenge,
            @RequestParam(name = "hub.verify_token", required = false) String hubVerifyToken,
            @RequestParam(name = "mode", required = false) String mode,
            @RequestParam(name = "challenge", required = false) String challenge,
            @RequestParam(name = "verify_token", required = false) String verifyToken) {

        String effectiveMode = hubMode != null ? hubMode : mode;
        String effectiveChallenge = hubChallenge != null ? hubChallenge : challenge;
        String effectiveToken = hubVerifyToken != null ? hubVerifyToken : verifyToken;

        if (!"subscribe".equals(effectiveMode) || effectiveChallenge == null
                || !tokenMatches(effectiveToken)) {
            log.warn("Webhook verification refused (mode={})", effectiveMode);
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", "verification failed"));
        }

        log.info("Webhook subscription verified");
        Map<String, String> body = new LinkedHashMap<>();
        body.put("hub.challenge", effectiveChallenge);
        body.put("challenge", effectiveChallenge);
        return ResponseEntity.ok(body);
    }

    // ── Event delivery ────────────────────────────────────────────────────────

    /**
     * Receive one push event. A 2xx acknowledges it; anything else makes Strava
     * deliver it again later. A missing or revoked owner credential is a processing
     * failure (500) so the event is redelivered once the athlete reconnects; only a
     * foreign subscription is refused with 403.
     */
    @PostMapping("/webhook")
    public ResponseEntity<Map<String, String>> receive(@RequestBody WebhookEvent event) {
        try {
            WebhookEventRouter.Outcome outcome = router.route(event);
            return ResponseEntity.ok(Map.of("status", outcome.label()));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (ForeignSubscriptionException e) {
            log.warn("Webhook refused: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.FORBIDDEN).body(Map.of("error", e.getMessage()));
        } catch (Exception e) {
            log.error("Webhook processing failed for object {}: {}", event.getObjectId(), e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", "event processing failed"));
        }
    }

    // ── Subscription management ───────────────────────────────────────────────

    @PostMapping("/webhook/subscription")
    public ResponseEntity<Map<String, Object>> ensureSubscription() {
        return ResponseEntity.ok(subscriptionService.ensureSubscription());
    }

    private boolean tokenMatches(String supplied) {
        String expected = properties.getWebhook().getVerifyToken();
        if (supplied == null || expected == null || expected.isEmpty()) {
            return false;
        }
        return MessageDigest.isEqual(
                supplied.getBytes(StandardCharsets.UTF_8),
                expected.getBytes(StandardCharsets.UTF_8));
    }
}
