package com.stravatalk.activity.service;

import com.stravatalk.activity.config.ActivityServiceProperties;
import com.stravatalk.activity.error.AuthorizationException;
import com.stravatalk.activity.error.ForeignSubscriptionException;
import com.stravatalk.activity.error.UpstreamException;
import com.stravatalk.activity.model.Activity;
import com.stravatalk.activity.model.StravaActivity;
import com.stravatalk.activity.model.WebhookEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.Map;

/**
 * Dispatches verified push events to the reconciler and the token manager.
 *
 * Each delivery moves RECEIVED → VERIFIED → DISPATCHED and ends APPLIED, or FAILED
 * when an exception propagates to the caller. Events that need no action (unknown
 * types, activities that have since disappeared) are acknowledged as IGNORED so the
 * sender stops redelivering them.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WebhookEventRouter {

    public enum DeliveryState { RECEIVED, VERIFIED, DISPATCHED, APPLIED, FAILED }

    public enum Outcome {
        APPLIED, IGNORED;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }

    private final ActivityReconciler reconciler;
    private final TokenLifecycleManager tokenManager;
    private final StravaApiClient stravaApiClient;
    private final ActivityMapper mapper;
    private final ActivityServiceProperties properties;

    /**
     * @return APPLIED if storage changed, IGNORED if the event was acknowledged without effect
     * @throws ForeignSubscriptionException if the event belongs to another subscription
     * @throws AuthorizationException       if the owner's credential is missing or unusable
     * @throws IllegalArgumentException if required fields are missing
     */
    public Outcome route(WebhookEvent event) {
        DeliveryState state = DeliveryState.RECEIVED;
        log.debug("Webhook {}: {}/{} object={} owner={}", state,
                event.getObjectType(), event.getAspectType(), event.getObjectId(), event.getOwnerId());
        try {
            verify(event);
            state = DeliveryState.VERIFIED;

            state = DeliveryState.DISPATCHED;
            Outcome outcome = dispatch(event);

            state = DeliveryState.APPLIED;
            log.info("Webhook {}/{} for object {} (owner {}) {}", event.getObjectType(), event.getAspectType(),
                    event.getObjectId(), event.getOwnerId(), outcome.label());
            return outcome;
        } catch (RuntimeException e) {
            log.error("Webhook {}/{} for object {} {} after {}: {}", event.getObjectType(),
                    event.getAspectType(), event.getObjectId(), DeliveryState.FAILED, state, e.getMessage());
            throw e;
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private void verify(WebhookEvent event) {
        if (event.getObjectType() == null || event.getAspectType() == null
                || event.getObjectId() == null || event.getOwnerId() == null) {
            throw new IllegalArgumentException("Webhook event is missing object_type, aspect_type, object_id or owner_id");
        }
        Long expected = properties.getWebhook().getSubscriptionId();
        if (expected != null && !expected.equals(event.getSubscriptionId())) {
            throw new ForeignSubscriptionException(event.getSubscriptionId());
        }
    }

    private Outcome dispatch(WebhookEvent event) {
        long objectId = event.getObjectId();
        long ownerId = event.getOwnerId();

        return switch (event.object()) {
            case ACTIVITY -> switch (event.aspect()) {
                case CREATE -> fetchAndUpsert(objectId, ownerId);
                case UPDATE -> applyUpdate(objectId, ownerId, event.updatesOrEmpty());
                case DELETE -> {
                    reconciler.delete(objectId, ownerId);
                    yield Outcome.APPLIED;
                }
                default -> ignore(event);
            };
            case ATHLETE -> {
                if (event.aspect() == WebhookEvent.AspectType.UPDATE
                        && "false".equals(String.valueOf(event.updatesOrEmpty().get("authorized")))) {
                    tokenManager.revoke(ownerId);
                    yield Outcome.APPLIED;
                }
                yield ignore(event);
            }
            default -> ignore(event);
        };
    }

    private Outcome fetchAndUpsert(long activityId, long ownerId) {
        String token = tokenManager.getValidToken(ownerId);
        StravaActivity raw;
        try {
            raw = stravaApiClient.fetchActivity(activityId, token);
        } catch (UpstreamException e) {
            if (e.isNotFound()) {
                log.info("Activity {} no longer available from Strava; nothing to store", activityId);
                return Outcome.IGNORED;
            }
            throw e;
        }
        Activity activity = mapper.map(raw, ownerId);
        return reconciler.upsert(activity, ownerId) ? Outcome.APPLIED : Outcome.IGNORED;
    }

    private Outcome applyUpdate(long activityId, long ownerId, Map<String, Object> updates) {
        Map<String, Object> columns = mapper.toColumnUpdates(updates);
        if (columns.isEmpty()) {
            log.debug("Update for activity {} carries no stored fields: {}", activityId, updates.keySet());
            return Outcome.IGNORED;
        }
        if (reconciler.patch(activityId, ownerId, columns)) {
            return Outcome.APPLIED;
        }
        // update overtook its create, or the create was lost
        if (properties.getWebhook().isFetchOnMissingPatch()) {
            log.info("Activity {} not stored yet; fetching it to apply update", activityId);
            return fetchAndUpsert(activityId, ownerId);
        }
        return Outcome.IGNORED;
    }

    private Outcome ignore(WebhookEvent event) {
        log.warn("Ignoring unsupported webhook event {}/{} for object {}",
                event.getObjectType(), event.getAspectType(), event.getObjectId());
        return Outcome.IGNORED;
    }
}
