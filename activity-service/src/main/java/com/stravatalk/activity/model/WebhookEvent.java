package com.stravatalk.activity.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Push event as delivered by the Strava webhook subscription.
 *
 * Delivery is at-least-once and may be out of order; there is no unique delivery id,
 * so everything downstream is keyed by {@code objectId}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WebhookEvent {

    /** activity | athlete (the provider's account object) */
    @JsonProperty("object_type")
    private String objectType;

    /** create | update | delete */
    @JsonProperty("aspect_type")
    private String aspectType;

    @JsonProperty("object_id")
    private Long objectId;

    /** Athlete that owns the object; the tenant every write is stamped with. */
    @JsonProperty("owner_id")
    private Long ownerId;

    /** Partial field map; only present on update events. */
    @Builder.Default
    private Map<String, Object> updates = new LinkedHashMap<>();

    /** Epoch seconds */
    @JsonProperty("event_time")
    private Long eventTime;

    @JsonProperty("subscription_id")
    private Long subscriptionId;

    public ObjectType object() {
        return ObjectType.from(objectType);
    }

    public AspectType aspect() {
        return AspectType.from(aspectType);
    }

    public Map<String, Object> updatesOrEmpty() {
        return updates == null ? Map.of() : updates;
    }

    public enum ObjectType {
        ACTIVITY, ATHLETE, UNKNOWN;

        static ObjectType from(String raw) {
            if (raw == null) return UNKNOWN;
            return switch (raw.toLowerCase(Locale.ROOT)) {
                case "activity" -> ACTIVITY;
                case "athlete", "account" -> ATHLETE;
                default -> UNKNOWN;
            };
        }
    }

    public enum AspectType {
        CREATE, UPDATE, DELETE, UNKNOWN;

        static AspectType from(String raw) {
            if (raw == null) return UNKNOWN;
            return switch (raw.toLowerCase(Locale.ROOT)) {
                case "create" -> CREATE;
                case "update" -> UPDATE;
                case "delete" -> DELETE;
                default -> UNKNOWN;
            };
        }
    }
}
