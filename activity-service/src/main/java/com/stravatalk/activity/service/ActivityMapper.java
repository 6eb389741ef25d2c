package com.stravatalk.activity.service;

import com.stravatalk.activity.model.Activity;
import com.stravatalk.activity.model.StravaActivity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps raw Strava API payloads to the stored Activity model.
 */
@Component
@Slf4j
public class ActivityMapper {

    /**
     * @param raw      payload from the activity or athlete-activities endpoint
     * @param tenantId owner of the event or sync that fetched it; the payload's own
     *                 athlete block is never trusted for this
     */
    public Activity map(StravaActivity raw, long tenantId) {
        return Activity.builder()
                .id(raw.getId())
                .tenantId(tenantId)
                .name(raw.getName())
                .distance(raw.getDistance())
                .movingTime(raw.getMovingTime())
                .elapsedTime(raw.getElapsedTime())
                .totalElevationGain(raw.getTotalElevationGain())
                .type(raw.getType() != null ? raw.getType() : raw.getSportType())
                .startDate(parseStartDate(raw.getStartDate()))
                .build();
    }

    /**
     * Translate a webhook {@code updates} map into column values. Only fields the
     * provider is known to send on update are kept: title and type (sport_type on
     * newer deliveries). Anything else, including privacy flips, is dropped.
     *
     * @return column → value, empty if nothing applies
     */
    public Map<String, Object> toColumnUpdates(Map<String, Object> updates) {
        Map<String, Object> columns = new LinkedHashMap<>();
        if (updates.containsKey("title")) {
            columns.put("name", str(updates.get("title")));
        }
        if (updates.containsKey("type")) {
            columns.put("type", str(updates.get("type")));
        } else if (updates.containsKey("sport_type")) {
            columns.put("type", str(updates.get("sport_type")));
        }
        return columns;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private OffsetDateTime parseStartDate(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return OffsetDateTime.parse(value);
        } catch (DateTimeParseException e) {
            log.warn("Could not parse activity start date: {}", value);
            return null;
        }
    }

    private String str(Object val) {
        return val == null ? null : val.toString();
    }
}
