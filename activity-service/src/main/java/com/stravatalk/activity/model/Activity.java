package com.stravatalk.activity.model;

import lombok.Builder;
import lombok.Data;

import java.time.OffsetDateTime;

/**
 * Activity row as stored in the shared {@code activities} table.
 *
 * Schema design notes:
 *  - id is the Strava activity id, stable and unique across all athletes
 *  - tenantId is the owning athlete; it is stamped by whichever channel writes
 *    the row and never taken from a fetched payload
 *  - rows are removed outright on delete, there is no soft-delete flag
 */
@Data
@Builder
public class Activity {

    private Long id;

    private Long tenantId;

    private String name;

    /** Metres */
    private Double distance;

    /** Seconds */
    private Integer movingTime;

    /** Seconds */
    private Integer elapsedTime;

    /** Metres */
    private Double totalElevationGain;

    /** Run, Ride, Swim, ... */
    private String type;

    private OffsetDateTime startDate;
}
