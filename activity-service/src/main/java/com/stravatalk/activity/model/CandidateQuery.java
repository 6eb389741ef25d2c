package com.stravatalk.activity.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Untrusted SELECT text proposed by the natural-language layer, plus the tenant
 * taken from the authenticated session. Consumed once by the gateway, never stored.
 *
 * @param sql        candidate query text
 * @param tenantId   tenant of the caller's session, never derived from {@code sql}
 * @param parameters values for positional {@code ?} placeholders in {@code sql}, in order
 */
public record CandidateQuery(String sql, long tenantId, List<Object> parameters) {

    public CandidateQuery {
        parameters = parameters == null
                ? List.of()
                : Collections.unmodifiableList(new ArrayList<>(parameters));
    }

    public CandidateQuery(String sql, long tenantId) {
        this(sql, tenantId, List.of());
    }
}
