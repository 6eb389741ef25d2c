package com.stravatalk.activity.gateway;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A rewritten, tenant-bounded SELECT ready for execution.
 *
 * <p>{@code slots} describes every {@code ?} in {@link #sql()} in textual order: either
 * a tenant placeholder added by the rewriter or one of the candidate's own
 * placeholders. The tenant id is only ever bound, never part of the text.</p>
 *
 * @param sql      rewritten statement with positional placeholders
 * @param tenantId tenant every inserted placeholder binds to
 * @param shape    aggregate or row-level
 * @param slots    placeholder layout in textual order
 */
public record SafeQuery(String sql, long tenantId, QueryShape shape, List<Slot> slots) {

    public SafeQuery {
        slots = List.copyOf(slots);
    }

    /**
     * One positional placeholder.
     *
     * @param candidateIndex index into the candidate's own parameters, or -1 for a tenant placeholder
     */
    public record Slot(int candidateIndex) {

        static final Slot TENANT = new Slot(-1);

        public boolean isTenant() {
            return candidateIndex < 0;
        }
    }

    public int tenantPlaceholderCount() {
        return (int) slots.stream().filter(Slot::isTenant).count();
    }

    public int candidatePlaceholderCount() {
        return slots.size() - tenantPlaceholderCount();
    }

    /**
     * Parameters for a statement without placeholders of its own.
     *
     * @throws IllegalStateException if the candidate declared placeholders; use {@link #bind(List)}
     */
    public List<Object> parameters() {
        if (candidatePlaceholderCount() > 0) {
            throw new IllegalStateException("Statement has " + candidatePlaceholderCount()
                    + " candidate placeholder(s); bind their values explicitly");
        }
        return bind(List.of());
    }

    /**
     * Full positional parameter list: the tenant id at every inserted placeholder and the
     * candidate's own values, in their original order, at theirs.
     */
    public List<Object> bind(List<?> candidateParameters) {
        List<?> candidate = candidateParameters == null ? List.of() : candidateParameters;
        if (candidate.size() != candidatePlaceholderCount()) {
            throw new IllegalArgumentException("Statement expects " + candidatePlaceholderCount()
                    + " candidate parameter(s) but " + candidate.size() + " were supplied");
        }
        List<Object> bound = new ArrayList<>(slots.size());
        for (Slot slot : slots) {
            bound.add(slot.isTenant() ? (Object) tenantId : candidate.get(slot.candidateIndex()));
        }
        return Collections.unmodifiableList(bound);
    }
}
