package com.stravatalk.activity.gateway;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SafeQueryTest {

    private static final SafeQuery.Slot TENANT = SafeQuery.Slot.TENANT;

    @Test
    void interleavesTenantAndCandidateValues() {
        SafeQuery query = new SafeQuery("SELECT ...", 9L, QueryShape.ROW_LEVEL,
                List.of(new SafeQuery.Slot(0), TENANT, new SafeQuery.Slot(1), TENANT));

        assertThat(query.tenantPlaceholderCount()).isEqualTo(2);
        assertThat(query.bind(List.of("a", "b"))).containsExactly("a", 9L, "b", 9L);
    }

    @Test
    void refusesWrongCandidateArity() {
        SafeQuery query = new SafeQuery("SELECT ...", 9L, QueryShape.ROW_LEVEL,
                List.of(TENANT, new SafeQuery.Slot(0)));

        assertThatThrownBy(() -> query.bind(List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("expects 1");
        assertThatThrownBy(query::parameters).isInstanceOf(IllegalStateException.class);
    }
}
