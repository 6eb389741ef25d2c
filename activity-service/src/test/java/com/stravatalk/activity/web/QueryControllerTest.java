package com.stravatalk.activity.web;

import com.stravatalk.activity.gateway.SchemaCatalogService;
import com.stravatalk.activity.gateway.TenantQueryGateway;
import com.stravatalk.activity.model.CandidateQuery;
import com.stravatalk.activity.model.QueryResult;
import com.stravatalk.activity.output.QueryResultCsvWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class QueryControllerTest {

    @Mock
    private TenantQueryGateway gateway;
    @Mock
    private SchemaCatalogService schemaCatalogService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders
                .standaloneSetup(new QueryController(gateway, schemaCatalogService, new QueryResultCsvWriter()))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void takesTenantFromHeaderOnly() throws Exception {
        when(gateway.run(any(CandidateQuery.class))).thenReturn(
                QueryResult.of(List.of("count"), List.of(Map.of("count", 12)), "AGGREGATE"));

        mockMvc.perform(post("/internal/query")
                        .header("X-Tenant-Id", "42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\": \"SELECT COUNT(*) FROM activities WHERE tenant_id = 7\", \"tenantId\": 7}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.row_count").value(1))
                .andExpect(jsonPath("$.rows[0].count").value(12));

        ArgumentCaptor<CandidateQuery> captor = ArgumentCaptor.forClass(CandidateQuery.class);
        verify(gateway).run(captor.capture());
        assertThat(captor.getValue().tenantId()).isEqualTo(42L);
    }

    @Test
    void refusedQueryIsUnprocessable() throws Exception {
        when(gateway.run(any(CandidateQuery.class))).thenReturn(QueryResult.failure("Only SELECT statements are allowed"));

        mockMvc.perform(post("/internal/query")
                        .header("X-Tenant-Id", "42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\": \"DROP TABLE activities\"}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error_message").value("Only SELECT statements are allowed"));
    }

    @Test
    void timeoutIsGatewayTimeout() throws Exception {
        when(gateway.run(any(CandidateQuery.class))).thenReturn(QueryResult.timeout("Query exceeded the 10s time limit"));

        mockMvc.perform(post("/internal/query")
                        .header("X-Tenant-Id", "42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\": \"SELECT * FROM activities\"}"))
                .andExpect(status().isGatewayTimeout())
                .andExpect(jsonPath("$.timed_out").value(true));
    }

    @Test
    void rendersCsvOnRequest() throws Exception {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("type", "Run");
        row.put("total", 3);
        when(gateway.run(any(CandidateQuery.class))).thenReturn(
                QueryResult.of(List.of("type", "total"), List.of(row), "AGGREGATE"));

        mockMvc.perform(post("/internal/query")
                        .param("format", "csv")
                        .header("X-Tenant-Id", "42")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\": \"SELECT type, COUNT(*) AS total FROM activities GROUP BY type\"}"))
                .andExpect(status().isOk())
                .andExpect(content().string("\"type\",\"total\"\n\"Run\",\"3\"\n"));
    }

    @Test
    void missingTenantHeaderIsBadRequest() throws Exception {
        mockMvc.perform(post("/internal/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sql\": \"SELECT * FROM activities\"}"))
                .andExpect(status().isBadRequest());

        verifyNoInteractions(gateway);
    }
}
