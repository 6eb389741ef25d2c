package com.stravatalk.activity.web;

import com.stravatalk.activity.gateway.SchemaCatalogService;
import com.stravatalk.activity.gateway.TenantQueryGateway;
import com.stravatalk.activity.model.CandidateQuery;
import com.stravatalk.activity.model.QueryResult;
import com.stravatalk.activity.output.QueryResultCsvWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Internal boundary used by the conversational front end. The tenant comes from the
 * {@value #TENANT_HEADER} header, which the authenticating proxy sets from the session;
 * nothing in the request body can change it.
 */
@RestController
@RequestMapping("/internal")
@Slf4j
@RequiredArgsConstructor
public class QueryController {

    static final String TENANT_HEADER = "X-Tenant-Id";

    private final TenantQueryGateway gateway;
    private final SchemaCatalogService schemaCatalogService;
    private final QueryResultCsvWriter csvWriter;

    public record QueryRequest(String sql, List<Object> params) {
    }

    /**
     * POST /internal/query  {"sql": "SELECT ...", "params": [...]}
     *
     * Responds 200 with the QueryResult on success, 422 when the query was refused or
     * failed, 504 on timeout. With format=csv or Accept: text/csv a successful result is
     * returned as CSV.
     */
    @PostMapping("/query")
    public ResponseEntity<?> query(
            @RequestHeader(TENANT_HEADER) long tenantId,
            @RequestBody QueryRequest request,
            @RequestParam(required = false) String format,
            @RequestHeader(value = HttpHeaders.ACCEPT, required = false) String accept) {

        QueryResult result = gateway.run(new CandidateQuery(request.sql(), tenantId, request.params()));

        if (!result.success()) {
            return ResponseEntity.status(result.timedOut() ? 504 : 422).body(result);
        }
        if ("csv".equalsIgnoreCase(format) || (accept != null && accept.contains("text/csv"))) {
            return ResponseEntity.ok()
                    .contentType(new MediaType("text", "csv"))
                    .body(csvWriter.write(result));
        }
        return ResponseEntity.ok(result);
    }

    /**
     * GET /internal/schema
     *
     * Column names, types and descriptions of the queryable tables, for building
     * the prompt that produces candidate SQL.
     */
    @GetMapping("/schema")
    public ResponseEntity<?> schema() {
        try {
            return ResponseEntity.ok(schemaCatalogService.tableDefinitions());
        } catch (Exception e) {
            log.error("Schema lookup failed: {}", e.getMessage(), e);
            return ResponseEntity.internalServerError().body(Map.of("error", "schema lookup failed"));
        }
    }
}
