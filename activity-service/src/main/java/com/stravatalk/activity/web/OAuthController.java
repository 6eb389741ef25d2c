package com.stravatalk.activity.web;

import com.stravatalk.activity.model.TenantCredential;
import com.stravatalk.activity.service.TokenLifecycleManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.util.Map;

@RestController
@RequestMapping("/oauth")
@Slf4j
@RequiredArgsConstructor
public class OAuthController {

    private final TokenLifecycleManager tokenManager;

    /**
     * GET /oauth/authorize?scope=read_all
     *
     * Redirects to the Strava consent page. read covers public activities only,
     * read_all adds private ones.
     */
    @GetMapping("/authorize")
    public ResponseEntity<Void> authorize(@RequestParam(defaultValue = "read") String scope) {
        String requested = "read_all".equals(scope)
                ? TokenLifecycleManager.SCOPE_READ_ALL
                : TokenLifecycleManager.SCOPE_READ;
        return ResponseEntity.status(302)
                .location(URI.create(tokenManager.authorizationUrl(requested)))
                .build();
    }

    /**
     * GET /oauth/callback?code=...&scope=...  or  ?error=access_denied
     */
    @GetMapping("/callback")
    public ResponseEntity<Map<String, Object>> callback(
            @RequestParam(required = false) String code,
            @RequestParam(required = false) String scope,
            @RequestParam(required = false) String error) {
        if (error != null) {
            log.info("Athlete declined authorization: {}", error);
            return ResponseEntity.badRequest().body(Map.of("error", error));
        }
        if (code == null || code.isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "missing authorization code"));
        }
        TenantCredential credential = tokenManager.connect(code, scope);
        return ResponseEntity.ok(Map.of(
                "tenant_id", credential.getTenantId(),
                "scope", credential.getScope()));
    }
}
