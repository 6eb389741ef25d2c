package com.stravatalk.activity.service;

import com.stravatalk.activity.config.ActivityServiceProperties;
import com.stravatalk.activity.error.OperationTimeoutException;
import com.stravatalk.activity.error.UpstreamException;
import com.stravatalk.activity.model.StravaActivity;
import com.stravatalk.activity.model.StravaTokenResponse;
import io.github.resilience4j.ratelimiter.annotation.RateLimiter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Service;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Thin client over the Strava REST API and its OAuth token endpoint.
 *
 * Nothing here retries. Webhook handlers report failure so the sender redelivers,
 * and a failed token refresh must surface rather than be repeated silently.
 * Backfill pages go through the {@code stravaApi} rate limiter so a long history
 * does not exhaust the application's request quota.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class StravaApiClient {

    private static final ParameterizedTypeReference<List<Map<String, Object>>> SUBSCRIPTION_LIST =
            new ParameterizedTypeReference<>() {};
    private static final ParameterizedTypeReference<Map<String, Object>> SUBSCRIPTION =
            new ParameterizedTypeReference<>() {};

    private final RestTemplate restTemplate;
    private final ActivityServiceProperties properties;

    /**
     * Fetch the detailed representation of one activity.
     *
     * @throws UpstreamException with status 404 when the activity is gone or private
     */
    public StravaActivity fetchActivity(long activityId, String accessToken) {
        String url = apiUrl("/activities/" + activityId).toUriString();
        return call("GET " + url, () -> restTemplate.exchange(
                url, HttpMethod.GET, new HttpEntity<>(bearer(accessToken)), StravaActivity.class).getBody());
    }

    /**
     * One page of the authenticated athlete's activities, newest first.
     *
     * @param page    1-based page number
     * @param perPage page size, capped at the provider maximum of 200
     * @return activities on the page (empty past the end, never null)
     */
    @RateLimiter(name = "stravaApi")
    public List<StravaActivity> fetchActivitiesPage(String accessToken, int page, int perPage) {
        String url = apiUrl("/athlete/activities")
                .queryParam("page", page)
                .queryParam("per_page", Math.min(Math.max(perPage, 1), 200))
                .toUriString();
        StravaActivity[] body = call("GET " + url, () -> restTemplate.exchange(
                url, HttpMethod.GET, new HttpEntity<>(bearer(accessToken)), StravaActivity[].class).getBody());
        if (body == null) {
            return Collections.emptyList();
        }
        log.debug("Activities page {} returned {} entries", page, body.length);
        return Arrays.asList(body);
    }

    public StravaTokenResponse refreshToken(String refreshToken) {
        MultiValueMap<String, String> form = clientCredentials();
        form.add("grant_type", "refresh_token");
        form.add("refresh_token", refreshToken);
        return postToken(form);
    }

    /** Exchange the code handed to the OAuth callback for a first credential. */
    public StravaTokenResponse exchangeCode(String code) {
        MultiValueMap<String, String> form = clientCredentials();
        form.add("grant_type", "authorization_code");
        form.add("code", code);
        return postToken(form);
    }

    public List<Map<String, Object>> listSubscriptions() {
        String url = apiUrl("/push_subscriptions")
                .queryParam("client_id", properties.getStrava().getClientId())
                .queryParam("client_secret", properties.getStrava().getClientSecret())
                .toUriString();
        List<Map<String, Object>> body = call("GET /push_subscriptions", () -> restTemplate.exchange(
                url, HttpMethod.GET, null, SUBSCRIPTION_LIST).getBody());
        return body == null ? Collections.emptyList() : body;
    }

    /**
     * Register the callback URL. Strava verifies it synchronously by calling
     * {@code GET /webhook} before this returns.
     */
    public Map<String, Object> createSubscription(String callbackUrl, String verifyToken) {
        MultiValueMap<String, String> form = clientCredentials();
        form.add("callback_url", callbackUrl);
        form.add("verify_token", verifyToken);
        String url = apiUrl("/push_subscriptions").toUriString();
        return call("POST /push_subscriptions", () -> restTemplate.exchange(
                url, HttpMethod.POST, new HttpEntity<>(form, formHeaders()), SUBSCRIPTION).getBody());
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private StravaTokenResponse postToken(MultiValueMap<String, String> form) {
        String url = properties.getStrava().getOauthBaseUrl() + "/token";
        ResponseEntity<StravaTokenResponse> response = call("POST /oauth/token", () -> restTemplate.postForEntity(
                url, new HttpEntity<>(form, formHeaders()), StravaTokenResponse.class));
        StravaTokenResponse body = response.getBody();
        if (body == null || body.getAccessToken() == null || body.getExpiresAt() == null) {
            throw new UpstreamException(response.getStatusCode().value(), "Token endpoint returned an incomplete body");
        }
        return body;
    }

    private <T> T call(String description, Supplier<T> request) {
        log.debug("Calling Strava API: {}", description);
        try {
            return request.get();
        } catch (RestClientResponseException e) {
            log.warn("Strava API {} answered {}", description, e.getStatusCode().value());
            throw new UpstreamException(e.getStatusCode().value(),
                    "Strava API returned " + e.getStatusCode().value() + " for " + description, e);
        } catch (ResourceAccessException e) {
            log.error("Strava API {} unreachable: {}", description, e.getMessage());
            throw new OperationTimeoutException("Strava API did not respond: " + description, e);
        }
    }

    private UriComponentsBuilder apiUrl(String path) {
        return UriComponentsBuilder.fromHttpUrl(properties.getStrava().getApiBaseUrl() + path);
    }

    private MultiValueMap<String, String> clientCredentials() {
        MultiValueMap<String, String> form = new LinkedMultiValueMap<>();
        form.add("client_id", properties.getStrava().getClientId());
        form.add("client_secret", properties.getStrava().getClientSecret());
        return form;
    }

    private static HttpHeaders bearer(String accessToken) {
        HttpHeaders headers = new HttpHeaders();
        headers.setBearerAuth(accessToken);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }

    private static HttpHeaders formHeaders() {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_FORM_URLENCODED);
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        return headers;
    }
}
