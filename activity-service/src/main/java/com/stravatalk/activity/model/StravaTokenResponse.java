package com.stravatalk.activity.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Body of the Strava token endpoint for both the authorization-code and the
 * refresh-token grants. The athlete block is only present on the code exchange.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class StravaTokenResponse {

    @JsonProperty("access_token")
    private String accessToken;

    @JsonProperty("refresh_token")
    private String refreshToken;

    /** Epoch seconds */
    @JsonProperty("expires_at")
    private Long expiresAt;

    @JsonProperty("token_type")
    private String tokenType;

    private StravaActivity.Athlete athlete;

    @Override
    public String toString() {
        return "StravaTokenResponse(expiresAt=" + expiresAt + ", athlete=" + athlete + ")";
    }
}
