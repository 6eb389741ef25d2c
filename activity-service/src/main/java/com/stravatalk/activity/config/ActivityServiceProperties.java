package com.stravatalk.activity.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "activity-service")
@Data
public class ActivityServiceProperties {

    private Strava strava = new Strava();
    private Webhook webhook = new Webhook();
    private Token token = new Token();
    private Gateway gateway = new Gateway();
    private Schema schema = new Schema();
    private Sync sync = new Sync();

    @Data
    public static class Strava {
        private String apiBaseUrl = "https://www.strava.com/api/v3";
        private String oauthBaseUrl = "https://www.strava.com/oauth";
        private String clientId;
        private String clientSecret;
        private String redirectUri = "http://localhost:8080/oauth/callback";
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(15);
    }

    @Data
    public static class Webhook {
        /** Shared secret echoed back by the provider during subscription verification. */
        private String verifyToken;
        private String callbackUrl;
        /** When set, events carrying another subscription id are rejected. */
        private Long subscriptionId;
        /** Fetch and create the activity when an update arrives before its create. */
        private boolean fetchOnMissingPatch = true;
        private boolean ensureSubscriptionOnStartup = false;
    }

    @Data
    public static class Token {
        /** Credentials expiring within this window are refreshed early. */
        private Duration refreshSkew = Duration.ofSeconds(60);
    }

    @Data
    public static class Gateway {
        private String tenantColumn = "tenant_id";
        private List<String> tenantScopedTables = new ArrayList<>(List.of("activities"));
        private Duration statementTimeout = Duration.ofSeconds(10);
        private TenantPredicatePolicy tenantPredicatePolicy = TenantPredicatePolicy.OVERRIDE;
        /** Functions a candidate may call. Any other function, or a schema-qualified one, is refused. */
        private List<String> allowedFunctions = new ArrayList<>(List.of(
                // aggregates
                "count", "sum", "avg", "min", "max", "stddev", "stddev_pop", "stddev_samp",
                "variance", "var_pop", "var_samp", "percentile_cont", "percentile_disc", "mode",
                "string_agg", "bool_and", "bool_or",
                // window
                "row_number", "rank", "dense_rank", "ntile", "lag", "lead", "first_value",
                "last_value", "percent_rank", "cume_dist",
                // math
                "abs", "ceil", "ceiling", "floor", "round", "trunc", "sqrt", "power", "mod",
                "ln", "log", "exp", "sign", "greatest", "least",
                // string
                "lower", "upper", "length", "char_length", "substring", "substr", "trim", "btrim",
                "ltrim", "rtrim", "concat", "concat_ws", "replace", "left", "right", "strpos",
                "split_part", "initcap", "lpad", "rpad", "starts_with",
                // date and time
                "date_trunc", "date_part", "extract", "to_char", "to_date", "to_timestamp", "now",
                "age", "make_date", "make_interval", "justify_interval",
                // conditional
                "coalesce", "nullif"));
        /** Session setting carrying the tenant id for the row-level-security policy. */
        private String tenantSetting = "app.current_tenant_id";

        public enum TenantPredicatePolicy {
            /** Drop literal tenant comparisons and enforce the session tenant. */
            OVERRIDE,
            /** Refuse any candidate that mentions the tenant column. */
            REJECT
        }
    }

    @Data
    public static class Schema {
        private boolean initialize = true;
        private boolean rowLevelSecurity = false;
    }

    @Data
    public static class Sync {
        private int pageSize = 30;
    }
}
