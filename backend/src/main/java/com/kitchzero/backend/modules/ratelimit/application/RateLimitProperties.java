package com.kitchzero.backend.modules.ratelimit.application;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

import com.kitchzero.backend.modules.ratelimit.domain.EndpointClass;
import com.kitchzero.backend.modules.ratelimit.domain.RateLimitPolicy;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Per endpoint-class limits under {@code app.rate-limit.policies.<class>}. Classes missing from the
 * configuration fall back to the built-in defaults.
 */
@ConfigurationProperties(prefix = "app.rate-limit")
public class RateLimitProperties {

    private static final Map<EndpointClass, RateLimitPolicy> DEFAULTS = new EnumMap<>(EndpointClass.class);

    static {
        register(EndpointClass.LOGIN, 5, Duration.ofMinutes(15));
        register(EndpointClass.REFRESH, 10, Duration.ofMinutes(5));
        register(EndpointClass.API_READ, 100, Duration.ofMinutes(1));
        register(EndpointClass.API_WRITE, 50, Duration.ofMinutes(1));
        register(EndpointClass.API_DELETE, 20, Duration.ofMinutes(1));
        register(EndpointClass.ADMIN_READ, 300, Duration.ofMinutes(1));
        register(EndpointClass.ADMIN_WRITE, 150, Duration.ofMinutes(1));
        register(EndpointClass.ADMIN_DELETE, 50, Duration.ofMinutes(1));
        register(EndpointClass.ANALYTICS, 30, Duration.ofMinutes(1));
        register(EndpointClass.EXPORT, 5, Duration.ofMinutes(5));
    }

    private boolean enabled = true;

    private Map<String, Limit> policies = new LinkedHashMap<>();

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public Map<String, Limit> getPolicies() {
        return policies;
    }

    public void setPolicies(Map<String, Limit> policies) {
        this.policies = policies;
    }

    public RateLimitPolicy policyFor(EndpointClass endpointClass) {
        Limit configured = policies.get(endpointClass.propertyKey());
        if (configured == null) {
            return DEFAULTS.get(endpointClass);
        }
        RateLimitPolicy fallback = DEFAULTS.get(endpointClass);
        int limit = configured.getLimit() != null ? configured.getLimit() : fallback.limit();
        Duration window = configured.getWindow() != null ? configured.getWindow() : fallback.window();
        return new RateLimitPolicy(endpointClass, limit, window);
    }

    private static void register(EndpointClass endpointClass, int limit, Duration window) {
        DEFAULTS.put(endpointClass, new RateLimitPolicy(endpointClass, limit, window));
    }

    public static class Limit {

        private Integer limit;
        private Duration window;

        public Integer getLimit() {
            return limit;
        }

        public void setLimit(Integer limit) {
            this.limit = limit;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }
}
