package com.warden.authz.rebac;

import com.warden.context.AuthorizationContext;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.Collection;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Activation conditions for {@link ReBAcPolicyDefinition.Builder#activeWhen(Predicate)}.
 */
public final class PolicyActivations {

    /** Key looked up for feature flags, in resolved data and then in attributes. */
    public static final String FEATURES_KEY = "features";

    /** Key looked up for the deployment environment, in meta and then in attributes. */
    public static final String ENVIRONMENT_KEY = "environment";

    private PolicyActivations() {
        // utility class
    }

    /**
     * Active when {@code feature} is enabled for the caller. The {@value #FEATURES_KEY} value
     * may be a collection of enabled names or a map of name to boolean.
     */
    public static Predicate<PolicyEvaluationContext> feature(String feature) {
        return ctx -> {
            Object features = ctx.resolved().get(FEATURES_KEY)
                    .orElseGet(() -> ctx.auth().attributes().get(FEATURES_KEY));
            if (features instanceof Collection<?> enabled) {
                return enabled.contains(feature);
            }
            if (features instanceof Map<?, ?> flags) {
                return Boolean.TRUE.equals(flags.get(feature));
            }
            return false;
        };
    }

    /**
     * Active between {@code startHour} (inclusive) and {@code endHour} (exclusive) in the
     * clock's zone. A start after the end spans midnight, e.g. 22 to 6.
     */
    public static Predicate<PolicyEvaluationContext> timeRange(int startHour, int endHour, Clock clock) {
        checkHour(startHour, "startHour");
        checkHour(endHour, "endHour");
        Objects.requireNonNull(clock, "clock");
        return ctx -> {
            int hour = ZonedDateTime.ofInstant(ctx.timestamp(), clock.getZone()).getHour();
            return startHour > endHour
                    ? hour >= startHour || hour < endHour
                    : hour >= startHour && hour < endHour;
        };
    }

    /** Active when the caller's environment is one of {@code environments}. */
    public static Predicate<PolicyEvaluationContext> environment(String... environments) {
        Set<String> allowed = Set.of(environments);
        return ctx -> {
            AuthorizationContext auth = ctx.auth();
            Object env = auth.meta().getOrDefault(ENVIRONMENT_KEY, auth.attributes().get(ENVIRONMENT_KEY));
            return env != null && allowed.contains(env.toString());
        };
    }

    /** Active when the caller's attribute {@code name} equals {@code value}. */
    public static Predicate<PolicyEvaluationContext> attributeEquals(String name, Object value) {
        return ctx -> Objects.equals(ctx.auth().attributes().get(name), value);
    }

    /** Active when the caller holds any of {@code roles}. */
    public static Predicate<PolicyEvaluationContext> hasAnyRole(String... roles) {
        Set<String> wanted = Set.of(roles);
        return ctx -> ctx.auth().hasAnyRole(wanted);
    }

    private static void checkHour(int hour, String name) {
        if (hour < 0 || hour > 23) {
            throw new IllegalArgumentException(name + " must be between 0 and 23");
        }
    }
}
