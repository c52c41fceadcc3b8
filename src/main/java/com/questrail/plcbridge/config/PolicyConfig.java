package com.questrail.plcbridge.config;

import com.questrail.plcbridge.api.FilterPolicy;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PolicyConfig
 * -----------------------------------------------------------------------------
 * Operator-supplied filtering configuration: an optional default policy and
 * per-variable overrides.
 *
 * <p>{@link #none()} is the configuration used when no policy collaborator is
 * deployed: every variable is enabled and only policies carried by the
 * events themselves apply.</p>
 */
public record PolicyConfig(Optional<FilterPolicy> defaultPolicy, Map<String, VariableOverride> overrides)
{
    /**
     * Per-variable override.
     *
     * @param enabled {@code false} drops the variable from the bridge entirely
     * @param policy  when present, replaces any event-carried or default policy
     */
    public record VariableOverride(boolean enabled, Optional<FilterPolicy> policy)
    {
        public VariableOverride {
            Objects.requireNonNull(policy, "policy");
        }

        public static VariableOverride disabled() {
            return new VariableOverride(false, Optional.empty());
        }

        public static VariableOverride withPolicy(FilterPolicy policy) {
            return new VariableOverride(true, Optional.of(policy));
        }
    }

    public PolicyConfig {
        Objects.requireNonNull(defaultPolicy, "defaultPolicy");
        overrides = Map.copyOf(Objects.requireNonNull(overrides, "overrides"));
    }

    public static PolicyConfig none() {
        return new PolicyConfig(Optional.empty(), Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private FilterPolicy defaultPolicy;
        private final Map<String, VariableOverride> overrides = new HashMap<>();

        public Builder withDefaultPolicy(FilterPolicy policy) {
            this.defaultPolicy = policy;
            return this;
        }

        public Builder withOverride(String variableId, VariableOverride override) {
            overrides.put(Objects.requireNonNull(variableId, "variableId"),
                    Objects.requireNonNull(override, "override"));
            return this;
        }

        public PolicyConfig build() {
            return new PolicyConfig(Optional.ofNullable(defaultPolicy), overrides);
        }
    }
}
