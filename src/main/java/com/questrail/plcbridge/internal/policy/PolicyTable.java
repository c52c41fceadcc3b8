package com.questrail.plcbridge.internal.policy;

import com.questrail.plcbridge.api.FilterPolicy;
import com.questrail.plcbridge.config.PolicyConfig;
import com.questrail.plcbridge.config.PolicyConfig.VariableOverride;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * PolicyTable
 * -----------------------------------------------------------------------------
 * Live view of the operator's filtering configuration.
 *
 * <p>The table holds an immutable {@link PolicyConfig} snapshot behind a
 * volatile reference. Writers (the policy collaborator's thread) swap in a
 * new snapshot; the event loop reads whichever snapshot is current when it
 * resolves an event.</p>
 *
 * <h2>Precedence</h2>
 * Override policy, then the policy carried by the event, then the default
 * policy. An override with {@code enabled = false} drops the variable.
 */
public final class PolicyTable
{
    private volatile PolicyConfig snapshot;

    public PolicyTable(PolicyConfig initial) {
        this.snapshot = Objects.requireNonNull(initial, "initial");
    }

    public PolicyConfig snapshot() {
        return snapshot;
    }

    public synchronized void replace(PolicyConfig config) {
        this.snapshot = Objects.requireNonNull(config, "config");
    }

    /**
     * Replaces the override of one variable, leaving the rest untouched.
     */
    public synchronized void put(String variableId, VariableOverride override) {
        Objects.requireNonNull(variableId, "variableId");
        Objects.requireNonNull(override, "override");

        PolicyConfig current = snapshot;
        Map<String, VariableOverride> overrides = new HashMap<>(current.overrides());
        overrides.put(variableId, override);
        snapshot = new PolicyConfig(current.defaultPolicy(), overrides);
    }

    public boolean isEnabled(String variableId) {
        VariableOverride override = snapshot.overrides().get(variableId);
        return override == null || override.enabled();
    }

    /**
     * Resolves the effective policy for an event, or empty when the variable
     * is disabled by an override.
     */
    public Optional<EffectivePolicy> resolve(String variableId, Optional<FilterPolicy> eventPolicy) {
        PolicyConfig config = snapshot;
        VariableOverride override = config.overrides().get(variableId);

        if (override != null) {
            if (!override.enabled()) {
                return Optional.empty();
            }
            if (override.policy().isPresent()) {
                return Optional.of(new EffectivePolicy(override.policy()));
            }
        }
        if (eventPolicy.isPresent()) {
            return Optional.of(new EffectivePolicy(eventPolicy));
        }
        return Optional.of(new EffectivePolicy(config.defaultPolicy()));
    }
}
