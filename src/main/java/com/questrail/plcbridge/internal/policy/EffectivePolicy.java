package com.questrail.plcbridge.internal.policy;

import com.questrail.plcbridge.api.FilterPolicy;

import java.util.Objects;
import java.util.Optional;

/**
 * Policy resolved for one event after overrides and defaults were applied.
 */
public record EffectivePolicy(Optional<FilterPolicy> policy)
{
    public static final EffectivePolicy NONE = new EffectivePolicy(Optional.empty());

    public EffectivePolicy {
        Objects.requireNonNull(policy, "policy");
    }

    public FilterPolicy orNull() {
        return policy.orElse(null);
    }
}
