package com.questrail.plcbridge.internal.registry;

import com.questrail.plcbridge.api.PrimitiveType;

/**
 * Outcome of {@link VariableRegistry#upsert(VariableUpdate)}.
 *
 * @param isNew         the id was previously unknown
 * @param schemaChanged the variable existed and its announced representation changed
 * @param previousType  announced type before this update (null when new or unannounced)
 */
public record UpsertResult(Variable variable, boolean isNew, boolean schemaChanged, PrimitiveType previousType)
{
    /**
     * Whether the schema must be re-announced before this variable's values
     * may be published. A new variable without a metric of its own (a
     * flat-mode structured parent) needs no announcement.
     */
    public boolean requiresAnnouncement() {
        return (isNew && variable.metricType().isPresent()) || schemaChanged;
    }
}
