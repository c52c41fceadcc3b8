package com.questrail.plcbridge.internal.registry;

import com.questrail.plcbridge.api.FilterPolicy;
import com.questrail.plcbridge.api.StructureTemplate;
import com.questrail.plcbridge.api.VariableKind;

import java.util.Objects;

/**
 * Input to {@link VariableRegistry#upsert(VariableUpdate)}.
 *
 * <p>{@code policy} is the effective policy and may be {@code null}.
 * {@code filterDisabled}, {@code template} and {@code description} are
 * {@code null} when the event did not carry them; the registry then keeps
 * what it already knows.</p>
 */
public record VariableUpdate(String id,
                             String ownerModuleId,
                             VariableKind declaredKind,
                             Object value,
                             FilterPolicy policy,
                             Boolean filterDisabled,
                             StructureTemplate template,
                             String description,
                             String parentId,
                             String memberName)
{
    public VariableUpdate {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(ownerModuleId, "ownerModuleId");
        Objects.requireNonNull(declaredKind, "declaredKind");
    }

    public static VariableUpdate of(String id,
                                    String ownerModuleId,
                                    VariableKind declaredKind,
                                    Object value,
                                    FilterPolicy policy,
                                    StructureTemplate template) {
        return new VariableUpdate(id, ownerModuleId, declaredKind, value, policy, null, template, null, null, null);
    }

    public VariableUpdate withFilterDisabled(Boolean disabled) {
        return new VariableUpdate(id, ownerModuleId, declaredKind, value, policy, disabled, template, description, parentId, memberName);
    }

    public VariableUpdate withDescription(String text) {
        return new VariableUpdate(id, ownerModuleId, declaredKind, value, policy, filterDisabled, template, text, parentId, memberName);
    }

    public VariableUpdate asMemberOf(String parent, String member) {
        return new VariableUpdate(id, ownerModuleId, declaredKind, value, policy, filterDisabled, template, description, parent, member);
    }
}
