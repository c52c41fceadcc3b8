package com.questrail.plcbridge.internal.registry;

import com.questrail.plcbridge.api.FilterPolicy;
import com.questrail.plcbridge.api.PrimitiveType;
import com.questrail.plcbridge.api.StructureTemplate;
import com.questrail.plcbridge.api.VariableKind;

import java.util.Objects;
import java.util.Optional;

/**
 * Variable
 * -----------------------------------------------------------------------------
 * Registry entry for one discovered variable.
 *
 * <p>Entries are created on first sight and mutated in place by the
 * {@link VariableRegistry} only; they live as long as the process. Reading is
 * safe on the bridge's event-loop thread, which is the only thread that ever
 * sees them.</p>
 *
 * <p>A flat-mode member entry ({@code "temp/hi"}) records its structured
 * parent and member name so that commands can be routed back to the parent.</p>
 */
public final class Variable
{
    private final String id;
    private final String parentId;
    private final String memberName;

    private String ownerModuleId;
    private VariableKind kind;
    private Object value;
    private FilterPolicy policy;
    private boolean filterDisabled;
    private StructureTemplate template;
    private String description;
    private PrimitiveType metricType;

    Variable(String id, String parentId, String memberName) {
        this.id = Objects.requireNonNull(id, "id");
        this.parentId = parentId;
        this.memberName = memberName;
    }

    public String id() {
        return id;
    }

    public String ownerModuleId() {
        return ownerModuleId;
    }

    public VariableKind kind() {
        return kind;
    }

    /**
     * Current value. For structured variables with a template this is a member
     * map in template order holding primitive member values.
     */
    public Object value() {
        return value;
    }

    public Optional<FilterPolicy> policy() {
        return Optional.ofNullable(policy);
    }

    public boolean filterDisabled() {
        return filterDisabled;
    }

    public Optional<StructureTemplate> template() {
        return Optional.ofNullable(template);
    }

    public String description() {
        return description;
    }

    /**
     * Type this variable is announced with; empty for a flat-mode structured
     * parent, whose members carry the metrics.
     */
    public Optional<PrimitiveType> metricType() {
        return Optional.ofNullable(metricType);
    }

    public Optional<String> parentId() {
        return Optional.ofNullable(parentId);
    }

    public Optional<String> memberName() {
        return Optional.ofNullable(memberName);
    }

    public boolean isFlatMember() {
        return parentId != null;
    }

    void ownerModuleId(String ownerModuleId) {
        this.ownerModuleId = ownerModuleId;
    }

    void kind(VariableKind kind) {
        this.kind = kind;
    }

    void value(Object value) {
        this.value = value;
    }

    void policy(FilterPolicy policy) {
        this.policy = policy;
    }

    void filterDisabled(boolean filterDisabled) {
        this.filterDisabled = filterDisabled;
    }

    void template(StructureTemplate template) {
        this.template = template;
    }

    void description(String description) {
        this.description = description;
    }

    void metricType(PrimitiveType metricType) {
        this.metricType = metricType;
    }

    @Override
    public String toString() {
        return "Variable[" + id + " " + kind + " = " + value + " @" + ownerModuleId + "]";
    }
}
