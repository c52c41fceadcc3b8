package com.questrail.plcbridge.internal.registry;

import com.questrail.plcbridge.api.FilterPolicy;
import com.questrail.plcbridge.api.Metric;
import com.questrail.plcbridge.api.PrimitiveType;
import com.questrail.plcbridge.api.StructureTemplate;
import com.questrail.plcbridge.api.VariableKind;
import com.questrail.plcbridge.config.TemplateMode;
import com.questrail.plcbridge.internal.mapping.TemplateDecomposer;
import com.questrail.plcbridge.internal.mapping.TypeMapper;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * VariableRegistry
 * =============================================================================
 * Authoritative table of every variable the bridge has discovered.
 *
 * <h2>Ownership</h2>
 * The registry is owned by the bridge event loop. It performs no locking and
 * must not be touched from any other thread. Entries are never removed.
 *
 * <h2>Schema changes</h2>
 * Every variable with a metric type appears in the announced schema. An
 * {@link #upsert(VariableUpdate)} reports whether the update introduced a
 * new metric or changed the representation of an existing one; in either
 * case the caller must re-announce the schema before publishing values.
 *
 * <h2>Discovery order</h2>
 * {@link #metricSet(Instant)} lists variables in the order they were first
 * seen, so repeated announcements are stable.
 */
public final class VariableRegistry
{
    public static final String SOURCE = "plc";
    public static final String QUALITY_GOOD = "good";

    private final TemplateDecomposer decomposer;
    private final TemplateTable templates;
    private final Map<String, Variable> variables = new LinkedHashMap<>();

    public VariableRegistry(TemplateDecomposer decomposer, TemplateTable templates) {
        this.decomposer = Objects.requireNonNull(decomposer, "decomposer");
        this.templates = Objects.requireNonNull(templates, "templates");
    }

    public TemplateTable templates() {
        return templates;
    }

    public Optional<Variable> find(String id) {
        return Optional.ofNullable(variables.get(id));
    }

    public Collection<Variable> variables() {
        return Collections.unmodifiableCollection(variables.values());
    }

    public int size() {
        return variables.size();
    }

    /**
     * Convenience form of {@link #upsert(VariableUpdate)} for updates that
     * carry no description and no filter-disable flag.
     */
    public UpsertResult upsert(String id,
                               String ownerModuleId,
                               VariableKind kind,
                               Object value,
                               FilterPolicy policy,
                               StructureTemplate template) {
        return upsert(VariableUpdate.of(id, ownerModuleId, kind, value, policy, template));
    }

    /**
     * Inserts or updates a variable.
     *
     * <p>The declared kind is corrected against the literal value first. Value
     * and policy always replace what was stored; filter-disable flag, template
     * and description replace it only when the update carries them.</p>
     */
    public UpsertResult upsert(VariableUpdate update) {
        Objects.requireNonNull(update, "update");

        VariableKind kind = TypeMapper.resolveKind(update.declaredKind(), update.value());
        Variable existing = variables.get(update.id());

        StructureTemplate template = update.template();
        if (template == null && existing != null && kind == VariableKind.STRUCTURED) {
            template = existing.template().orElse(null);
        }
        if (kind != VariableKind.STRUCTURED) {
            template = null;
        }
        PrimitiveType metricType = decomposer.metricTypeFor(kind, template).orElse(null);

        if (existing == null) {
            Variable created = new Variable(update.id(), update.parentId(), update.memberName());
            apply(created, update, kind, template, metricType);
            if (created.description() == null) {
                created.description(update.ownerModuleId() + "/" + update.id());
            }
            variables.put(created.id(), created);
            return new UpsertResult(created, true, false, null);
        }

        PrimitiveType previousType = existing.metricType().orElse(null);
        String previousTemplate = existing.template().map(StructureTemplate::name).orElse(null);

        apply(existing, update, kind, template, metricType);

        boolean schemaChanged = !Objects.equals(previousType, metricType);
        if (!schemaChanged && metricType == PrimitiveType.TEMPLATE) {
            schemaChanged = !Objects.equals(previousTemplate, template.name());
        }
        return new UpsertResult(existing, false, schemaChanged, previousType);
    }

    private static void apply(Variable v,
                              VariableUpdate update,
                              VariableKind kind,
                              StructureTemplate template,
                              PrimitiveType metricType) {
        v.ownerModuleId(update.ownerModuleId());
        v.kind(kind);
        v.value(update.value());
        v.policy(update.policy());
        v.template(template);
        v.metricType(metricType);
        if (update.filterDisabled() != null) {
            v.filterDisabled(update.filterDisabled());
        }
        if (update.description() != null) {
            v.description(update.description());
        }
    }

    /**
     * Updates a variable's value after a command was routed to its owner. Does
     * not publish. A templated structured variable only accepts a member map;
     * any other value is ignored and {@code false} returned.
     */
    public boolean applyCommandValue(Variable variable, Object value) {
        Objects.requireNonNull(variable, "variable");

        if (variable.kind() == VariableKind.STRUCTURED && variable.template().isPresent()) {
            if (!(value instanceof Map<?, ?>)) {
                return false;
            }
            variable.value(decomposer.normalize(variable.template().get(), value));
            return true;
        }
        variable.value(value);
        return true;
    }

    /**
     * Updates one member of a structured variable's value after a member
     * command was routed. Does not publish.
     */
    public void applyMemberCommandValue(Variable variable, String memberName, Object value) {
        Objects.requireNonNull(variable, "variable");
        Objects.requireNonNull(memberName, "memberName");

        Map<String, Object> members = variable.value() instanceof Map<?, ?>
                ? TypeMapper.asMemberMap(variable.value())
                : new LinkedHashMap<>();

        VariableKind memberKind = variable.template()
                .flatMap(t -> t.member(memberName))
                .map(StructureTemplate.Member::kind)
                .orElse(null);

        members.put(memberName, memberKind == null ? value : TypeMapper.toPrimitive(value, memberKind));
        variable.value(members);
    }

    /**
     * Value a variable is published with: a template instance for nested
     * structured variables, otherwise the primitive for its kind.
     */
    public Object publishedValue(Variable variable) {
        if (variable.metricType().orElse(null) == PrimitiveType.TEMPLATE) {
            return decomposer.instance(variable.template().orElseThrow(), variable.value());
        }
        return TypeMapper.toPrimitive(variable.value(), variable.kind());
    }

    /**
     * Full schema snapshot: template definitions (nested mode only) followed
     * by every variable that has a metric type, in discovery order.
     */
    public List<Metric> metricSet(Instant timestamp) {
        List<Metric> metrics = new ArrayList<>();

        if (decomposer.mode() == TemplateMode.NESTED) {
            for (StructureTemplate template : templates.all()) {
                metrics.add(decomposer.definition(template, timestamp));
            }
        }

        for (Variable v : variables.values()) {
            Optional<PrimitiveType> type = v.metricType();
            if (type.isEmpty()) {
                continue;
            }
            metrics.add(new Metric(v.id(), type.get(), publishedValue(v), timestamp, propertiesOf(v)));
        }
        return metrics;
    }

    private static Map<String, Object> propertiesOf(Variable v) {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put("datatype", v.kind().declaredName());
        props.put("source", SOURCE);
        props.put("quality", QUALITY_GOOD);
        props.put("moduleId", v.ownerModuleId());
        props.put("description", v.description());
        v.policy().ifPresent(p -> {
            props.put("deadbandValue", p.threshold());
            p.maxInterval().ifPresent(d -> props.put("deadbandMaxTime", d.toMillis()));
        });
        return props;
    }
}
