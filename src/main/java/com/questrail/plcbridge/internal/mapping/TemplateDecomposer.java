package com.questrail.plcbridge.internal.mapping;

import com.questrail.plcbridge.api.Metric;
import com.questrail.plcbridge.api.PrimitiveType;
import com.questrail.plcbridge.api.StructureTemplate;
import com.questrail.plcbridge.api.TemplateValue;
import com.questrail.plcbridge.api.VariableKind;
import com.questrail.plcbridge.config.TemplateMode;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * TemplateDecomposer
 * =============================================================================
 * Turns structured (UDT) values into telemetry metrics and member commands
 * back into domain values.
 *
 * <h2>Nested mode</h2>
 * A structured variable is one {@link PrimitiveType#TEMPLATE} metric whose
 * members follow the template order. Members absent from the value are
 * {@code null}. Each template name is announced once as a definition metric.
 *
 * <h2>Flat mode</h2>
 * A structured variable is N primitive metrics named
 * {@code variableId/memberName}. The structured variable itself has no metric.
 *
 * <p>All methods are pure. Callers decompose before mutating any state, so a
 * value that fails to decompose leaves nothing half-applied.</p>
 */
public final class TemplateDecomposer
{
    /**
     * One primitive metric produced by flat decomposition.
     */
    public record FlatMember(String metricName, String memberName, VariableKind kind, Object value) {}

    /**
     * One member write produced by inverse decomposition of a command.
     */
    public record MemberCommand(String memberName, Object value) {}

    private final TemplateMode mode;

    public TemplateDecomposer(TemplateMode mode) {
        this.mode = Objects.requireNonNull(mode, "mode");
    }

    public TemplateMode mode() {
        return mode;
    }

    public static String flatName(String variableId, String memberName) {
        return variableId + "/" + memberName;
    }

    /**
     * Metric type a variable is announced with, or empty when the variable has
     * no metric of its own (a templated structured variable in flat mode).
     */
    public Optional<PrimitiveType> metricTypeFor(VariableKind kind, StructureTemplate template) {
        if (kind == VariableKind.STRUCTURED && template != null) {
            return mode == TemplateMode.NESTED ? Optional.of(PrimitiveType.TEMPLATE) : Optional.empty();
        }
        return Optional.of(TypeMapper.primitiveTypeOf(kind));
    }

    /**
     * Member map in template order with every member converted to its
     * primitive; missing members map to {@code null}, unknown members are
     * dropped.
     *
     * @throws IllegalArgumentException if {@code value} has no member structure
     */
    public Map<String, Object> normalize(StructureTemplate template, Object value) {
        Map<String, Object> raw = TypeMapper.asMemberMap(value);
        Map<String, Object> normalized = new LinkedHashMap<>();
        for (StructureTemplate.Member member : template.members()) {
            normalized.put(member.name(), TypeMapper.toPrimitive(raw.get(member.name()), member.kind()));
        }
        return normalized;
    }

    /**
     * Template-instance payload for a structured value.
     */
    public TemplateValue instance(StructureTemplate template, Object value) {
        Map<String, Object> members = normalize(template, value);
        List<TemplateValue.Member> list = new ArrayList<>(members.size());
        for (StructureTemplate.Member member : template.members()) {
            list.add(new TemplateValue.Member(
                    member.name(),
                    TypeMapper.primitiveTypeOf(member.kind()),
                    members.get(member.name())));
        }
        return new TemplateValue(template.name(), template.version(), false, list);
    }

    /**
     * Definition metric announcing a template's shape. Member values are
     * {@code null}.
     */
    public Metric definition(StructureTemplate template, Instant timestamp) {
        List<TemplateValue.Member> stubs = new ArrayList<>(template.members().size());
        for (StructureTemplate.Member member : template.members()) {
            stubs.add(new TemplateValue.Member(member.name(), TypeMapper.primitiveTypeOf(member.kind()), null));
        }
        TemplateValue value = new TemplateValue(template.name(), template.version(), true, stubs);
        return new Metric(template.name(), PrimitiveType.TEMPLATE, value, timestamp, Map.of());
    }

    /**
     * Flat member metrics for a structured value, in template order.
     */
    public List<FlatMember> flatten(String variableId, StructureTemplate template, Object value) {
        Map<String, Object> members = normalize(template, value);
        List<FlatMember> flat = new ArrayList<>(members.size());
        for (StructureTemplate.Member member : template.members()) {
            flat.add(new FlatMember(
                    flatName(variableId, member.name()),
                    member.name(),
                    member.kind(),
                    members.get(member.name())));
        }
        return flat;
    }

    /**
     * Converts the members listed in a nested command payload back to domain
     * values. Members the template does not know are converted by their
     * runtime shape.
     */
    public List<MemberCommand> memberCommands(StructureTemplate template, TemplateValue payload) {
        List<MemberCommand> commands = new ArrayList<>(payload.members().size());
        for (TemplateValue.Member member : payload.members()) {
            Object converted = template == null
                    ? TypeMapper.inferDomain(member.value())
                    : template.member(member.name())
                            .map(m -> TypeMapper.toDomain(member.value(), m.kind()))
                            .orElseGet(() -> TypeMapper.inferDomain(member.value()));
            commands.add(new MemberCommand(member.name(), converted));
        }
        return commands;
    }
}
