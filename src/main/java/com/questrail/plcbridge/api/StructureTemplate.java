package com.questrail.plcbridge.api;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * StructureTemplate
 * -----------------------------------------------------------------------------
 * Named, versioned, ordered member list describing the shape of a structured
 * (user-defined type) value.
 *
 * <p>Templates are immutable. The bridge registers each template name once;
 * a later template with the same name but a different shape is ignored.</p>
 *
 * @param name    template name, unique within a deployment
 * @param version free-form version label ({@code ""} when the module sent none)
 * @param members ordered members; names are unique
 */
public record StructureTemplate(String name, String version, List<Member> members)
{
    /**
     * One named member of a template. Members are always primitive; a nested
     * structured member is treated as {@link VariableKind#TEXT}.
     */
    public record Member(String name, VariableKind kind)
    {
        public Member {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(kind, "kind");
            if (kind == VariableKind.STRUCTURED) {
                kind = VariableKind.TEXT;
            }
        }
    }

    public StructureTemplate {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(version, "version");
        members = List.copyOf(Objects.requireNonNull(members, "members"));

        if (name.isBlank()) {
            throw new IllegalArgumentException("template name must not be blank");
        }
        Set<String> seen = new HashSet<>();
        for (Member member : members) {
            if (!seen.add(member.name())) {
                throw new IllegalArgumentException(
                        "duplicate member '" + member.name() + "' in template " + name);
            }
        }
    }

    public static StructureTemplate of(String name, Member... members) {
        return new StructureTemplate(name, "", List.of(members));
    }

    public Optional<Member> member(String memberName) {
        for (Member member : members) {
            if (member.name().equals(memberName)) {
                return Optional.of(member);
            }
        }
        return Optional.empty();
    }
}
