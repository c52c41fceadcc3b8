package com.questrail.plcbridge.api;

import java.util.List;
import java.util.Objects;

/**
 * TemplateValue
 * -----------------------------------------------------------------------------
 * Payload of a {@link PrimitiveType#TEMPLATE} metric.
 *
 * <p>Two shapes share this type:</p>
 * <ul>
 *   <li><b>definition</b>: announced once per template name, member values
 *       are all {@code null}</li>
 *   <li><b>instance</b>: one per structured variable, member values follow
 *       template order</li>
 * </ul>
 *
 * <p>Record equality is deep: two instances are equal when every member
 * name, type and value matches. The exception filter relies on this.</p>
 */
public record TemplateValue(String templateRef,
                            String version,
                            boolean definition,
                            List<Member> members)
{
    /**
     * One member of a template payload. {@code value} is {@code null} for
     * definitions and for members missing from an instance.
     */
    public record Member(String name, PrimitiveType type, Object value)
    {
        public Member {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(type, "type");
        }
    }

    public TemplateValue {
        Objects.requireNonNull(templateRef, "templateRef");
        Objects.requireNonNull(version, "version");
        members = List.copyOf(Objects.requireNonNull(members, "members"));
    }
}
