package com.questrail.plcbridge.internal.registry;

import com.questrail.plcbridge.api.StructureTemplate;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * TemplateTable
 * -----------------------------------------------------------------------------
 * Append-only table of structure templates keyed by name.
 *
 * <p>The first registration of a name wins. A later template with the same
 * name and a different shape is reported as {@link Outcome#MISMATCH} and the
 * earlier one is returned to the caller for use.</p>
 *
 * <p>Reads may happen from any thread; all access is synchronized on the
 * table.</p>
 */
public final class TemplateTable
{
    public enum Outcome {
        /** First time this name was seen. */
        REGISTERED,
        /** Same name, same shape as the existing registration. */
        KNOWN,
        /** Same name, different shape; the existing registration was kept. */
        MISMATCH
    }

    /**
     * @param template the template callers must use (always the first one registered)
     */
    public record Registration(StructureTemplate template, Outcome outcome)
    {
        public boolean isNew() {
            return outcome == Outcome.REGISTERED;
        }
    }

    private final Map<String, StructureTemplate> templates = new LinkedHashMap<>();

    public synchronized Registration register(StructureTemplate template) {
        Objects.requireNonNull(template, "template");

        StructureTemplate existing = templates.get(template.name());
        if (existing == null) {
            templates.put(template.name(), template);
            return new Registration(template, Outcome.REGISTERED);
        }
        if (existing.equals(template)) {
            return new Registration(existing, Outcome.KNOWN);
        }
        return new Registration(existing, Outcome.MISMATCH);
    }

    public synchronized Optional<StructureTemplate> find(String name) {
        return Optional.ofNullable(templates.get(name));
    }

    /**
     * Registered templates in registration order.
     */
    public synchronized List<StructureTemplate> all() {
        return new ArrayList<>(templates.values());
    }
}
