package com.questrail.plcbridge.api;

import java.util.Locale;
import java.util.Optional;

/**
 * VariableKind
 * -----------------------------------------------------------------------------
 * Domain-level kind of a control-module variable, as declared by the module
 * that produces it.
 *
 * <p>The declared kind is a hint, not an authority. Modules occasionally
 * mislabel values (a numeric tag declared as {@code "string"}); the registry
 * corrects the kind whenever the literal value's own type is unambiguous.</p>
 *
 * <h2>Declared names</h2>
 * <ul>
 *   <li>{@code number}  → {@link #NUMBER}</li>
 *   <li>{@code boolean} → {@link #BOOLEAN}</li>
 *   <li>{@code string}  → {@link #TEXT}</li>
 *   <li>{@code udt}     → {@link #STRUCTURED}</li>
 * </ul>
 */
public enum VariableKind
{
    NUMBER("number"),
    BOOLEAN("boolean"),
    TEXT("string"),
    STRUCTURED("udt");

    private final String declaredName;

    VariableKind(String declaredName) {
        this.declaredName = declaredName;
    }

    /**
     * The name modules use on the wire for this kind.
     */
    public String declaredName() {
        return declaredName;
    }

    /**
     * Looks up a kind by its declared name, case-insensitively.
     *
     * @return the kind, or empty if the name is not one of the four declared names
     */
    public static Optional<VariableKind> fromDeclared(String declared) {
        if (declared == null) {
            return Optional.empty();
        }
        String normalized = declared.trim().toLowerCase(Locale.ROOT);
        for (VariableKind kind : values()) {
            if (kind.declaredName.equals(normalized)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
