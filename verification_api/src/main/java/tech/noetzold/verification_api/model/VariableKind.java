package tech.noetzold.verification_api.model;

import java.util.Locale;
import java.util.Optional;

public enum VariableKind {
    REAL,
    INTEGER,
    BOOLEAN,
    STRING;

    public boolean isNumeric() {
        return this == REAL || this == INTEGER;
    }

    /**
     * Accepts the names used in ontology documents, including the short aliases
     * ({@code int}, {@code bool}, {@code float}).
     */
    public static Optional<VariableKind> parse(String raw) {
        if (raw == null) return Optional.empty();
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "real", "float", "number", "decimal" -> Optional.of(REAL);
            case "integer", "int" -> Optional.of(INTEGER);
            case "boolean", "bool" -> Optional.of(BOOLEAN);
            case "string", "text" -> Optional.of(STRING);
            default -> Optional.empty();
        };
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
