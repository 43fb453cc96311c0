package io.github.filtersql.core.api;

import java.util.Locale;
import java.util.Set;

/**
 * Semantic category of a filterable column, driving which default handler compiles a condition
 * and which operators are accepted.
 * <p>
 * The category is normally inferred from the declared SQL data type with
 * {@link #fromDataType(String)}; a {@link FilterCondition} may also carry an explicit type that
 * takes precedence over inference.
 * </p>
 *
 * <pre>{@code
 * SemanticType.fromDataType("timestamp with time zone"); // DATE
 * SemanticType.fromDataType("bigint");                   // NUMERIC
 * SemanticType.fromDataType("character varying");        // TEXT
 * }</pre>
 *
 * @since 1.0.0
 */
public enum SemanticType {

    /** Character data: pattern matching with wildcard escaping. */
    TEXT,

    /** Integer and decimal data: direct comparison. */
    NUMERIC,

    /** {@code TRUE}/{@code FALSE} exact match. */
    BOOLEAN,

    /** Dates and timestamps: relative tokens and range expansion. */
    DATE,

    /** Opaque identifiers such as UUIDs: exact match only. */
    IDENTIFIER,

    /** Enumerated (user-defined) types: exact match only. */
    ENUM,

    /** Structured JSON documents: key and path extraction syntax. */
    JSON,

    /** SQL arrays. No default handling; served by custom handlers. */
    ARRAY;

    private static final Set<String> DATE_TYPES = Set.of(
            "date",
            "timestamp",
            "timestamptz",
            "timestamp with time zone",
            "timestamp without time zone");

    private static final Set<String> NUMERIC_TYPES = Set.of(
            "integer",
            "int",
            "int4",
            "int8",
            "bigint",
            "smallint",
            "numeric",
            "decimal",
            "real",
            "double precision",
            "float4",
            "float8");

    private static final Set<String> JSON_TYPES = Set.of("json", "jsonb");

    /**
     * Infers the semantic type from a declared SQL data type name, case-insensitively.
     * Unknown or {@code null} types are treated as {@link #TEXT}.
     *
     * @param dataType the declared data type, e.g. {@code "timestamp with time zone"}
     * @return the inferred semantic type, never {@code null}
     */
    public static SemanticType fromDataType(String dataType) {
        if (dataType == null || dataType.isBlank()) {
            return TEXT;
        }

        String normalized = dataType.trim().toLowerCase(Locale.ROOT);

        if (normalized.endsWith("[]") || normalized.equals("array")) return ARRAY;
        if (DATE_TYPES.contains(normalized)) return DATE;
        if (NUMERIC_TYPES.contains(normalized)) return NUMERIC;
        if (normalized.equals("boolean") || normalized.equals("bool")) return BOOLEAN;
        if (JSON_TYPES.contains(normalized)) return JSON;
        if (normalized.equals("uuid")) return IDENTIFIER;
        if (normalized.equals("user-defined") || normalized.equals("enum")) return ENUM;

        return TEXT;
    }
}
