package io.github.filtersql.core.config;

/**
 * How values end up in the compiled SQL.
 */
public enum EscapeStrategy {

    /**
     * Values are inlined as quoted literals. Unsafe fallback for callers that cannot bind
     * parameters; relies on quote doubling and strict identifier checks.
     */
    RAW_SQL,

    /**
     * Values are emitted as {@code ?} placeholders and returned as an ordered list of bound values.
     */
    PARAMETERIZED
}
