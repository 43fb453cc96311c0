package io.github.filtersql.core.widget;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Dashboard widget kinds and whether their queries aggregate.
 */
public enum WidgetType {
    CHART("chart"),
    METRIC("metric"),
    TABLE("table");

    private final String code;

    WidgetType(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    public static Optional<WidgetType> find(String code) {
        if (code == null) return Optional.empty();
        String normalized = code.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(type -> type.code.equals(normalized)).findFirst();
    }

    /**
     * @param code widget type code, e.g. {@code "chart"}
     * @return the type
     * @throws IllegalArgumentException for unsupported widget types
     */
    public static WidgetType fromCode(String code) {
        return find(code).orElseThrow(() -> new IllegalArgumentException("Unsupported widget type: " + code));
    }
}
