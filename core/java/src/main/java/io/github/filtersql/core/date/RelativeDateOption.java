package io.github.filtersql.core.date;

import java.util.Optional;

/**
 * Symbolic date ranges that can be stored in a filter value as a relative date token.
 *
 * @see RelativeDateResolver#createToken(RelativeDateOption)
 */
public enum RelativeDateOption {
    TODAY("today"),
    YESTERDAY("yesterday"),
    TOMORROW("tomorrow"),
    THIS_WEEK("thisWeek"),
    LAST_WEEK("lastWeek"),
    NEXT_WEEK("nextWeek"),
    THIS_MONTH("thisMonth"),
    LAST_MONTH("lastMonth"),
    NEXT_MONTH("nextMonth"),
    LAST_7_DAYS("last7Days"),
    NEXT_7_DAYS("next7Days"),
    LAST_30_DAYS("last30Days"),
    NEXT_30_DAYS("next30Days"),
    THIS_YEAR("thisYear"),
    LAST_YEAR("lastYear"),
    /** Placeholder chosen by the date picker before a concrete date is entered; resolves like {@link #TODAY}. */
    CUSTOM("custom");

    private final String code;

    RelativeDateOption(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * Finds an option by its exact (case-sensitive) code.
     *
     * @param code e.g. {@code "last7Days"}
     * @return the option, or empty if the code is unknown
     */
    public static Optional<RelativeDateOption> fromCode(String code) {
        for (RelativeDateOption option : values()) {
            if (option.code.equals(code)) return Optional.of(option);
        }
        return Optional.empty();
    }
}
