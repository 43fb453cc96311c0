package io.github.filtersql.core.exception;

/**
 * Thrown when a filter condition references a column that the table metadata does not declare.
 *
 * @since 1.0.0
 */
public class ColumnNotFoundException extends FilterValidationException {

    private final String column;

    /**
     * @param column the column name that could not be resolved
     */
    public ColumnNotFoundException(String column) {
        super("Column '" + column + "' not found in metadata");
        this.column = column;
    }

    /**
     * @return the unresolved column name
     */
    public String getColumn() {
        return column;
    }
}
