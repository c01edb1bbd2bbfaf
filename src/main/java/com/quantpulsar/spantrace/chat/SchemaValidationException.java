package com.quantpulsar.spantrace.chat;

/**
 * Thrown when a structured chat attribute does not conform to its schema.
 * The span the attribute was meant for is left unchanged.
 *
 * @author Quantpulsar 2025-2026
 */
public class SchemaValidationException extends RuntimeException {

    private final String schema;
    private final int index;
    private final String field;

    /**
     * Creates the exception.
     *
     * @param schema the schema name, e.g. {@code ChatMessage}
     * @param index  index of the offending element
     * @param field  dotted path of the offending field, or null if the element itself is malformed
     * @param detail what is wrong
     * @param cause  the underlying failure, may be null
     */
    public SchemaValidationException(String schema, int index, String field, String detail, Throwable cause) {
        super("1 validation error for " + schema + ": element " + index
                + (field != null ? ", field '" + field + "'" : "") + ": " + detail, cause);
        this.schema = schema;
        this.index = index;
        this.field = field;
    }

    public String getSchema() {
        return schema;
    }

    public int getIndex() {
        return index;
    }

    public String getField() {
        return field;
    }
}
