package io.github.cyfko.sdtp.core.exception;

/**
 * Thrown when a filter or a projection references a column the table schema does not have,
 * or when a table definition itself is inconsistent (duplicate column names, rows of the wrong width).
 *
 * @since 1.0.0
 */
public class SchemaException extends SdtpException {

    public SchemaException(String message) {
        super(ErrorKind.SCHEMA, message, null);
    }

    public SchemaException(String message, String path) {
        super(ErrorKind.SCHEMA, message, path);
    }
}
