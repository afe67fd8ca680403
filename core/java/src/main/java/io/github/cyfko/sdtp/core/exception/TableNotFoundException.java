package io.github.cyfko.sdtp.core.exception;

/**
 * Thrown when a request names a table that no registry entry serves.
 *
 * @since 1.0.0
 */
public class TableNotFoundException extends SdtpException {

    private final String tableName;

    public TableNotFoundException(String tableName) {
        super(ErrorKind.NOT_FOUND, String.format("No table named '%s' is registered", tableName), null);
        this.tableName = tableName;
    }

    public String tableName() {
        return tableName;
    }
}
