package io.github.cyfko.sdtp.core.exception;

/**
 * Stable classification of every failure an SDTP request can report.
 * <p>
 * Each kind owns the string written to the {@code error_kind} field of a failure document.
 * Clients switch on that string, so the values below never change once published.
 * </p>
 *
 * <table>
 *   <caption>Wire mapping</caption>
 *   <tr><th>Kind</th><th>Wire value</th><th>Raised when</th></tr>
 *   <tr><td>{@link #NOT_FOUND}</td><td>NotFoundError</td><td>the requested table is not registered</td></tr>
 *   <tr><td>{@link #SCHEMA}</td><td>SchemaError</td><td>a filter or projection names an unknown column</td></tr>
 *   <tr><td>{@link #TYPE}</td><td>TypeError</td><td>a literal cannot be coerced to its column type</td></tr>
 *   <tr><td>{@link #SPEC}</td><td>SpecError</td><td>the request or filter document is malformed</td></tr>
 *   <tr><td>{@link #CONVERSION}</td><td>ConversionError</td><td>a row value cannot be encoded and no default helps</td></tr>
 *   <tr><td>{@link #TIMEOUT}</td><td>TimeoutError</td><td>the request exceeded its time budget</td></tr>
 *   <tr><td>{@link #INTERNAL}</td><td>InternalError</td><td>a table backend failed unexpectedly</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public enum ErrorKind {

    NOT_FOUND("NotFoundError"),
    SCHEMA("SchemaError"),
    TYPE("TypeError"),
    SPEC("SpecError"),
    CONVERSION("ConversionError"),
    TIMEOUT("TimeoutError"),
    INTERNAL("InternalError");

    private final String wireName;

    ErrorKind(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Returns the value written to the {@code error_kind} field.
     *
     * @return the stable wire name of this kind
     */
    public String wireName() {
        return wireName;
    }
}
