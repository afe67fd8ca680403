package io.github.cyfko.sdtp.core.exception;

/**
 * Thrown when a request or filter document has the wrong shape.
 * <p>
 * Typical causes are an unknown operator, a missing required field, a combinator with the wrong
 * number of arguments, a {@code BETWEEN} operand that is not a pair, or a document exceeding the
 * configured nesting limits. Reported on the wire as {@code SpecError}.
 * </p>
 *
 * <pre>{@code
 * {"operator": "NOT", "arguments": []}
 * // -> SpecError at "NOT": Operator NOT requires exactly 1 argument, got 0
 * }</pre>
 *
 * @since 1.0.0
 */
public class SpecException extends SdtpException {

    public SpecException(String message) {
        super(ErrorKind.SPEC, message, null);
    }

    public SpecException(String message, String path) {
        super(ErrorKind.SPEC, message, path);
    }

    public SpecException(String message, String path, Throwable cause) {
        super(ErrorKind.SPEC, message, path, cause);
    }
}
