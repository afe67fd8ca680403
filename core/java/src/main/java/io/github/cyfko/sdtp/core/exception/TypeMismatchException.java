package io.github.cyfko.sdtp.core.exception;

/**
 * Thrown during filter validation when an operand literal cannot be coerced to the declared type
 * of its column, or when an operator is applied to a column type that does not support it
 * (for instance {@code REGEX} against a {@code number} column).
 * <p>
 * Reported on the wire as {@code TypeError}.
 * </p>
 *
 * @since 1.0.0
 */
public class TypeMismatchException extends SdtpException {

    public TypeMismatchException(String message, String path) {
        super(ErrorKind.TYPE, message, path);
    }

    public TypeMismatchException(String message, String path, Throwable cause) {
        super(ErrorKind.TYPE, message, path, cause);
    }
}
