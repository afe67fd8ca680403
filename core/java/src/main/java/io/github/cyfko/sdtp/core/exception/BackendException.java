package io.github.cyfko.sdtp.core.exception;

/**
 * Wraps an unexpected failure raised by a table backend while producing rows.
 *
 * @since 1.0.0
 */
public class BackendException extends SdtpException {

    public BackendException(String message, Throwable cause) {
        super(ErrorKind.INTERNAL, message, null, cause);
    }
}
