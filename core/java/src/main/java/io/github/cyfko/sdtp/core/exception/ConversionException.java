package io.github.cyfko.sdtp.core.exception;

/**
 * Thrown when a value cannot be converted to its column type and no usable default is configured.
 *
 * @since 1.0.0
 */
public class ConversionException extends SdtpException {

    public ConversionException(String message) {
        super(ErrorKind.CONVERSION, message, null);
    }

    public ConversionException(String message, Throwable cause) {
        super(ErrorKind.CONVERSION, message, null, cause);
    }
}
