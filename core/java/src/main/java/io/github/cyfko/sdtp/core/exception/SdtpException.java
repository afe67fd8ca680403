package io.github.cyfko.sdtp.core.exception;

import java.util.Objects;

/**
 * Base class of every failure raised while serving an SDTP request.
 * <p>
 * An {@code SdtpException} always knows its {@link ErrorKind}, so the dispatcher can turn it into
 * a failure document without inspecting the concrete subclass. Errors raised while validating a
 * filter also carry the {@code path} of the offending subtree, for example {@code "AND[1].age"}.
 * </p>
 *
 * <p><strong>Handling example:</strong></p>
 * <pre>{@code
 * try {
 *     QueryResult result = dispatcher.query(request);
 * } catch (SdtpException e) {
 *     log.warning(e.kind().wireName() + " at " + e.path() + ": " + e.getMessage());
 * }
 * }</pre>
 *
 * @since 1.0.0
 */
public abstract class SdtpException extends RuntimeException {

    private final ErrorKind kind;
    private final String path;

    protected SdtpException(ErrorKind kind, String message, String path) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.path = path;
    }

    protected SdtpException(ErrorKind kind, String message, String path, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.path = path;
    }

    /**
     * @return the classification of this failure
     */
    public ErrorKind kind() {
        return kind;
    }

    /**
     * Returns the location of the offending filter subtree.
     *
     * @return the path, or {@code null} when the failure is not tied to a filter node
     */
    public String path() {
        return path;
    }

    /**
     * @return {@code true} when {@link #path()} is present and not empty
     */
    public boolean hasPath() {
        return path != null && !path.isEmpty();
    }
}
