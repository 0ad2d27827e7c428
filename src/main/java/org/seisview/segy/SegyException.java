package org.seisview.segy;

/**
 * Base class for all failures raised by the seismic volume access engine.
 * <p>
 * Each subclass represents exactly one entry of the error taxonomy and reports it via
 * {@link #getErrorCode()}, so the transport layer can map failures to responses without
 * inspecting messages.
 * <p>
 * <strong>Error Handling Pattern:</strong> These exceptions are terminal for the request that
 * triggered them. The engine never retries internally; callers decide whether to retry.
 */
public abstract class SegyException extends Exception {

    protected SegyException(String message) {
        super(message);
    }

    protected SegyException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Returns the stable taxonomy name of this failure (e.g. {@code "MalformedHeader"}).
     *
     * @return the error code, never null
     */
    public abstract String getErrorCode();
}
