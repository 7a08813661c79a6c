package eu.fbk.sciencesource;

import javax.annotation.Nullable;

/**
 * Signals the failure of a call to a remote {@link ScienceSource}.
 * <p>
 * The exception is opaque to the upload logic: network, authentication and remote API failures
 * are all reported this way. When the remote API returned a structured error, its code is
 * available via {@link #getCode()}.
 * </p>
 */
public class ScienceSourceException extends Exception {

    private static final long serialVersionUID = 1L;

    @Nullable
    private final String code;

    public ScienceSourceException(final String message) {
        this(null, message, null);
    }

    public ScienceSourceException(final String message, @Nullable final Throwable cause) {
        this(null, message, cause);
    }

    /**
     * Creates a new instance with the remote error code, message and cause specified.
     *
     * @param code
     *            the error code returned by the remote API, if any
     * @param message
     *            the error message
     * @param cause
     *            the optional cause of this exception
     */
    public ScienceSourceException(@Nullable final String code, final String message,
            @Nullable final Throwable cause) {
        super(code == null ? message : message + " (" + code + ")", cause);
        this.code = code;
    }

    /**
     * Returns the error code returned by the remote API, if any.
     *
     * @return the error code, or null if not available
     */
    @Nullable
    public String getCode() {
        return this.code;
    }

}
