package eu.fbk.sciencesource.vocabulary;

import com.google.common.base.Preconditions;

import eu.fbk.sciencesource.ScienceSourceException;

/**
 * Signals the failure of resolving a label to its remote ID.
 * <p>
 * Resolution has no side effects on the remote store, so the operation can be retried as is once
 * the cause (reported by {@link #getCause()}) is fixed.
 * </p>
 */
public class ResolutionException extends Exception {

    private static final long serialVersionUID = 1L;

    private final Role role;

    private final String label;

    public ResolutionException(final Role role, final String label,
            final ScienceSourceException cause) {
        super("Could not resolve " + Preconditions.checkNotNull(role) + " label '" + label
                + "': " + cause.getMessage(), cause);
        this.role = role;
        this.label = Preconditions.checkNotNull(label);
    }

    public final Role getRole() {
        return this.role;
    }

    public final String getLabel() {
        return this.label;
    }

    @Override
    public synchronized ScienceSourceException getCause() {
        return (ScienceSourceException) super.getCause();
    }

}
