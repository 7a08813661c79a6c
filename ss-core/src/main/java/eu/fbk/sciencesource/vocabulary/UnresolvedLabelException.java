package eu.fbk.sciencesource.vocabulary;

import com.google.common.base.Preconditions;

/**
 * Signals that a label has no resolved remote ID.
 * <p>
 * This is a configuration error, not a transient failure: either labels were not resolved before
 * uploading, or the local schemas and the remote vocabulary have diverged. Retrying without
 * fixing the cause fails again.
 * </p>
 */
public class UnresolvedLabelException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    private final Role role;

    private final String label;

    public UnresolvedLabelException(final Role role, final String label) {
        super("Unresolved " + Preconditions.checkNotNull(role) + " label '" + label + "'");
        this.role = role;
        this.label = Preconditions.checkNotNull(label);
    }

    public final Role getRole() {
        return this.role;
    }

    public final String getLabel() {
        return this.label;
    }

}
