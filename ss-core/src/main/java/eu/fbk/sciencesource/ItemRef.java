package eu.fbk.sciencesource;

import java.io.Serializable;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * A reference to a remote item, used as a property value.
 */
public final class ItemRef implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;

    private ItemRef(final String id) {
        this.id = id;
    }

    public static ItemRef of(final String id) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(id), "Empty item ID");
        return new ItemRef(id);
    }

    public String getID() {
        return this.id;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof ItemRef)) {
            return false;
        }
        return this.id.equals(((ItemRef) object).id);
    }

    @Override
    public int hashCode() {
        return this.id.hashCode();
    }

    @Override
    public String toString() {
        return this.id;
    }

}
