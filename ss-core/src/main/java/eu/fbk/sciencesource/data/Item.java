package eu.fbk.sciencesource.data;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Base class of the records uploaded as remote items.
 * <p>
 * Every item carries the ID assigned to it by the remote store once uploaded (immutable after
 * assignment) and the instance-only {@code instance of} reference to the item classifying it.
 * Uploaded field values are accessed generically by JSON key via {@link #get(String)}, following
 * the {@link Schema} returned by {@link #getSchema()}.
 * </p>
 */
public abstract class Item {

    static final String INSTANCE_OF = "instance_of";

    @Nullable
    @JsonProperty("id")
    private String id;

    @Nullable
    @JsonProperty(INSTANCE_OF)
    private String instanceOf;

    /**
     * Returns the kind of remote item this record is uploaded as.
     *
     * @return the item type
     */
    public abstract ItemType getItemType();

    /**
     * Returns the schema of this record kind.
     *
     * @return the schema
     */
    public abstract Schema getSchema();

    /**
     * Returns the value of the field with the JSON key specified.
     *
     * @param key
     *            the JSON key of a field of this record's schema
     * @return the field value, possibly null; an {@code Integer} for quantity fields, a
     *         {@code String} otherwise
     * @throws IllegalArgumentException
     *             if the key does not denote a field of this record
     */
    @Nullable
    public final Object get(final String key) {
        if (INSTANCE_OF.equals(key)) {
            return this.instanceOf;
        }
        return doGet(key);
    }

    @Nullable
    abstract Object doGet(String key);

    @Nullable
    public String getID() {
        return this.id;
    }

    public boolean hasID() {
        return !Strings.isNullOrEmpty(this.id);
    }

    /**
     * Records the ID assigned by the remote store. Setting the same ID again has no effect. An
     * empty ID, as found in documents produced before the upload, counts as no ID.
     *
     * @param id
     *            the remote ID, not empty
     * @throws IllegalStateException
     *             if a different ID was already assigned
     */
    public void setID(final String id) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(id), "Empty ID");
        Preconditions.checkState(Strings.isNullOrEmpty(this.id) || this.id.equals(id),
                "%s already has ID %s, cannot assign %s", getItemType(), this.id, id);
        this.id = id;
    }

    @Nullable
    public String getInstanceOf() {
        return this.instanceOf;
    }

    public void setInstanceOf(@Nullable final String instanceOf) {
        this.instanceOf = instanceOf;
    }

    static IllegalArgumentException unknownKey(final Schema schema, final String key) {
        return new IllegalArgumentException("No field '" + key + "' in " + schema.getName()
                + " schema");
    }

}
