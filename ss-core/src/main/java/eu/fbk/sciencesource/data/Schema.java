package eu.fbk.sciencesource.data;

import java.util.List;
import java.util.Set;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

/**
 * The static description of a record kind: the item types it declares and, for each uploaded
 * field, its JSON key, the label of the remote property it is stored under, its value kind and
 * the {@link Layer} it belongs to.
 * <p>
 * Schemas are immutable and declared once per record kind (see {@link Article#SCHEMA},
 * {@link AnchorPoint#SCHEMA} and {@link Annotation#SCHEMA}).
 * </p>
 */
public final class Schema {

    private final String name;

    private final Set<ItemType> itemTypes;

    private final List<Field> fields;

    private Schema(final Builder builder) {
        this.name = builder.name;
        this.itemTypes = builder.itemTypes.build();
        this.fields = builder.fields.build();
    }

    public String getName() {
        return this.name;
    }

    public Set<ItemType> getItemTypes() {
        return this.itemTypes;
    }

    public List<Field> getFields() {
        return this.fields;
    }

    /**
     * Returns the field with the JSON key specified.
     *
     * @param key
     *            the JSON key
     * @return the field
     * @throws IllegalArgumentException
     *             if this schema has no such field
     */
    public Field getField(final String key) {
        for (final Field field : this.fields) {
            if (field.getKey().equals(key)) {
                return field;
            }
        }
        throw new IllegalArgumentException("No field '" + key + "' in " + this.name + " schema");
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("name", this.name)
                .add("itemTypes", this.itemTypes).add("fields", this.fields).toString();
    }

    public static Builder builder(final String name) {
        return new Builder(name);
    }

    public static final class Field {

        private final String key;

        private final String label;

        private final ValueKind kind;

        private final Layer layer;

        Field(final String key, final String label, final ValueKind kind, final Layer layer) {
            this.key = key;
            this.label = label;
            this.kind = kind;
            this.layer = layer;
        }

        public String getKey() {
            return this.key;
        }

        public String getLabel() {
            return this.label;
        }

        public ValueKind getKind() {
            return this.kind;
        }

        public Layer getLayer() {
            return this.layer;
        }

        @Override
        public String toString() {
            return this.key + " -> '" + this.label + "' (" + this.kind + ", " + this.layer + ")";
        }

    }

    public static final class Builder {

        private final String name;

        private final ImmutableSet.Builder<ItemType> itemTypes;

        private final ImmutableList.Builder<Field> fields;

        private final Set<String> keys;

        Builder(final String name) {
            this.name = Preconditions.checkNotNull(name);
            this.itemTypes = ImmutableSet.builder();
            this.fields = ImmutableList.builder();
            this.keys = Sets.newHashSet();
        }

        public Builder item(final ItemType itemType) {
            this.itemTypes.add(itemType);
            return this;
        }

        public Builder property(final String key, final String label, final ValueKind kind,
                final Layer layer) {
            Preconditions.checkArgument(!Strings.isNullOrEmpty(key), "Empty key");
            Preconditions.checkArgument(!Strings.isNullOrEmpty(label), "Empty label for %s", key);
            Preconditions.checkArgument(this.keys.add(key), "Duplicate key %s", key);
            this.fields.add(new Field(key, label, Preconditions.checkNotNull(kind),
                    Preconditions.checkNotNull(layer)));
            return this;
        }

        public Schema build() {
            return new Schema(this);
        }

    }

}
