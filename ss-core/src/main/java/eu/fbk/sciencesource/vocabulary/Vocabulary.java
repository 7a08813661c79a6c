package eu.fbk.sciencesource.vocabulary;

import java.util.Map;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableMap;

import eu.fbk.sciencesource.data.ItemType;

/**
 * The remote IDs of the property and item labels used by an upload session.
 * <p>
 * Instances are immutable; they are normally produced by
 * {@link LabelResolver#resolve(TagRegistry)} and passed to whatever needs to translate labels.
 * </p>
 */
public final class Vocabulary {

    private final Map<String, String> propertyIDs;

    private final Map<String, String> itemIDs;

    private Vocabulary(final Map<String, String> propertyIDs, final Map<String, String> itemIDs) {
        this.propertyIDs = propertyIDs;
        this.itemIDs = itemIDs;
    }

    public static Vocabulary create(final Map<String, String> propertyIDs,
            final Map<String, String> itemIDs) {
        return new Vocabulary(ImmutableMap.copyOf(propertyIDs), ImmutableMap.copyOf(itemIDs));
    }

    /**
     * Returns the ID of the property labelled as specified.
     *
     * @param label
     *            the property label
     * @return the property ID
     * @throws UnresolvedLabelException
     *             if the label was not resolved
     */
    public String getPropertyID(final String label) {
        final String id = this.propertyIDs.get(label);
        if (id == null) {
            throw new UnresolvedLabelException(Role.PROPERTY, label);
        }
        return id;
    }

    /**
     * Returns the ID of the item labelled as specified.
     *
     * @param label
     *            the item label
     * @return the item ID
     * @throws UnresolvedLabelException
     *             if the label was not resolved
     */
    public String getItemID(final String label) {
        final String id = this.itemIDs.get(label);
        if (id == null) {
            throw new UnresolvedLabelException(Role.ITEM, label);
        }
        return id;
    }

    public String getItemID(final ItemType itemType) {
        return getItemID(itemType.getLabel());
    }

    public Map<String, String> getPropertyIDs() {
        return this.propertyIDs;
    }

    public Map<String, String> getItemIDs() {
        return this.itemIDs;
    }

    /**
     * Checks that every label of the registry specified has a resolved ID.
     *
     * @param registry
     *            the registry to check
     * @throws UnresolvedLabelException
     *             reporting the first label without an ID
     */
    public void checkCovers(final TagRegistry registry) {
        for (final String label : registry.getPropertyLabels()) {
            getPropertyID(label);
        }
        for (final String label : registry.getItemLabels()) {
            getItemID(label);
        }
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Vocabulary)) {
            return false;
        }
        final Vocabulary other = (Vocabulary) object;
        return this.propertyIDs.equals(other.propertyIDs) && this.itemIDs.equals(other.itemIDs);
    }

    @Override
    public int hashCode() {
        return this.propertyIDs.hashCode() * 37 + this.itemIDs.hashCode();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("properties", this.propertyIDs)
                .add("items", this.itemIDs).toString();
    }

}
