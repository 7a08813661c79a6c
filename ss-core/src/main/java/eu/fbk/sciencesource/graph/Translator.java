package eu.fbk.sciencesource.graph;

import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;

import eu.fbk.sciencesource.ItemRef;
import eu.fbk.sciencesource.data.Item;
import eu.fbk.sciencesource.data.Layer;
import eu.fbk.sciencesource.data.Schema;
import eu.fbk.sciencesource.vocabulary.UnresolvedLabelException;
import eu.fbk.sciencesource.vocabulary.Vocabulary;

/**
 * Translates record fields into the property values understood by the remote store.
 * <p>
 * Fields are selected by {@link Layer} and keyed by the ID of the property their label resolves
 * to. String values are passed as is, quantities as {@code Integer}s, references as
 * {@link ItemRef}s. Null and empty strings are omitted, quantities are always included. A label
 * with no resolved ID results in an {@link UnresolvedLabelException}.
 * </p>
 */
public final class Translator {

    private final Vocabulary vocabulary;

    public Translator(final Vocabulary vocabulary) {
        this.vocabulary = Preconditions.checkNotNull(vocabulary);
    }

    public Vocabulary getVocabulary() {
        return this.vocabulary;
    }

    /**
     * Returns the property values of the fields of the layers specified.
     *
     * @param item
     *            the record to translate
     * @param layers
     *            the layers to include
     * @return an insertion-ordered map from property ID to value
     * @throws UnresolvedLabelException
     *             if the label of an included field has no resolved ID
     */
    public Map<String, Object> translate(final Item item, final Layer... layers) {
        final Set<Layer> selected = ImmutableSet.copyOf(layers);
        final Map<String, Object> properties = Maps.newLinkedHashMap();
        for (final Schema.Field field : item.getSchema().getFields()) {
            if (!selected.contains(field.getLayer())) {
                continue;
            }
            final Object value = convert(field, item.get(field.getKey()));
            if (value != null) {
                properties.put(this.vocabulary.getPropertyID(field.getLabel()), value);
            }
        }
        return properties;
    }

    @Nullable
    private static Object convert(final Schema.Field field, @Nullable final Object value) {
        if (value == null) {
            return null;
        }
        switch (field.getKind()) {
        case QUANTITY:
            return (Integer) value;
        case ITEM:
            final String id = (String) value;
            return id.isEmpty() ? null : ItemRef.of(id);
        case STRING:
            final String string = (String) value;
            return string.isEmpty() ? null : string;
        default:
            throw new Error("Unexpected value kind " + field.getKind());
        }
    }

}
