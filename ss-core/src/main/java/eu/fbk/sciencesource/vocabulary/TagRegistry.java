package eu.fbk.sciencesource.vocabulary;

import java.util.Set;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import eu.fbk.sciencesource.data.AnchorPoint;
import eu.fbk.sciencesource.data.Annotation;
import eu.fbk.sciencesource.data.Article;
import eu.fbk.sciencesource.data.ItemType;
import eu.fbk.sciencesource.data.Schema;

/**
 * The labels declared by a set of record schemas.
 * <p>
 * Property labels are collected from the fields of the schemas, item labels from the item types
 * they declare. Each label is reported once, no matter how many fields or schemas declare it; the
 * order of the returned sets carries no meaning.
 * </p>
 */
public final class TagRegistry {

    private static final TagRegistry DEFAULT = create(ImmutableList.of(Annotation.SCHEMA,
            AnchorPoint.SCHEMA, Article.SCHEMA));

    private final Set<String> propertyLabels;

    private final Set<String> itemLabels;

    private TagRegistry(final Set<String> propertyLabels, final Set<String> itemLabels) {
        this.propertyLabels = propertyLabels;
        this.itemLabels = itemLabels;
    }

    /**
     * Returns the registry for the article, anchor point and annotation schemas.
     *
     * @return the default registry
     */
    public static TagRegistry getDefault() {
        return DEFAULT;
    }

    public static TagRegistry create(final Iterable<Schema> schemas) {
        final ImmutableSet.Builder<String> properties = ImmutableSet.builder();
        final ImmutableSet.Builder<String> items = ImmutableSet.builder();
        for (final Schema schema : schemas) {
            for (final Schema.Field field : schema.getFields()) {
                properties.add(field.getLabel());
            }
            for (final ItemType itemType : schema.getItemTypes()) {
                items.add(itemType.getLabel());
            }
        }
        return new TagRegistry(properties.build(), items.build());
    }

    public Set<String> getPropertyLabels() {
        return this.propertyLabels;
    }

    public Set<String> getItemLabels() {
        return this.itemLabels;
    }

    public Set<String> getLabels(final Role role) {
        Preconditions.checkNotNull(role);
        return role == Role.PROPERTY ? this.propertyLabels : this.itemLabels;
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("properties", this.propertyLabels)
                .add("items", this.itemLabels).toString();
    }

}
