package eu.fbk.sciencesource.vocabulary;

import java.util.List;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.sciencesource.data.AnchorPoint;
import eu.fbk.sciencesource.data.Annotation;
import eu.fbk.sciencesource.data.Article;
import eu.fbk.sciencesource.data.Schema;

public class TagRegistryTest {

    private static final Set<String> PROPERTY_LABELS = ImmutableSet.of("term found",
            "length of term found", "Wikidata item code", "dictionary name", "time code1",
            "instance of", "preceding phrase", "following phrase", "distance to preceding",
            "distance to following", "character number", "ScienceSource article title",
            "anchor point in", "anchors", "preceding anchor point", "following anchor point",
            "article text title", "publication date", "page ID");

    @Test
    public void testDefault() {
        final TagRegistry registry = TagRegistry.getDefault();
        Assert.assertEquals(PROPERTY_LABELS, registry.getPropertyLabels());
        Assert.assertEquals(ImmutableSet.of("article", "anchor point", "annotation", "terminus"),
                registry.getItemLabels());
        Assert.assertEquals(registry.getItemLabels(), registry.getLabels(Role.ITEM));
    }

    @Test
    public void testNoDuplicates() {
        final List<String> labels = Lists.newArrayList();
        for (final Schema schema : ImmutableList.of(Annotation.SCHEMA, AnchorPoint.SCHEMA,
                Article.SCHEMA)) {
            for (final Schema.Field field : schema.getFields()) {
                labels.add(field.getLabel());
            }
        }
        Assert.assertTrue(labels.size() > PROPERTY_LABELS.size());
        final List<String> registered = ImmutableList.copyOf(TagRegistry.getDefault()
                .getPropertyLabels());
        Assert.assertEquals(ImmutableSet.copyOf(registered).size(), registered.size());
        Assert.assertEquals(ImmutableSet.copyOf(labels), ImmutableSet.copyOf(registered));
    }

    @Test
    public void testEmpty() {
        final TagRegistry registry = TagRegistry.create(ImmutableList.of(Schema
                .builder("empty").build()));
        Assert.assertTrue(registry.getPropertyLabels().isEmpty());
        Assert.assertTrue(registry.getItemLabels().isEmpty());
    }

}
