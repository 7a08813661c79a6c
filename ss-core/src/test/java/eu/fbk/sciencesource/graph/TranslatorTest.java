package eu.fbk.sciencesource.graph;

import java.util.Map;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.sciencesource.Fixtures;
import eu.fbk.sciencesource.ItemRef;
import eu.fbk.sciencesource.data.AnchorPoint;
import eu.fbk.sciencesource.data.Annotation;
import eu.fbk.sciencesource.data.Article;
import eu.fbk.sciencesource.data.Layer;
import eu.fbk.sciencesource.vocabulary.TagRegistry;
import eu.fbk.sciencesource.vocabulary.UnresolvedLabelException;
import eu.fbk.sciencesource.vocabulary.Vocabulary;

public class TranslatorTest {

    private static Vocabulary vocabulary() {
        final Map<String, String> properties = Maps.newHashMap();
        int index = 0;
        for (final String label : TagRegistry.getDefault().getPropertyLabels()) {
            properties.put(label, "P" + ++index);
        }
        return Vocabulary.create(properties, ImmutableMap.<String, String>of());
    }

    @Test
    public void testAnnotation() {
        final Vocabulary vocabulary = vocabulary();
        final Annotation annotation = new Annotation("malaria", "Q12156", "", "2018-06-14");
        annotation.setInstanceOf("Q3");

        final Map<String, Object> upfront = new Translator(vocabulary).translate(annotation,
                Layer.UPFRONT);
        Assert.assertEquals(ImmutableList.of(vocabulary.getPropertyID("term found"),
                vocabulary.getPropertyID("length of term found"),
                vocabulary.getPropertyID("Wikidata item code"),
                vocabulary.getPropertyID("time code1")), ImmutableList.copyOf(upfront.keySet()));
        Assert.assertEquals("malaria", upfront.get(vocabulary.getPropertyID("term found")));
        Assert.assertEquals(7, upfront.get(vocabulary.getPropertyID("length of term found")));

        final Map<String, Object> instance = new Translator(vocabulary).translate(annotation,
                Layer.INSTANCE);
        Assert.assertEquals(ImmutableMap.of(vocabulary.getPropertyID("instance of"),
                ItemRef.of("Q3")), instance);
    }

    @Test
    public void testLayers() {
        final Vocabulary vocabulary = vocabulary();
        final Article article = Fixtures.article(1);
        final AnchorPoint anchorPoint = article.getAnchorPoints().get(0);
        anchorPoint.setAnchorPointIn("Q100");
        anchorPoint.setAnchors("Q101");
        anchorPoint.setPrecedingAnchorPoint("Q100");
        anchorPoint.setFollowingAnchorPoint("Q4");

        final Translator translator = new Translator(vocabulary);
        Assert.assertEquals(ImmutableMap.of(vocabulary.getPropertyID("preceding anchor point"),
                ItemRef.of("Q100"), vocabulary.getPropertyID("following anchor point"),
                ItemRef.of("Q4")), translator.translate(anchorPoint, Layer.LINKED));
        Assert.assertEquals(ImmutableMap.of(vocabulary.getPropertyID("anchors"),
                ItemRef.of("Q101")), translator.translate(anchorPoint,
                Layer.ANNOTATIONS_UPLOADED));
        Assert.assertTrue(translator.translate(anchorPoint).isEmpty());

        final Map<String, Object> upfront = translator.translate(article, Layer.UPFRONT);
        Assert.assertEquals(0, upfront.get(vocabulary.getPropertyID("character number")));
        Assert.assertFalse(upfront.containsKey(vocabulary.getPropertyID("preceding phrase")));
    }

    @Test
    public void testUnresolved() {
        final Vocabulary vocabulary = Vocabulary.create(ImmutableMap.of("term found", "P1"),
                ImmutableMap.<String, String>of());
        try {
            new Translator(vocabulary).translate(new Annotation("gene", null, null, null),
                    Layer.UPFRONT);
            Assert.fail();
        } catch (final UnresolvedLabelException ex) {
            Assert.assertEquals("length of term found", ex.getLabel());
        }
    }

}
