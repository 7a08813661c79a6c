package eu.fbk.sciencesource.vocabulary;

import java.util.Map;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import org.junit.Assert;
import org.junit.Test;

import eu.fbk.sciencesource.MockScienceSource;
import eu.fbk.sciencesource.data.ItemType;

public class LabelResolverTest {

    @Test
    public void testResolve() throws Throwable {
        final MockScienceSource source = new MockScienceSource();
        final TagRegistry registry = TagRegistry.getDefault();
        final Vocabulary vocabulary = new LabelResolver(source).resolve(registry);
        Assert.assertEquals(registry.getPropertyLabels(), vocabulary.getPropertyIDs().keySet());
        Assert.assertEquals(registry.getItemLabels(), vocabulary.getItemIDs().keySet());
        Assert.assertEquals(registry.getPropertyLabels().size(),
                ImmutableSet.copyOf(vocabulary.getPropertyIDs().values()).size());
        Assert.assertTrue(vocabulary.getPropertyID("anchors").startsWith("P"));
        Assert.assertTrue(vocabulary.getItemID(ItemType.TERMINUS).startsWith("Q"));
        vocabulary.checkCovers(registry);
    }

    @Test
    public void testFailFast() {
        final Set<String> labels = Sets.newLinkedHashSet(ImmutableList.of("term found",
                "length of term found", "dictionary name", "time code1", "instance of"));
        final MockScienceSource source = new MockScienceSource().failOnLabel("dictionary name");
        try {
            new LabelResolver(source).resolvePropertyLabels(labels);
            Assert.fail();
        } catch (final ResolutionException ex) {
            Assert.assertEquals("dictionary name", ex.getLabel());
            Assert.assertEquals(Role.PROPERTY, ex.getRole());
            Assert.assertEquals("no-such-label", ex.getCause().getCode());
        }
        Assert.assertEquals(ImmutableList.of("term found", "length of term found",
                "dictionary name"), source.getLookups());
    }

    @Test
    public void testItemFailure() {
        final MockScienceSource source = new MockScienceSource().failOnLabel("terminus");
        try {
            new LabelResolver(source).resolve(TagRegistry.getDefault());
            Assert.fail();
        } catch (final ResolutionException ex) {
            Assert.assertEquals("terminus", ex.getLabel());
            Assert.assertEquals(Role.ITEM, ex.getRole());
        }
        Assert.assertEquals(0, source.getWrites());
    }

    @Test
    public void testEmptyLabels() throws Throwable {
        final MockScienceSource source = new MockScienceSource();
        final Map<String, String> ids = new LabelResolver(source).resolveItemLabels(ImmutableSet
                .<String>of());
        Assert.assertTrue(ids.isEmpty());
        Assert.assertTrue(source.getLookups().isEmpty());
    }

}
