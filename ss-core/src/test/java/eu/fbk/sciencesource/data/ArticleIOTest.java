package eu.fbk.sciencesource.data;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import eu.fbk.sciencesource.Fixtures;

public class ArticleIOTest {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testEmptyArticle() throws IOException {
        final Article article = Fixtures.article(0);
        final Article loaded = roundTrip(article);
        Assert.assertEquals(article, loaded);
        Assert.assertEquals(Stage.UNSUBMITTED, loaded.getStage());
        Assert.assertTrue(loaded.getAnchorPoints().isEmpty());
    }

    @Test
    public void testPartiallyUploaded() throws IOException {
        final Article article = Fixtures.article(3);
        article.setID("Q1000");
        article.setPageID(100);
        article.setScienceSourceTitle("Artemisinin resistance");
        article.setStage(Stage.ARTICLE_UPLOADED);
        article.getAnchorPoints().get(0).getAnnotation().setID("Q1001");
        article.getAnchorPoints().get(0).setAnchorPointIn("Q1000");

        final Article loaded = roundTrip(article);
        Assert.assertEquals(article, loaded);
        Assert.assertEquals(Stage.ARTICLE_UPLOADED, loaded.getStage());
        Assert.assertEquals(100, loaded.getPageID());
        Assert.assertEquals("Q1001", loaded.getAnchorPoints().get(0).getAnnotation().getID());
        Assert.assertFalse(loaded.getAnchorPoints().get(0).hasID());
        Assert.assertFalse(loaded.getAnchorPoints().get(1).getAnnotation().hasID());
    }

    @Test
    public void testOrderPreserved() throws IOException {
        final Article article = Fixtures.article(5);
        final Article loaded = roundTrip(article);
        for (int i = 0; i < 5; ++i) {
            Assert.assertEquals(article.getAnchorPoints().get(i).getAnnotation().getTermFound(),
                    loaded.getAnchorPoints().get(i).getAnnotation().getTermFound());
            Assert.assertEquals(120 * (i + 1), loaded.getAnchorPoints().get(i)
                    .getCharacterNumber());
        }
    }

    @Test
    public void testKeys() throws IOException {
        final Article article = Fixtures.article(1);
        article.getAnchorPoints().get(0).setPrecedingAnchorPoint("Q7");
        final ByteArrayOutputStream stream = new ByteArrayOutputStream();
        ArticleIO.write(article, stream);

        final JsonNode root = new ObjectMapper().readTree(stream.toByteArray());
        Assert.assertEquals("Artemisinin resistance in Plasmodium falciparum", root.get("title")
                .asText());
        Assert.assertEquals("unsubmitted", root.get("stage").asText());
        final JsonNode anchorPoint = root.get("annotations").get(0);
        Assert.assertEquals("Q7", anchorPoint.get("preceding_anchor").asText());
        Assert.assertEquals(120, anchorPoint.get("character").asInt());
        Assert.assertEquals("malaria", anchorPoint.get("annotation").get("term").asText());
        Assert.assertEquals(7, anchorPoint.get("annotation").get("length").asInt());
        Assert.assertFalse(anchorPoint.has("following_anchor"));
        Assert.assertFalse(root.has("id"));
    }

    @Test
    public void testUnknownKeysIgnored() throws IOException {
        final String json = "{\"title\":\"Some title\",\"extra\":{\"a\":1},\"annotations\":"
                + "[{\"character\":4,\"annotation\":{\"term\":\"gene\",\"length\":4,"
                + "\"unused\":true}}]}";
        final Article article = read(json);
        Assert.assertEquals("Some title", article.getArticleTextTitle());
        Assert.assertEquals(Stage.UNSUBMITTED, article.getStage());
        Assert.assertEquals(1, article.getAnchorPoints().size());
        Assert.assertEquals("gene", article.getAnchorPoints().get(0).getAnnotation()
                .getTermFound());
    }

    @Test
    public void testMalformed() throws IOException {
        try {
            read("{\"title\":\"Some title\",\"annotations\":[{\"annotation\":null}]}");
            Assert.fail();
        } catch (final IOException ex) {
            // ok
        }
        try {
            read("{\"title\":\"Some title\",\"annotations\":[null]}");
            Assert.fail();
        } catch (final IOException ex) {
            // ok
        }
        try {
            read("{\"title\":\"Some title\",\"stage\":\"uploading\"}");
            Assert.fail();
        } catch (final IOException ex) {
            // ok
        }
        try {
            read("{\"title\":");
            Assert.fail();
        } catch (final IOException ex) {
            // ok
        }
    }

    @Test
    public void testNullStage() throws IOException {
        final Article explicit = read("{\"title\":\"Some title\",\"stage\":null}");
        final Article missing = read("{\"title\":\"Some title\"}");
        Assert.assertEquals(Stage.UNSUBMITTED, explicit.getStage());
        Assert.assertEquals(missing, explicit);
    }

    @Test
    public void testNullAnnotations() throws IOException {
        final Article article = read("{\"title\":\"Some title\",\"annotations\":null}");
        Assert.assertNotNull(article.getAnchorPoints());
        Assert.assertTrue(article.getAnchorPoints().isEmpty());
        Assert.assertEquals(Stage.UNSUBMITTED, article.getStage());
        article.addAnchorPoint(new AnchorPoint(new Annotation("gene", "Q7187", "gene", "")));
        Assert.assertEquals(1, article.getAnchorPoints().size());
    }

    @Test
    public void testAnnotatedDocument() throws IOException {
        final Article article = Fixtures.annotatedArticle();
        Assert.assertEquals("Mosquito nets and malaria incidence", article.getArticleTextTitle());
        Assert.assertEquals(Stage.UNSUBMITTED, article.getStage());
        Assert.assertFalse(article.hasID());
        Assert.assertFalse(article.hasPageID());
        Assert.assertEquals(2, article.getAnchorPoints().size());
        final AnchorPoint anchorPoint = article.getAnchorPoints().get(1);
        Assert.assertFalse(anchorPoint.hasID());
        Assert.assertFalse(anchorPoint.getAnnotation().hasID());
        Assert.assertEquals(159, anchorPoint.getCharacterNumber());
        Assert.assertEquals("permethrin", anchorPoint.getAnnotation().getTermFound());

        article.setID("Q1000");
        anchorPoint.getAnnotation().setID("Q1001");
        Assert.assertEquals("Q1000", article.getID());
        Assert.assertEquals(article, roundTrip(article));
    }

    @Test
    public void testSaveLoad() throws IOException {
        final File root = this.folder.newFolder();
        final Path file = root.toPath().resolve("sub").resolve("article.json");
        final Article article = Fixtures.article(2);
        ArticleIO.save(article, file);
        Assert.assertTrue(Files.exists(file));
        Assert.assertFalse(Files.exists(file.resolveSibling("article.json.tmp")));
        Assert.assertEquals(article, ArticleIO.load(file));

        article.setStage(Stage.ARTICLE_UPLOADED);
        ArticleIO.save(article, file);
        Assert.assertEquals(Stage.ARTICLE_UPLOADED, ArticleIO.load(file).getStage());
    }

    @Test
    public void testLoadMissing() throws IOException {
        try {
            ArticleIO.load(this.folder.getRoot().toPath().resolve("missing.json"));
            Assert.fail();
        } catch (final IOException ex) {
            // ok
        }
    }

    private static Article roundTrip(final Article article) throws IOException {
        final ByteArrayOutputStream stream = new ByteArrayOutputStream();
        ArticleIO.write(article, stream);
        return ArticleIO.read(new ByteArrayInputStream(stream.toByteArray()));
    }

    private static Article read(final String json) throws IOException {
        return ArticleIO.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)));
    }

}
