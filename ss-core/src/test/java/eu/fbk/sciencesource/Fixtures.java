package eu.fbk.sciencesource;

import java.io.IOException;
import java.io.InputStream;

import com.google.common.io.Resources;

import eu.fbk.sciencesource.data.AnchorPoint;
import eu.fbk.sciencesource.data.Annotation;
import eu.fbk.sciencesource.data.Article;
import eu.fbk.sciencesource.data.ArticleIO;

public final class Fixtures {

    private static final String[] TERMS = { "malaria", "Plasmodium falciparum", "artemisinin",
            "mosquito", "quinine" };

    private Fixtures() {
    }

    public static Article article(final int anchorPoints) {
        final Article article = new Article();
        article.setWikidataItemCode("Q56000000");
        article.setArticleTextTitle("Artemisinin resistance in Plasmodium falciparum");
        article.setPublicationDate("2018-03-02");
        article.setTimeCode("2018-06-14T10:22:01Z");
        article.setPrecedingPhrase("");
        article.setFollowingPhrase("Abstract Background");
        for (int i = 0; i < anchorPoints; ++i) {
            final String term = TERMS[i % TERMS.length];
            final Annotation annotation = new Annotation(term, "Q" + (12000 + i), "disease",
                    "2018-06-14T10:22:01Z");
            final AnchorPoint anchorPoint = new AnchorPoint(annotation);
            anchorPoint.setPrecedingPhrase("resistance to " + i);
            anchorPoint.setFollowingPhrase("was observed " + i);
            anchorPoint.setCharacterNumber(120 * (i + 1));
            anchorPoint.setDistanceToPreceding(i == 0 ? 120 : 120 - term.length());
            anchorPoint.setDistanceToFollowing(120 - term.length());
            anchorPoint.setTimeCode("2018-06-14T10:22:01Z");
            article.addAnchorPoint(anchorPoint);
        }
        return article;
    }

    /**
     * Returns the article of {@code annotated-article.json}, a document as emitted by the
     * annotation step: two anchor points, every string field present with empty IDs and
     * references, {@code page_id} 0 and no {@code stage}.
     */
    public static Article annotatedArticle() throws IOException {
        try (InputStream stream = Resources.getResource(Fixtures.class,
                "annotated-article.json").openStream()) {
            return ArticleIO.read(stream);
        }
    }

}
