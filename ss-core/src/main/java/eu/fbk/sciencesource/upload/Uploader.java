package eu.fbk.sciencesource.upload;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.sciencesource.ScienceSource;
import eu.fbk.sciencesource.ScienceSourceException;
import eu.fbk.sciencesource.data.AnchorPoint;
import eu.fbk.sciencesource.data.Annotation;
import eu.fbk.sciencesource.data.Article;
import eu.fbk.sciencesource.data.ArticleIO;
import eu.fbk.sciencesource.data.ItemType;
import eu.fbk.sciencesource.data.Layer;
import eu.fbk.sciencesource.data.Stage;
import eu.fbk.sciencesource.graph.AnnotationGraph;
import eu.fbk.sciencesource.graph.Translator;
import eu.fbk.sciencesource.internal.Logging;
import eu.fbk.sciencesource.vocabulary.LabelResolver;
import eu.fbk.sciencesource.vocabulary.ResolutionException;
import eu.fbk.sciencesource.vocabulary.TagRegistry;
import eu.fbk.sciencesource.vocabulary.Vocabulary;

/**
 * Uploads annotation graphs to a {@link ScienceSource}, one stage at a time.
 * <p>
 * The stages, run strictly in sequence as each one needs the IDs produced by the previous ones,
 * are:
 * </p>
 * <ol>
 * <li>{@link Stage#ARTICLE_UPLOADED}: the article text is uploaded as a wiki page, the article
 * item is created and every anchor point gets a reference to it;</li>
 * <li>{@link Stage#ANNOTATIONS_UPLOADED}: for each anchor point in document order, the annotation
 * item and then the anchor point item referencing it are created;</li>
 * <li>{@link Stage#LINKED}: each anchor point item is updated with the references to its
 * neighbours, and the article item with the reference to the first anchor point.</li>
 * </ol>
 * <p>
 * A record that already has a remote ID (or a reference that has already been pushed) is never
 * uploaded again, so that a failed upload can be retried on the same graph, or on the graph
 * saved at the time of the failure, without duplicating remote items. Failures of the remote
 * store are reported as {@link UploadException}s; the stage of the article is only advanced once
 * all the records of that stage have been uploaded.
 * </p>
 */
public final class Uploader {

    private static final Logger LOGGER = LoggerFactory.getLogger(Uploader.class);

    private final ScienceSource source;

    private final Vocabulary vocabulary;

    private final Translator translator;

    /**
     * Creates a new instance uploading to the store specified with the vocabulary specified.
     *
     * @param source
     *            the remote store
     * @param vocabulary
     *            the resolved vocabulary, which must cover all the labels of
     *            {@link TagRegistry#getDefault()}
     * @throws eu.fbk.sciencesource.vocabulary.UnresolvedLabelException
     *             if the vocabulary misses some label
     */
    public Uploader(final ScienceSource source, final Vocabulary vocabulary) {
        this.source = Preconditions.checkNotNull(source);
        this.vocabulary = Preconditions.checkNotNull(vocabulary);
        this.translator = new Translator(vocabulary);
        vocabulary.checkCovers(TagRegistry.getDefault());
    }

    /**
     * Resolves the labels of all the record schemas against the store specified, and returns an
     * {@code Uploader} using the resulting vocabulary.
     *
     * @param source
     *            the remote store
     * @return the created uploader
     * @throws ResolutionException
     *             if some label could not be resolved
     */
    public static Uploader connect(final ScienceSource source) throws ResolutionException {
        final Vocabulary vocabulary = new LabelResolver(source).resolve(TagRegistry.getDefault());
        return new Uploader(source, vocabulary);
    }

    public Vocabulary getVocabulary() {
        return this.vocabulary;
    }

    /**
     * Uploads the text of an article as a new wiki page, recording the page ID in the article.
     * The page is titled after the ScienceSource title of the article, defaulting to (and then
     * set to) its text title. Nothing is uploaded if the article already has a page ID.
     *
     * @param article
     *            the article
     * @param content
     *            the article text
     * @return the page ID
     * @throws ScienceSourceException
     *             if the page could not be created
     */
    public int uploadArticle(final Article article, final String content)
            throws ScienceSourceException {
        Preconditions.checkNotNull(content);
        if (article.hasPageID()) {
            LOGGER.debug("Text of {} already uploaded as page {}", article, article.getPageID());
            return article.getPageID();
        }
        final String title = pageTitle(article);
        final int pageID = this.source.createArticle(title, content);
        article.setScienceSourceTitle(title);
        article.setPageID(pageID);
        LOGGER.info("Uploaded text of '{}' as page {}", title, pageID);
        return pageID;
    }

    /**
     * Uploads the text of an article read from the (UTF-8) HTML file specified.
     *
     * @param article
     *            the article
     * @param file
     *            the file with the article text
     * @return the page ID
     * @throws IOException
     *             if the file could not be read
     * @throws ScienceSourceException
     *             if the page could not be created
     * @see #uploadArticle(Article, String)
     */
    public int uploadArticle(final Article article, final Path file) throws IOException,
            ScienceSourceException {
        final String content = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return uploadArticle(article, content);
    }

    /**
     * Drives the graph specified through all its remaining stages.
     *
     * @param graph
     *            the graph to upload
     * @param content
     *            the article text, which may be null if the text was already uploaded
     * @throws UploadException
     *             if a stage failed
     */
    public void upload(final AnnotationGraph graph, @Nullable final String content)
            throws UploadException {
        try {
            upload(graph, content, null);
        } catch (final IOException ex) {
            throw new Error("Unexpected I/O failure with no checkpoint", ex);
        }
    }

    /**
     * Drives the graph specified through all its remaining stages, saving it to the checkpoint
     * file after every completed stage and after a failure.
     *
     * @param graph
     *            the graph to upload
     * @param content
     *            the article text, which may be null if the text was already uploaded
     * @param checkpoint
     *            the file the graph is saved to, null to disable saving
     * @throws UploadException
     *             if a stage failed
     * @throws IOException
     *             if the graph could not be saved after a completed stage
     */
    public void upload(final AnnotationGraph graph, @Nullable final String content,
            @Nullable final Path checkpoint) throws UploadException, IOException {

        final Article article = graph.getArticle();
        final String previousContext = Logging.setContext(article.getArticleTextTitle());
        try {
            if (graph.isLinked()) {
                LOGGER.debug("{} already linked", article);
                return;
            }
            while (!graph.isLinked()) {
                final Stage stage = graph.getStage().next();
                final long ts = System.currentTimeMillis();
                try {
                    run(graph, stage, content);
                } catch (final ScienceSourceException ex) {
                    final UploadException failure = new UploadException(stage,
                            article.getArticleTextTitle(), ex);
                    if (checkpoint != null) {
                        try {
                            ArticleIO.save(article, checkpoint);
                        } catch (final IOException ex2) {
                            failure.addSuppressed(ex2);
                        }
                    }
                    LOGGER.debug("Stage {} failed, {} left at stage {}", stage, article,
                            graph.getStage());
                    throw failure;
                }
                graph.advance(stage);
                LOGGER.info("Stage {} completed in {} ms", stage, System.currentTimeMillis() - ts);
                if (checkpoint != null) {
                    ArticleIO.save(article, checkpoint);
                }
            }
        } finally {
            Logging.setContext(previousContext);
        }
    }

    private void run(final AnnotationGraph graph, final Stage stage,
            @Nullable final String content) throws ScienceSourceException {
        switch (stage) {
        case ARTICLE_UPLOADED:
            uploadArticleItem(graph, content);
            break;
        case ANNOTATIONS_UPLOADED:
            uploadAnnotations(graph);
            break;
        case LINKED:
            link(graph);
            break;
        default:
            throw new Error("Unexpected stage " + stage);
        }
    }

    private void uploadArticleItem(final AnnotationGraph graph, @Nullable final String content)
            throws ScienceSourceException {
        final Article article = graph.getArticle();
        graph.classify(this.vocabulary);
        if (!article.hasPageID()) {
            Preconditions.checkState(content != null, "No text supplied for %s", article);
            uploadArticle(article, content);
        }
        if (!article.hasID()) {
            final Map<String, Object> properties = this.translator.translate(article,
                    Layer.UPFRONT, Layer.INSTANCE, Layer.ARTICLE_UPLOADED);
            article.setID(this.source.createItem(this.vocabulary.getItemID(ItemType.ARTICLE),
                    properties));
            LOGGER.debug("Created article item {}", article.getID());
        }
        graph.attachAnchorPoints();
    }

    private void uploadAnnotations(final AnnotationGraph graph) throws ScienceSourceException {
        final String annotationType = this.vocabulary.getItemID(ItemType.ANNOTATION);
        final String anchorPointType = this.vocabulary.getItemID(ItemType.ANCHOR_POINT);
        int created = 0;
        for (final AnchorPoint anchorPoint : graph.getAnchorPoints()) {
            final Annotation annotation = anchorPoint.getAnnotation();
            if (!annotation.hasID()) {
                annotation.setID(this.source.createItem(annotationType,
                        this.translator.translate(annotation, Layer.UPFRONT, Layer.INSTANCE)));
                ++created;
            }
            if (!anchorPoint.hasID()) {
                anchorPoint.setAnchors(annotation.getID());
                anchorPoint.setID(this.source.createItem(anchorPointType, this.translator
                        .translate(anchorPoint, Layer.UPFRONT, Layer.INSTANCE,
                                Layer.ARTICLE_UPLOADED, Layer.ANNOTATIONS_UPLOADED)));
                ++created;
            }
        }
        LOGGER.debug("Created {} annotation and anchor point items", created);
    }

    private void link(final AnnotationGraph graph) throws ScienceSourceException {
        final Article article = graph.getArticle();
        final String terminusID = this.vocabulary.getItemID(ItemType.TERMINUS);
        int updated = 0;
        for (final AnnotationGraph.Link link : graph.chain(terminusID)) {
            if (link.isApplied()) {
                continue;
            }
            final AnchorPoint anchorPoint = link.getAnchorPoint();
            final String preceding = anchorPoint.getPrecedingAnchorPoint();
            final String following = anchorPoint.getFollowingAnchorPoint();
            boolean pushed = false;
            link.apply();
            try {
                this.source.updateItem(anchorPoint.getID(),
                        this.translator.translate(anchorPoint, Layer.LINKED));
                pushed = true;
            } finally {
                if (!pushed) {
                    anchorPoint.setPrecedingAnchorPoint(preceding);
                    anchorPoint.setFollowingAnchorPoint(following);
                }
            }
            ++updated;
        }
        final String head = graph.head(terminusID);
        if (!head.equals(article.getFollowingAnchorPoint())) {
            final String following = article.getFollowingAnchorPoint();
            boolean pushed = false;
            article.setFollowingAnchorPoint(head);
            try {
                this.source.updateItem(article.getID(),
                        this.translator.translate(article, Layer.LINKED));
                pushed = true;
            } finally {
                if (!pushed) {
                    article.setFollowingAnchorPoint(following);
                }
            }
            ++updated;
        }
        graph.checkChain(terminusID);
        LOGGER.debug("Updated {} items with chain references", updated);
    }

    private static String pageTitle(final Article article) {
        final String title = article.getScienceSourceTitle();
        if (!Strings.isNullOrEmpty(title)) {
            return title;
        }
        Preconditions.checkState(!Strings.isNullOrEmpty(article.getArticleTextTitle()),
                "No title for %s", article);
        return article.getArticleTextTitle();
    }

}
