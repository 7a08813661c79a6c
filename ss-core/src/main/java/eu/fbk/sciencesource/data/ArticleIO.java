package eu.fbk.sciencesource.data;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

import com.fasterxml.jackson.annotation.JsonAutoDetect.Visibility;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.PropertyAccessor;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads and writes annotation graphs as JSON.
 * <p>
 * An article is stored as one JSON object with its anchor points nested in array
 * {@code annotations} and the annotation of each anchor point nested in object
 * {@code annotation}, using the short field keys of the ScienceSource data schema (e.g.,
 * {@code term}, {@code length}, {@code wikidata}, {@code preceding_anchor}). Remote IDs and the
 * upload {@link Stage} are stored as well, so that a graph read back is equal to the one written.
 * Unknown keys are ignored when reading. Documents lacking upload data, such as those
 * produced by the annotation step, are accepted: a missing or null {@code stage} reads as
 * {@link Stage#UNSUBMITTED}, a null {@code annotations} as no anchor points, and empty IDs as
 * unassigned.
 * </p>
 */
public final class ArticleIO {

    private static final Logger LOGGER = LoggerFactory.getLogger(ArticleIO.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .setVisibility(PropertyAccessor.ALL, Visibility.NONE)
            .setVisibility(PropertyAccessor.FIELD, Visibility.ANY)
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .configure(JsonGenerator.Feature.AUTO_CLOSE_TARGET, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private ArticleIO() {
    }

    /**
     * Writes the article specified to a file, replacing it if existing. The article is first
     * written to a temporary file in the same directory, which is then moved over the target: a
     * failed write leaves any previous content of the target untouched.
     *
     * @param article
     *            the article to save
     * @param file
     *            the target file
     * @throws IOException
     *             on failure
     */
    public static void save(final Article article, final Path file) throws IOException {
        Preconditions.checkNotNull(article);
        final Path target = file.toAbsolutePath();
        final Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        final Path temp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            try (OutputStream stream = Files.newOutputStream(temp)) {
                write(article, stream);
            }
            try {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING,
                        StandardCopyOption.ATOMIC_MOVE);
            } catch (final AtomicMoveNotSupportedException ex) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } finally {
            Files.deleteIfExists(temp);
        }
        LOGGER.debug("Saved {} to {}", article, target);
    }

    /**
     * Reads an article from a file.
     *
     * @param file
     *            the file to read
     * @return the article read
     * @throws IOException
     *             on failure, including malformed content
     */
    public static Article load(final Path file) throws IOException {
        try (InputStream stream = Files.newInputStream(file)) {
            final Article article = read(stream);
            LOGGER.debug("Loaded {} from {}", article, file);
            return article;
        }
    }

    /**
     * Writes an article to a stream. The stream is not closed.
     *
     * @param article
     *            the article to write
     * @param stream
     *            the stream to write to
     * @throws IOException
     *             on failure
     */
    public static void write(final Article article, final OutputStream stream)
            throws IOException {
        MAPPER.writeValue(stream, Preconditions.checkNotNull(article));
    }

    /**
     * Reads an article from a stream. The stream is not closed.
     *
     * @param stream
     *            the stream to read from
     * @return the article read
     * @throws IOException
     *             on failure, including malformed content
     */
    public static Article read(final InputStream stream) throws IOException {
        final Article article = MAPPER.readValue(stream, Article.class);
        if (article == null) {
            throw new JsonMappingException(null, "No article found");
        }
        validate(article);
        return article;
    }

    private static void validate(final Article article) throws IOException {
        int index = 0;
        for (final AnchorPoint anchorPoint : article.getAnchorPoints()) {
            if (anchorPoint == null || anchorPoint.getAnnotation() == null) {
                throw new JsonMappingException(null, "Missing annotation for anchor point "
                        + index + " of article " + article.getArticleTextTitle());
            }
            ++index;
        }
    }

}
