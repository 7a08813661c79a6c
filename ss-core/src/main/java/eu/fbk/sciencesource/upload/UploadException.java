package eu.fbk.sciencesource.upload;

import javax.annotation.Nullable;

import com.google.common.base.Preconditions;

import eu.fbk.sciencesource.ScienceSourceException;
import eu.fbk.sciencesource.data.Stage;

/**
 * Signals the failure of an upload stage.
 * <p>
 * The article is left at the last stage it completed, with the remote IDs of the records
 * uploaded so far; uploading it again resumes from that point. The stage that failed and the
 * article affected are reported by {@link #getStage()} and {@link #getArticleTitle()}, while the
 * error of the remote store is the cause of this exception.
 * </p>
 */
public class UploadException extends Exception {

    private static final long serialVersionUID = 1L;

    private final Stage stage;

    @Nullable
    private final String articleTitle;

    public UploadException(final Stage stage, @Nullable final String articleTitle,
            final ScienceSourceException cause) {
        super("Upload of article '" + articleTitle + "' failed reaching stage "
                + Preconditions.checkNotNull(stage) + ": " + cause.getMessage(), cause);
        this.stage = stage;
        this.articleTitle = articleTitle;
    }

    /**
     * Returns the stage the upload was attempting to reach.
     *
     * @return the failed stage
     */
    public final Stage getStage() {
        return this.stage;
    }

    @Nullable
    public final String getArticleTitle() {
        return this.articleTitle;
    }

    @Override
    public synchronized ScienceSourceException getCause() {
        return (ScienceSourceException) super.getCause();
    }

}
