package eu.fbk.sciencesource.data;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The upload stage of an article. Stages are traversed strictly in declaration order.
 */
public enum Stage {

    @JsonProperty("unsubmitted")
    UNSUBMITTED,

    @JsonProperty("article_uploaded")
    ARTICLE_UPLOADED,

    @JsonProperty("annotations_uploaded")
    ANNOTATIONS_UPLOADED,

    @JsonProperty("linked")
    LINKED;

    /**
     * Returns the stage following this one.
     *
     * @return the next stage, or null if this is the terminal stage
     */
    @Nullable
    public Stage next() {
        final Stage[] stages = values();
        return ordinal() + 1 < stages.length ? stages[ordinal() + 1] : null;
    }

    public boolean isTerminal() {
        return this == LINKED;
    }

}
