package eu.fbk.sciencesource.data;

/**
 * When the value of a record field becomes available.
 */
public enum Layer {

    /** Known before any network interaction, e.g., the term text or the publication date. */
    UPFRONT,

    /** Known once the remote instance is selected, i.e., the {@code instance of} item. */
    INSTANCE,

    /** Known once the article page and item have been created. */
    ARTICLE_UPLOADED,

    /** Known once the annotation items have been created. */
    ANNOTATIONS_UPLOADED,

    /** Known once the anchor point chain has been computed. */
    LINKED

}
