package eu.fbk.sciencesource.data;

/**
 * The kinds of remote items the annotation graph is made of.
 * <p>
 * Each constant carries the label of the remote item classifying items of that kind; the ID it
 * resolves to is what the {@code instance of} property of uploaded records points to.
 * {@link #TERMINUS} is not the type of any record: its item closes the chain of anchor points at
 * the end of an article.
 * </p>
 */
public enum ItemType {

    ARTICLE("article"),

    ANCHOR_POINT("anchor point"),

    ANNOTATION("annotation"),

    TERMINUS("terminus");

    private final String label;

    private ItemType(final String label) {
        this.label = label;
    }

    public String getLabel() {
        return this.label;
    }

}
