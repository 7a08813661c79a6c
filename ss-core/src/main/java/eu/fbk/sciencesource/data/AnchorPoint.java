package eu.fbk.sciencesource.data;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A located occurrence of a term in the text of an article.
 * <p>
 * An anchor point owns the {@link Annotation} it locates. Once the article item exists, it
 * references it via {@code anchor point in}; once its annotation is uploaded, it references it
 * via {@code anchors}; once every anchor point of the article is uploaded, it references its
 * predecessor and successor in document order, so that the anchor points of an article form a
 * chain starting at the article item and ending at the terminus item.
 * </p>
 */
@JsonPropertyOrder({ "preceding_phrase", "following_phrase", "preceding_distance",
        "following_distance", "character", "time", "instance_of", "science_source_title",
        "point", "anchors", "preceding_anchor", "following_anchor", "id", "annotation" })
public final class AnchorPoint extends Item {

    public static final Schema SCHEMA = Schema.builder("anchor point") //
            .item(ItemType.ANCHOR_POINT) //
            .property("preceding_phrase", "preceding phrase", ValueKind.STRING, Layer.UPFRONT) //
            .property("following_phrase", "following phrase", ValueKind.STRING, Layer.UPFRONT) //
            .property("preceding_distance", "distance to preceding", ValueKind.QUANTITY,
                    Layer.UPFRONT) //
            .property("following_distance", "distance to following", ValueKind.QUANTITY,
                    Layer.UPFRONT) //
            .property("character", "character number", ValueKind.QUANTITY, Layer.UPFRONT) //
            .property("time", "time code1", ValueKind.STRING, Layer.UPFRONT) //
            .property(INSTANCE_OF, "instance of", ValueKind.ITEM, Layer.INSTANCE) //
            .property("science_source_title", "ScienceSource article title", ValueKind.STRING,
                    Layer.ARTICLE_UPLOADED) //
            .property("point", "anchor point in", ValueKind.ITEM, Layer.ARTICLE_UPLOADED) //
            .property("anchors", "anchors", ValueKind.ITEM, Layer.ANNOTATIONS_UPLOADED) //
            .property("preceding_anchor", "preceding anchor point", ValueKind.ITEM,
                    Layer.LINKED) //
            .property("following_anchor", "following anchor point", ValueKind.ITEM,
                    Layer.LINKED) //
            .build();

    @Nullable
    @JsonProperty("preceding_phrase")
    private String precedingPhrase;

    @Nullable
    @JsonProperty("following_phrase")
    private String followingPhrase;

    @JsonProperty("preceding_distance")
    private int distanceToPreceding;

    @JsonProperty("following_distance")
    private int distanceToFollowing;

    @JsonProperty("character")
    private int characterNumber;

    @Nullable
    @JsonProperty("time")
    private String timeCode;

    @Nullable
    @JsonProperty("science_source_title")
    private String scienceSourceTitle;

    @Nullable
    @JsonProperty("point")
    private String anchorPointIn;

    @Nullable
    @JsonProperty("anchors")
    private String anchors;

    @Nullable
    @JsonProperty("preceding_anchor")
    private String precedingAnchorPoint;

    @Nullable
    @JsonProperty("following_anchor")
    private String followingAnchorPoint;

    @JsonProperty("annotation")
    private Annotation annotation;

    public AnchorPoint() {
        this(new Annotation());
    }

    public AnchorPoint(final Annotation annotation) {
        this.annotation = Preconditions.checkNotNull(annotation);
    }

    @Override
    public ItemType getItemType() {
        return ItemType.ANCHOR_POINT;
    }

    @Override
    public Schema getSchema() {
        return SCHEMA;
    }

    @Override
    @Nullable
    Object doGet(final String key) {
        switch (key) {
        case "preceding_phrase":
            return this.precedingPhrase;
        case "following_phrase":
            return this.followingPhrase;
        case "preceding_distance":
            return this.distanceToPreceding;
        case "following_distance":
            return this.distanceToFollowing;
        case "character":
            return this.characterNumber;
        case "time":
            return this.timeCode;
        case "science_source_title":
            return this.scienceSourceTitle;
        case "point":
            return this.anchorPointIn;
        case "anchors":
            return this.anchors;
        case "preceding_anchor":
            return this.precedingAnchorPoint;
        case "following_anchor":
            return this.followingAnchorPoint;
        default:
            throw unknownKey(SCHEMA, key);
        }
    }

    public Annotation getAnnotation() {
        return this.annotation;
    }

    @Nullable
    public String getPrecedingPhrase() {
        return this.precedingPhrase;
    }

    public void setPrecedingPhrase(@Nullable final String precedingPhrase) {
        this.precedingPhrase = precedingPhrase;
    }

    @Nullable
    public String getFollowingPhrase() {
        return this.followingPhrase;
    }

    public void setFollowingPhrase(@Nullable final String followingPhrase) {
        this.followingPhrase = followingPhrase;
    }

    public int getDistanceToPreceding() {
        return this.distanceToPreceding;
    }

    public void setDistanceToPreceding(final int distanceToPreceding) {
        this.distanceToPreceding = distanceToPreceding;
    }

    public int getDistanceToFollowing() {
        return this.distanceToFollowing;
    }

    public void setDistanceToFollowing(final int distanceToFollowing) {
        this.distanceToFollowing = distanceToFollowing;
    }

    public int getCharacterNumber() {
        return this.characterNumber;
    }

    public void setCharacterNumber(final int characterNumber) {
        this.characterNumber = characterNumber;
    }

    @Nullable
    public String getTimeCode() {
        return this.timeCode;
    }

    public void setTimeCode(@Nullable final String timeCode) {
        this.timeCode = timeCode;
    }

    @Nullable
    public String getScienceSourceTitle() {
        return this.scienceSourceTitle;
    }

    public void setScienceSourceTitle(@Nullable final String scienceSourceTitle) {
        this.scienceSourceTitle = scienceSourceTitle;
    }

    /**
     * Returns the ID of the article item this anchor point belongs to.
     *
     * @return the article item ID, null before the article is uploaded
     */
    @Nullable
    public String getAnchorPointIn() {
        return this.anchorPointIn;
    }

    public void setAnchorPointIn(@Nullable final String anchorPointIn) {
        this.anchorPointIn = anchorPointIn;
    }

    /**
     * Returns the ID of the annotation item this anchor point locates.
     *
     * @return the annotation item ID, null before the annotation is uploaded
     */
    @Nullable
    public String getAnchors() {
        return this.anchors;
    }

    public void setAnchors(@Nullable final String anchors) {
        this.anchors = anchors;
    }

    /**
     * Returns the ID of the previous anchor point, or of the article item for the first anchor
     * point of the article.
     *
     * @return the preceding reference, null before the chain is linked
     */
    @Nullable
    public String getPrecedingAnchorPoint() {
        return this.precedingAnchorPoint;
    }

    public void setPrecedingAnchorPoint(@Nullable final String precedingAnchorPoint) {
        this.precedingAnchorPoint = precedingAnchorPoint;
    }

    /**
     * Returns the ID of the next anchor point, or of the terminus item for the last anchor point
     * of the article.
     *
     * @return the following reference, null before the chain is linked
     */
    @Nullable
    public String getFollowingAnchorPoint() {
        return this.followingAnchorPoint;
    }

    public void setFollowingAnchorPoint(@Nullable final String followingAnchorPoint) {
        this.followingAnchorPoint = followingAnchorPoint;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof AnchorPoint)) {
            return false;
        }
        final AnchorPoint other = (AnchorPoint) object;
        return Objects.equal(this.precedingPhrase, other.precedingPhrase)
                && Objects.equal(this.followingPhrase, other.followingPhrase)
                && this.distanceToPreceding == other.distanceToPreceding
                && this.distanceToFollowing == other.distanceToFollowing
                && this.characterNumber == other.characterNumber
                && Objects.equal(this.timeCode, other.timeCode)
                && Objects.equal(this.scienceSourceTitle, other.scienceSourceTitle)
                && Objects.equal(this.anchorPointIn, other.anchorPointIn)
                && Objects.equal(this.anchors, other.anchors)
                && Objects.equal(this.precedingAnchorPoint, other.precedingAnchorPoint)
                && Objects.equal(this.followingAnchorPoint, other.followingAnchorPoint)
                && Objects.equal(getInstanceOf(), other.getInstanceOf())
                && Objects.equal(getID(), other.getID())
                && this.annotation.equals(other.annotation);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.precedingPhrase, this.followingPhrase,
                this.distanceToPreceding, this.distanceToFollowing, this.characterNumber,
                this.timeCode, this.scienceSourceTitle, this.anchorPointIn, this.anchors,
                this.precedingAnchorPoint, this.followingAnchorPoint, getInstanceOf(), getID(),
                this.annotation);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("id", getID())
                .add("character", this.characterNumber)
                .add("preceding", this.precedingAnchorPoint)
                .add("following", this.followingAnchorPoint)
                .add("annotation", this.annotation).toString();
    }

}
