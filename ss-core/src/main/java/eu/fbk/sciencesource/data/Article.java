package eu.fbk.sciencesource.data;

import java.util.List;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.collect.Lists;

/**
 * A scientific article, root of an annotation graph.
 * <p>
 * An article holds its descriptive fields, the {@link AnchorPoint}s found in its text in document
 * order, and the fields assigned as its upload progresses: the ID of the wiki page holding its
 * text, the ID of its item, and the reference to the first anchor point of the chain. The
 * {@link Stage} reached by the upload is recorded with the article so that an interrupted upload
 * can be resumed from a saved copy.
 * </p>
 * <p>
 * The character number of an article is carried as an opaque value.
 * </p>
 */
@JsonPropertyOrder({ "wikidata", "title", "publication_date", "time", "character",
        "preceding_phrase", "following_phrase", "instance_of", "science_source_title", "page_id",
        "following_anchor", "id", "stage", "annotations" })
public final class Article extends Item {

    public static final Schema SCHEMA = Schema.builder("article") //
            .item(ItemType.ARTICLE) //
            .item(ItemType.TERMINUS) //
            .property("wikidata", "Wikidata item code", ValueKind.STRING, Layer.UPFRONT) //
            .property("title", "article text title", ValueKind.STRING, Layer.UPFRONT) //
            .property("publication_date", "publication date", ValueKind.STRING, Layer.UPFRONT) //
            .property("time", "time code1", ValueKind.STRING, Layer.UPFRONT) //
            .property("character", "character number", ValueKind.QUANTITY, Layer.UPFRONT) //
            .property("preceding_phrase", "preceding phrase", ValueKind.STRING, Layer.UPFRONT) //
            .property("following_phrase", "following phrase", ValueKind.STRING, Layer.UPFRONT) //
            .property(INSTANCE_OF, "instance of", ValueKind.ITEM, Layer.INSTANCE) //
            .property("science_source_title", "ScienceSource article title", ValueKind.STRING,
                    Layer.ARTICLE_UPLOADED) //
            .property("page_id", "page ID", ValueKind.QUANTITY, Layer.ARTICLE_UPLOADED) //
            .property("following_anchor", "following anchor point", ValueKind.ITEM,
                    Layer.LINKED) //
            .build();

    @Nullable
    @JsonProperty("wikidata")
    private String wikidataItemCode;

    @Nullable
    @JsonProperty("title")
    private String articleTextTitle;

    @Nullable
    @JsonProperty("publication_date")
    private String publicationDate;

    @Nullable
    @JsonProperty("time")
    private String timeCode;

    @JsonProperty("character")
    private int characterNumber;

    @Nullable
    @JsonProperty("preceding_phrase")
    private String precedingPhrase;

    @Nullable
    @JsonProperty("following_phrase")
    private String followingPhrase;

    @Nullable
    @JsonProperty("science_source_title")
    private String scienceSourceTitle;

    @JsonProperty("page_id")
    private int pageID;

    @Nullable
    @JsonProperty("following_anchor")
    private String followingAnchorPoint;

    // null or missing in JSON: not yet submitted
    @JsonProperty("stage")
    @JsonSetter(nulls = Nulls.SKIP)
    private Stage stage;

    // null in JSON: no anchor points
    @JsonProperty("annotations")
    @JsonSetter(nulls = Nulls.AS_EMPTY)
    private List<AnchorPoint> anchorPoints;

    public Article() {
        this.stage = Stage.UNSUBMITTED;
        this.anchorPoints = Lists.newArrayList();
    }

    @Override
    public ItemType getItemType() {
        return ItemType.ARTICLE;
    }

    @Override
    public Schema getSchema() {
        return SCHEMA;
    }

    @Override
    @Nullable
    Object doGet(final String key) {
        switch (key) {
        case "wikidata":
            return this.wikidataItemCode;
        case "title":
            return this.articleTextTitle;
        case "publication_date":
            return this.publicationDate;
        case "time":
            return this.timeCode;
        case "character":
            return this.characterNumber;
        case "preceding_phrase":
            return this.precedingPhrase;
        case "following_phrase":
            return this.followingPhrase;
        case "science_source_title":
            return this.scienceSourceTitle;
        case "page_id":
            return this.pageID;
        case "following_anchor":
            return this.followingAnchorPoint;
        default:
            throw unknownKey(SCHEMA, key);
        }
    }

    /**
     * Returns the anchor points of this article in document order. The returned list is live:
     * anchor points are added to the article by appending them to it.
     *
     * @return a modifiable list of anchor points
     */
    public List<AnchorPoint> getAnchorPoints() {
        return this.anchorPoints;
    }

    public AnchorPoint addAnchorPoint(final AnchorPoint anchorPoint) {
        this.anchorPoints.add(Preconditions.checkNotNull(anchorPoint));
        return anchorPoint;
    }

    public Stage getStage() {
        return this.stage;
    }

    public void setStage(final Stage stage) {
        this.stage = Preconditions.checkNotNull(stage);
    }

    @Nullable
    public String getWikidataItemCode() {
        return this.wikidataItemCode;
    }

    public void setWikidataItemCode(@Nullable final String wikidataItemCode) {
        this.wikidataItemCode = wikidataItemCode;
    }

    @Nullable
    public String getArticleTextTitle() {
        return this.articleTextTitle;
    }

    public void setArticleTextTitle(@Nullable final String articleTextTitle) {
        this.articleTextTitle = articleTextTitle;
    }

    @Nullable
    public String getPublicationDate() {
        return this.publicationDate;
    }

    public void setPublicationDate(@Nullable final String publicationDate) {
        this.publicationDate = publicationDate;
    }

    @Nullable
    public String getTimeCode() {
        return this.timeCode;
    }

    public void setTimeCode(@Nullable final String timeCode) {
        this.timeCode = timeCode;
    }

    public int getCharacterNumber() {
        return this.characterNumber;
    }

    public void setCharacterNumber(final int characterNumber) {
        this.characterNumber = characterNumber;
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

    /**
     * Returns the title of the wiki page holding the article text.
     *
     * @return the page title, possibly null
     */
    @Nullable
    public String getScienceSourceTitle() {
        return this.scienceSourceTitle;
    }

    public void setScienceSourceTitle(@Nullable final String scienceSourceTitle) {
        this.scienceSourceTitle = scienceSourceTitle;
    }

    /**
     * Returns the ID of the wiki page holding the article text.
     *
     * @return the page ID, 0 if the text has not been uploaded
     */
    public int getPageID() {
        return this.pageID;
    }

    public boolean hasPageID() {
        return this.pageID != 0;
    }

    /**
     * Records the ID of the wiki page holding the article text. Setting the same ID again has no
     * effect.
     *
     * @param pageID
     *            the page ID, positive
     * @throws IllegalStateException
     *             if a different page ID was already assigned
     */
    public void setPageID(final int pageID) {
        Preconditions.checkArgument(pageID > 0, "Invalid page ID %s", pageID);
        Preconditions.checkState(this.pageID == 0 || this.pageID == pageID,
                "Article already has page ID %s, cannot assign %s", this.pageID, pageID);
        this.pageID = pageID;
    }

    /**
     * Returns the ID of the first anchor point of the chain, or of the terminus item if the
     * article has no anchor points.
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
        if (!(object instanceof Article)) {
            return false;
        }
        final Article other = (Article) object;
        return Objects.equal(this.wikidataItemCode, other.wikidataItemCode)
                && Objects.equal(this.articleTextTitle, other.articleTextTitle)
                && Objects.equal(this.publicationDate, other.publicationDate)
                && Objects.equal(this.timeCode, other.timeCode)
                && this.characterNumber == other.characterNumber
                && Objects.equal(this.precedingPhrase, other.precedingPhrase)
                && Objects.equal(this.followingPhrase, other.followingPhrase)
                && Objects.equal(this.scienceSourceTitle, other.scienceSourceTitle)
                && this.pageID == other.pageID
                && Objects.equal(this.followingAnchorPoint, other.followingAnchorPoint)
                && this.stage == other.stage
                && Objects.equal(getInstanceOf(), other.getInstanceOf())
                && Objects.equal(getID(), other.getID())
                && this.anchorPoints.equals(other.anchorPoints);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.wikidataItemCode, this.articleTextTitle,
                this.publicationDate, this.timeCode, this.characterNumber, this.precedingPhrase,
                this.followingPhrase, this.scienceSourceTitle, this.pageID,
                this.followingAnchorPoint, this.stage, getInstanceOf(), getID(),
                this.anchorPoints);
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("id", getID())
                .add("title", this.articleTextTitle).add("pageID", this.pageID)
                .add("stage", this.stage).add("anchorPoints", this.anchorPoints.size())
                .toString();
    }

}
