package eu.fbk.sciencesource.data;

import javax.annotation.Nullable;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;

/**
 * A term found in an article, as matched against a dictionary.
 * <p>
 * An annotation is owned by exactly one {@link AnchorPoint} locating it in the article text, and
 * does not reference it back.
 * </p>
 */
@JsonPropertyOrder({ "term", "length", "wikidata", "dictionary", "time", "instance_of", "id" })
public final class Annotation extends Item {

    public static final Schema SCHEMA = Schema.builder("annotation") //
            .item(ItemType.ANNOTATION) //
            .property("term", "term found", ValueKind.STRING, Layer.UPFRONT) //
            .property("length", "length of term found", ValueKind.QUANTITY, Layer.UPFRONT) //
            .property("wikidata", "Wikidata item code", ValueKind.STRING, Layer.UPFRONT) //
            .property("dictionary", "dictionary name", ValueKind.STRING, Layer.UPFRONT) //
            .property("time", "time code1", ValueKind.STRING, Layer.UPFRONT) //
            .property(INSTANCE_OF, "instance of", ValueKind.ITEM, Layer.INSTANCE) //
            .build();

    @Nullable
    @JsonProperty("term")
    private String termFound;

    @JsonProperty("length")
    private int lengthOfTermFound;

    @Nullable
    @JsonProperty("wikidata")
    private String wikidataItemCode;

    @Nullable
    @JsonProperty("dictionary")
    private String dictionaryName;

    @Nullable
    @JsonProperty("time")
    private String timeCode;

    public Annotation() {
    }

    public Annotation(final String termFound, @Nullable final String wikidataItemCode,
            @Nullable final String dictionaryName, @Nullable final String timeCode) {
        this.termFound = termFound;
        this.lengthOfTermFound = termFound.length();
        this.wikidataItemCode = wikidataItemCode;
        this.dictionaryName = dictionaryName;
        this.timeCode = timeCode;
    }

    @Override
    public ItemType getItemType() {
        return ItemType.ANNOTATION;
    }

    @Override
    public Schema getSchema() {
        return SCHEMA;
    }

    @Override
    @Nullable
    Object doGet(final String key) {
        switch (key) {
        case "term":
            return this.termFound;
        case "length":
            return this.lengthOfTermFound;
        case "wikidata":
            return this.wikidataItemCode;
        case "dictionary":
            return this.dictionaryName;
        case "time":
            return this.timeCode;
        default:
            throw unknownKey(SCHEMA, key);
        }
    }

    @Nullable
    public String getTermFound() {
        return this.termFound;
    }

    public void setTermFound(@Nullable final String termFound) {
        this.termFound = termFound;
    }

    public int getLengthOfTermFound() {
        return this.lengthOfTermFound;
    }

    public void setLengthOfTermFound(final int lengthOfTermFound) {
        this.lengthOfTermFound = lengthOfTermFound;
    }

    @Nullable
    public String getWikidataItemCode() {
        return this.wikidataItemCode;
    }

    public void setWikidataItemCode(@Nullable final String wikidataItemCode) {
        this.wikidataItemCode = wikidataItemCode;
    }

    @Nullable
    public String getDictionaryName() {
        return this.dictionaryName;
    }

    public void setDictionaryName(@Nullable final String dictionaryName) {
        this.dictionaryName = dictionaryName;
    }

    @Nullable
    public String getTimeCode() {
        return this.timeCode;
    }

    public void setTimeCode(@Nullable final String timeCode) {
        this.timeCode = timeCode;
    }

    @Override
    public boolean equals(final Object object) {
        if (object == this) {
            return true;
        }
        if (!(object instanceof Annotation)) {
            return false;
        }
        final Annotation other = (Annotation) object;
        return Objects.equal(this.termFound, other.termFound)
                && this.lengthOfTermFound == other.lengthOfTermFound
                && Objects.equal(this.wikidataItemCode, other.wikidataItemCode)
                && Objects.equal(this.dictionaryName, other.dictionaryName)
                && Objects.equal(this.timeCode, other.timeCode)
                && Objects.equal(getInstanceOf(), other.getInstanceOf())
                && Objects.equal(getID(), other.getID());
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(this.termFound, this.lengthOfTermFound, this.wikidataItemCode,
                this.dictionaryName, this.timeCode, getInstanceOf(), getID());
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).omitNullValues().add("id", getID())
                .add("term", this.termFound).add("wikidata", this.wikidataItemCode)
                .add("dictionary", this.dictionaryName).toString();
    }

}
