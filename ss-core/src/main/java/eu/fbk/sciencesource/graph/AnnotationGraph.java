package eu.fbk.sciencesource.graph;

import java.util.List;

import com.google.common.base.MoreObjects;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;

import eu.fbk.sciencesource.data.AnchorPoint;
import eu.fbk.sciencesource.data.Article;
import eu.fbk.sciencesource.data.ItemType;
import eu.fbk.sciencesource.data.Stage;
import eu.fbk.sciencesource.vocabulary.Vocabulary;

/**
 * The structure of one article: the article record, its anchor points in document order and the
 * annotation of each anchor point.
 * <p>
 * The graph tracks the upload {@link Stage} of the article and computes how records reference
 * each other. Before upload, records hold their own values only; as stages complete they gain
 * references to the remote IDs of the records uploaded before them. Once every record has an ID,
 * {@link #chain(String)} computes the doubly linked chain of anchor points: the article item
 * precedes the first anchor point and the terminus item follows the last one.
 * </p>
 */
public final class AnnotationGraph {

    private final Article article;

    public AnnotationGraph(final Article article) {
        this.article = Preconditions.checkNotNull(article);
    }

    public Article getArticle() {
        return this.article;
    }

    public Stage getStage() {
        return this.article.getStage();
    }

    public List<AnchorPoint> getAnchorPoints() {
        return this.article.getAnchorPoints();
    }

    public boolean isLinked() {
        return this.article.getStage() == Stage.LINKED;
    }

    /**
     * Moves the graph to the stage specified, which must follow the current one.
     *
     * @param stage
     *            the next stage
     * @throws IllegalStateException
     *             if the stage does not immediately follow the current one
     */
    public void advance(final Stage stage) {
        final Stage current = this.article.getStage();
        Preconditions.checkState(current.next() == stage, "Cannot move %s from %s to %s",
                this.article, current, stage);
        this.article.setStage(stage);
    }

    /**
     * Sets the instance-only {@code instance of} field of every record to the ID of the item
     * classifying its kind. Calling this method again has no further effect.
     *
     * @param vocabulary
     *            the vocabulary supplying item IDs
     */
    public void classify(final Vocabulary vocabulary) {
        this.article.setInstanceOf(vocabulary.getItemID(ItemType.ARTICLE));
        final String anchorPointType = vocabulary.getItemID(ItemType.ANCHOR_POINT);
        final String annotationType = vocabulary.getItemID(ItemType.ANNOTATION);
        for (final AnchorPoint anchorPoint : this.article.getAnchorPoints()) {
            anchorPoint.setInstanceOf(anchorPointType);
            anchorPoint.getAnnotation().setInstanceOf(annotationType);
        }
    }

    /**
     * Sets the references to the article item and its page title on every anchor point.
     *
     * @throws IllegalStateException
     *             if the article has no item ID
     */
    public void attachAnchorPoints() {
        Preconditions.checkState(this.article.hasID(), "%s has no item ID", this.article);
        for (final AnchorPoint anchorPoint : this.article.getAnchorPoints()) {
            anchorPoint.setAnchorPointIn(this.article.getID());
            anchorPoint.setScienceSourceTitle(this.article.getScienceSourceTitle());
        }
    }

    /**
     * Computes the chain of references between anchor points. Records are not modified: each
     * returned {@link Link} can be applied separately once pushed to the remote store.
     *
     * @param terminusID
     *            the ID of the item ending the chain
     * @return one link per anchor point, in document order
     * @throws IllegalStateException
     *             if the article or some anchor point has no item ID
     */
    public List<Link> chain(final String terminusID) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(terminusID), "Empty terminus ID");
        Preconditions.checkState(this.article.hasID(), "%s has no item ID", this.article);
        final List<AnchorPoint> anchorPoints = this.article.getAnchorPoints();
        final ImmutableList.Builder<Link> builder = ImmutableList.builder();
        for (int i = 0; i < anchorPoints.size(); ++i) {
            final AnchorPoint anchorPoint = anchorPoints.get(i);
            Preconditions.checkState(anchorPoint.hasID(), "Anchor point %s of %s has no item ID",
                    i, this.article);
            final String preceding = i == 0 ? this.article.getID() : anchorPoints.get(i - 1)
                    .getID();
            final String following = i == anchorPoints.size() - 1 ? terminusID : anchorPoints
                    .get(i + 1).getID();
            Preconditions.checkState(following != null, "Anchor point %s of %s has no item ID",
                    i + 1, this.article);
            builder.add(new Link(anchorPoint, preceding, following));
        }
        return builder.build();
    }

    /**
     * Returns the ID the article references as its following anchor point: the first anchor
     * point, or the terminus item if the article has none.
     *
     * @param terminusID
     *            the ID of the item ending the chain
     * @return the ID of the head of the chain
     */
    public String head(final String terminusID) {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(terminusID), "Empty terminus ID");
        final List<AnchorPoint> anchorPoints = this.article.getAnchorPoints();
        if (anchorPoints.isEmpty()) {
            return terminusID;
        }
        Preconditions.checkState(anchorPoints.get(0).hasID(),
                "Anchor point 0 of %s has no item ID", this.article);
        return anchorPoints.get(0).getID();
    }

    /**
     * Checks that the references between the article and its anchor points form a consistent
     * chain: the successor of A is B iff the predecessor of B is A.
     *
     * @param terminusID
     *            the ID of the item ending the chain
     * @throws IllegalStateException
     *             reporting the first inconsistency found
     */
    public void checkChain(final String terminusID) {
        Preconditions.checkState(Objects.equal(this.article.getFollowingAnchorPoint(),
                head(terminusID)), "%s does not reference the head of its chain", this.article);
        for (final Link link : chain(terminusID)) {
            Preconditions.checkState(link.isApplied(), "Inconsistent chain at %s",
                    link.getAnchorPoint());
        }
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this).add("article", this.article).toString();
    }

    /**
     * The preceding and following references computed for an anchor point.
     */
    public static final class Link {

        private final AnchorPoint anchorPoint;

        private final String preceding;

        private final String following;

        Link(final AnchorPoint anchorPoint, final String preceding, final String following) {
            this.anchorPoint = anchorPoint;
            this.preceding = preceding;
            this.following = following;
        }

        public AnchorPoint getAnchorPoint() {
            return this.anchorPoint;
        }

        public String getPreceding() {
            return this.preceding;
        }

        public String getFollowing() {
            return this.following;
        }

        /**
         * Tests whether the anchor point already holds the references of this link.
         *
         * @return true if the link is applied
         */
        public boolean isApplied() {
            return this.preceding.equals(this.anchorPoint.getPrecedingAnchorPoint())
                    && this.following.equals(this.anchorPoint.getFollowingAnchorPoint());
        }

        /**
         * Stores the references of this link in the anchor point.
         */
        public void apply() {
            this.anchorPoint.setPrecedingAnchorPoint(this.preceding);
            this.anchorPoint.setFollowingAnchorPoint(this.following);
        }

        @Override
        public String toString() {
            return this.preceding + " <- " + this.anchorPoint.getID() + " -> " + this.following;
        }

    }

}
