/**
 * Records describing an article, the anchor points found in its text and their annotations,
 * together with their static schemas and their JSON persistence.
 * <p>
 * The JSON layout follows the ScienceSource data schema: one object per article, anchor points
 * nested in array {@code annotations}, the annotation of each anchor point nested in object
 * {@code annotation}.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.sciencesource.data;
