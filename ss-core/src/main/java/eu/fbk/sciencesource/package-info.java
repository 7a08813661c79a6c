/**
 * ScienceSource core API ({@code ss-core}).
 * <p>
 * The {@link eu.fbk.sciencesource.ScienceSource} interface is the entry point towards the remote
 * Wikibase instance. Records describing an article, its anchor points and their annotations are
 * defined in package {@code eu.fbk.sciencesource.data}; the labels those records use are
 * discovered and resolved to remote identifiers by package {@code eu.fbk.sciencesource.vocabulary};
 * package {@code eu.fbk.sciencesource.graph} links the records of an article together, and
 * package {@code eu.fbk.sciencesource.upload} drives their staged upload.
 * </p>
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.sciencesource;
