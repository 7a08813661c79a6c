/**
 * Staged upload of annotated articles to a ScienceSource instance.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.sciencesource.upload;
