/**
 * Linkage of the records of an article and their translation into remote property values.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.sciencesource.graph;
