/**
 * Discovery of the labels declared by record schemas and their resolution to remote IDs.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.sciencesource.vocabulary;
