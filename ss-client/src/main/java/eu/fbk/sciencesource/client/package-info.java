/**
 * HTTP client for ScienceSource, based on the MediaWiki/Wikibase action API.
 */
@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.sciencesource.client;
