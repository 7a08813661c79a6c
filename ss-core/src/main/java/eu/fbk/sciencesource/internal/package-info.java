@javax.annotation.ParametersAreNonnullByDefault
package eu.fbk.sciencesource.internal;
