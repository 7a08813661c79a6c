package eu.fbk.sciencesource.vocabulary;

import java.util.Map;
import java.util.Set;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import eu.fbk.sciencesource.ScienceSource;
import eu.fbk.sciencesource.ScienceSourceException;

/**
 * Resolves labels to remote IDs, one remote lookup per label.
 * <p>
 * Labels are resolved in the iteration order of the set supplied. Resolution is fail-fast: the
 * first failed lookup aborts the whole operation with a {@link ResolutionException} identifying
 * the label, no later label is looked up and no partial result is returned, as an upload cannot
 * proceed without the complete set of IDs.
 * </p>
 */
public final class LabelResolver {

    private static final Logger LOGGER = LoggerFactory.getLogger(LabelResolver.class);

    private final ScienceSource source;

    public LabelResolver(final ScienceSource source) {
        this.source = Preconditions.checkNotNull(source);
    }

    public Map<String, String> resolvePropertyLabels(final Set<String> labels)
            throws ResolutionException {
        return resolveLabels(Role.PROPERTY, labels);
    }

    public Map<String, String> resolveItemLabels(final Set<String> labels)
            throws ResolutionException {
        return resolveLabels(Role.ITEM, labels);
    }

    /**
     * Resolves all the property labels and then all the item labels of the registry specified.
     *
     * @param registry
     *            the registry supplying the labels
     * @return the resolved vocabulary, covering all the labels of the registry
     * @throws ResolutionException
     *             if a label could not be resolved
     */
    public Vocabulary resolve(final TagRegistry registry) throws ResolutionException {
        final Map<String, String> properties = resolvePropertyLabels(registry.getPropertyLabels());
        final Map<String, String> items = resolveItemLabels(registry.getItemLabels());
        LOGGER.info("Resolved {} property labels and {} item labels", properties.size(),
                items.size());
        return Vocabulary.create(properties, items);
    }

    private Map<String, String> resolveLabels(final Role role, final Set<String> labels)
            throws ResolutionException {
        final ImmutableMap.Builder<String, String> builder = ImmutableMap.builder();
        for (final String label : labels) {
            Preconditions.checkArgument(!Strings.isNullOrEmpty(label), "Empty %s label", role);
            final String id;
            try {
                id = role == Role.PROPERTY ? this.source.resolvePropertyLabel(label)
                        : this.source.resolveItemLabel(label);
            } catch (final ScienceSourceException ex) {
                throw new ResolutionException(role, label, ex);
            }
            if (Strings.isNullOrEmpty(id)) {
                throw new ResolutionException(role, label, new ScienceSourceException(
                        "Empty ID returned for '" + label + "'"));
            }
            LOGGER.debug("Resolved {} '{}' to {}", role, label, id);
            builder.put(label, id);
        }
        return builder.build();
    }

}
