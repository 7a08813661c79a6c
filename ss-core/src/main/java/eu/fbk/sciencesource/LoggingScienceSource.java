package eu.fbk.sciencesource;

import java.util.Map;

import com.google.common.base.Preconditions;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@code ScienceSource} wrapper that logs calls to the operations of a wrapped
 * {@code ScienceSource} and their execution times.
 * <p>
 * Calls and their results are logged via SLF4J at level DEBUG (logger named after this class);
 * failed calls are logged at the same level together with the error message, leaving the
 * decision on how to report them to the caller. The overhead introduced by this wrapper when
 * logging is disabled is negligible.
 * </p>
 */
public class LoggingScienceSource extends ForwardingScienceSource {

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingScienceSource.class);

    private final ScienceSource delegate;

    /**
     * Creates a new instance for the wrapped {@code ScienceSource} specified.
     *
     * @param delegate
     *            the wrapped {@code ScienceSource}
     */
    public LoggingScienceSource(final ScienceSource delegate) {
        this.delegate = Preconditions.checkNotNull(delegate);
        LOGGER.debug("{} configured", getClass().getSimpleName());
    }

    @Override
    protected ScienceSource delegate() {
        return this.delegate;
    }

    @Override
    public String resolvePropertyLabel(final String label) throws ScienceSourceException {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            try {
                final String result = super.resolvePropertyLabel(label);
                LOGGER.debug("{} - property '{}' resolved to {} in {} ms", this, label, result,
                        System.currentTimeMillis() - ts);
                return result;
            } catch (final ScienceSourceException ex) {
                LOGGER.debug("{} - property '{}' not resolved after {} ms: {}", this, label,
                        System.currentTimeMillis() - ts, ex.getMessage());
                throw ex;
            }
        } else {
            return super.resolvePropertyLabel(label);
        }
    }

    @Override
    public String resolveItemLabel(final String label) throws ScienceSourceException {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            try {
                final String result = super.resolveItemLabel(label);
                LOGGER.debug("{} - item '{}' resolved to {} in {} ms", this, label, result,
                        System.currentTimeMillis() - ts);
                return result;
            } catch (final ScienceSourceException ex) {
                LOGGER.debug("{} - item '{}' not resolved after {} ms: {}", this, label,
                        System.currentTimeMillis() - ts, ex.getMessage());
                throw ex;
            }
        } else {
            return super.resolveItemLabel(label);
        }
    }

    @Override
    public int createArticle(final String title, final String content)
            throws ScienceSourceException {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            try {
                final int result = super.createArticle(title, content);
                LOGGER.debug("{} - page '{}' ({} chars) created with ID {} in {} ms", this,
                        title, content.length(), result, System.currentTimeMillis() - ts);
                return result;
            } catch (final ScienceSourceException ex) {
                LOGGER.debug("{} - page '{}' not created after {} ms: {}", this, title,
                        System.currentTimeMillis() - ts, ex.getMessage());
                throw ex;
            }
        } else {
            return super.createArticle(title, content);
        }
    }

    @Override
    public String createItem(final String itemTypeID, final Map<String, Object> properties)
            throws ScienceSourceException {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            try {
                final String result = super.createItem(itemTypeID, properties);
                LOGGER.debug("{} - {} item created with ID {} and {} properties in {} ms",
                        this, itemTypeID, result, properties.size(),
                        System.currentTimeMillis() - ts);
                return result;
            } catch (final ScienceSourceException ex) {
                LOGGER.debug("{} - {} item not created after {} ms: {}", this, itemTypeID,
                        System.currentTimeMillis() - ts, ex.getMessage());
                throw ex;
            }
        } else {
            return super.createItem(itemTypeID, properties);
        }
    }

    @Override
    public void updateItem(final String itemID, final Map<String, Object> properties)
            throws ScienceSourceException {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            try {
                super.updateItem(itemID, properties);
                LOGGER.debug("{} - item {} updated with {} properties in {} ms", this, itemID,
                        properties.size(), System.currentTimeMillis() - ts);
            } catch (final ScienceSourceException ex) {
                LOGGER.debug("{} - item {} not updated after {} ms: {}", this, itemID,
                        System.currentTimeMillis() - ts, ex.getMessage());
                throw ex;
            }
        } else {
            super.updateItem(itemID, properties);
        }
    }

    @Override
    public void close() {
        if (LOGGER.isDebugEnabled()) {
            final long ts = System.currentTimeMillis();
            super.close();
            LOGGER.debug("{} - closed in {} ms", this, System.currentTimeMillis() - ts);
        } else {
            super.close();
        }
    }

}
