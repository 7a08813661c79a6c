package eu.fbk.sciencesource;

import java.io.Closeable;
import java.util.Map;

/**
 * A remote ScienceSource instance.
 * <p>
 * This interface represents the remote item/property store the annotation graph is uploaded to.
 * It exposes the few operations the upload protocol relies on: resolving human readable labels
 * to property and item identifiers, creating the wiki page holding the article text, creating
 * typed items described by a set of property values and patching existing items with additional
 * property values. How these calls are carried over the network (and how authentication, timeouts
 * and retries are handled) is up to the implementation.
 * </p>
 * <p>
 * Property values passed to {@link #createItem(String, Map)} and {@link #updateItem(String, Map)}
 * are keyed by property ID and may be {@code String}s (string values), {@code Integer}s (quantity
 * values) or {@link ItemRef}s (references to other items).
 * </p>
 * <p>
 * Calls are synchronous; a {@code ScienceSource} is not required to be thread safe.
 * </p>
 */
public interface ScienceSource extends Closeable {

    /**
     * Returns the ID of the property labelled as specified.
     *
     * @param label
     *            the property label, not empty
     * @return the property ID, not empty
     * @throws ScienceSourceException
     *             if the label is unknown or the lookup failed
     */
    String resolvePropertyLabel(String label) throws ScienceSourceException;

    /**
     * Returns the ID of the item labelled as specified.
     *
     * @param label
     *            the item label, not empty
     * @return the item ID, not empty
     * @throws ScienceSourceException
     *             if the label is unknown or the lookup failed
     */
    String resolveItemLabel(String label) throws ScienceSourceException;

    /**
     * Creates the wiki page holding the text of an article.
     *
     * @param title
     *            the page title
     * @param content
     *            the page content
     * @return the ID assigned to the new page
     * @throws ScienceSourceException
     *             if the page could not be created
     */
    int createArticle(String title, String content) throws ScienceSourceException;

    /**
     * Creates a new item with the property values specified.
     *
     * @param itemTypeID
     *            the ID of the item describing the type of the new item
     * @param properties
     *            the property values of the new item, keyed by property ID
     * @return the ID assigned to the new item
     * @throws ScienceSourceException
     *             if the item could not be created
     */
    String createItem(String itemTypeID, Map<String, Object> properties)
            throws ScienceSourceException;

    /**
     * Adds the property values specified to an existing item.
     *
     * @param itemID
     *            the ID of the item to update
     * @param properties
     *            the property values to add, keyed by property ID
     * @throws ScienceSourceException
     *             if the item could not be updated
     */
    void updateItem(String itemID, Map<String, Object> properties) throws ScienceSourceException;

    /**
     * {@inheritDoc} Releases any resource allocated by this instance. Calling this method
     * additional times has no effect.
     */
    @Override
    void close();

}
