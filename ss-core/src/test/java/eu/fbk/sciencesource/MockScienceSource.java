package eu.fbk.sciencesource;

import java.util.List;
import java.util.Map;
import java.util.Set;

import javax.annotation.Nullable;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;
import com.google.common.collect.Maps;
import com.google.common.collect.Sets;

/**
 * An in-memory {@code ScienceSource} recording the calls it receives. Labels resolve to
 * sequentially assigned IDs; failures can be injected on a label or on the n-th write call.
 */
public final class MockScienceSource implements ScienceSource {

    private final Map<String, String> propertyIDs = Maps.newHashMap();

    private final Map<String, String> itemIDs = Maps.newHashMap();

    private final List<String> lookups = Lists.newArrayList();

    private final Map<String, String> pages = Maps.newLinkedHashMap();

    private final Map<String, String> itemTypes = Maps.newLinkedHashMap();

    private final Map<String, Map<String, Object>> items = Maps.newLinkedHashMap();

    private final List<String> updates = Lists.newArrayList();

    private final Set<String> failingLabels = Sets.newHashSet();

    private int writes;

    private int failingWrite;

    private int nextPageID = 100;

    private int nextItemID = 1000;

    private boolean closed;

    public MockScienceSource failOnLabel(final String label) {
        this.failingLabels.add(label);
        return this;
    }

    /**
     * Makes the n-th write call from now on (1-based) fail once.
     */
    public MockScienceSource failOnWrite(final int n) {
        this.failingWrite = this.writes + n;
        return this;
    }

    @Override
    public String resolvePropertyLabel(final String label) throws ScienceSourceException {
        return resolve("P", this.propertyIDs, label);
    }

    @Override
    public String resolveItemLabel(final String label) throws ScienceSourceException {
        return resolve("Q", this.itemIDs, label);
    }

    private String resolve(final String prefix, final Map<String, String> ids,
            final String label) throws ScienceSourceException {
        checkOpen();
        this.lookups.add(label);
        if (this.failingLabels.contains(label)) {
            throw new ScienceSourceException("no-such-label", "Unknown label " + label, null);
        }
        String id = ids.get(label);
        if (id == null) {
            id = prefix + (ids.size() + 1);
            ids.put(label, id);
        }
        return id;
    }

    @Override
    public int createArticle(final String title, final String content)
            throws ScienceSourceException {
        checkWrite();
        this.pages.put(title, content);
        return this.nextPageID++;
    }

    @Override
    public String createItem(final String itemTypeID, final Map<String, Object> properties)
            throws ScienceSourceException {
        checkWrite();
        final String id = "Q" + this.nextItemID++;
        this.itemTypes.put(id, itemTypeID);
        this.items.put(id, Maps.newLinkedHashMap(properties));
        return id;
    }

    @Override
    public void updateItem(final String itemID, final Map<String, Object> properties)
            throws ScienceSourceException {
        checkWrite();
        final Map<String, Object> item = this.items.get(itemID);
        if (item == null) {
            throw new ScienceSourceException("no-such-entity", "Unknown item " + itemID, null);
        }
        item.putAll(properties);
        this.updates.add(itemID);
    }

    @Override
    public void close() {
        this.closed = true;
    }

    public boolean isClosed() {
        return this.closed;
    }

    public List<String> getLookups() {
        return ImmutableList.copyOf(this.lookups);
    }

    public Map<String, String> getPages() {
        return ImmutableMap.copyOf(this.pages);
    }

    public Map<String, Map<String, Object>> getItems() {
        return ImmutableMap.copyOf(this.items);
    }

    @Nullable
    public Map<String, Object> getItem(final String id) {
        return this.items.get(id);
    }

    @Nullable
    public String getItemType(final String id) {
        return this.itemTypes.get(id);
    }

    public List<String> getUpdates() {
        return ImmutableList.copyOf(this.updates);
    }

    public int getWrites() {
        return this.writes;
    }

    private void checkWrite() throws ScienceSourceException {
        checkOpen();
        ++this.writes;
        if (this.writes == this.failingWrite) {
            throw new ScienceSourceException("Injected failure on write " + this.writes);
        }
    }

    private void checkOpen() {
        if (this.closed) {
            throw new IllegalStateException("Closed");
        }
    }

    @Override
    public String toString() {
        return "MockScienceSource";
    }

}
