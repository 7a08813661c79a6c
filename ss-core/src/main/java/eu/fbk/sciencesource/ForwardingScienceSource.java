package eu.fbk.sciencesource;

import java.util.Map;

import com.google.common.collect.ForwardingObject;

public abstract class ForwardingScienceSource extends ForwardingObject implements ScienceSource {

    @Override
    protected abstract ScienceSource delegate();

    @Override
    public String resolvePropertyLabel(final String label) throws ScienceSourceException {
        return delegate().resolvePropertyLabel(label);
    }

    @Override
    public String resolveItemLabel(final String label) throws ScienceSourceException {
        return delegate().resolveItemLabel(label);
    }

    @Override
    public int createArticle(final String title, final String content)
            throws ScienceSourceException {
        return delegate().createArticle(title, content);
    }

    @Override
    public String createItem(final String itemTypeID, final Map<String, Object> properties)
            throws ScienceSourceException {
        return delegate().createItem(itemTypeID, properties);
    }

    @Override
    public void updateItem(final String itemID, final Map<String, Object> properties)
            throws ScienceSourceException {
        delegate().updateItem(itemID, properties);
    }

    @Override
    public void close() {
        delegate().close();
    }

}
