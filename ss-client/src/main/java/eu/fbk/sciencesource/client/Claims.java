package eu.fbk.sciencesource.client;

import java.util.Map;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.base.Preconditions;

import eu.fbk.sciencesource.ItemRef;

/**
 * Encodes property values as the Wikibase JSON claims accepted by {@code wbeditentity}.
 * <p>
 * Each entry of the property map becomes a statement whose main snak has the entry key as
 * property and a data value depending on the Java type of the entry value: {@code String}s are
 * encoded as {@code string} values, {@code Integer}s as dimensionless {@code quantity} values
 * and {@link ItemRef}s as {@code wikibase-entityid} values.
 * </p>
 */
public final class Claims {

    private static final JsonNodeFactory FACTORY = JsonNodeFactory.instance;

    private Claims() {
    }

    /**
     * Returns the {@code data} object holding the claims for the properties specified.
     *
     * @param properties
     *            a map from property ID to value
     * @return the encoded entity data
     * @throws IllegalArgumentException
     *             if a value has an unsupported type
     */
    public static ObjectNode encode(final Map<String, Object> properties) {
        final ObjectNode data = FACTORY.objectNode();
        final ArrayNode claims = data.putArray("claims");
        for (final Map.Entry<String, Object> entry : properties.entrySet()) {
            final ObjectNode snak = FACTORY.objectNode();
            snak.put("snaktype", "value");
            snak.put("property", entry.getKey());
            snak.set("datavalue", encodeValue(entry.getValue()));
            final ObjectNode claim = claims.addObject();
            claim.set("mainsnak", snak);
            claim.put("type", "statement");
            claim.put("rank", "normal");
        }
        return data;
    }

    static ObjectNode encodeValue(final Object value) {
        Preconditions.checkNotNull(value);
        final ObjectNode node = FACTORY.objectNode();
        if (value instanceof String) {
            node.put("value", (String) value);
            node.put("type", "string");
        } else if (value instanceof Integer) {
            final int amount = (Integer) value;
            final ObjectNode quantity = node.putObject("value");
            quantity.put("amount", amount < 0 ? Integer.toString(amount) : "+" + amount);
            quantity.put("unit", "1");
            node.put("type", "quantity");
        } else if (value instanceof ItemRef) {
            final ObjectNode entity = node.putObject("value");
            entity.put("entity-type", "item");
            entity.put("id", ((ItemRef) value).getID());
            node.put("type", "wikibase-entityid");
        } else {
            throw new IllegalArgumentException("Unsupported property value " + value + " ("
                    + value.getClass().getSimpleName() + ")");
        }
        return node;
    }

}
