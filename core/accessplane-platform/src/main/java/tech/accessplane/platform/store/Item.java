package tech.accessplane.platform.store;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * An immutable item of the key-value store.
 *
 * <p>Attribute values are plain Java values: {@link String}, {@link Boolean},
 * {@link Number}, {@link List} and {@link Map} (nested to any depth). Null
 * values are never stored; setting an attribute to null leaves it absent.
 */
public final class Item {

    private final Map<String, Object> attributes;

    private Item(Map<String, Object> attributes) {
        this.attributes = Collections.unmodifiableMap(attributes);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static Item of(Map<String, ?> attributes) {
        Builder builder = new Builder();
        attributes.forEach(builder::set);
        return builder.build();
    }

    public Map<String, Object> attributes() {
        return attributes;
    }

    public ItemKey key() {
        String pk = getString(KeySpace.PK);
        String sk = getString(KeySpace.SK);
        if (pk == null || sk == null) {
            throw new IllegalStateException("Item has no primary key: " + attributes.keySet());
        }
        return new ItemKey(pk, sk);
    }

    public boolean has(String name) {
        return attributes.containsKey(name);
    }

    public Object get(String name) {
        return attributes.get(name);
    }

    public String getString(String name) {
        Object value = attributes.get(name);
        return value == null ? null : value.toString();
    }

    public Optional<String> findString(String name) {
        String value = getString(name);
        return value == null || value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    public boolean getBoolean(String name, boolean defaultValue) {
        Object value = attributes.get(name);
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof String s) {
            return Boolean.parseBoolean(s);
        }
        return defaultValue;
    }

    public long getLong(String name, long defaultValue) {
        Object value = attributes.get(name);
        if (value instanceof Number n) {
            return n.longValue();
        }
        if (value instanceof String s && !s.isBlank()) {
            return new BigDecimal(s.trim()).longValue();
        }
        return defaultValue;
    }

    @SuppressWarnings("unchecked")
    public List<Object> getList(String name) {
        Object value = attributes.get(name);
        return value instanceof List<?> list ? (List<Object>) list : List.of();
    }

    /**
     * Copy of this item with the given attributes overwritten. Null values
     * in {@code changes} are ignored.
     */
    public Item with(Map<String, ?> changes) {
        Builder builder = new Builder();
        attributes.forEach(builder::set);
        changes.forEach(builder::set);
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof Item other && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return attributes.hashCode();
    }

    @Override
    public String toString() {
        return "Item" + attributes;
    }

    public static final class Builder {
        private final Map<String, Object> attributes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder set(String name, Object value) {
            if (value != null) {
                attributes.put(name, value);
            }
            return this;
        }

        public Builder key(ItemKey key) {
            return set(KeySpace.PK, key.partitionKey()).set(KeySpace.SK, key.sortKey());
        }

        public Item build() {
            return new Item(new LinkedHashMap<>(attributes));
        }
    }
}
