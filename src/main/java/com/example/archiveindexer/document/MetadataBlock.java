package com.example.archiveindexer.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered multi-valued mapping parsed from the {@code key: value} lines under a heading.
 * Keys keep their declared spelling and order; lookups ignore case.
 */
public final class MetadataBlock {
    private static final MetadataBlock EMPTY = new MetadataBlock(new LinkedHashMap<>());

    private final Map<String, List<String>> values;

    private MetadataBlock(LinkedHashMap<String, List<String>> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public static MetadataBlock empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<String> values(String key) {
        for (Map.Entry<String, List<String>> entry : values.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(key)) {
                return entry.getValue();
            }
        }
        return List.of();
    }

    public Optional<String> first(String key) {
        List<String> found = values(key);
        return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0));
    }

    public Set<String> keys() {
        return values.keySet();
    }

    public Map<String, List<String>> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    /**
     * Returns a block holding this block's values followed by the values of {@code other}
     * that are not already present under the same key.
     */
    public MetadataBlock merge(MetadataBlock other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        Builder builder = new Builder();
        for (Map.Entry<String, List<String>> entry : values.entrySet()) {
            builder.declare(entry.getKey());
            entry.getValue().forEach(value -> builder.add(entry.getKey(), value));
        }
        builder.addAll(other);
        return builder.build();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof MetadataBlock other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }

    public static final class Builder {
        private final LinkedHashMap<String, List<String>> values = new LinkedHashMap<>();

        private Builder() {
        }

        /**
         * Registers a key without a value yet. Used for {@code key:} lines whose values
         * follow on continuation lines.
         */
        public Builder declare(String key) {
            slot(key);
            return this;
        }

        /**
         * Appends {@code value} under {@code key}, repeats included.
         */
        public Builder add(String key, String value) {
            slot(key).add(value);
            return this;
        }

        /**
         * Appends the values of {@code block} that are not already held under the same key.
         */
        public Builder addAll(MetadataBlock block) {
            for (Map.Entry<String, List<String>> entry : block.values.entrySet()) {
                List<String> slot = slot(entry.getKey());
                for (String value : entry.getValue()) {
                    if (!slot.contains(value)) {
                        slot.add(value);
                    }
                }
            }
            return this;
        }

        public MetadataBlock build() {
            if (values.isEmpty()) {
                return EMPTY;
            }
            LinkedHashMap<String, List<String>> copy = new LinkedHashMap<>();
            values.forEach((key, list) -> copy.put(key, List.copyOf(list)));
            return new MetadataBlock(copy);
        }

        private List<String> slot(String key) {
            for (Map.Entry<String, List<String>> entry : values.entrySet()) {
                if (entry.getKey().equalsIgnoreCase(key)) {
                    return entry.getValue();
                }
            }
            List<String> created = new ArrayList<>();
            values.put(key, created);
            return created;
        }
    }
}
