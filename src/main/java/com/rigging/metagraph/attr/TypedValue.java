package com.rigging.metagraph.attr;

import java.util.List;

/**
 * A value together with the kind it was read from.
 *
 * For array and compound slots {@code value} is a {@code List<TypedValue>} with one
 * entry per existing element or child, in index order. Message slots read as a
 * null value.
 */
public record TypedValue(AttributeKind kind, Object value) {

    @SuppressWarnings("unchecked")
    public List<TypedValue> elements() {
        if (!(value instanceof List))
            throw new IllegalStateException("Not an array or compound value: " + kind);
        return (List<TypedValue>) value;
    }

    public boolean isEmpty() {
        return value == null;
    }
}
