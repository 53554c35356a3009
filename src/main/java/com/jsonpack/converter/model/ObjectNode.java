package com.jsonpack.converter.model;

import java.util.Collections;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.SortedMap;
import java.util.TreeMap;

import lombok.Builder;
import lombok.Singular;

/**
 * Mapping of string keys to values.
 *
 * Keys are unique and kept sorted by Unicode code point, which is also the
 * UTF-8 byte order. Every encoder and writer emits members in this order, so
 * output is deterministic regardless of the order keys appeared in the input.
 * When the same key is put twice the later value wins.
 */
@Builder
public record ObjectNode(@Singular SortedMap<String, ValueNode> members) implements ValueNode {

    public static final Comparator<String> KEY_ORDER = ObjectNode::compareByCodePoint;

    public static final ObjectNode EMPTY = new ObjectNode(Collections.emptySortedMap());

    public ObjectNode {
        SortedMap<String, ValueNode> sorted = new TreeMap<>(KEY_ORDER);
        sorted.putAll(members);
        members = Collections.unmodifiableSortedMap(sorted);
    }

    /**
     * Creates an object from any map; iteration order of the source does not matter.
     */
    public static ObjectNode of(Map<String, ? extends ValueNode> members) {
        SortedMap<String, ValueNode> sorted = new TreeMap<>(KEY_ORDER);
        sorted.putAll(members);
        return new ObjectNode(sorted);
    }

    public int size() {
        return members.size();
    }

    public Optional<ValueNode> get(String key) {
        return Optional.ofNullable(members.get(key));
    }

    @Override
    public <R, E extends Exception> R accept(ValueNodeVisitor<R, E> visitor) throws E {
        return visitor.visitObject(this);
    }

    private static int compareByCodePoint(String a, String b) {
        int i = 0;
        int j = 0;
        while (i < a.length() && j < b.length()) {
            int ca = a.codePointAt(i);
            int cb = b.codePointAt(j);
            if (ca != cb) {
                return Integer.compare(ca, cb);
            }
            i += Character.charCount(ca);
            j += Character.charCount(cb);
        }
        return Integer.compare(a.length() - i, b.length() - j);
    }
}
