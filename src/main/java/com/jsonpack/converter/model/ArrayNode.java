package com.jsonpack.converter.model;

import java.util.List;

import lombok.Builder;
import lombok.Singular;

/**
 * Ordered sequence of values.
 */
@Builder
public record ArrayNode(@Singular List<ValueNode> elements) implements ValueNode {

    public static final ArrayNode EMPTY = new ArrayNode(List.of());

    public ArrayNode {
        elements = List.copyOf(elements);
    }

    public static ArrayNode of(ValueNode... elements) {
        return new ArrayNode(List.of(elements));
    }

    public int size() {
        return elements.size();
    }

    @Override
    public <R, E extends Exception> R accept(ValueNodeVisitor<R, E> visitor) throws E {
        return visitor.visitArray(this);
    }
}
