package com.jsonpack.converter.model;

/**
 * The null value.
 */
public record NullNode() implements ValueNode {

    public static final NullNode INSTANCE = new NullNode();

    @Override
    public <R, E extends Exception> R accept(ValueNodeVisitor<R, E> visitor) throws E {
        return visitor.visitNull();
    }
}
