package com.jsonpack.converter.model;

public record BooleanNode(boolean value) implements ValueNode {

    public static final BooleanNode TRUE = new BooleanNode(true);
    public static final BooleanNode FALSE = new BooleanNode(false);

    public static BooleanNode of(boolean value) {
        return value ? TRUE : FALSE;
    }

    @Override
    public <R, E extends Exception> R accept(ValueNodeVisitor<R, E> visitor) throws E {
        return visitor.visitBoolean(this);
    }
}
