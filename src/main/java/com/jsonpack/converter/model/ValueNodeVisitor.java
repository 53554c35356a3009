package com.jsonpack.converter.model;

/**
 * Visitor over the {@link ValueNode} variants.
 *
 * @param <R> result type
 * @param <E> checked exception a visit may throw
 */
public interface ValueNodeVisitor<R, E extends Exception> {
    R visitNull() throws E;
    R visitBoolean(BooleanNode node) throws E;
    R visitNumber(NumberNode node) throws E;
    R visitString(StringNode node) throws E;
    R visitArray(ArrayNode node) throws E;
    R visitObject(ObjectNode node) throws E;
}
