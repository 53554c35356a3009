package com.jsonpack.converter.model;

/**
 * A JSON-expressible value: the pivot representation both conversion
 * directions pass through.
 *
 * The variants are the six records of this package and no others. Consumers
 * branch on the variant through {@link ValueNodeVisitor}, which has exactly one
 * method per variant.
 */
public interface ValueNode {

    <R, E extends Exception> R accept(ValueNodeVisitor<R, E> visitor) throws E;
}
