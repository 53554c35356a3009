package com.jsonpack.converter.model;

import java.util.Objects;

public record StringNode(String value) implements ValueNode {

    public StringNode {
        Objects.requireNonNull(value, "value");
    }

    /**
     * Returns true when every surrogate in the text is part of a valid pair,
     * i.e. the text can be encoded as UTF-8 without substitution.
     */
    public static boolean isWellFormed(CharSequence text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isHighSurrogate(c)) {
                if (i + 1 >= text.length() || !Character.isLowSurrogate(text.charAt(i + 1))) {
                    return false;
                }
                i++;
            } else if (Character.isLowSurrogate(c)) {
                return false;
            }
        }
        return true;
    }

    @Override
    public <R, E extends Exception> R accept(ValueNodeVisitor<R, E> visitor) throws E {
        return visitor.visitString(this);
    }
}
