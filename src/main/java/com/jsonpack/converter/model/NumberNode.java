package com.jsonpack.converter.model;

import java.math.BigInteger;
import java.util.Objects;

/**
 * A numeric value that keeps the integer / floating point distinction.
 *
 * Representation is canonical so that record equality is structural equality:
 * <ul>
 *   <li>{@link Long} for every integer in the signed 64-bit range</li>
 *   <li>{@link BigInteger} only for unsigned 64-bit integers above {@link Long#MAX_VALUE}</li>
 *   <li>{@link Double} for floating point values, which must be finite</li>
 * </ul>
 */
public record NumberNode(Number value) implements ValueNode {

    public NumberNode {
        Objects.requireNonNull(value, "value");
        if (value instanceof Double d) {
            if (!Double.isFinite(d)) {
                throw new IllegalArgumentException("Number must be finite: " + d);
            }
        } else if (value instanceof BigInteger big) {
            if (big.signum() <= 0 || big.bitLength() != 64) {
                throw new IllegalArgumentException(
                        "BigInteger is reserved for unsigned 64-bit values above Long.MAX_VALUE: " + big);
            }
        } else if (!(value instanceof Long)) {
            throw new IllegalArgumentException("Unsupported number type: " + value.getClass().getName());
        }
    }

    public static NumberNode of(long value) {
        return new NumberNode(value);
    }

    public static NumberNode of(double value) {
        return new NumberNode(value);
    }

    /**
     * Integer of arbitrary size. Values outside the signed and unsigned 64-bit
     * ranges degrade to the nearest double.
     */
    public static NumberNode ofInteger(BigInteger value) {
        if (value.bitLength() <= 63) {
            return new NumberNode(value.longValue());
        }
        if (value.signum() > 0 && value.bitLength() == 64) {
            return new NumberNode(value);
        }
        return new NumberNode(value.doubleValue());
    }

    public boolean isIntegral() {
        return !(value instanceof Double);
    }

    public boolean isUnsigned64() {
        return value instanceof BigInteger;
    }

    @Override
    public <R, E extends Exception> R accept(ValueNodeVisitor<R, E> visitor) throws E {
        return visitor.visitNumber(this);
    }
}
