package com.jsonpack.converter.json;

import java.io.IOException;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.core.StreamReadConstraints;
import com.jsonpack.converter.exception.JsonReadException;
import com.jsonpack.converter.model.ArrayNode;
import com.jsonpack.converter.model.BooleanNode;
import com.jsonpack.converter.model.NullNode;
import com.jsonpack.converter.model.NumberNode;
import com.jsonpack.converter.model.ObjectNode;
import com.jsonpack.converter.model.StringNode;
import com.jsonpack.converter.model.ValueNode;

/**
 * Parses one complete JSON document into a {@link ValueNode} tree.
 *
 * Tokenizing is done by Jackson's streaming parser with its strict defaults
 * (no comments, no single quotes, no trailing commas, no NaN literals). This
 * class adds the document rules on top:
 * - exactly one value, nothing but whitespace after it
 * - duplicate object keys: the last occurrence wins
 * - integers keep 64-bit precision (signed, or unsigned above Long.MAX_VALUE)
 * - floating point literals must fit a finite double
 * - strings must not contain unpaired surrogates
 */
public class JsonDocumentParser {
    private static final Logger log = LoggerFactory.getLogger(JsonDocumentParser.class);

    private final JsonFactory factory;

    public JsonDocumentParser(int maxNestingDepth) {
        this.factory = JsonFactory.builder()
                .streamReadConstraints(StreamReadConstraints.builder()
                        .maxNestingDepth(maxNestingDepth)
                        .maxNumberLength(Integer.MAX_VALUE)
                        .maxNameLength(Integer.MAX_VALUE)
                        .maxStringLength(Integer.MAX_VALUE)
                        .build())
                .build();
    }

    public ValueNode parse(String text) throws JsonReadException {
        try (JsonParser parser = factory.createParser(text)) {
            ValueNode root = readValue(parser, parser.nextToken());

            if (parser.nextToken() != null) {
                throw error("trailing characters after the JSON value", parser.currentTokenLocation());
            }

            log.debug("Parsed JSON document of {} characters", text.length());
            return root;
        } catch (JsonProcessingException e) {
            throw new JsonReadException(describe(e), e);
        } catch (IOException e) {
            throw new JsonReadException(e.getMessage(), e);
        }
    }

    private ValueNode readValue(JsonParser parser, JsonToken token) throws IOException, JsonReadException {
        if (token == null) {
            throw error("unexpected end of input, expected a JSON value", parser.currentLocation());
        }
        return switch (token) {
            case START_OBJECT -> readObject(parser);
            case START_ARRAY -> readArray(parser);
            case VALUE_STRING -> new StringNode(readString(parser, parser.getText()));
            case VALUE_NUMBER_INT -> readInteger(parser);
            case VALUE_NUMBER_FLOAT -> readFloat(parser);
            case VALUE_TRUE -> BooleanNode.TRUE;
            case VALUE_FALSE -> BooleanNode.FALSE;
            case VALUE_NULL -> NullNode.INSTANCE;
            default -> throw error("unexpected token " + token, parser.currentTokenLocation());
        };
    }

    private ObjectNode readObject(JsonParser parser) throws IOException, JsonReadException {
        SortedMap<String, ValueNode> members = new TreeMap<>(ObjectNode.KEY_ORDER);
        JsonToken token;
        while ((token = parser.nextToken()) == JsonToken.FIELD_NAME) {
            String key = readString(parser, parser.currentName());
            ValueNode previous = members.put(key, readValue(parser, parser.nextToken()));
            if (previous != null) {
                log.debug("Duplicate key '{}' replaced an earlier value", key);
            }
        }
        if (token != JsonToken.END_OBJECT) {
            throw error("unterminated object", parser.currentLocation());
        }
        return new ObjectNode(members);
    }

    private ArrayNode readArray(JsonParser parser) throws IOException, JsonReadException {
        List<ValueNode> elements = new ArrayList<>();
        JsonToken token;
        while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
            elements.add(readValue(parser, token));
        }
        return new ArrayNode(elements);
    }

    private NumberNode readInteger(JsonParser parser) throws IOException, JsonReadException {
        switch (parser.getNumberType()) {
            case INT:
            case LONG:
                long value = parser.getLongValue();
                // -0 has no integer form; keep its sign as a double
                if (value == 0 && parser.getText().startsWith("-")) {
                    return NumberNode.of(-0.0);
                }
                return NumberNode.of(value);
            default:
                BigInteger big = parser.getBigIntegerValue();
                if (big.bitLength() > 64 && !Double.isFinite(big.doubleValue())) {
                    throw error("number out of range: " + abbreviate(parser.getText()),
                            parser.currentTokenLocation());
                }
                return NumberNode.ofInteger(big);
        }
    }

    private NumberNode readFloat(JsonParser parser) throws IOException, JsonReadException {
        double value = parser.getDoubleValue();
        if (!Double.isFinite(value)) {
            throw error("number out of range: " + abbreviate(parser.getText()), parser.currentTokenLocation());
        }
        return NumberNode.of(value);
    }

    private String readString(JsonParser parser, String value) throws JsonReadException {
        if (!StringNode.isWellFormed(value)) {
            throw error("lone surrogate in string", parser.currentTokenLocation());
        }
        return value;
    }

    private static String abbreviate(String literal) {
        return literal.length() <= 40 ? literal : literal.substring(0, 40) + "...";
    }

    private static JsonReadException error(String message, JsonLocation location) {
        return new JsonReadException(message + position(location));
    }

    private static String describe(JsonProcessingException e) {
        return e.getOriginalMessage() + position(e.getLocation());
    }

    private static String position(JsonLocation location) {
        if (location == null || location.getLineNr() < 0) {
            return "";
        }
        return " at line " + location.getLineNr() + " column " + location.getColumnNr();
    }
}
