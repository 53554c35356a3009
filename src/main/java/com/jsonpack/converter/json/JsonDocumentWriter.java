package com.jsonpack.converter.json;

import java.io.IOException;
import java.io.StringWriter;
import java.math.BigInteger;
import java.util.Map;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.jsonpack.converter.exception.JsonWriteException;
import com.jsonpack.converter.model.ArrayNode;
import com.jsonpack.converter.model.BooleanNode;
import com.jsonpack.converter.model.NumberNode;
import com.jsonpack.converter.model.ObjectNode;
import com.jsonpack.converter.model.StringNode;
import com.jsonpack.converter.model.ValueNode;
import com.jsonpack.converter.model.ValueNodeVisitor;

/**
 * Renders a {@link ValueNode} as pretty-printed JSON text.
 *
 * Output has no trailing newline. Object members appear in the object's key
 * order. Non-ASCII text is written as-is; quotes, backslashes and control
 * characters are escaped.
 */
public class JsonDocumentWriter {

    private static final JsonFactory FACTORY = new JsonFactory();

    public String write(ValueNode value) throws JsonWriteException {
        StringWriter out = new StringWriter();
        try (JsonGenerator generator = FACTORY.createGenerator(out)) {
            generator.setPrettyPrinter(new IndentingPrettyPrinter());
            value.accept(new GeneratingVisitor(generator));
        } catch (IOException e) {
            throw new JsonWriteException(e.getMessage(), e);
        }
        return out.toString();
    }

    private static final class GeneratingVisitor implements ValueNodeVisitor<Void, IOException> {

        private final JsonGenerator generator;

        private GeneratingVisitor(JsonGenerator generator) {
            this.generator = generator;
        }

        @Override
        public Void visitNull() throws IOException {
            generator.writeNull();
            return null;
        }

        @Override
        public Void visitBoolean(BooleanNode node) throws IOException {
            generator.writeBoolean(node.value());
            return null;
        }

        @Override
        public Void visitNumber(NumberNode node) throws IOException {
            Number number = node.value();
            if (number instanceof Long l) {
                generator.writeNumber(l);
            } else if (number instanceof BigInteger big) {
                generator.writeNumber(big);
            } else {
                generator.writeNumber(number.doubleValue());
            }
            return null;
        }

        @Override
        public Void visitString(StringNode node) throws IOException {
            generator.writeString(node.value());
            return null;
        }

        @Override
        public Void visitArray(ArrayNode node) throws IOException {
            generator.writeStartArray();
            for (ValueNode element : node.elements()) {
                element.accept(this);
            }
            generator.writeEndArray();
            return null;
        }

        @Override
        public Void visitObject(ObjectNode node) throws IOException {
            generator.writeStartObject();
            for (Map.Entry<String, ValueNode> member : node.members().entrySet()) {
                generator.writeFieldName(member.getKey());
                member.getValue().accept(this);
            }
            generator.writeEndObject();
            return null;
        }
    }
}
