package com.jsonpack.converter.msgpack;

import java.io.IOException;
import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.msgpack.core.MessageBufferPacker;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessagePacker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonpack.converter.exception.MessagePackEncodeException;
import com.jsonpack.converter.model.ArrayNode;
import com.jsonpack.converter.model.BooleanNode;
import com.jsonpack.converter.model.NumberNode;
import com.jsonpack.converter.model.ObjectNode;
import com.jsonpack.converter.model.StringNode;
import com.jsonpack.converter.model.ValueNode;
import com.jsonpack.converter.model.ValueNodeVisitor;

/**
 * Writes a {@link ValueNode} as MessagePack.
 *
 * Each value uses the most compact encoding msgpack-core offers for it:
 * integers pick the smallest fixint/int/uint width that holds them, doubles
 * are always float64, and string/array/map headers are sized to the content.
 * Strings are encoded to UTF-8 strictly, so text with unpaired surrogates is
 * rejected instead of being replaced.
 */
public class MessagePackEncoder {
    private static final Logger log = LoggerFactory.getLogger(MessagePackEncoder.class);

    public byte[] encode(ValueNode value) throws MessagePackEncodeException {
        try (MessageBufferPacker packer = MessagePack.newDefaultBufferPacker()) {
            value.accept(new PackingVisitor(packer));
            byte[] bytes = packer.toByteArray();
            log.debug("Encoded MessagePack value of {} bytes", bytes.length);
            return bytes;
        } catch (CharacterCodingException e) {
            throw new MessagePackEncodeException("string is not valid Unicode (unpaired surrogate)", e);
        } catch (IOException | MessagePackException e) {
            throw new MessagePackEncodeException(String.valueOf(e.getMessage()), e);
        }
    }

    private static final class PackingVisitor implements ValueNodeVisitor<Void, IOException> {

        private final MessagePacker packer;
        private final CharsetEncoder utf8 = StandardCharsets.UTF_8.newEncoder();

        private PackingVisitor(MessagePacker packer) {
            this.packer = packer;
        }

        @Override
        public Void visitNull() throws IOException {
            packer.packNil();
            return null;
        }

        @Override
        public Void visitBoolean(BooleanNode node) throws IOException {
            packer.packBoolean(node.value());
            return null;
        }

        @Override
        public Void visitNumber(NumberNode node) throws IOException {
            Number number = node.value();
            if (node.isUnsigned64()) {
                packer.packBigInteger((BigInteger) number);
            } else if (node.isIntegral()) {
                packer.packLong(number.longValue());
            } else {
                packer.packDouble(number.doubleValue());
            }
            return null;
        }

        @Override
        public Void visitString(StringNode node) throws IOException {
            packString(node.value());
            return null;
        }

        @Override
        public Void visitArray(ArrayNode node) throws IOException {
            packer.packArrayHeader(node.size());
            for (ValueNode element : node.elements()) {
                element.accept(this);
            }
            return null;
        }

        @Override
        public Void visitObject(ObjectNode node) throws IOException {
            packer.packMapHeader(node.size());
            for (Map.Entry<String, ValueNode> member : node.members().entrySet()) {
                packString(member.getKey());
                member.getValue().accept(this);
            }
            return null;
        }

        private void packString(String value) throws IOException {
            ByteBuffer encoded = utf8.encode(CharBuffer.wrap(value));
            int length = encoded.remaining();
            packer.packRawStringHeader(length);
            packer.writePayload(encoded.array(), encoded.arrayOffset() + encoded.position(), length);
        }
    }
}
