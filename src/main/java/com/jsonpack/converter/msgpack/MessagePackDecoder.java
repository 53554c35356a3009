package com.jsonpack.converter.msgpack;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedMap;
import java.util.TreeMap;

import org.msgpack.core.ExtensionTypeHeader;
import org.msgpack.core.MessageFormat;
import org.msgpack.core.MessageInsufficientBufferException;
import org.msgpack.core.MessagePack;
import org.msgpack.core.MessagePackException;
import org.msgpack.core.MessageUnpacker;
import org.msgpack.value.ValueType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonpack.converter.exception.MessagePackDecodeException;
import com.jsonpack.converter.model.ArrayNode;
import com.jsonpack.converter.model.BooleanNode;
import com.jsonpack.converter.model.NullNode;
import com.jsonpack.converter.model.NumberNode;
import com.jsonpack.converter.model.ObjectNode;
import com.jsonpack.converter.model.StringNode;
import com.jsonpack.converter.model.ValueNode;

/**
 * Reads the first MessagePack value of a buffer into a {@link ValueNode}.
 *
 * Bytes after the first complete value are ignored. Shapes JSON cannot hold
 * are handled as follows:
 * <ul>
 *   <li>bin 8/16/32: rejected</li>
 *   <li>ext and fixext: rejected</li>
 *   <li>map keys other than strings: rejected</li>
 *   <li>NaN and infinite floats: decoded as null</li>
 *   <li>uint 64 above Long.MAX_VALUE: kept as an unsigned integer</li>
 *   <li>duplicate map keys: the last one wins</li>
 * </ul>
 */
public class MessagePackDecoder {
    private static final Logger log = LoggerFactory.getLogger(MessagePackDecoder.class);

    private final int maxNestingDepth;

    public MessagePackDecoder(int maxNestingDepth) {
        this.maxNestingDepth = maxNestingDepth;
    }

    public ValueNode decode(byte[] bytes) throws MessagePackDecodeException {
        try (MessageUnpacker unpacker = MessagePack.newDefaultUnpacker(bytes)) {
            if (!unpacker.hasNext()) {
                throw new MessagePackDecodeException("unexpected end of input, no value present");
            }

            ValueNode value = new Reader(unpacker, bytes.length).readValue(0);

            long trailing = bytes.length - unpacker.getTotalReadBytes();
            if (trailing > 0) {
                log.debug("Ignoring {} trailing bytes after the first value", trailing);
            }
            return value;
        } catch (MessageInsufficientBufferException e) {
            throw new MessagePackDecodeException("unexpected end of input", e);
        } catch (MessagePackException e) {
            throw new MessagePackDecodeException(String.valueOf(e.getMessage()), e);
        } catch (CharacterCodingException e) {
            throw new MessagePackDecodeException("invalid UTF-8 in string", e);
        } catch (IOException e) {
            throw new MessagePackDecodeException(String.valueOf(e.getMessage()), e);
        }
    }

    private final class Reader {

        private final MessageUnpacker unpacker;
        private final long length;
        private final CharsetDecoder utf8 = StandardCharsets.UTF_8.newDecoder();

        private Reader(MessageUnpacker unpacker, long length) {
            this.unpacker = unpacker;
            this.length = length;
        }

        ValueNode readValue(int depth) throws IOException, MessagePackDecodeException {
            long offset = unpacker.getTotalReadBytes();
            MessageFormat format = nextFormat(offset);

            return switch (format.getValueType()) {
                case NIL -> readNil();
                case BOOLEAN -> BooleanNode.of(unpacker.unpackBoolean());
                case INTEGER -> format == MessageFormat.UINT64
                        ? NumberNode.ofInteger(unpacker.unpackBigInteger())
                        : NumberNode.of(unpacker.unpackLong());
                case FLOAT -> readFloat(offset);
                case STRING -> new StringNode(readString(offset));
                case ARRAY -> readArray(depth + 1, offset);
                case MAP -> readMap(depth + 1, offset);
                case BINARY -> throw new MessagePackDecodeException(
                        "binary data at offset " + offset + " has no JSON representation");
                case EXTENSION -> throw unsupportedExtension(offset);
            };
        }

        private MessageFormat nextFormat(long offset) throws IOException, MessagePackDecodeException {
            MessageFormat format = unpacker.getNextFormat();
            if (format == MessageFormat.NEVER_USED) {
                throw new MessagePackDecodeException("unrecognized type marker 0xc1 at offset " + offset);
            }
            return format;
        }

        private NullNode readNil() throws IOException {
            unpacker.unpackNil();
            return NullNode.INSTANCE;
        }

        private ValueNode readFloat(long offset) throws IOException {
            double value = unpacker.unpackDouble();
            if (!Double.isFinite(value)) {
                log.debug("Float {} at offset {} has no JSON literal, decoding as null", value, offset);
                return NullNode.INSTANCE;
            }
            return NumberNode.of(value);
        }

        private String readString(long offset) throws IOException, MessagePackDecodeException {
            int size = unpacker.unpackRawStringHeader();
            requireAvailable(size, "string of " + size + " bytes", offset);
            byte[] raw = unpacker.readPayload(size);
            return utf8.decode(ByteBuffer.wrap(raw)).toString();
        }

        private ArrayNode readArray(int depth, long offset) throws IOException, MessagePackDecodeException {
            requireDepth(depth, offset);
            int count = unpacker.unpackArrayHeader();
            requireAvailable(count, "array of " + count + " elements", offset);

            List<ValueNode> elements = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                elements.add(readValue(depth));
            }
            return new ArrayNode(elements);
        }

        private ObjectNode readMap(int depth, long offset) throws IOException, MessagePackDecodeException {
            requireDepth(depth, offset);
            int count = unpacker.unpackMapHeader();
            // every entry needs at least one byte for its key and one for its value
            requireAvailable(2L * count, "map of " + count + " entries", offset);

            SortedMap<String, ValueNode> members = new TreeMap<>(ObjectNode.KEY_ORDER);
            for (int i = 0; i < count; i++) {
                long keyOffset = unpacker.getTotalReadBytes();
                ValueType keyType = nextFormat(keyOffset).getValueType();
                if (keyType != ValueType.STRING) {
                    throw new MessagePackDecodeException("map key at offset " + keyOffset
                            + " must be a string, found " + keyType.name().toLowerCase());
                }
                String key = readString(keyOffset);
                members.put(key, readValue(depth));
            }
            return new ObjectNode(members);
        }

        private MessagePackDecodeException unsupportedExtension(long offset) throws IOException {
            ExtensionTypeHeader header = unpacker.unpackExtensionTypeHeader();
            return new MessagePackDecodeException("extension type " + header.getType()
                    + " at offset " + offset + " is not supported");
        }

        private void requireDepth(int depth, long offset) throws MessagePackDecodeException {
            if (depth > maxNestingDepth) {
                throw new MessagePackDecodeException("nesting depth exceeds the maximum of "
                        + maxNestingDepth + " at offset " + offset);
            }
        }

        private void requireAvailable(long minimumBytes, String description, long offset)
                throws MessagePackDecodeException {
            long remaining = length - unpacker.getTotalReadBytes();
            if (minimumBytes > remaining) {
                throw new MessagePackDecodeException(description + " at offset " + offset
                        + " exceeds the " + remaining + " bytes remaining");
            }
        }
    }
}
