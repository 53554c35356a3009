package com.jsonpack.converter.convert;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.jsonpack.converter.exception.ConversionException;
import com.jsonpack.converter.json.JsonDocumentParser;
import com.jsonpack.converter.json.JsonDocumentWriter;
import com.jsonpack.converter.model.ValueNode;
import com.jsonpack.converter.msgpack.MessagePackDecoder;
import com.jsonpack.converter.msgpack.MessagePackEncoder;
import com.jsonpack.converter.transport.TextEncoding;
import com.jsonpack.converter.transport.TransportCodec;

/**
 * The two public conversions.
 *
 * Each call runs its pipeline to the end or stops at the first failing stage
 * and returns that stage's error in the result. Bad input never throws. The
 * service keeps no state between calls and can be shared across threads.
 */
public class ConversionService {
    private static final Logger log = LoggerFactory.getLogger(ConversionService.class);

    private final JsonDocumentParser jsonParser;
    private final JsonDocumentWriter jsonWriter;
    private final MessagePackEncoder messagePackEncoder;
    private final MessagePackDecoder messagePackDecoder;

    public ConversionService() {
        this(ConverterConfig.defaults());
    }

    public ConversionService(ConverterConfig config) {
        this.jsonParser = new JsonDocumentParser(config.getMaxNestingDepth());
        this.jsonWriter = new JsonDocumentWriter();
        this.messagePackEncoder = new MessagePackEncoder();
        this.messagePackDecoder = new MessagePackDecoder(config.getMaxNestingDepth());
    }

    /**
     * JSON text to base64 MessagePack.
     */
    public ConversionResult jsonToMessagePack(String jsonText) {
        Objects.requireNonNull(jsonText, "jsonText");
        try {
            ValueNode value = jsonParser.parse(jsonText);
            log.debug("Parsed {} characters of JSON", jsonText.length());

            byte[] packed = messagePackEncoder.encode(value);
            log.debug("Encoded {} bytes of MessagePack", packed.length);

            String output = TransportCodec.encodeBase64(packed);
            log.debug("JSON to MessagePack complete, {} base64 characters", output.length());
            return ConversionResult.success(output, null);
        } catch (ConversionException e) {
            log.debug("JSON to MessagePack failed ({}): {}", e.getKind(), e.getMessage());
            return ConversionResult.failure(e, null);
        }
    }

    /**
     * Hex or base64 MessagePack to pretty-printed JSON. The alphabet is
     * detected from the characters of the input.
     */
    public ConversionResult messagePackToJson(String encodedText) {
        Objects.requireNonNull(encodedText, "encodedText");
        TextEncoding encoding = TransportCodec.detect(encodedText);
        log.debug("Input of {} characters classified as {}", encodedText.length(), encoding);
        try {
            byte[] packed = TransportCodec.decode(encodedText, encoding);
            log.debug("Decoded {} bytes from {}", packed.length, encoding.getDisplayName());

            ValueNode value = messagePackDecoder.decode(packed);
            log.debug("Decoded MessagePack {}", value.getClass().getSimpleName());

            String output = jsonWriter.write(value);
            log.debug("MessagePack to JSON complete, {} characters", output.length());
            return ConversionResult.success(output, encoding);
        } catch (ConversionException e) {
            log.debug("MessagePack to JSON failed ({}): {}", e.getKind(), e.getMessage());
            return ConversionResult.failure(e, encoding);
        }
    }
}
