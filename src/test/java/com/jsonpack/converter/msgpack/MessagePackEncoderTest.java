package com.jsonpack.converter.msgpack;

import com.jsonpack.converter.exception.ErrorKind;
import com.jsonpack.converter.exception.MessagePackEncodeException;
import com.jsonpack.converter.model.ArrayNode;
import com.jsonpack.converter.model.BooleanNode;
import com.jsonpack.converter.model.NullNode;
import com.jsonpack.converter.model.NumberNode;
import com.jsonpack.converter.model.ObjectNode;
import com.jsonpack.converter.model.StringNode;
import com.jsonpack.converter.model.ValueNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigInteger;
import java.util.Collections;
import java.util.HexFormat;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for MessagePackEncoder byte layout.
 */
class MessagePackEncoderTest {

    private final MessagePackEncoder encoder = new MessagePackEncoder();

    @Test
    void testEncodeObjectWithSortedKeys() throws Exception {
        ObjectNode value = ObjectNode.builder()
                .member("name", new StringNode("Alice"))
                .member("age", NumberNode.of(30))
                .member("city", new StringNode("Wonderland"))
                .build();

        assertThat(hex(value))
                .isEqualTo("83a36167651ea463697479aa576f6e6465726c616e64a46e616d65a5416c696365");
    }

    @Test
    void testEncodeConstants() throws Exception {
        assertThat(hex(NullNode.INSTANCE)).isEqualTo("c0");
        assertThat(hex(BooleanNode.TRUE)).isEqualTo("c3");
        assertThat(hex(BooleanNode.FALSE)).isEqualTo("c2");
    }

    @ParameterizedTest
    @CsvSource({
        "0, 00",
        "127, 7f",
        "128, cc80",
        "255, ccff",
        "256, cd0100",
        "65535, cdffff",
        "65536, ce00010000",
        "4294967296, cf0000000100000000",
        "-1, ff",
        "-32, e0",
        "-33, d0df",
        "-128, d080",
        "-129, d1ff7f",
        "-32769, d2ffff7fff",
        "-9223372036854775808, d38000000000000000"
    })
    void testIntegersUseSmallestEncoding(long value, String expectedHex) throws Exception {
        assertThat(hex(NumberNode.of(value))).isEqualTo(expectedHex);
    }

    @Test
    void testUnsigned64() throws Exception {
        NumberNode max = NumberNode.ofInteger(new BigInteger("18446744073709551615"));

        assertThat(hex(max)).isEqualTo("cfffffffffffffffff");
    }

    @Test
    void testDoubleIsFloat64() throws Exception {
        assertThat(hex(NumberNode.of(1.5))).isEqualTo("cb3ff8000000000000");
        assertThat(hex(NumberNode.of(1.0))).isEqualTo("cb3ff0000000000000");
    }

    @Test
    void testStringHeaderIsSizedByUtf8Length() throws Exception {
        assertThat(hex(new StringNode(""))).isEqualTo("a0");
        assertThat(hex(new StringNode("é"))).isEqualTo("a2c3a9");
        assertThat(hex(new StringNode("x".repeat(31)))).startsWith("bf");
        assertThat(hex(new StringNode("x".repeat(32)))).startsWith("d920");
        assertThat(hex(new StringNode("x".repeat(1000)))).startsWith("da03e8");
        // 11 two-byte characters need 22 bytes, still a fixstr
        assertThat(hex(new StringNode("é".repeat(11)))).startsWith("b6");
    }

    @Test
    void testContainerHeaders() throws Exception {
        assertThat(hex(ArrayNode.EMPTY)).isEqualTo("90");
        assertThat(hex(ObjectNode.EMPTY)).isEqualTo("80");
        assertThat(hex(ArrayNode.of(NumberNode.of(1), NumberNode.of(2)))).isEqualTo("920102");
        assertThat(hex(new ArrayNode(Collections.nCopies(16, NullNode.INSTANCE)))).startsWith("dc0010");
    }

    @Test
    void testUnpairedSurrogateCannotBeEncoded() {
        ValueNode value = ObjectNode.builder().member("bad", new StringNode("x\ud800y")).build();

        assertThatThrownBy(() -> encoder.encode(value))
                .isInstanceOf(MessagePackEncodeException.class)
                .hasMessageContaining("unpaired surrogate")
                .satisfies(e -> {
                    MessagePackEncodeException ex = (MessagePackEncodeException) e;
                    assertThat(ex.getKind()).isEqualTo(ErrorKind.MESSAGEPACK_ENCODE);
                    assertThat(ex.describe()).startsWith("Failed to serialize to MessagePack: ");
                });
    }

    private String hex(ValueNode value) throws MessagePackEncodeException {
        return HexFormat.of().formatHex(encoder.encode(value));
    }
}
