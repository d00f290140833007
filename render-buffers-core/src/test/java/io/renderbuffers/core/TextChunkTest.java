package io.renderbuffers.core;

import org.junit.jupiter.api.Test;

import java.io.StringWriter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TextChunkTest {

    private final StringWriter writer = new StringWriter();
    private final char[] scratch = new char[TextChunk.SCRATCH_SIZE];

    @Test
    void canHoldString() throws Exception {
        TextChunk.of("string value").writeTo(writer, null, scratch);
        assertThat(writer.toString()).isEqualTo("string value");
    }

    @Test
    void canHoldChar() throws Exception {
        TextChunk.of('x').writeTo(writer, null, scratch);
        assertThat(writer.toString()).isEqualTo("x");
    }

    @Test
    void canHoldCharArraySlice() throws Exception {
        char[] chars = {'a', 'b', 'c', 'd', 'e'};
        TextChunk.of(chars, 1, 3).writeTo(writer, null, scratch);
        assertThat(writer.toString()).isEqualTo("bcd");
    }

    @Test
    void canHoldInt() throws Exception {
        TextChunk.of(123).writeTo(writer, null, scratch);
        TextChunk.of(456).writeTo(writer, null, scratch);
        assertThat(writer.toString()).isEqualTo("123456");
    }

    @Test
    void intFormatsNegativeAndExtremeValues() throws Exception {
        TextChunk.of(-42).writeTo(writer, null, scratch);
        writer.write('|');
        TextChunk.of(0).writeTo(writer, null, scratch);
        writer.write('|');
        TextChunk.of(Integer.MIN_VALUE).writeTo(writer, null, scratch);
        writer.write('|');
        TextChunk.of(Integer.MAX_VALUE).writeTo(writer, null, scratch);

        assertThat(writer.toString()).isEqualTo("-42|0|-2147483648|2147483647");
    }

    @Test
    void lengthCountsProducedCharacters() {
        assertThat(TextChunk.of("abc").length()).isEqualTo(3);
        assertThat(TextChunk.of('a').length()).isEqualTo(1);
        assertThat(TextChunk.of(new char[8], 2, 5).length()).isEqualTo(5);
        assertThat(TextChunk.of(0).length()).isEqualTo(1);
        assertThat(TextChunk.of(-1000).length()).isEqualTo(5);
        assertThat(TextChunk.of(Integer.MIN_VALUE).length()).isEqualTo(11);
    }

    @Test
    void sliceOutOfRangeFailsAtConstruction() {
        char[] chars = new char[4];

        assertThatThrownBy(() -> TextChunk.of(chars, 2, 3))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("exceeds array length");
        assertThatThrownBy(() -> TextChunk.of(chars, -1, 1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TextChunk.of(chars, 0, -1))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> TextChunk.of(chars, Integer.MAX_VALUE, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void sliceReadsCallerArrayLazily() throws Exception {
        char[] chars = {'a', 'b'};
        TextChunk chunk = TextChunk.of(chars, 0, 2);
        chars[1] = 'z';

        chunk.writeTo(writer, null, scratch);

        assertThat(writer.toString()).isEqualTo("az");
    }

    @Test
    void encoderAppliesToEveryForm() throws Exception {
        char[] chars = {'<', 'b', '>'};
        TextChunk.of("a&b").writeTo(writer, HtmlEncoder.DEFAULT, scratch);
        TextChunk.of('"').writeTo(writer, HtmlEncoder.DEFAULT, scratch);
        TextChunk.of(chars, 0, 3).writeTo(writer, HtmlEncoder.DEFAULT, scratch);
        TextChunk.of(-7).writeTo(writer, HtmlEncoder.DEFAULT, scratch);

        assertThat(writer.toString()).isEqualTo("a&amp;b&quot;&lt;b&gt;-7");
    }

    @Test
    void writesAsynchronously() {
        RecordingSink sink = new RecordingSink();

        TextChunk.of("x<").writeToAsync(sink, null).join();
        TextChunk.of('<').writeToAsync(sink, HtmlEncoder.DEFAULT).join();
        TextChunk.of(new char[]{'p', 'q', 'r'}, 1, 2).writeToAsync(sink, null).join();
        TextChunk.of(-15).writeToAsync(sink, null).join();

        assertThat(sink.text()).isEqualTo("x<&lt;qr-15");
    }
}
