package io.renderbuffers.core;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ViewBufferTextWriterTest {

    @Test
    void flushDeliversBufferedContentAndEmptiesBuffer() throws Exception {
        CountingWriter sink = new CountingWriter();
        ViewBufferTextWriter writer = new ViewBufferTextWriter(new ViewBuffer(), HtmlEncoder.DEFAULT, sink);

        writer.write("a");
        writer.writeValue(7);
        writer.write('b');

        assertThat(sink.toString()).isEmpty();

        writer.flush();

        assertThat(sink.toString()).isEqualTo("a7b");
        assertThat(sink.flushes).isEqualTo(1);
        assertThat(writer.buffer().isEmpty()).isTrue();
        assertThat(writer.state()).isEqualTo(WriterState.IDLE);

        writer.write("c");
        assertThat(writer.toString()).isEqualTo("c");
        assertThat(sink.toString()).isEqualTo("a7b");
    }

    @Test
    void nullAndEmptyStringsDoNotAddChunks() throws Exception {
        ViewBufferTextWriter writer = new ViewBufferTextWriter(new ViewBuffer());

        writer.write((String) null);
        writer.write("");
        writer.write((Object) null);
        writer.write(new char[0], 0, 0);
        writer.writeLine((Object) null);

        assertThat(writer.buffer().count()).isZero();
    }

    @Test
    void flushWithoutTargetKeepsContent() throws Exception {
        ViewBufferTextWriter writer = new ViewBufferTextWriter(new ViewBuffer());
        writer.write("kept");

        writer.flush();
        writer.flushAsync().join();

        assertThat(writer.target()).isInstanceOf(OutputTarget.None.class);
        assertThat(writer.buffer().count()).isEqualTo(1);
        assertThat(writer.toString()).isEqualTo("kept");
    }

    @Test
    void flushIntoNestedWriterIsNoOp() throws Exception {
        ViewBufferTextWriter outer = new ViewBufferTextWriter(new ViewBuffer());
        ViewBufferTextWriter inner = new ViewBufferTextWriter(new ViewBuffer(), HtmlEncoder.DEFAULT, outer);
        inner.write("inner");

        inner.flush();
        inner.flushAsync().join();

        assertThat(inner.target()).isInstanceOf(OutputTarget.Nested.class);
        assertThat(inner.toString()).isEqualTo("inner");
        assertThat(outer.buffer().isEmpty()).isTrue();
    }

    @Test
    void writesDuringAsyncFlushAreRejected() throws Exception {
        RecordingSink sink = new RecordingSink(true);
        StringWriter unused = new StringWriter();
        ViewBufferTextWriter writer = new ViewBufferTextWriter(
                new ViewBuffer(), new OutputTarget.Terminal(unused, sink), ViewBufferOptions.defaults());
        writer.write("first");

        CompletableFuture<Void> flushed = writer.flushAsync();
        assertThat(writer.state()).isEqualTo(WriterState.DRAINING);

        assertThatThrownBy(() -> writer.write("second"))
                .isInstanceOf(RenderBufferException.ConcurrentUse.class);
        assertThatThrownBy(() -> writer.writeValue(1))
                .isInstanceOf(RenderBufferException.ConcurrentUse.class);
        assertThatThrownBy(writer::flushAsync)
                .isInstanceOf(RenderBufferException.ConcurrentUse.class);
        assertThatThrownBy(writer::flush)
                .isInstanceOf(RenderBufferException.ConcurrentUse.class);

        sink.completeNext(); // write
        assertThat(flushed).isNotDone();
        assertThat(writer.buffer().isEmpty()).isTrue();
        sink.completeNext(); // flush

        assertThat(flushed).isCompleted();
        assertThat(writer.state()).isEqualTo(WriterState.IDLE);
        assertThat(sink.operations()).containsExactly("write:first", "flush");

        writer.write("second");
        assertThat(writer.toString()).isEqualTo("second");
    }

    @Test
    void reentrantWriteFromSinkIsRejected() throws Exception {
        ViewBuffer buffer = new ViewBuffer();
        ReentrantWriter sink = new ReentrantWriter();
        ViewBufferTextWriter writer = new ViewBufferTextWriter(buffer, HtmlEncoder.DEFAULT, sink);
        sink.writer = writer;
        writer.write("x");

        assertThatThrownBy(writer::flush).isInstanceOf(RenderBufferException.ConcurrentUse.class);
        assertThat(writer.state()).isEqualTo(WriterState.FAULTED);
    }

    @Test
    void failedFlushFaultsWriterAndKeepsBuffer() throws Exception {
        ViewBufferTextWriter writer = new ViewBufferTextWriter(
                new ViewBuffer(), HtmlEncoder.DEFAULT, new ViewBufferTest.FailingWriter(0));
        writer.write("lost");

        assertThatThrownBy(writer::flush).isInstanceOf(IOException.class).hasMessage("connection reset");

        assertThat(writer.state()).isEqualTo(WriterState.FAULTED);
        assertThat(writer.buffer().count()).isEqualTo(1);
        assertThatThrownBy(() -> writer.write("more"))
                .isInstanceOf(RenderBufferException.Faulted.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void failedAsyncFlushCompletesExceptionally() throws Exception {
        RecordingSink sink = new RecordingSink(true);
        ViewBufferTextWriter writer = new ViewBufferTextWriter(
                new ViewBuffer(), new OutputTarget.Terminal(new StringWriter(), sink), ViewBufferOptions.defaults());
        writer.write("content");

        CompletableFuture<Void> flushed = writer.flushAsync();
        sink.failNext(new RenderBufferException.UncheckedIo(new IOException("timeout")));

        assertThat(flushed).isCompletedExceptionally();
        assertThat(writer.state()).isEqualTo(WriterState.FAULTED);
        assertThat(writer.buffer().isEmpty()).isFalse();
    }

    @Test
    void failedAsyncFlushRecordsSinkFailureAsCause() throws Exception {
        RecordingSink sink = new RecordingSink(true);
        ViewBufferTextWriter writer = new ViewBufferTextWriter(
                new ViewBuffer(), new OutputTarget.Terminal(new StringWriter(), sink), ViewBufferOptions.defaults());
        writer.write("first");
        writer.write("second");

        CompletableFuture<Void> flushed = writer.flushAsync();
        sink.completeNext();
        sink.failNext(new RenderBufferException.UncheckedIo(new IOException("timeout")));

        assertThat(flushed).isCompletedExceptionally();
        assertThatThrownBy(() -> writer.write("more"))
                .isInstanceOf(RenderBufferException.Faulted.class)
                .cause()
                .isInstanceOf(RenderBufferException.UncheckedIo.class)
                .hasRootCauseInstanceOf(IOException.class)
                .hasRootCauseMessage("timeout");
    }

    @Test
    void asyncFlushOverWriterTarget() throws Exception {
        StringWriter sink = new StringWriter();
        ViewBufferTextWriter writer = new ViewBufferTextWriter(new ViewBuffer(), HtmlEncoder.DEFAULT, sink);

        writer.writeAsync("<div>").join();
        writer.writeLineAsync('x').join();
        writer.writeLineAsync().join();
        writer.flushAsync().join();

        assertThat(sink.toString()).isEqualTo("<div>x\r\n\r\n");
        assertThat(writer.buffer().isEmpty()).isTrue();
    }

    @Test
    void writeObjectPrefersContainerThenContentThenText() throws Exception {
        ViewBufferTextWriter writer = new ViewBufferTextWriter(new ViewBuffer());
        HtmlFragment fragment = new HtmlFragment().appendHtml("<b>").append("&").appendHtml("</b>");
        HtmlContent content = (out, encoder) -> encoder.encode(out, "<i>");

        writer.write((Object) fragment);
        writer.write((Object) content);
        writer.write((Object) new StringBuilder("<raw>"));
        writer.write((Object) 12);

        assertThat(fragment.count()).isZero();
        assertThat(writer.buffer().count()).isEqualTo(6);
        assertThat(writer.toString()).isEqualTo("<b>&amp;</b>&lt;i&gt;<raw>12");
    }

    @Test
    void writeLineVariantsUseConfiguredNewLine() throws Exception {
        ViewBufferOptions options = ViewBufferOptions.builder().newLine("\n").build();
        ViewBufferTextWriter writer = new ViewBufferTextWriter(new ViewBuffer(), OutputTarget.NONE, options);

        writer.writeLine("a");
        writer.writeLine('b');
        writer.writeLine(new char[]{'x', 'c', 'y'}, 1, 1);
        writer.writeLine((Object) new HtmlString("<hr>"));
        writer.writeLine();

        assertThat(writer.toString()).isEqualTo("a\nb\nc\n<hr>\n\n");
    }

    @Test
    void charArrayWritesAreCopied() throws Exception {
        ViewBufferTextWriter writer = new ViewBufferTextWriter(new ViewBuffer());
        char[] chars = {'a', 'b', 'c'};

        writer.write(chars, 0, 3);
        chars[0] = 'z';

        assertThat(writer.toString()).isEqualTo("abc");
    }

    @Test
    void charArrayBoundsAreValidated() {
        ViewBufferTextWriter writer = new ViewBufferTextWriter(new ViewBuffer());

        assertThatThrownBy(() -> writer.write((char[]) null, 0, 1)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> writer.write(new char[2], 1, 2)).isInstanceOf(IndexOutOfBoundsException.class);
        assertThatThrownBy(() -> writer.write(new char[2], -1, 1)).isInstanceOf(IndexOutOfBoundsException.class);
    }

    @Test
    void appendFollowsWriterConventions() throws Exception {
        ViewBufferTextWriter writer = new ViewBufferTextWriter(new ViewBuffer());

        writer.append("ab").append(null).append("xyz", 1, 2).append('!');

        assertThat(writer.toString()).isEqualTo("abnully!");
    }

    @Test
    void closeFlushesAndRejectsFurtherWrites() throws Exception {
        CountingWriter sink = new CountingWriter();
        ViewBufferTextWriter writer = new ViewBufferTextWriter(new ViewBuffer(), HtmlEncoder.DEFAULT, sink);
        writer.write("done");

        writer.close();
        writer.close();

        assertThat(sink.toString()).isEqualTo("done");
        assertThat(sink.closed).isFalse();
        assertThatThrownBy(() -> writer.write("late")).isInstanceOf(IOException.class).hasMessage("Writer closed");
        assertThat(writer.flushAsync()).isCompletedExceptionally();
    }

    static final class CountingWriter extends Writer {
        private final StringBuilder text = new StringBuilder();
        int flushes;
        boolean closed;

        @Override
        public void write(char[] cbuf, int off, int len) {
            text.append(cbuf, off, len);
        }

        @Override
        public void flush() {
            flushes++;
        }

        @Override
        public void close() {
            closed = true;
        }

        @Override
        public String toString() {
            return text.toString();
        }
    }

    private static final class ReentrantWriter extends Writer {
        ViewBufferTextWriter writer;

        @Override
        public void write(char[] cbuf, int off, int len) throws IOException {
            writer.write("again");
        }

        @Override
        public void flush() {
        }

        @Override
        public void close() {
        }
    }
}
