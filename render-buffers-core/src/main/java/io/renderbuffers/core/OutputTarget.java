package io.renderbuffers.core;

import java.io.Writer;
import java.util.Objects;

/**
 * Where a {@link ViewBufferTextWriter} sends its buffered content on flush.
 *
 * <ul>
 *   <li>{@link None}: pure in-memory buffering, flush never drains</li>
 *   <li>{@link Terminal}: a real destination such as a response writer, flush drains</li>
 *   <li>{@link Nested}: another buffering writer, flush never drains so the outer writer decides when output is committed</li>
 * </ul>
 */
public sealed interface OutputTarget permits OutputTarget.None, OutputTarget.Terminal, OutputTarget.Nested {

    OutputTarget NONE = new None();

    /**
     * Classifies {@code writer}: {@code null} is {@link None}, another {@link ViewBufferTextWriter}
     * is {@link Nested}, anything else is a {@link Terminal} with a same-thread {@link WriterTextSink}.
     */
    static OutputTarget of(Writer writer) {
        if (writer == null) {
            return NONE;
        }
        if (writer instanceof ViewBufferTextWriter nested) {
            return new Nested(nested);
        }
        return new Terminal(writer, new WriterTextSink(writer));
    }

    record None() implements OutputTarget {}

    /**
     * @param writer used by {@link ViewBufferTextWriter#flush()}
     * @param sink used by {@link ViewBufferTextWriter#flushAsync()}; usually writes to {@code writer}
     */
    record Terminal(Writer writer, AsyncTextSink sink) implements OutputTarget {
        public Terminal {
            Objects.requireNonNull(writer, "writer");
            Objects.requireNonNull(sink, "sink");
        }
    }

    record Nested(ViewBufferTextWriter writer) implements OutputTarget {
        public Nested {
            Objects.requireNonNull(writer, "writer");
        }
    }
}
