package io.renderbuffers.core;

/**
 * Lifecycle of a {@link ViewBufferTextWriter}.
 */
public enum WriterState {
    /** No flush in progress; writes are accepted. */
    IDLE,
    /** A flush is copying buffered content to the sink; writes are usage errors. */
    DRAINING,
    /** A flush failed; the response is considered lost and the writer rejects further use. */
    FAULTED
}
