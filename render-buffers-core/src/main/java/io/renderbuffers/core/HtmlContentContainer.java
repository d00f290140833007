package io.renderbuffers.core;

/**
 * {@link HtmlContent} that holds other buffered content and can hand it over to a builder.
 *
 * <p>Containers take priority over plain {@link HtmlContent} when passed to
 * {@link ViewBufferTextWriter#write(Object)}.
 */
public interface HtmlContentContainer extends HtmlContent {

    /**
     * Copy all content into {@code destination}; this container is unchanged.
     */
    void copyTo(HtmlContentBuilder destination);

    /**
     * Move all content into {@code destination}; this container is left empty.
     */
    void moveTo(HtmlContentBuilder destination);
}
