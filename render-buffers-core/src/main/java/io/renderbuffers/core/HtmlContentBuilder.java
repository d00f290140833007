package io.renderbuffers.core;

/**
 * Target that html content can be appended to.
 */
public interface HtmlContentBuilder {

    /**
     * Append text that will be encoded when written.
     */
    HtmlContentBuilder append(String unencoded);

    /**
     * Append markup that is written verbatim.
     */
    HtmlContentBuilder appendHtml(String encoded);

    HtmlContentBuilder appendHtml(HtmlContent content);

    HtmlContentBuilder clear();
}
