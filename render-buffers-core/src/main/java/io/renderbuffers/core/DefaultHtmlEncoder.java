package io.renderbuffers.core;

import java.io.IOException;
import java.io.Writer;

final class DefaultHtmlEncoder implements HtmlEncoder {

    DefaultHtmlEncoder() {
    }

    @Override
    public void encode(Writer out, char[] chars, int offset, int length) throws IOException {
        int end = offset + length;
        int runStart = offset;
        for (int i = offset; i < end; i++) {
            String replacement = replacement(chars[i]);
            if (replacement == null) continue;
            if (i > runStart) {
                out.write(chars, runStart, i - runStart);
            }
            out.write(replacement);
            runStart = i + 1;
        }
        if (end > runStart) {
            out.write(chars, runStart, end - runStart);
        }
    }

    @Override
    public void encode(Writer out, String value) throws IOException {
        int runStart = 0;
        int end = value.length();
        for (int i = 0; i < end; i++) {
            String replacement = replacement(value.charAt(i));
            if (replacement == null) continue;
            if (i > runStart) {
                out.write(value, runStart, i - runStart);
            }
            out.write(replacement);
            runStart = i + 1;
        }
        if (end > runStart) {
            out.write(value, runStart, end - runStart);
        }
    }

    private static String replacement(char c) {
        switch (c) {
            case '&':
                return "&amp;";
            case '<':
                return "&lt;";
            case '>':
                return "&gt;";
            case '"':
                return "&quot;";
            case '\'':
                return "&#39;";
            default:
                return null;
        }
    }
}
