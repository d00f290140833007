package io.renderbuffers.core;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ViewBufferOptionsTest {

    @Test
    void defaults() {
        ViewBufferOptions options = ViewBufferOptions.defaults();

        assertThat(options.pageSize()).isEqualTo(32);
        assertThat(options.maxRetainedPages()).isEqualTo(64);
        assertThat(options.newLine()).isEqualTo("\r\n");
        assertThat(options.encoder()).isSameAs(HtmlEncoder.DEFAULT);
    }

    @Test
    void builderOverridesAndCreatesMatchingPool() {
        ViewBufferOptions options = ViewBufferOptions.builder()
                .pageSize(8)
                .maxRetainedPages(0)
                .newLine("\n")
                .encoder(HtmlEncoder.NONE)
                .build();

        ViewBufferPagePool pool = options.newPagePool();

        assertThat(pool.pageSize()).isEqualTo(8);
        assertThat(pool.maxRetainedPages()).isZero();
        assertThat(options.encoder()).isSameAs(HtmlEncoder.NONE);
        assertThat(options.toString()).contains("pageSize=8", "newLine=\\n");
    }

    @Test
    void writerUsesConfiguredEncoderForContent() throws Exception {
        ViewBufferOptions options = ViewBufferOptions.builder().encoder(HtmlEncoder.NONE).build();
        ViewBufferTextWriter writer = new ViewBufferTextWriter(new ViewBuffer(), OutputTarget.NONE, options);
        HtmlFragment fragment = new HtmlFragment().append("<kept>");

        writer.write(fragment);

        assertThat(writer.toString()).isEqualTo("<kept>");
    }
}
