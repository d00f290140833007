package io.renderbuffers.spring_boot_starter;

import io.renderbuffers.core.ViewBufferOptions;
import io.renderbuffers.core.ViewBufferPagePool;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class RenderBuffersAutoConfigurationTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(RenderBuffersAutoConfiguration.class));

    @Test
    void providesDefaults() {
        runner.run(context -> {
            assertThat(context).hasSingleBean(ViewBufferOptions.class);
            assertThat(context).hasSingleBean(ViewBufferPagePool.class);

            ViewBufferOptions options = context.getBean(ViewBufferOptions.class);
            assertThat(options.pageSize()).isEqualTo(ViewBufferOptions.DEFAULT_PAGE_SIZE);
            assertThat(options.newLine()).isEqualTo("\r\n");
        });
    }

    @Test
    void bindsProperties() {
        runner.withPropertyValues(
                        "render-buffers.page-size=8",
                        "render-buffers.max-retained-pages=2",
                        "render-buffers.new-line=<br>")
                .run(context -> {
                    ViewBufferPagePool pool = context.getBean(ViewBufferPagePool.class);
                    assertThat(pool.pageSize()).isEqualTo(8);
                    assertThat(pool.maxRetainedPages()).isEqualTo(2);
                    assertThat(context.getBean(ViewBufferOptions.class).newLine()).isEqualTo("<br>");
                });
    }

    @Test
    void backsOffWhenUserDefinesPool() {
        runner.withUserConfiguration(CustomPool.class).run(context -> {
            assertThat(context).hasSingleBean(ViewBufferPagePool.class);
            assertThat(context.getBean(ViewBufferPagePool.class).pageSize()).isEqualTo(128);
        });
    }

    @Configuration(proxyBeanMethods = false)
    static class CustomPool {
        @Bean
        ViewBufferPagePool customPool() {
            return ViewBufferPagePool.unpooled(128);
        }
    }
}
