package io.renderbuffers.spring_boot_starter;

import io.renderbuffers.core.ViewBufferOptions;
import io.renderbuffers.core.ViewBufferPagePool;
import io.renderbuffers.core.ViewBufferTextWriter;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Auto-configuration for render buffer components.
 *
 * <p>Provides default beans for {@link ViewBufferOptions} (bound from {@code render-buffers.*})
 * and a shared {@link ViewBufferPagePool}. Both can be overridden by defining your own beans.
 *
 * <p>This autoconfiguration does NOT register any servlet or route. Wire the pool into your own
 * endpoint, for example:
 * <pre>{@code
 * @Bean
 * public ServletRegistrationBean<StreamingRenderServlet> pages(ViewBufferOptions options, ViewBufferPagePool pool) {
 *     return new ServletRegistrationBean<>(new StreamingRenderServlet(myHandler, options, pool), "/pages/*");
 * }
 * }</pre>
 */
@AutoConfiguration
@ConditionalOnClass(ViewBufferTextWriter.class)
@EnableConfigurationProperties(RenderBuffersProperties.class)
public class RenderBuffersAutoConfiguration {

    /**
     * Options built from {@link RenderBuffersProperties}.
     */
    @Bean
    @ConditionalOnMissingBean
    public ViewBufferOptions viewBufferOptions(RenderBuffersProperties properties) {
        return properties.toOptions();
    }

    /**
     * Page pool shared by every request.
     */
    @Bean
    @ConditionalOnMissingBean
    public ViewBufferPagePool viewBufferPagePool(ViewBufferOptions options) {
        return options.newPagePool();
    }
}
