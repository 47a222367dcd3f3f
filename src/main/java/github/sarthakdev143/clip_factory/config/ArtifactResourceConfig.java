package github.sarthakdev143.clip_factory.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.ResourceHandlerRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * Serves rendered clips from the output directory under the public video path, e.g.
 * {@code /videos/{jobId}/{jobId}_clip_1.mp4}.
 */
@Configuration
public class ArtifactResourceConfig implements WebMvcConfigurer {

    private final ClipFactoryProperties properties;

    public ArtifactResourceConfig(ClipFactoryProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addResourceHandlers(ResourceHandlerRegistry registry) {
        String publicPath = properties.publicVideoPath().endsWith("/")
                ? properties.publicVideoPath()
                : properties.publicVideoPath() + "/";
        String location = properties.outputDir().toAbsolutePath().toUri().toString();
        registry.addResourceHandler(publicPath + "**")
                .addResourceLocations(location.endsWith("/") ? location : location + "/");
    }
}
