package github.sarthakdev143.clip_factory.config;

import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.time.Duration;

@Configuration
@EnableScheduling
public class AsyncConfig {

    /**
     * One thread per admission slot. The admission controller never hands over more than
     * {@code max-concurrent-jobs} jobs at once, so the executor queue only absorbs hand-off races.
     */
    @Bean(name = "jobWorkerExecutor")
    public ThreadPoolTaskExecutor jobWorkerExecutor(ClipFactoryProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.maxConcurrentJobs());
        executor.setMaxPoolSize(properties.maxConcurrentJobs());
        executor.setQueueCapacity(properties.maxConcurrentJobs());
        executor.setThreadNamePrefix("clip-worker-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public RestTemplate analysisRestTemplate(RestTemplateBuilder builder, ClipFactoryProperties properties) {
        Duration timeout = properties.ai().timeout();
        return builder
                .connectTimeout(Duration.ofSeconds(10))
                .readTimeout(timeout)
                .build();
    }
}
