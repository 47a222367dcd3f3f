package github.sarthakdev143.clip_factory.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.clip_factory.captions.CaptionStyle;
import github.sarthakdev143.clip_factory.config.ClipFactoryProperties;
import github.sarthakdev143.clip_factory.model.CaptionSettings;
import github.sarthakdev143.clip_factory.model.ClipResult;
import github.sarthakdev143.clip_factory.model.Job;
import github.sarthakdev143.clip_factory.model.JobInput;
import github.sarthakdev143.clip_factory.model.JobResult;
import github.sarthakdev143.clip_factory.model.JobStatus;
import github.sarthakdev143.clip_factory.model.PipelineStage;
import github.sarthakdev143.clip_factory.model.Transcript;
import github.sarthakdev143.clip_factory.model.TranscriptSegment;
import github.sarthakdev143.clip_factory.model.TranscriptWord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.redis.connection.RedisStandaloneConfiguration;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.http.converter.json.Jackson2ObjectMapperBuilder;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Testcontainers(disabledWithoutDocker = true)
class RedisJobStoreTest {

    @Container
    private static final GenericContainer<?> REDIS =
            new GenericContainer<>(DockerImageName.parse("redis:7-alpine")).withExposedPorts(6379);

    private final MutableClock clock = new MutableClock(Instant.now());
    private final ObjectMapper objectMapper = Jackson2ObjectMapperBuilder.json().build();
    private LettuceConnectionFactory connectionFactory;
    private StringRedisTemplate redisTemplate;
    private RedisJobStore store;

    @BeforeEach
    void setUp() {
        connectionFactory = connectionFactory(REDIS.getHost(), REDIS.getMappedPort(6379));
        redisTemplate = new StringRedisTemplate(connectionFactory);
        redisTemplate.execute(connection -> {
            connection.serverCommands().flushAll();
            return null;
        }, true);
        store = new RedisJobStore(redisTemplate, objectMapper, properties(), clock);
    }

    @AfterEach
    void tearDown() {
        connectionFactory.destroy();
    }

    @Test
    void roundTripsFullJobSnapshot() {
        Transcript transcript = new Transcript("en", List.of(new TranscriptSegment(0.0, 2.0, "hello world",
                List.of(new TranscriptWord("hello", 0.0, 0.8), new TranscriptWord("world", 0.9, 1.6)))));
        Job job = Job.queued("job-1", JobInput.ofUrl("https://example.com/v"),
                        new CaptionSettings(true, CaptionStyle.KARAOKE, "#FFFFFF", null), clock.instant())
                .markProcessing(clock.instant())
                .withStage(PipelineStage.FINALIZING)
                .markCompleted(new JobResult(
                        List.of(new ClipResult(1, "/videos/job-1/job-1_clip_1.mp4", "T", "tt", "ig", "yt")),
                        transcript), clock.instant());

        store.create(job);

        assertThat(store.get("job-1")).contains(job);
    }

    @Test
    void expiryIsMeasuredFromCreationNotLastWrite() {
        Job job = queued("job-1");
        store.create(job);
        clock.advance(Duration.ofHours(20));

        store.update("job-1", current -> current.withLog(clock.instant(), "late write", 1000));

        Long ttlSeconds = redisTemplate.getExpire(RedisJobStore.KEY_PREFIX + "job-1");
        assertThat(ttlSeconds).isBetween(1L, Duration.ofHours(4).toSeconds());
    }

    @Test
    void jobPastTtlIsTreatedAsMissing() {
        store.create(queued("job-1"));
        clock.advance(Duration.ofHours(25));

        assertThat(store.get("job-1")).isEmpty();
        assertThat(store.update("job-1", current -> current.markProcessing(clock.instant()))).isEmpty();
    }

    @Test
    void updateOfMissingJobReturnsEmpty() {
        assertThat(store.update("nope", current -> current)).isEmpty();
    }

    @Test
    void concurrentUpdatesAreNotLost() throws Exception {
        store.create(queued("job-1").markProcessing(clock.instant()));
        ExecutorService pool = Executors.newFixedThreadPool(4);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int writer = 0; writer < 4; writer++) {
                int id = writer;
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int line = 0; line < 5; line++) {
                        String message = "w" + id + "-" + line;
                        store.update("job-1", current -> current.withLog(clock.instant(), message, 1000));
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            pool.shutdownNow();
        }

        assertThat(store.get("job-1").orElseThrow().logs()).hasSize(21);
    }

    @Test
    void listsJobsInCreationOrder() {
        store.create(queued("b"));
        clock.advance(Duration.ofSeconds(-10));
        store.create(queued("a"));

        assertThat(store.findAll()).extracting(Job::jobId).containsExactly("a", "b");
        assertThat(store.findAll()).extracting(Job::status).containsOnly(JobStatus.QUEUED);
    }

    @Test
    void reportsAvailability() {
        assertThat(store.isAvailable()).isTrue();
    }

    @Test
    void unreachableRedisSurfacesAsStoreUnavailable() {
        LettuceConnectionFactory unreachable = connectionFactory("localhost", 1);
        try {
            RedisJobStore down = new RedisJobStore(new StringRedisTemplate(unreachable), objectMapper, properties(), clock);

            assertThat(down.isAvailable()).isFalse();
            assertThatThrownBy(() -> down.get("job-1")).isInstanceOf(StoreUnavailableException.class);
            assertThatThrownBy(() -> down.create(queued("job-1"))).isInstanceOf(StoreUnavailableException.class);
        } finally {
            unreachable.destroy();
        }
    }

    private Job queued(String jobId) {
        return Job.queued(jobId, JobInput.ofUrl("https://example.com/" + jobId), null, clock.instant());
    }

    private static ClipFactoryProperties properties() {
        return new ClipFactoryProperties(null, Duration.ofHours(24), null, null, null, null, null,
                null, null, null, null, null, null, null);
    }

    private static LettuceConnectionFactory connectionFactory(String host, int port) {
        LettuceConnectionFactory factory = new LettuceConnectionFactory(new RedisStandaloneConfiguration(host, port));
        factory.afterPropertiesSet();
        factory.start();
        return factory;
    }

    private static final class MutableClock extends Clock {

        private volatile Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
