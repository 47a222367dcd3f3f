package github.sarthakdev143.clip_factory.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.clip_factory.config.ClipFactoryProperties;
import github.sarthakdev143.clip_factory.model.Job;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.Cursor;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisOperations;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.data.redis.core.SessionCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

/**
 * Stores each job as one JSON string under {@code clip-factory:job:{id}}. Writes set the key's expiry to
 * whatever remains of the TTL since creation, so updates never extend a job's lifetime.
 */
@Component
public class RedisJobStore implements JobStore {

    static final String KEY_PREFIX = "clip-factory:job:";
    private static final Logger logger = LoggerFactory.getLogger(RedisJobStore.class);
    private static final int MAX_OPTIMISTIC_ATTEMPTS = 10;

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Duration ttl;
    private final Clock clock;

    public RedisJobStore(
            StringRedisTemplate redisTemplate,
            ObjectMapper objectMapper,
            ClipFactoryProperties properties,
            Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.ttl = properties.jobTtl();
        this.clock = clock;
    }

    @Override
    public void create(Job job) {
        long remainingMillis = remainingMillis(job);
        if (remainingMillis <= 0) {
            throw new IllegalArgumentException("Job " + job.jobId() + " is already past its expiry.");
        }
        try {
            redisTemplate.opsForValue().set(key(job.jobId()), serialize(job), remainingMillis, TimeUnit.MILLISECONDS);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Job store unavailable while creating job " + job.jobId(), e);
        }
    }

    @Override
    public Optional<Job> get(String jobId) {
        try {
            String json = redisTemplate.opsForValue().get(key(jobId));
            return Optional.ofNullable(json).map(this::deserialize).filter(this::notExpired);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Job store unavailable while reading job " + jobId, e);
        }
    }

    @Override
    public Optional<Job> update(String jobId, UnaryOperator<Job> mutator) {
        String key = key(jobId);
        try {
            for (int attempt = 1; attempt <= MAX_OPTIMISTIC_ATTEMPTS; attempt++) {
                UpdateOutcome outcome = redisTemplate.execute(new SessionCallback<UpdateOutcome>() {
                    @Override
                    public <K, V> UpdateOutcome execute(RedisOperations<K, V> operations) throws DataAccessException {
                        return updateOnce(stringOperations(operations), key, mutator);
                    }
                });

                if (outcome == null || outcome.conflict()) {
                    logger.debug("Concurrent write on job {}; retrying update (attempt {})", jobId, attempt);
                    continue;
                }
                return Optional.ofNullable(outcome.job());
            }
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Job store unavailable while updating job " + jobId, e);
        }
        throw new StoreUnavailableException("Job " + jobId + " could not be updated after "
                + MAX_OPTIMISTIC_ATTEMPTS + " optimistic attempts.");
    }

    @Override
    public List<Job> findAll() {
        List<String> keys = new ArrayList<>();
        ScanOptions options = ScanOptions.scanOptions().match(KEY_PREFIX + "*").count(200).build();
        try (Cursor<String> cursor = redisTemplate.scan(options)) {
            cursor.forEachRemaining(keys::add);
        } catch (DataAccessException e) {
            throw new StoreUnavailableException("Job store unavailable while scanning jobs", e);
        }

        List<Job> jobs = new ArrayList<>();
        for (String key : keys) {
            get(key.substring(KEY_PREFIX.length())).ifPresent(jobs::add);
        }
        jobs.sort(Comparator.comparing(Job::createdAt));
        return jobs;
    }

    @Override
    public boolean isAvailable() {
        try {
            String pong = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping, true);
            return "PONG".equalsIgnoreCase(pong);
        } catch (RuntimeException e) {
            logger.warn("Job store ping failed: {}", e.getMessage());
            return false;
        }
    }

    private UpdateOutcome updateOnce(RedisOperations<String, String> operations, String key, UnaryOperator<Job> mutator) {
        operations.watch(key);
        String json = operations.opsForValue().get(key);
        if (json == null) {
            operations.unwatch();
            return UpdateOutcome.ofMissing();
        }
        Job updated = mutator.apply(deserialize(json));
        long remainingMillis = remainingMillis(updated);
        if (remainingMillis <= 0) {
            operations.unwatch();
            return UpdateOutcome.ofMissing();
        }
        operations.multi();
        operations.opsForValue().set(key, serialize(updated), remainingMillis, TimeUnit.MILLISECONDS);
        List<Object> results = operations.exec();
        return results == null || results.isEmpty()
                ? UpdateOutcome.ofConflict()
                : UpdateOutcome.ofWritten(updated);
    }

    // The session runs on the StringRedisTemplate, so keys and values are strings.
    @SuppressWarnings("unchecked")
    private static RedisOperations<String, String> stringOperations(RedisOperations<?, ?> operations) {
        return (RedisOperations<String, String>) operations;
    }

    private long remainingMillis(Job job) {
        Instant expiresAt = job.expiresAt(ttl);
        return Duration.between(clock.instant(), expiresAt).toMillis();
    }

    private boolean notExpired(Job job) {
        return remainingMillis(job) > 0;
    }

    private String key(String jobId) {
        return KEY_PREFIX + jobId;
    }

    private String serialize(Job job) {
        try {
            return objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize job " + job.jobId(), e);
        }
    }

    private Job deserialize(String json) {
        try {
            return objectMapper.readValue(json, Job.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Stored job record is not valid JSON.", e);
        }
    }

    private record UpdateOutcome(Job job, boolean conflict) {

        static UpdateOutcome ofMissing() {
            return new UpdateOutcome(null, false);
        }

        static UpdateOutcome ofConflict() {
            return new UpdateOutcome(null, true);
        }

        static UpdateOutcome ofWritten(Job job) {
            return new UpdateOutcome(job, false);
        }
    }
}
