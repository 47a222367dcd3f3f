package github.sarthakdev143.clip_factory.service.impl;

import github.sarthakdev143.clip_factory.config.ClipFactoryProperties;
import github.sarthakdev143.clip_factory.store.JobStore;
import github.sarthakdev143.clip_factory.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Deletes clip directories ({@code output/{jobId}}) and uploads ({@code uploads/{jobId}_*}) once their job
 * record has expired from the store or the artifact itself is older than the job TTL.
 */
@Component
public class ExpiredArtifactReaper {

    private static final Logger logger = LoggerFactory.getLogger(ExpiredArtifactReaper.class);
    private static final int JOB_ID_LENGTH = 36;

    private final JobStore jobStore;
    private final ClipFactoryProperties properties;
    private final Clock clock;

    public ExpiredArtifactReaper(JobStore jobStore, ClipFactoryProperties properties, Clock clock) {
        this.jobStore = jobStore;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(
            initialDelayString = "${clip-factory.reaper.interval:5m}",
            fixedDelayString = "${clip-factory.reaper.interval:5m}")
    public void scheduledReap() {
        int removed = reapExpired();
        if (removed > 0) {
            logger.info("Removed {} expired job artifacts", removed);
        }
    }

    public int reapExpired() {
        int removed = 0;
        for (Path directory : list(properties.outputDir())) {
            if (Files.isDirectory(directory) && isExpired(directory.getFileName().toString(), directory)) {
                deleteRecursively(directory);
                removed++;
            }
        }
        for (Path upload : list(properties.uploadDir())) {
            String fileName = upload.getFileName().toString();
            if (fileName.length() > JOB_ID_LENGTH && fileName.charAt(JOB_ID_LENGTH) == '_'
                    && isExpired(fileName.substring(0, JOB_ID_LENGTH), upload)) {
                deleteRecursively(upload);
                removed++;
            }
        }
        return removed;
    }

    private boolean isExpired(String jobId, Path artifact) {
        if (olderThanTtl(artifact)) {
            return true;
        }
        try {
            return jobStore.get(jobId).isEmpty();
        } catch (StoreUnavailableException e) {
            logger.debug("Store unavailable while reaping {}; using artifact age only", artifact);
            return false;
        }
    }

    private boolean olderThanTtl(Path artifact) {
        try {
            Instant modified = Files.getLastModifiedTime(artifact).toInstant();
            return Duration.between(modified, clock.instant()).compareTo(properties.jobTtl()) > 0;
        } catch (IOException e) {
            logger.debug("Could not read modification time of {}", artifact, e);
            return false;
        }
    }

    private List<Path> list(Path directory) {
        if (!Files.isDirectory(directory)) {
            return List.of();
        }
        try (Stream<Path> entries = Files.list(directory)) {
            return entries.toList();
        } catch (IOException e) {
            logger.warn("Could not list {} for expiry cleanup", directory, e);
            return List.of();
        }
    }

    private void deleteRecursively(Path root) {
        try (Stream<Path> paths = Files.walk(root)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    logger.warn("Could not delete expired artifact {}", path, e);
                }
            });
        } catch (IOException e) {
            logger.warn("Could not walk expired artifact {}", root, e);
        }
    }
}
