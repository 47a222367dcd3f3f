package github.sarthakdev143.clip_factory.service.impl;

import github.sarthakdev143.clip_factory.config.ClipFactoryProperties;
import github.sarthakdev143.clip_factory.model.Job;
import github.sarthakdev143.clip_factory.model.JobInput;
import github.sarthakdev143.clip_factory.store.InMemoryJobStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class ExpiredArtifactReaperTest {

    @TempDir
    Path tempDir;

    private final InMemoryJobStore store = new InMemoryJobStore();
    private final Instant now = Instant.now().truncatedTo(ChronoUnit.SECONDS);
    private Path outputDir;
    private Path uploadDir;
    private ExpiredArtifactReaper reaper;

    @BeforeEach
    void setUp() throws IOException {
        outputDir = Files.createDirectories(tempDir.resolve("output"));
        uploadDir = Files.createDirectories(tempDir.resolve("uploads"));
        ClipFactoryProperties properties = new ClipFactoryProperties(
                null, Duration.ofHours(24), outputDir, uploadDir, null, null, null,
                null, null, null, null, null, null, null);
        reaper = new ExpiredArtifactReaper(store, properties, Clock.fixed(now, ZoneOffset.UTC));
    }

    @Test
    void keepsArtifactsOfLiveJobs() throws IOException {
        String jobId = liveJob();
        Path clipDir = clipDirectory(jobId);
        Path upload = Files.writeString(uploadDir.resolve(jobId + "_talk.mp4"), "video");

        int removed = reaper.reapExpired();

        assertThat(removed).isZero();
        assertThat(clipDir).exists();
        assertThat(upload).exists();
    }

    @Test
    void removesArtifactsWhoseJobExpired() throws IOException {
        String jobId = UUID.randomUUID().toString();
        Path clipDir = clipDirectory(jobId);
        Path upload = Files.writeString(uploadDir.resolve(jobId + "_talk.mp4"), "video");

        int removed = reaper.reapExpired();

        assertThat(removed).isEqualTo(2);
        assertThat(clipDir).doesNotExist();
        assertThat(upload).doesNotExist();
    }

    @Test
    void removesArtifactsOlderThanTtlEvenWhenRecordRemains() throws IOException {
        String jobId = liveJob();
        Path clipDir = clipDirectory(jobId);
        Files.setLastModifiedTime(clipDir, FileTime.from(now.minus(Duration.ofHours(25))));

        assertThat(reaper.reapExpired()).isEqualTo(1);
        assertThat(clipDir).doesNotExist();
    }

    @Test
    void usesArtifactAgeOnlyWhenStoreIsDown() throws IOException {
        Path fresh = clipDirectory(UUID.randomUUID().toString());
        Path stale = clipDirectory(UUID.randomUUID().toString());
        Files.setLastModifiedTime(stale, FileTime.from(now.minus(Duration.ofHours(30))));
        store.setAvailable(false);

        assertThat(reaper.reapExpired()).isEqualTo(1);
        assertThat(fresh).exists();
        assertThat(stale).doesNotExist();
    }

    @Test
    void ignoresUploadsWithoutJobPrefix() throws IOException {
        Path stray = Files.writeString(uploadDir.resolve("notes.txt"), "x");

        reaper.reapExpired();

        assertThat(stray).exists();
    }

    @Test
    void toleratesMissingDirectories() throws IOException {
        Files.delete(outputDir);
        Files.delete(uploadDir);

        assertThat(reaper.reapExpired()).isZero();
    }

    private String liveJob() {
        String jobId = UUID.randomUUID().toString();
        store.create(Job.queued(jobId, JobInput.ofUrl("https://example.com/v"), null, now));
        return jobId;
    }

    private Path clipDirectory(String jobId) throws IOException {
        Path directory = Files.createDirectories(outputDir.resolve(jobId));
        Files.writeString(directory.resolve(jobId + "_clip_1.mp4"), "clip");
        Files.setLastModifiedTime(directory, FileTime.from(now));
        return directory;
    }
}
