package github.sarthakdev143.clip_factory.service.impl;

import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.clip_factory.captions.AssCaptionRenderer;
import github.sarthakdev143.clip_factory.captions.CaptionTrack;
import github.sarthakdev143.clip_factory.config.ClipFactoryProperties;
import github.sarthakdev143.clip_factory.model.CaptionSettings;
import github.sarthakdev143.clip_factory.model.ClipResult;
import github.sarthakdev143.clip_factory.model.Job;
import github.sarthakdev143.clip_factory.model.JobResult;
import github.sarthakdev143.clip_factory.model.JobStatus;
import github.sarthakdev143.clip_factory.model.PipelineStage;
import github.sarthakdev143.clip_factory.model.Transcript;
import github.sarthakdev143.clip_factory.model.VideoInfo;
import github.sarthakdev143.clip_factory.model.ViralSegment;
import github.sarthakdev143.clip_factory.queue.JobRunner;
import github.sarthakdev143.clip_factory.service.ClipRenderer;
import github.sarthakdev143.clip_factory.service.ContentAnalyzer;
import github.sarthakdev143.clip_factory.service.JobFailureException;
import github.sarthakdev143.clip_factory.service.MediaProbe;
import github.sarthakdev143.clip_factory.service.SourceResolver;
import github.sarthakdev143.clip_factory.service.SubjectDetector;
import github.sarthakdev143.clip_factory.service.Transcriber;
import github.sarthakdev143.clip_factory.store.JobStore;
import github.sarthakdev143.clip_factory.store.StoreUnavailableException;
import github.sarthakdev143.clip_factory.tracking.CropWindow;
import github.sarthakdev143.clip_factory.tracking.FrameDetections;
import github.sarthakdev143.clip_factory.tracking.SubjectTracker;
import github.sarthakdev143.clip_factory.tracking.TrackerSettings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Drives one admitted job through download, transcription, AI analysis, clip creation and finalizing.
 * Stages run strictly in that order; each one records its stage label and percentage before it starts.
 */
@Service
public class PipelineStageRunner implements JobRunner {

    static final int MIN_SEGMENTS = 3;
    static final int MAX_SEGMENTS = 15;
    private static final Logger logger = LoggerFactory.getLogger(PipelineStageRunner.class);

    private final JobStore jobStore;
    private final JobProgressRecorder recorder;
    private final RetryPolicy retryPolicy;
    private final CredentialVault credentialVault;
    private final SourceResolver sourceResolver;
    private final Transcriber transcriber;
    private final ContentAnalyzer contentAnalyzer;
    private final MediaProbe mediaProbe;
    private final SubjectDetector subjectDetector;
    private final ClipRenderer clipRenderer;
    private final AssCaptionRenderer captionRenderer;
    private final ObjectMapper metadataMapper;
    private final ClipFactoryProperties properties;
    private final TrackerSettings trackerSettings;
    private final Counter completedCounter;
    private final Counter failedCounter;
    private final Counter degradedCaptionsCounter;

    public PipelineStageRunner(
            JobStore jobStore,
            JobProgressRecorder recorder,
            RetryPolicy retryPolicy,
            CredentialVault credentialVault,
            SourceResolver sourceResolver,
            Transcriber transcriber,
            ContentAnalyzer contentAnalyzer,
            MediaProbe mediaProbe,
            SubjectDetector subjectDetector,
            ClipRenderer clipRenderer,
            AssCaptionRenderer captionRenderer,
            ObjectMapper objectMapper,
            ClipFactoryProperties properties,
            MeterRegistry meterRegistry) {
        this.jobStore = jobStore;
        this.recorder = recorder;
        this.retryPolicy = retryPolicy;
        this.credentialVault = credentialVault;
        this.sourceResolver = sourceResolver;
        this.transcriber = transcriber;
        this.contentAnalyzer = contentAnalyzer;
        this.mediaProbe = mediaProbe;
        this.subjectDetector = subjectDetector;
        this.clipRenderer = clipRenderer;
        this.captionRenderer = captionRenderer;
        this.metadataMapper = objectMapper;
        this.properties = properties;
        this.trackerSettings = properties.tracker().toSettings();
        this.completedCounter = meterRegistry.counter("clip_factory.jobs.completed");
        this.failedCounter = meterRegistry.counter("clip_factory.jobs.failed");
        this.degradedCaptionsCounter = meterRegistry.counter("clip_factory.captions.degraded");
    }

    @Override
    public void run(String jobId) {
        Optional<Job> stored;
        try {
            stored = jobStore.get(jobId);
        } catch (StoreUnavailableException e) {
            logger.error("Job {} could not be loaded; the store is unavailable", jobId, e);
            recorder.fail(jobId, "Job store unavailable: " + e.getMessage());
            credentialVault.forget(jobId);
            failedCounter.increment();
            return;
        }
        if (stored.isEmpty()) {
            logger.warn("Job {} expired or vanished before it was admitted", jobId);
            credentialVault.forget(jobId);
            return;
        }
        Job job = stored.get();
        if (job.status() != JobStatus.QUEUED) {
            logger.warn("Job {} is {} and will not be processed again", jobId, job.status().toApiValue());
            return;
        }

        Path workDir = null;
        try {
            recorder.start(jobId);
            workDir = Files.createTempDirectory("clip-factory-" + jobId + "-");
            JobResult result = runStages(job, workDir);
            recorder.complete(jobId, result, "Job completed with " + result.clips().size() + " clips.");
            completedCounter.increment();
            logger.info("Completed clip job {} clips={}", jobId, result.clips().size());
        } catch (JobFailureException e) {
            logger.error("Clip job {} failed: {}", jobId, e.getMessage(), e);
            recorder.fail(jobId, e.getMessage());
            failedCounter.increment();
        } catch (IOException e) {
            logger.error("Clip job {} failed on local file I/O", jobId, e);
            recorder.fail(jobId, "File system error: " + e.getMessage());
            failedCounter.increment();
        } catch (RuntimeException e) {
            logger.error("Clip job {} failed unexpectedly", jobId, e);
            recorder.fail(jobId, "Unexpected error: " + e.getMessage());
            failedCounter.increment();
        } finally {
            credentialVault.forget(jobId);
            deleteRecursively(workDir);
        }
    }

    private JobResult runStages(Job job, Path workDir) throws JobFailureException, IOException {
        String jobId = job.jobId();

        recorder.enterStage(jobId, PipelineStage.DOWNLOADING);
        Path source = retryPolicy.execute("download", jobId, () -> sourceResolver.resolve(job.input(), workDir));
        recorder.log(jobId, "Source ready: " + source.getFileName());

        recorder.enterStage(jobId, PipelineStage.TRANSCRIBING);
        Transcript transcript = retryPolicy.execute("transcribe", jobId, () -> transcriber.transcribe(source, workDir));
        if (transcript.isEmpty()) {
            throw new JobFailureException("Transcription found no speech in the source video.");
        }
        recorder.log(jobId, "Transcribed " + transcript.segments().size() + " segments.");

        recorder.enterStage(jobId, PipelineStage.ANALYZING);
        String apiKey = credentialVault.resolve(jobId)
                .orElseThrow(() -> new JobFailureException("No AI credential available for this job."));
        List<ViralSegment> candidates = retryPolicy.execute(
                "analyze", jobId, () -> contentAnalyzer.analyze(transcript, apiKey));
        List<ViralSegment> segments = selectSegments(candidates);
        if (segments.size() < MIN_SEGMENTS) {
            logger.warn("Job {} has only {} usable segments", jobId, segments.size());
            recorder.log(jobId, "Only " + segments.size() + " usable segments found (expected at least "
                    + MIN_SEGMENTS + "); continuing with fewer clips.");
        }
        recorder.log(jobId, "AI analysis selected " + segments.size() + " segments.");

        recorder.enterStage(jobId, PipelineStage.CREATING_CLIPS);
        Path jobOutputDir = properties.outputDir().resolve(jobId);
        Files.createDirectories(jobOutputDir);
        List<ClipResult> clips = new ArrayList<>();
        for (int index = 0; index < segments.size(); index++) {
            ClipResult clip = createClip(job, index + 1, segments.get(index), source, transcript, workDir, jobOutputDir);
            clips.add(clip);
            recorder.log(jobId, "Clips ready: " + clips.size() + "/" + segments.size() + " (" + clip.videoUrl() + ")");
        }

        recorder.enterStage(jobId, PipelineStage.FINALIZING);
        writeMetadata(jobId, jobOutputDir, segments, clips);
        return new JobResult(clips, transcript);
    }

    /**
     * Drops unusable candidates and keeps at most {@value #MAX_SEGMENTS} in the collaborator's order.
     */
    static List<ViralSegment> selectSegments(List<ViralSegment> candidates) throws JobFailureException {
        List<ViralSegment> usable = candidates == null
                ? List.of()
                : candidates.stream().filter(ViralSegment::isUsable).limit(MAX_SEGMENTS).toList();
        if (usable.isEmpty()) {
            throw new JobFailureException(JobFailureException.NO_VIRAL_SEGMENTS);
        }
        return usable;
    }

    private ClipResult createClip(
            Job job,
            int index,
            ViralSegment segment,
            Path source,
            Transcript transcript,
            Path workDir,
            Path jobOutputDir) throws JobFailureException, IOException {
        String jobId = job.jobId();
        Path segmentFile = workDir.resolve("segment_" + index + ".mp4");
        retryPolicy.execute("extract segment", jobId, () -> {
            clipRenderer.extractSegment(source, segment.startSec(), segment.endSec(), segmentFile);
            return segmentFile;
        });

        VideoInfo info = retryPolicy.execute("probe", jobId, () -> mediaProbe.probe(segmentFile));
        List<FrameDetections> detections = retryPolicy.execute(
                "detect subjects", jobId, () -> subjectDetector.detect(segmentFile, workDir));
        int frameCount = Math.max(1, (int) Math.round(info.durationSec() * info.fps()));
        List<CropWindow> trajectory = new SubjectTracker(trackerSettings)
                .track(info.width(), info.height(), info.fps(), frameCount, detections);

        Path captionFile = writeCaptions(job, index, segment, transcript, workDir);
        String fileName = jobId + "_clip_" + index + ".mp4";
        Path output = jobOutputDir.resolve(fileName);
        retryPolicy.execute("render clip", jobId, () -> {
            clipRenderer.renderVertical(segmentFile, info, trajectory, captionFile, output);
            return output;
        });
        Files.deleteIfExists(segmentFile);

        return new ClipResult(
                index,
                publicUrl(jobId, fileName),
                segment.title(),
                segment.descriptionTiktok(),
                segment.descriptionInstagram(),
                segment.descriptionYoutube());
    }

    private Path writeCaptions(Job job, int index, ViralSegment segment, Transcript transcript, Path workDir)
            throws JobFailureException, IOException {
        CaptionSettings captionSettings = job.captionSettings();
        if (!captionSettings.rendersCaptions()) {
            return null;
        }
        CaptionTrack track = captionRenderer.render(
                captionSettings,
                transcript,
                segment.startSec(),
                segment.endSec(),
                ClipRenderer.OUTPUT_WIDTH,
                ClipRenderer.OUTPUT_HEIGHT);
        if (track.degradedToSegmentTiming()) {
            degradedCaptionsCounter.increment();
            recorder.log(job.jobId(), "Clip " + index + ": no word timestamps, "
                    + captionSettings.style().toApiValue() + " captions use segment timing.");
        }
        if (track.isEmpty()) {
            return null;
        }
        Path captionFile = workDir.resolve("captions_" + index + ".ass");
        Files.writeString(captionFile, track.document(), StandardCharsets.UTF_8);
        return captionFile;
    }

    private void writeMetadata(String jobId, Path jobOutputDir, List<ViralSegment> segments, List<ClipResult> clips)
            throws IOException {
        List<Map<String, Object>> shorts = new ArrayList<>();
        for (int index = 0; index < clips.size(); index++) {
            ViralSegment segment = segments.get(index);
            ClipResult clip = clips.get(index);
            shorts.add(Map.of(
                    "start", segment.startSec(),
                    "end", segment.endSec(),
                    "video_url", clip.videoUrl(),
                    "video_title_for_youtube_short", nullToEmpty(clip.title()),
                    "video_description_for_tiktok", nullToEmpty(clip.descriptionTiktok()),
                    "video_description_for_instagram", nullToEmpty(clip.descriptionInstagram()),
                    "video_description_for_youtube", nullToEmpty(clip.descriptionYoutube())));
        }
        Path metadataFile = jobOutputDir.resolve(jobId + "_metadata.json");
        metadataMapper.writerWithDefaultPrettyPrinter()
                .writeValue(metadataFile.toFile(), Map.of("job_id", jobId, "shorts", shorts));
    }

    private String publicUrl(String jobId, String fileName) {
        String prefix = properties.publicVideoPath().endsWith("/")
                ? properties.publicVideoPath()
                : properties.publicVideoPath() + "/";
        return prefix + jobId + "/" + fileName;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private void deleteRecursively(Path directory) {
        if (directory == null || Files.notExists(directory)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(directory)) {
            paths.sorted(Comparator.reverseOrder()).forEach(path -> {
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    logger.debug("Could not delete {}", path, e);
                }
            });
        } catch (IOException e) {
            logger.warn("Could not clean up work directory {}", directory, e);
        }
    }
}
