package github.sarthakdev143.clip_factory.config;

import github.sarthakdev143.clip_factory.tracking.ActiveSpeakerSignal;
import github.sarthakdev143.clip_factory.tracking.TrackerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;
import java.time.Duration;

/**
 * Binds {@code clip-factory.*}. Missing groups and values fall back to the documented defaults.
 */
@ConfigurationProperties(prefix = "clip-factory")
public record ClipFactoryProperties(
        Integer maxConcurrentJobs,
        Duration jobTtl,
        Path outputDir,
        Path uploadDir,
        Long maxUploadSizeMb,
        String publicVideoPath,
        Integer maxLogLines,
        Ai ai,
        Download download,
        Transcription transcription,
        Detection detection,
        Retry retry,
        Tracker tracker,
        Reaper reaper) {

    public ClipFactoryProperties {
        maxConcurrentJobs = maxConcurrentJobs == null ? 5 : maxConcurrentJobs;
        if (maxConcurrentJobs < 1) {
            throw new IllegalArgumentException("clip-factory.max-concurrent-jobs must be at least 1.");
        }
        jobTtl = jobTtl == null ? Duration.ofHours(24) : jobTtl;
        outputDir = outputDir == null ? Path.of("output") : outputDir;
        uploadDir = uploadDir == null ? Path.of("uploads") : uploadDir;
        maxUploadSizeMb = maxUploadSizeMb == null ? 500L : maxUploadSizeMb;
        publicVideoPath = publicVideoPath == null || publicVideoPath.isBlank() ? "/videos" : publicVideoPath;
        maxLogLines = maxLogLines == null ? 1000 : maxLogLines;
        ai = ai == null ? new Ai(null, null, null, null) : ai;
        download = download == null ? new Download(null, null, null) : download;
        transcription = transcription == null ? new Transcription(null, null) : transcription;
        detection = detection == null ? new Detection(null, null) : detection;
        retry = retry == null ? new Retry(null, null, null) : retry;
        tracker = tracker == null ? new Tracker(null, null, null, null, null, null) : tracker;
        reaper = reaper == null ? new Reaper(null) : reaper;
    }

    public static ClipFactoryProperties defaults() {
        return new ClipFactoryProperties(null, null, null, null, null, null, null,
                null, null, null, null, null, null, null);
    }

    public long maxUploadSizeBytes() {
        return maxUploadSizeMb * 1024L * 1024L;
    }

    public record Ai(String apiKey, String model, String endpoint, Duration timeout) {

        public Ai {
            apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey.trim();
            model = model == null || model.isBlank() ? "gemini-2.5-flash" : model;
            endpoint = endpoint == null || endpoint.isBlank()
                    ? "https://generativelanguage.googleapis.com/v1beta"
                    : endpoint;
            timeout = timeout == null ? Duration.ofSeconds(120) : timeout;
        }
    }

    public record Download(String binary, Path cookiesFile, Duration timeout) {

        public Download {
            binary = binary == null || binary.isBlank() ? "yt-dlp" : binary;
            cookiesFile = cookiesFile == null || cookiesFile.toString().isBlank() ? null : cookiesFile;
            timeout = timeout == null ? Duration.ofMinutes(15) : timeout;
        }
    }

    public record Transcription(String command, Duration timeout) {

        public Transcription {
            command = command == null || command.isBlank() ? "whisper-json {input} {output}" : command;
            timeout = timeout == null ? Duration.ofMinutes(30) : timeout;
        }
    }

    public record Detection(String command, Duration timeout) {

        public Detection {
            command = command == null || command.isBlank() ? "subject-detect {input} {output}" : command;
            timeout = timeout == null ? Duration.ofMinutes(20) : timeout;
        }
    }

    public record Retry(Integer maxAttempts, Duration initialDelay, Double multiplier) {

        public Retry {
            maxAttempts = maxAttempts == null ? 3 : maxAttempts;
            initialDelay = initialDelay == null ? Duration.ofSeconds(2) : initialDelay;
            multiplier = multiplier == null ? 2.0 : multiplier;
        }
    }

    public record Tracker(
            Duration smoothingTimeConstant,
            Integer stabilizationFrames,
            Integer cooldownFrames,
            Double farApartRatio,
            Double safeZoneMargin,
            ActiveSpeakerSignal activeSpeakerSignal) {

        public TrackerSettings toSettings() {
            TrackerSettings defaults = TrackerSettings.defaults();
            return new TrackerSettings(
                    smoothingTimeConstant == null ? defaults.smoothingTimeConstant() : smoothingTimeConstant,
                    stabilizationFrames == null ? defaults.stabilizationFrames() : stabilizationFrames,
                    cooldownFrames == null ? defaults.cooldownFrames() : cooldownFrames,
                    farApartRatio == null ? defaults.farApartRatio() : farApartRatio,
                    safeZoneMargin == null ? defaults.safeZoneMargin() : safeZoneMargin,
                    activeSpeakerSignal == null ? defaults.activeSpeakerSignal() : activeSpeakerSignal);
        }
    }

    public record Reaper(Duration interval) {

        public Reaper {
            interval = interval == null ? Duration.ofMinutes(5) : interval;
        }
    }
}
