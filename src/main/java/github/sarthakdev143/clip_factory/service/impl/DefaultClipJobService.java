package github.sarthakdev143.clip_factory.service.impl;

import github.sarthakdev143.clip_factory.captions.CaptionSettingsValidator;
import github.sarthakdev143.clip_factory.config.ClipFactoryProperties;
import github.sarthakdev143.clip_factory.model.CaptionSettings;
import github.sarthakdev143.clip_factory.model.Job;
import github.sarthakdev143.clip_factory.model.JobInput;
import github.sarthakdev143.clip_factory.queue.AdmissionController;
import github.sarthakdev143.clip_factory.service.ClipJobService;
import github.sarthakdev143.clip_factory.service.ClipSubmission;
import github.sarthakdev143.clip_factory.service.UploadTooLargeException;
import github.sarthakdev143.clip_factory.store.JobStore;
import github.sarthakdev143.clip_factory.store.StoreUnavailableException;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

@Service
public class DefaultClipJobService implements ClipJobService {

    private static final Logger logger = LoggerFactory.getLogger(DefaultClipJobService.class);
    static final String MISSING_CREDENTIAL_MESSAGE =
            "Missing Gemini API key. Provide X-Gemini-Key header or set GEMINI_API_KEY env var.";

    private final JobStore jobStore;
    private final AdmissionController admissionController;
    private final CaptionSettingsValidator captionSettingsValidator;
    private final CredentialVault credentialVault;
    private final ClipFactoryProperties properties;
    private final Clock clock;
    private final Counter submittedCounter;

    public DefaultClipJobService(
            JobStore jobStore,
            AdmissionController admissionController,
            CaptionSettingsValidator captionSettingsValidator,
            CredentialVault credentialVault,
            ClipFactoryProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.jobStore = jobStore;
        this.admissionController = admissionController;
        this.captionSettingsValidator = captionSettingsValidator;
        this.credentialVault = credentialVault;
        this.properties = properties;
        this.clock = clock;
        this.submittedCounter = meterRegistry.counter("clip_factory.jobs.submitted");
    }

    @Override
    public Job submit(ClipSubmission submission) throws IOException {
        MultipartFile file = submission.file() != null && !submission.file().isEmpty() ? submission.file() : null;
        String url = submission.url() == null || submission.url().isBlank() ? null : submission.url().trim();
        validateSource(url, file);

        CaptionSettings captionSettings = captionSettingsValidator.normalizeAndValidate(
                submission.includeCaptions(),
                submission.captionStyle(),
                submission.captionColor(),
                submission.captionOutlineColor());
        String apiKey = credentialVault.select(submission.apiKey())
                .orElseThrow(() -> new IllegalArgumentException(MISSING_CREDENTIAL_MESSAGE));

        if (!jobStore.isAvailable()) {
            throw new StoreUnavailableException("Job store unavailable. Check REDIS_URL.");
        }

        String jobId = UUID.randomUUID().toString();
        Path uploadPath = file == null ? null : saveUpload(jobId, file);
        JobInput input = uploadPath == null ? JobInput.ofUrl(url) : JobInput.ofUpload(uploadPath.toString());
        Job job = Job.queued(jobId, input, captionSettings, clock.instant());

        try {
            jobStore.create(job);
        } catch (StoreUnavailableException e) {
            deleteUpload(uploadPath);
            throw e;
        }

        credentialVault.remember(jobId, apiKey);
        admissionController.enqueue(jobId);
        submittedCounter.increment();
        logger.info(
                "Accepted clip job {} source={} captionStyle={} includeCaptions={}",
                jobId,
                input.isUpload() ? "upload" : "url",
                captionSettings.style().toApiValue(),
                captionSettings.includeCaptions());
        return job;
    }

    @Override
    public Optional<Job> getJob(String jobId) {
        return jobStore.get(jobId);
    }

    @Override
    public boolean isStoreAvailable() {
        return jobStore.isAvailable();
    }

    private void validateSource(String url, MultipartFile file) {
        if (url == null && file == null) {
            throw new IllegalArgumentException("Provide either a url or an uploaded file.");
        }
        if (url != null && file != null) {
            throw new IllegalArgumentException("Provide either a url or an uploaded file, not both.");
        }
        if (file != null && file.getSize() > properties.maxUploadSizeBytes()) {
            throw new UploadTooLargeException(
                    "Uploaded file exceeds the " + properties.maxUploadSizeMb() + " MB limit.");
        }
        if (url != null) {
            try {
                URI uri = new URI(url);
                String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
                if (!scheme.equals("http") && !scheme.equals("https") || uri.getHost() == null) {
                    throw new IllegalArgumentException("url must be an absolute http(s) URL.");
                }
            } catch (URISyntaxException e) {
                throw new IllegalArgumentException("url is not a valid URL.", e);
            }
        }
    }

    private Path saveUpload(String jobId, MultipartFile file) throws IOException {
        Files.createDirectories(properties.uploadDir());
        Path target = properties.uploadDir().resolve(jobId + "_" + sanitizeFileName(file.getOriginalFilename()));
        try {
            file.transferTo(target.toAbsolutePath());
        } catch (IOException e) {
            deleteUpload(target);
            throw e;
        }
        return target;
    }

    static String sanitizeFileName(String originalName) {
        if (originalName == null || originalName.isBlank()) {
            return "upload.mp4";
        }
        String normalized = originalName.replace('\\', '/');
        String name = normalized.substring(normalized.lastIndexOf('/') + 1);
        String cleaned = name.replaceAll("[^A-Za-z0-9._-]", "_");
        return cleaned.isBlank() || cleaned.startsWith(".") ? "upload" + cleaned : cleaned;
    }

    private void deleteUpload(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.warn("Could not delete upload {}", path, e);
        }
    }
}
