package github.sarthakdev143.clip_factory.controller;

import github.sarthakdev143.clip_factory.dto.HealthResponse;
import github.sarthakdev143.clip_factory.dto.JobSubmissionResponse;
import github.sarthakdev143.clip_factory.model.Job;
import github.sarthakdev143.clip_factory.queue.AdmissionController;
import github.sarthakdev143.clip_factory.service.ClipJobService;
import github.sarthakdev143.clip_factory.service.ClipSubmission;
import github.sarthakdev143.clip_factory.service.UploadTooLargeException;
import github.sarthakdev143.clip_factory.service.impl.JobProjection;
import github.sarthakdev143.clip_factory.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.MultipartFile;

import java.util.Optional;

@RestController
@RequestMapping("/api/v2")
public class ClipJobController {

    static final String API_KEY_HEADER = "X-Gemini-Key";
    private static final Logger logger = LoggerFactory.getLogger(ClipJobController.class);

    private final ClipJobService clipJobService;
    private final JobProjection jobProjection;
    private final AdmissionController admissionController;

    public ClipJobController(
            ClipJobService clipJobService,
            JobProjection jobProjection,
            AdmissionController admissionController) {
        this.clipJobService = clipJobService;
        this.jobProjection = jobProjection;
        this.admissionController = admissionController;
    }

    @PostMapping("/process")
    public ResponseEntity<?> process(
            @RequestParam(value = "url", required = false) String url,
            @RequestParam(value = "file", required = false) MultipartFile file,
            @RequestParam(value = "include_captions", required = false) Boolean includeCaptions,
            @RequestParam(value = "caption_style", required = false) String captionStyle,
            @RequestParam(value = "caption_color", required = false) String captionColor,
            @RequestParam(value = "caption_outline_color", required = false) String captionOutlineColor,
            @RequestHeader(value = API_KEY_HEADER, required = false) String apiKey) {

        try {
            Job job = clipJobService.submit(new ClipSubmission(
                    url,
                    file,
                    includeCaptions,
                    captionStyle,
                    captionColor,
                    captionOutlineColor,
                    apiKey));
            return ResponseEntity.accepted().body(new JobSubmissionResponse(job.jobId(), job.status()));
        } catch (UploadTooLargeException e) {
            return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body(e.getMessage());
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (StoreUnavailableException e) {
            logger.warn("Rejected submission, job store unavailable: {}", e.getMessage());
            return storeUnavailable();
        } catch (Exception e) {
            logger.error("Clip job submission failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to submit clip job. Please try again.");
        }
    }

    @GetMapping("/jobs/{jobId}")
    public ResponseEntity<?> getStatus(@PathVariable String jobId) {
        try {
            return findJob(jobId)
                    .<ResponseEntity<?>>map(job -> ResponseEntity.ok(jobProjection.toStatus(job)))
                    .orElseGet(() -> notFound(jobId));
        } catch (StoreUnavailableException e) {
            return storeUnavailable();
        }
    }

    @GetMapping("/jobs/{jobId}/result")
    public ResponseEntity<?> getResult(@PathVariable String jobId) {
        try {
            return findJob(jobId)
                    .<ResponseEntity<?>>map(job -> ResponseEntity.ok(jobProjection.toResult(job)))
                    .orElseGet(() -> notFound(jobId));
        } catch (StoreUnavailableException e) {
            return storeUnavailable();
        }
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResponse> health() {
        boolean storeUp = clipJobService.isStoreAvailable();
        HealthResponse body = new HealthResponse(
                storeUp ? "up" : "down",
                admissionController.activeCount(),
                admissionController.queuedCount(),
                admissionController.maxConcurrentJobs());
        return ResponseEntity.status(storeUp ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<String> uploadTooLarge(MaxUploadSizeExceededException e) {
        return ResponseEntity.status(HttpStatus.PAYLOAD_TOO_LARGE).body("Uploaded file is too large.");
    }

    private Optional<Job> findJob(String jobId) {
        return clipJobService.getJob(jobId);
    }

    private ResponseEntity<?> notFound(String jobId) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId);
    }

    private ResponseEntity<?> storeUnavailable() {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body("Job store unavailable. Set REDIS_URL to a reachable Redis instance.");
    }
}
