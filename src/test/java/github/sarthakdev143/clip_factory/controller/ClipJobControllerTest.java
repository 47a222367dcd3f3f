package github.sarthakdev143.clip_factory.controller;

import github.sarthakdev143.clip_factory.config.ClipFactoryProperties;
import github.sarthakdev143.clip_factory.model.ClipResult;
import github.sarthakdev143.clip_factory.model.Job;
import github.sarthakdev143.clip_factory.model.JobInput;
import github.sarthakdev143.clip_factory.model.JobResult;
import github.sarthakdev143.clip_factory.model.PipelineStage;
import github.sarthakdev143.clip_factory.model.Transcript;
import github.sarthakdev143.clip_factory.model.TranscriptSegment;
import github.sarthakdev143.clip_factory.queue.AdmissionController;
import github.sarthakdev143.clip_factory.service.ClipJobService;
import github.sarthakdev143.clip_factory.service.ClipSubmission;
import github.sarthakdev143.clip_factory.service.UploadTooLargeException;
import github.sarthakdev143.clip_factory.service.impl.JobProjection;
import github.sarthakdev143.clip_factory.store.StoreUnavailableException;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.endsWith;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ClipJobController.class)
@Import(JobProjection.class)
@EnableConfigurationProperties(ClipFactoryProperties.class)
class ClipJobControllerTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private ClipJobService clipJobService;

    @MockitoBean
    private AdmissionController admissionController;

    @Test
    void processReturnsAcceptedWithQueuedJob() throws Exception {
        when(clipJobService.submit(any())).thenReturn(queued());

        mockMvc.perform(multipart("/api/v2/process")
                        .param("url", "https://www.youtube.com/watch?v=abc")
                        .param("include_captions", "true")
                        .param("caption_style", "karaoke")
                        .param("caption_color", "#FFFFFF")
                        .header("X-Gemini-Key", "client-key"))
                .andExpect(status().isAccepted())
                .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
                .andExpect(jsonPath("$.job_id").value("job-1"))
                .andExpect(jsonPath("$.status").value("queued"));

        ArgumentCaptor<ClipSubmission> captor = ArgumentCaptor.forClass(ClipSubmission.class);
        verify(clipJobService).submit(captor.capture());
        ClipSubmission submission = captor.getValue();
        assertThat(submission.url()).isEqualTo("https://www.youtube.com/watch?v=abc");
        assertThat(submission.includeCaptions()).isTrue();
        assertThat(submission.captionStyle()).isEqualTo("karaoke");
        assertThat(submission.captionColor()).isEqualTo("#FFFFFF");
        assertThat(submission.apiKey()).isEqualTo("client-key");
        assertThat(submission.file()).isNull();
    }

    @Test
    void processPassesUploadedFile() throws Exception {
        when(clipJobService.submit(any())).thenReturn(queued());
        MockMultipartFile file = new MockMultipartFile("file", "talk.mp4", "video/mp4", new byte[] {1, 2});

        mockMvc.perform(multipart("/api/v2/process").file(file))
                .andExpect(status().isAccepted());

        ArgumentCaptor<ClipSubmission> captor = ArgumentCaptor.forClass(ClipSubmission.class);
        verify(clipJobService).submit(captor.capture());
        assertThat(captor.getValue().file().getOriginalFilename()).isEqualTo("talk.mp4");
        assertThat(captor.getValue().apiKey()).isNull();
    }

    @Test
    void processReturnsBadRequestForInvalidSubmission() throws Exception {
        when(clipJobService.submit(any()))
                .thenThrow(new IllegalArgumentException("Provide either a url or an uploaded file."));

        mockMvc.perform(multipart("/api/v2/process"))
                .andExpect(status().isBadRequest())
                .andExpect(content().string("Invalid request: Provide either a url or an uploaded file."));
    }

    @Test
    void processReturnsPayloadTooLargeForOversizedUpload() throws Exception {
        when(clipJobService.submit(any()))
                .thenThrow(new UploadTooLargeException("Uploaded file exceeds the 500 MB limit."));

        mockMvc.perform(multipart("/api/v2/process").param("url", "https://example.com/v"))
                .andExpect(status().isPayloadTooLarge())
                .andExpect(content().string(containsString("500 MB")));
    }

    @Test
    void processReturnsServiceUnavailableWhenStoreIsDown() throws Exception {
        when(clipJobService.submit(any())).thenThrow(new StoreUnavailableException("Job store unavailable."));

        mockMvc.perform(multipart("/api/v2/process").param("url", "https://example.com/v"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(content().string(containsString("REDIS_URL")));
    }

    @Test
    void statusReturnsProgressAndLogs() throws Exception {
        Job job = queued().markProcessing(NOW).withStage(PipelineStage.TRANSCRIBING);
        when(clipJobService.getJob("job-1")).thenReturn(Optional.of(job));

        mockMvc.perform(get("/api/v2/jobs/job-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job_id").value("job-1"))
                .andExpect(jsonPath("$.status").value("processing"))
                .andExpect(jsonPath("$.progress_percentage").value(30))
                .andExpect(jsonPath("$.progress_stage").value("Transcribing audio"))
                .andExpect(jsonPath("$.logs[0]").value(endsWith("Job job-1 queued.")))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void statusOfFailedJobIncludesError() throws Exception {
        Job job = queued().markFailed("Interrupted by service restart", NOW);
        when(clipJobService.getJob("job-1")).thenReturn(Optional.of(job));

        mockMvc.perform(get("/api/v2/jobs/job-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("failed"))
                .andExpect(jsonPath("$.error").value("Interrupted by service restart"));
    }

    @Test
    void statusReturnsNotFoundForUnknownJob() throws Exception {
        when(clipJobService.getJob("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v2/jobs/missing"))
                .andExpect(status().isNotFound())
                .andExpect(content().string("Job not found for id: missing"));
    }

    @Test
    void statusReturnsServiceUnavailableWhenStoreIsDown() throws Exception {
        when(clipJobService.getJob("job-1")).thenThrow(new StoreUnavailableException("down"));

        mockMvc.perform(get("/api/v2/jobs/job-1"))
                .andExpect(status().isServiceUnavailable());
    }

    @Test
    void resultReturnsClipsOnceCompleted() throws Exception {
        Transcript transcript = new Transcript("en", List.of(new TranscriptSegment(0.0, 2.0, "hello", List.of())));
        ClipResult clip = new ClipResult(1, "/videos/job-1/job-1_clip_1.mp4", "Title", "tt", "ig", "yt");
        Job job = queued().markProcessing(NOW).markCompleted(new JobResult(List.of(clip), transcript), NOW);
        when(clipJobService.getJob("job-1")).thenReturn(Optional.of(job));

        mockMvc.perform(get("/api/v2/jobs/job-1/result"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"))
                .andExpect(jsonPath("$.result.clips[0].video_url").value("/videos/job-1/job-1_clip_1.mp4"))
                .andExpect(jsonPath("$.result.clips[0].description_tiktok").value("tt"))
                .andExpect(jsonPath("$.result.transcript.segments[0].text").value("hello"))
                .andExpect(jsonPath("$.completed_at").exists());
    }

    @Test
    void resultIsNullWhileRunning() throws Exception {
        when(clipJobService.getJob("job-1")).thenReturn(Optional.of(queued().markProcessing(NOW)));

        mockMvc.perform(get("/api/v2/jobs/job-1/result"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("processing"))
                .andExpect(jsonPath("$.result").isEmpty());
    }

    @Test
    void resultReturnsNotFoundForUnknownJob() throws Exception {
        when(clipJobService.getJob("missing")).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v2/jobs/missing/result"))
                .andExpect(status().isNotFound());
    }

    @Test
    void healthReportsAdmissionState() throws Exception {
        when(clipJobService.isStoreAvailable()).thenReturn(true);
        when(admissionController.activeCount()).thenReturn(2);
        when(admissionController.queuedCount()).thenReturn(7);
        when(admissionController.maxConcurrentJobs()).thenReturn(5);

        mockMvc.perform(get("/api/v2/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.store").value("up"))
                .andExpect(jsonPath("$.active").value(2))
                .andExpect(jsonPath("$.queued").value(7))
                .andExpect(jsonPath("$.max_concurrent_jobs").value(5));
    }

    @Test
    void healthIsUnavailableWhenStoreIsDown() throws Exception {
        when(clipJobService.isStoreAvailable()).thenReturn(false);

        mockMvc.perform(get("/api/v2/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.store").value("down"));
    }

    private static Job queued() {
        return Job.queued("job-1", JobInput.ofUrl("https://example.com/v"), null, NOW);
    }
}
