package github.sarthakdev143.clip_factory.service.impl;

import github.sarthakdev143.clip_factory.config.ClipFactoryProperties;
import github.sarthakdev143.clip_factory.model.Job;
import github.sarthakdev143.clip_factory.model.JobStatus;
import github.sarthakdev143.clip_factory.queue.AdmissionController;
import github.sarthakdev143.clip_factory.service.JobFailureException;
import github.sarthakdev143.clip_factory.store.JobStore;
import github.sarthakdev143.clip_factory.store.StoreUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * Resolves jobs left behind by a previous process. {@code processing} jobs are failed with
 * {@value JobFailureException#INTERRUPTED_BY_RESTART}. {@code queued} jobs go back into the admission queue
 * in creation order when a server default AI credential exists (per-request credentials die with the process),
 * and are failed the same way otherwise.
 * <p>
 * Jobs created after this process booted, or already held by the local admission controller, belong to the
 * running process and are left alone.
 */
@Component
public class JobRecoveryRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(JobRecoveryRunner.class);

    private final JobStore jobStore;
    private final AdmissionController admissionController;
    private final CredentialVault credentialVault;
    private final Clock clock;
    private final int maxLogLines;
    private final Instant bootInstant;

    public JobRecoveryRunner(
            JobStore jobStore,
            AdmissionController admissionController,
            CredentialVault credentialVault,
            Clock clock,
            ClipFactoryProperties properties) {
        this.jobStore = jobStore;
        this.admissionController = admissionController;
        this.credentialVault = credentialVault;
        this.clock = clock;
        this.maxLogLines = properties.maxLogLines();
        this.bootInstant = clock.instant();
    }

    @Override
    public void run(ApplicationArguments args) {
        recover();
    }

    public void recover() {
        List<Job> jobs;
        try {
            jobs = jobStore.findAll();
        } catch (StoreUnavailableException e) {
            logger.warn("Job store unavailable at startup; skipping recovery of interrupted jobs: {}", e.getMessage());
            return;
        }

        int failed = 0;
        int requeued = 0;
        for (Job job : jobs) {
            if (job.status().isTerminal() || ownedByThisProcess(job)) {
                continue;
            }
            if (job.status() == JobStatus.PROCESSING) {
                failInterrupted(job);
                failed++;
            } else if (job.status() == JobStatus.QUEUED) {
                if (credentialVault.hasDefault()) {
                    Instant now = clock.instant();
                    jobStore.update(job.jobId(), current -> current.withLog(now, "Re-queued after service restart.", maxLogLines));
                    admissionController.enqueue(job.jobId());
                    requeued++;
                } else {
                    failInterrupted(job);
                    failed++;
                }
            }
        }
        if (failed > 0 || requeued > 0) {
            logger.info("Startup recovery: {} interrupted jobs failed, {} queued jobs re-queued", failed, requeued);
        }
    }

    private boolean ownedByThisProcess(Job job) {
        if (!job.createdAt().isBefore(bootInstant)) {
            return true;
        }
        return admissionController.isTracked(job.jobId());
    }

    private void failInterrupted(Job job) {
        Instant now = clock.instant();
        String reason = JobFailureException.INTERRUPTED_BY_RESTART;
        jobStore.update(job.jobId(), current -> current.status().isTerminal()
                ? current
                : current.withLog(now, "Job failed: " + reason, maxLogLines).markFailed(reason, now));
    }
}
