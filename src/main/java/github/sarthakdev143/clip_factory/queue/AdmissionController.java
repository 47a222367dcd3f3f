package github.sarthakdev143.clip_factory.queue;

import github.sarthakdev143.clip_factory.config.ClipFactoryProperties;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Bounds the number of jobs running at once. Job ids wait in a FIFO queue; a single dispatcher thread
 * takes the head, blocks for a slot and hands the job to a worker. The slot is released in a
 * {@code finally} block once the runner returns, whatever happened inside it.
 */
@Component
public class AdmissionController implements SmartLifecycle {

    private static final Logger logger = LoggerFactory.getLogger(AdmissionController.class);

    private final int maxConcurrentJobs;
    private final Semaphore slots;
    private final LinkedBlockingDeque<String> waiting = new LinkedBlockingDeque<>();
    private final Set<String> tracked = ConcurrentHashMap.newKeySet();
    private final TaskExecutor workerExecutor;
    private final JobRunner jobRunner;
    private volatile Thread dispatcher;
    private volatile boolean running;

    public AdmissionController(
            ClipFactoryProperties properties,
            @Qualifier("jobWorkerExecutor") TaskExecutor workerExecutor,
            JobRunner jobRunner,
            MeterRegistry meterRegistry) {
        this.maxConcurrentJobs = properties.maxConcurrentJobs();
        this.slots = new Semaphore(maxConcurrentJobs, true);
        this.workerExecutor = workerExecutor;
        this.jobRunner = jobRunner;
        Gauge.builder("clip_factory.admission.active", this, AdmissionController::activeCount)
                .register(meterRegistry);
        Gauge.builder("clip_factory.admission.queued", this, AdmissionController::queuedCount)
                .register(meterRegistry);
    }

    /**
     * Queues a job id for admission. Returns {@code false} when the id is already waiting or running.
     */
    public boolean enqueue(String jobId) {
        if (!tracked.add(jobId)) {
            logger.warn("Job {} is already queued or running; ignoring duplicate enqueue", jobId);
            return false;
        }
        waiting.add(jobId);
        logger.debug("Job {} waiting for admission ({} queued)", jobId, waiting.size());
        return true;
    }

    /**
     * Whether this process holds the job, either waiting for a slot or running.
     */
    public boolean isTracked(String jobId) {
        return tracked.contains(jobId);
    }

    public int activeCount() {
        return maxConcurrentJobs - slots.availablePermits();
    }

    public int queuedCount() {
        return waiting.size();
    }

    public int maxConcurrentJobs() {
        return maxConcurrentJobs;
    }

    @Override
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        dispatcher = new Thread(this::dispatchLoop, "clip-dispatcher");
        dispatcher.setDaemon(true);
        dispatcher.start();
        logger.info("Admission controller started with {} slots", maxConcurrentJobs);
    }

    @Override
    public synchronized void stop() {
        running = false;
        Thread current = dispatcher;
        if (current != null) {
            current.interrupt();
        }
        dispatcher = null;
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void dispatchLoop() {
        while (running) {
            String jobId;
            try {
                jobId = waiting.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }

            try {
                slots.acquire();
            } catch (InterruptedException e) {
                waiting.addFirst(jobId);
                Thread.currentThread().interrupt();
                return;
            }

            if (!admit(jobId)) {
                running = false;
                return;
            }
        }
    }

    private boolean admit(String jobId) {
        logger.info("Admitting job {} ({} of {} slots in use)", jobId, activeCount(), maxConcurrentJobs);
        try {
            workerExecutor.execute(() -> runAndRelease(jobId));
            return true;
        } catch (RejectedExecutionException e) {
            // Only happens once the worker pool is shutting down.
            logger.error("Worker pool rejected job {}; dispatcher stops and the job stays queued", jobId, e);
            slots.release();
            waiting.addFirst(jobId);
            return false;
        }
    }

    private void runAndRelease(String jobId) {
        try {
            jobRunner.run(jobId);
        } catch (RuntimeException e) {
            logger.error("Job runner threw for job {}", jobId, e);
        } finally {
            tracked.remove(jobId);
            slots.release();
        }
    }
}
