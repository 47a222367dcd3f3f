package github.sarthakdev143.clip_factory.integration.process;

import github.sarthakdev143.clip_factory.service.JobFailureException;
import github.sarthakdev143.clip_factory.service.TransientStageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Runs external tools (ffmpeg, ffprobe, yt-dlp, transcription and detection CLIs) with a hard timeout.
 * Combined stdout/stderr goes to a temporary file so a chatty process can never block on a full pipe.
 */
@Component
public class ProcessRunner {

    private static final Logger logger = LoggerFactory.getLogger(ProcessRunner.class);
    private static final int MAX_OUTPUT_CHARS = 4000;

    /**
     * Returns the process output. Timeouts, launch failures and non-zero exits are transient.
     */
    public String run(List<String> command, String stage, Duration timeout)
            throws TransientStageException, JobFailureException {
        logger.info("Running command for stage {}: {}", stage, String.join(" ", command));
        Path outputFile = null;
        Process process = null;
        try {
            outputFile = Files.createTempFile("clip-factory-process-", ".log");
            process = new ProcessBuilder(command)
                    .redirectErrorStream(true)
                    .redirectOutput(outputFile.toFile())
                    .start();

            boolean finished = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                throw new TransientStageException(
                        command.get(0) + " timed out after " + timeout + " during stage: " + stage);
            }

            String output = Files.readString(outputFile, StandardCharsets.UTF_8);
            if (process.exitValue() != 0) {
                throw new TransientStageException(
                        command.get(0)
                                + " failed during stage "
                                + stage
                                + " with exit code "
                                + process.exitValue()
                                + ". Output: "
                                + tail(output));
            }
            return output;
        } catch (IOException e) {
            throw new TransientStageException("Could not run " + command.get(0) + " during stage " + stage, e);
        } catch (InterruptedException e) {
            destroy(process, command);
            Thread.currentThread().interrupt();
            throw new JobFailureException("Interrupted while running " + command.get(0) + " during stage " + stage, e);
        } finally {
            destroy(process, command);
            deleteQuietly(outputFile);
        }
    }

    /**
     * Splits a command template on whitespace and substitutes {@code {name}} placeholders per token,
     * so substituted paths containing spaces stay a single argument.
     */
    public static List<String> expandTemplate(String template, Map<String, String> values) {
        List<String> command = new ArrayList<>();
        for (String token : template.trim().split("\\s+")) {
            String expanded = token;
            for (Map.Entry<String, String> entry : values.entrySet()) {
                expanded = expanded.replace("{" + entry.getKey() + "}", entry.getValue());
            }
            command.add(expanded);
        }
        return command;
    }

    static String tail(String output) {
        if (output == null || output.length() <= MAX_OUTPUT_CHARS) {
            return output;
        }
        return "..." + output.substring(output.length() - MAX_OUTPUT_CHARS);
    }

    private void destroy(Process process, List<String> command) {
        if (process != null && process.isAlive()) {
            logger.warn("Killing {} (pid {})", command.get(0), process.pid());
            process.destroyForcibly();
        }
    }

    private void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.debug("Could not delete process output file {}", path, e);
        }
    }
}
