package github.sarthakdev143.clip_factory.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

@Component
@ConditionalOnProperty(name = "clip-factory.preflight.enabled", havingValue = "true", matchIfMissing = true)
public class StartupPreflightChecks implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StartupPreflightChecks.class);
    private static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    private static final String FFPROBE_PATH_ENV = "FFPROBE_PATH";
    private static final int BINARY_CHECK_TIMEOUT_SECONDS = 10;

    private final ClipFactoryProperties properties;

    public StartupPreflightChecks(ClipFactoryProperties properties) {
        this.properties = properties;
    }

    @Override
    public void run(ApplicationArguments args) {
        checkBinary(FFMPEG_PATH_ENV, "ffmpeg");
        checkBinary(FFPROBE_PATH_ENV, "ffprobe");
        checkWritableDirectory(properties.outputDir(), "clip-factory.output-dir");
        checkWritableDirectory(properties.uploadDir(), "clip-factory.upload-dir");
        checkCookiesFile();
        if (properties.ai().apiKey() == null) {
            logger.warn("No default AI credential configured; every submission must send X-Gemini-Key.");
        }
    }

    private void checkBinary(String envName, String defaultBinary) {
        String configuredPath = System.getenv(envName);
        if (configuredPath != null && !configuredPath.isBlank()) {
            Path binaryPath = Path.of(configuredPath);
            if (!Files.isRegularFile(binaryPath)) {
                throw new IllegalStateException(
                        defaultBinary + " binary not found at " + binaryPath.toAbsolutePath()
                                + ". Set " + envName + " to a valid " + defaultBinary + " executable path.");
            }
            return;
        }

        try {
            Process process = new ProcessBuilder(defaultBinary, "-version")
                    .redirectErrorStream(true)
                    .start();
            boolean finished = process.waitFor(BINARY_CHECK_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            if (!finished || process.exitValue() != 0) {
                throw new IllegalStateException(
                        defaultBinary + " is not available on PATH. Install FFmpeg or set " + envName + ".");
            }
        } catch (IOException | InterruptedException e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            throw new IllegalStateException(
                    defaultBinary + " is not available on PATH. Install FFmpeg or set " + envName + ".",
                    e);
        }
    }

    private void checkWritableDirectory(Path directory, String propertyName) {
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new IllegalStateException(
                    "Cannot create " + directory.toAbsolutePath() + ". Check " + propertyName + ".", e);
        }
        if (!Files.isWritable(directory)) {
            throw new IllegalStateException(
                    "Directory " + directory.toAbsolutePath() + " is not writable. Check " + propertyName + ".");
        }
    }

    private void checkCookiesFile() {
        Path cookiesFile = properties.download().cookiesFile();
        if (cookiesFile != null && !Files.isReadable(cookiesFile)) {
            throw new IllegalStateException(
                    "yt-dlp cookies file is not readable at " + cookiesFile.toAbsolutePath()
                            + ". Fix clip-factory.download.cookies-file or leave it empty.");
        }
    }
}
