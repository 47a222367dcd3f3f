package github.sarthakdev143.clip_factory.integration.video;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.clip_factory.integration.process.ProcessRunner;
import github.sarthakdev143.clip_factory.model.VideoInfo;
import github.sarthakdev143.clip_factory.service.JobFailureException;
import github.sarthakdev143.clip_factory.service.MediaProbe;
import github.sarthakdev143.clip_factory.service.TransientStageException;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

@Component
public class FfprobeMediaProbe implements MediaProbe {

    private static final String FFPROBE_PATH_ENV = "FFPROBE_PATH";
    private static final String DEFAULT_FFPROBE_BINARY = "ffprobe";
    private static final Duration PROBE_TIMEOUT = Duration.ofMinutes(1);

    private final ProcessRunner processRunner;
    private final ObjectMapper objectMapper;

    public FfprobeMediaProbe(ProcessRunner processRunner, ObjectMapper objectMapper) {
        this.processRunner = processRunner;
        this.objectMapper = objectMapper;
    }

    @Override
    public VideoInfo probe(Path video) throws TransientStageException, JobFailureException {
        List<String> command = List.of(
                resolveFfprobeBinary(),
                "-v",
                "error",
                "-select_streams",
                "v:0",
                "-show_entries",
                "stream=width,height,r_frame_rate:format=duration",
                "-of",
                "json",
                video.toString());
        return parseProbeOutput(processRunner.run(command, "probe video", PROBE_TIMEOUT), video);
    }

    VideoInfo parseProbeOutput(String json, Path video) throws JobFailureException {
        try {
            JsonNode root = objectMapper.readTree(json);
            JsonNode stream = root.path("streams").path(0);
            if (stream.isMissingNode()) {
                throw new JobFailureException("No video stream found in " + video.getFileName() + ".");
            }
            int width = stream.path("width").asInt();
            int height = stream.path("height").asInt();
            double fps = parseFrameRate(stream.path("r_frame_rate").asText(""));
            double duration = root.path("format").path("duration").asDouble(0.0);
            return new VideoInfo(width, height, fps, duration);
        } catch (JsonProcessingException e) {
            throw new JobFailureException("ffprobe returned unreadable output for " + video.getFileName() + ".", e);
        } catch (IllegalArgumentException e) {
            throw new JobFailureException("Unsupported video " + video.getFileName() + ": " + e.getMessage(), e);
        }
    }

    static double parseFrameRate(String value) {
        if (value == null || value.isBlank()) {
            return 0.0;
        }
        int slash = value.indexOf('/');
        try {
            if (slash < 0) {
                return Double.parseDouble(value);
            }
            double numerator = Double.parseDouble(value.substring(0, slash));
            double denominator = Double.parseDouble(value.substring(slash + 1));
            return denominator == 0.0 ? 0.0 : numerator / denominator;
        } catch (NumberFormatException e) {
            return 0.0;
        }
    }

    private String resolveFfprobeBinary() {
        String configuredPath = System.getenv(FFPROBE_PATH_ENV);
        if (configuredPath != null && !configuredPath.isBlank()) {
            return configuredPath;
        }
        return DEFAULT_FFPROBE_BINARY;
    }
}
