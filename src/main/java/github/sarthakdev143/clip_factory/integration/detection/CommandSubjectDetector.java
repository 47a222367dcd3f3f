package github.sarthakdev143.clip_factory.integration.detection;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.clip_factory.config.ClipFactoryProperties;
import github.sarthakdev143.clip_factory.integration.process.ProcessRunner;
import github.sarthakdev143.clip_factory.service.JobFailureException;
import github.sarthakdev143.clip_factory.service.SubjectDetector;
import github.sarthakdev143.clip_factory.service.TransientStageException;
import github.sarthakdev143.clip_factory.tracking.Detection;
import github.sarthakdev143.clip_factory.tracking.FrameDetections;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the configured face/person detector over a clip. Expected output:
 * {@code {"frames": [{"frame": 0, "detections": [{"track_id", "x", "y", "width", "height", "confidence"}]}]}}
 * with boxes in source pixels.
 */
@Component
public class CommandSubjectDetector implements SubjectDetector {

    private final ProcessRunner processRunner;
    private final ObjectMapper objectMapper;
    private final ClipFactoryProperties.Detection settings;

    public CommandSubjectDetector(ProcessRunner processRunner, ObjectMapper objectMapper, ClipFactoryProperties properties) {
        this.processRunner = processRunner;
        this.objectMapper = objectMapper;
        this.settings = properties.detection();
    }

    @Override
    public List<FrameDetections> detect(Path clip, Path workDir) throws TransientStageException, JobFailureException {
        Path output = workDir.resolve(baseName(clip) + "_detections.json");
        List<String> command = ProcessRunner.expandTemplate(
                settings.command(),
                Map.of("input", clip.toString(), "output", output.toString()));
        processRunner.run(command, "detect subjects", settings.timeout());

        try {
            return parse(Files.readString(output, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new TransientStageException("Subject detection produced no readable output at " + output, e);
        }
    }

    List<FrameDetections> parse(String json) throws JobFailureException {
        try {
            JsonNode root = objectMapper.readTree(json);
            List<FrameDetections> frames = new ArrayList<>();
            for (JsonNode frameNode : root.path("frames")) {
                List<Detection> detections = new ArrayList<>();
                for (JsonNode box : frameNode.path("detections")) {
                    double width = box.path("width").asDouble();
                    double height = box.path("height").asDouble();
                    if (width <= 0 || height <= 0) {
                        continue;
                    }
                    detections.add(new Detection(
                            box.hasNonNull("track_id") ? box.get("track_id").asText() : null,
                            box.path("x").asDouble(),
                            box.path("y").asDouble(),
                            width,
                            height,
                            box.path("confidence").asDouble(1.0)));
                }
                frames.add(new FrameDetections(frameNode.path("frame").asInt(), detections));
            }
            return frames;
        } catch (JsonProcessingException e) {
            throw new JobFailureException("Subject detection output is not valid JSON.", e);
        } catch (IllegalArgumentException e) {
            throw new JobFailureException("Subject detection output is invalid: " + e.getMessage(), e);
        }
    }

    private String baseName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
