package github.sarthakdev143.clip_factory.integration.transcription;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.clip_factory.config.ClipFactoryProperties;
import github.sarthakdev143.clip_factory.integration.process.ProcessRunner;
import github.sarthakdev143.clip_factory.model.Transcript;
import github.sarthakdev143.clip_factory.model.TranscriptSegment;
import github.sarthakdev143.clip_factory.model.TranscriptWord;
import github.sarthakdev143.clip_factory.service.JobFailureException;
import github.sarthakdev143.clip_factory.service.TransientStageException;
import github.sarthakdev143.clip_factory.service.Transcriber;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs the configured speech-to-text command and reads the Whisper-style JSON it writes:
 * {@code {"language": "en", "segments": [{"start", "end", "text", "words": [{"word", "start", "end"}]}]}}.
 */
@Component
public class CommandTranscriber implements Transcriber {

    static final String TRANSCRIPT_FILE = "transcript.json";

    private final ProcessRunner processRunner;
    private final ObjectMapper objectMapper;
    private final ClipFactoryProperties.Transcription settings;

    public CommandTranscriber(ProcessRunner processRunner, ObjectMapper objectMapper, ClipFactoryProperties properties) {
        this.processRunner = processRunner;
        this.objectMapper = objectMapper;
        this.settings = properties.transcription();
    }

    @Override
    public Transcript transcribe(Path source, Path workDir) throws TransientStageException, JobFailureException {
        Path output = workDir.resolve(TRANSCRIPT_FILE);
        List<String> command = ProcessRunner.expandTemplate(
                settings.command(),
                Map.of("input", source.toString(), "output", output.toString()));
        processRunner.run(command, "transcribe", settings.timeout());

        String json;
        try {
            json = Files.readString(output, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TransientStageException("Transcription produced no readable output at " + output, e);
        }
        return parse(json);
    }

    Transcript parse(String json) throws JobFailureException {
        try {
            JsonNode root = objectMapper.readTree(json);
            List<TranscriptSegment> segments = new ArrayList<>();
            for (JsonNode segmentNode : root.path("segments")) {
                List<TranscriptWord> words = new ArrayList<>();
                for (JsonNode wordNode : segmentNode.path("words")) {
                    String word = wordNode.path("word").asText("").trim();
                    if (!word.isEmpty() && wordNode.has("start") && wordNode.has("end")) {
                        words.add(new TranscriptWord(word, wordNode.path("start").asDouble(), wordNode.path("end").asDouble()));
                    }
                }
                segments.add(new TranscriptSegment(
                        segmentNode.path("start").asDouble(),
                        segmentNode.path("end").asDouble(),
                        segmentNode.path("text").asText("").trim(),
                        words));
            }
            String language = root.path("language").asText(null);
            return new Transcript(language, segments);
        } catch (JsonProcessingException e) {
            throw new JobFailureException("Transcription output is not valid JSON.", e);
        }
    }
}
