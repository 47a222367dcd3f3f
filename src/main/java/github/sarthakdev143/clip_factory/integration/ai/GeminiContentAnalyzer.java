package github.sarthakdev143.clip_factory.integration.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import github.sarthakdev143.clip_factory.config.ClipFactoryProperties;
import github.sarthakdev143.clip_factory.model.Transcript;
import github.sarthakdev143.clip_factory.model.TranscriptSegment;
import github.sarthakdev143.clip_factory.model.ViralSegment;
import github.sarthakdev143.clip_factory.service.ContentAnalyzer;
import github.sarthakdev143.clip_factory.service.JobFailureException;
import github.sarthakdev143.clip_factory.service.TransientStageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Asks Gemini for the most shareable moments of a transcript. The model answers with JSON of the form
 * {@code {"shorts": [{"start", "end", "video_title_for_youtube_short", "video_description_for_tiktok",
 * "video_description_for_instagram", "video_description_for_youtube"}]}}.
 */
@Component
public class GeminiContentAnalyzer implements ContentAnalyzer {

    static final String API_KEY_HEADER = "x-goog-api-key";
    private static final Logger logger = LoggerFactory.getLogger(GeminiContentAnalyzer.class);
    private static final String PROMPT = """
            You are an editor cutting short vertical videos from a long recording.
            Pick between 3 and 15 self-contained moments of 15 to 60 seconds that would perform best as
            TikTok, Instagram Reels and YouTube Shorts. Use only timestamps that exist in the transcript.
            Answer with JSON only, shaped as:
            {"shorts": [{"start": <seconds>, "end": <seconds>,
              "video_title_for_youtube_short": "...",
              "video_description_for_tiktok": "...",
              "video_description_for_instagram": "...",
              "video_description_for_youtube": "..."}]}

            Transcript (one line per segment, times in seconds):
            """;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final ClipFactoryProperties.Ai settings;

    public GeminiContentAnalyzer(
            @Qualifier("analysisRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            ClipFactoryProperties properties) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.settings = properties.ai();
    }

    @Override
    public List<ViralSegment> analyze(Transcript transcript, String apiKey)
            throws TransientStageException, JobFailureException {
        if (apiKey == null || apiKey.isBlank()) {
            throw new JobFailureException("No AI credential available for content analysis.");
        }
        if (transcript == null || transcript.isEmpty()) {
            throw new JobFailureException("Transcript is empty; nothing to analyze.");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(API_KEY_HEADER, apiKey);
        HttpEntity<Map<String, Object>> request = new HttpEntity<>(buildRequestBody(transcript), headers);

        String response;
        try {
            response = restTemplate.postForObject(generateContentUrl(), request, String.class);
        } catch (HttpStatusCodeException e) {
            if (e.getStatusCode().is5xxServerError() || e.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                throw new TransientStageException("Gemini returned " + e.getStatusCode().value(), e);
            }
            throw new JobFailureException(
                    "Gemini rejected the analysis request (" + e.getStatusCode().value() + "): "
                            + e.getResponseBodyAsString(), e);
        } catch (ResourceAccessException e) {
            throw new TransientStageException("Gemini request failed: " + e.getMessage(), e);
        }

        List<ViralSegment> segments = parseResponse(response);
        logger.info("Gemini proposed {} segments", segments.size());
        return segments;
    }

    String generateContentUrl() {
        String endpoint = settings.endpoint().endsWith("/")
                ? settings.endpoint().substring(0, settings.endpoint().length() - 1)
                : settings.endpoint();
        return endpoint + "/models/" + settings.model() + ":generateContent";
    }

    Map<String, Object> buildRequestBody(Transcript transcript) {
        StringBuilder prompt = new StringBuilder(PROMPT);
        for (TranscriptSegment segment : transcript.segments()) {
            if (segment.text().isEmpty()) {
                continue;
            }
            prompt.append(String.format(Locale.ROOT, "[%.2f - %.2f] %s%n", segment.start(), segment.end(), segment.text()));
        }
        return Map.of(
                "contents", List.of(Map.of("role", "user", "parts", List.of(Map.of("text", prompt.toString())))),
                "generationConfig", Map.of("responseMimeType", "application/json"));
    }

    List<ViralSegment> parseResponse(String response) throws JobFailureException {
        if (response == null || response.isBlank()) {
            throw new JobFailureException("Gemini returned an empty response.");
        }
        try {
            JsonNode root = objectMapper.readTree(response);
            StringBuilder text = new StringBuilder();
            for (JsonNode part : root.path("candidates").path(0).path("content").path("parts")) {
                text.append(part.path("text").asText(""));
            }
            if (text.length() == 0) {
                String reason = root.path("promptFeedback").path("blockReason").asText("no candidates");
                throw new JobFailureException("Gemini returned no content (" + reason + ").");
            }

            JsonNode shorts = objectMapper.readTree(stripCodeFence(text.toString())).path("shorts");
            List<ViralSegment> segments = new ArrayList<>();
            for (JsonNode item : shorts) {
                String title = textOrNull(item, "video_title_for_youtube_short");
                String youtubeDescription = textOrNull(item, "video_description_for_youtube");
                segments.add(new ViralSegment(
                        item.path("start").asDouble(-1),
                        item.path("end").asDouble(-1),
                        title,
                        textOrNull(item, "video_description_for_tiktok"),
                        textOrNull(item, "video_description_for_instagram"),
                        youtubeDescription == null ? title : youtubeDescription));
            }
            return segments;
        } catch (JsonProcessingException e) {
            throw new JobFailureException("Gemini response is not valid JSON.", e);
        }
    }

    private static String stripCodeFence(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int lastFence = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && lastFence > firstNewline) {
                return trimmed.substring(firstNewline + 1, lastFence).trim();
            }
        }
        return trimmed;
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }
}
