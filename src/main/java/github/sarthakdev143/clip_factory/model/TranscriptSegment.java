package github.sarthakdev143.clip_factory.model;

import java.util.List;

public record TranscriptSegment(double start, double end, String text, List<TranscriptWord> words) {

    public TranscriptSegment {
        text = text == null ? "" : text.trim();
        words = words == null ? List.of() : List.copyOf(words);
    }
}
