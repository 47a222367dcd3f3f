package github.sarthakdev143.clip_factory.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

public record Transcript(String language, List<TranscriptSegment> segments) {

    public Transcript {
        segments = segments == null ? List.of() : List.copyOf(segments);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return segments.isEmpty();
    }

    /**
     * True when every non-empty segment carries word-level timestamps.
     */
    @JsonIgnore
    public boolean hasWordTimings() {
        boolean anyText = false;
        for (TranscriptSegment segment : segments) {
            if (segment.text().isEmpty()) {
                continue;
            }
            anyText = true;
            if (segment.words().isEmpty()) {
                return false;
            }
        }
        return anyText;
    }

    public List<TranscriptWord> wordsBetween(double startSec, double endSec) {
        List<TranscriptWord> words = new ArrayList<>();
        for (TranscriptSegment segment : segments) {
            for (TranscriptWord word : segment.words()) {
                if (word.end() > startSec && word.start() < endSec) {
                    words.add(word);
                }
            }
        }
        return words;
    }

    public List<TranscriptSegment> segmentsBetween(double startSec, double endSec) {
        List<TranscriptSegment> overlapping = new ArrayList<>();
        for (TranscriptSegment segment : segments) {
            if (segment.end() > startSec && segment.start() < endSec && !segment.text().isEmpty()) {
                overlapping.add(segment);
            }
        }
        return overlapping;
    }

    public String plainText() {
        StringBuilder text = new StringBuilder();
        for (TranscriptSegment segment : segments) {
            if (text.length() > 0) {
                text.append(' ');
            }
            text.append(segment.text());
        }
        return text.toString();
    }
}
