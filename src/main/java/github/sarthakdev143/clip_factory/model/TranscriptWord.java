package github.sarthakdev143.clip_factory.model;

public record TranscriptWord(String word, double start, double end) {
}
