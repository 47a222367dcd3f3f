package github.sarthakdev143.clip_factory.model;

import java.util.List;

public record JobResult(List<ClipResult> clips, Transcript transcript) {

    public JobResult {
        clips = clips == null ? List.of() : List.copyOf(clips);
    }
}
