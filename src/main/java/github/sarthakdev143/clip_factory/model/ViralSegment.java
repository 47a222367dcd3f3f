package github.sarthakdev143.clip_factory.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A time range of the source picked by the content-analysis collaborator, with its generated copy.
 */
public record ViralSegment(
        double startSec,
        double endSec,
        String title,
        String descriptionTiktok,
        String descriptionInstagram,
        String descriptionYoutube) {

    @JsonIgnore
    public double durationSec() {
        return endSec - startSec;
    }

    @JsonIgnore
    public boolean isUsable() {
        return startSec >= 0 && endSec > startSec && title != null && !title.isBlank();
    }
}
