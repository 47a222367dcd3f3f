package github.sarthakdev143.clip_factory.model;

public record ClipResult(
        int index,
        String videoUrl,
        String title,
        String descriptionTiktok,
        String descriptionInstagram,
        String descriptionYoutube) {
}
