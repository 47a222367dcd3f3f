package github.sarthakdev143.clip_factory.service;

import org.springframework.web.multipart.MultipartFile;

/**
 * Raw submission parameters as received from the caller.
 */
public record ClipSubmission(
        String url,
        MultipartFile file,
        Boolean includeCaptions,
        String captionStyle,
        String captionColor,
        String captionOutlineColor,
        String apiKey) {
}
