package github.sarthakdev143.clip_factory.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Where the source video comes from: a remote URL or a file already stored under the upload directory.
 */
public record JobInput(String url, String uploadPath) {

    public JobInput {
        url = url == null || url.isBlank() ? null : url.trim();
        uploadPath = uploadPath == null || uploadPath.isBlank() ? null : uploadPath;
    }

    public static JobInput ofUrl(String url) {
        return new JobInput(url, null);
    }

    public static JobInput ofUpload(String uploadPath) {
        return new JobInput(null, uploadPath);
    }

    @JsonIgnore
    public boolean isUpload() {
        return uploadPath != null;
    }

    @JsonIgnore
    public String describe() {
        return isUpload() ? "upload " + uploadPath : url;
    }
}
