package github.sarthakdev143.clip_factory.service;

public class UploadTooLargeException extends IllegalArgumentException {

    public UploadTooLargeException(String message) {
        super(message);
    }
}
