package github.sarthakdev143.clip_factory.tracking;

public enum FramingMode {
    SINGLE_SUBJECT,
    MULTI_SUBJECT_LETTERBOX
}
