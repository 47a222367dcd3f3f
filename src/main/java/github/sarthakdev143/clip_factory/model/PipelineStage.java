package github.sarthakdev143.clip_factory.model;

public enum PipelineStage {
    DOWNLOADING(10, "Downloading video"),
    TRANSCRIBING(30, "Transcribing audio"),
    ANALYZING(50, "AI analysis"),
    CREATING_CLIPS(70, "Creating clips"),
    FINALIZING(90, "Finalizing");

    private final int percentage;
    private final String label;

    PipelineStage(int percentage, String label) {
        this.percentage = percentage;
        this.label = label;
    }

    public int percentage() {
        return percentage;
    }

    public String label() {
        return label;
    }
}
