package github.sarthakdev143.clip_factory.tracking;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns noisy per-frame subject detections into one crop window per frame for a 9:16 reframe.
 *
 * <p>Frames without detections hold the previous window. Frames before the first detection reuse the first
 * window so the clip does not open with a pan. A clip with no detection at all gets a centered static crop.
 */
public class SubjectTracker {

    private final TrackerSettings settings;

    public SubjectTracker(TrackerSettings settings) {
        this.settings = settings;
    }

    public List<CropWindow> track(int frameWidth, int frameHeight, double fps, int frameCount, List<FrameDetections> frames) {
        if (frameCount < 0) {
            throw new IllegalArgumentException("frameCount must not be negative.");
        }
        int[] cropSize = verticalCropSize(frameWidth, frameHeight);
        int cropWidth = cropSize[0];
        int cropHeight = cropSize[1];

        Map<Integer, List<Detection>> byFrame = indexByFrame(frames, frameCount);
        if (byFrame.isEmpty()) {
            CropWindow centered = SmoothedCameraman.centered(frameWidth, frameHeight, cropWidth, cropHeight);
            return List.of(fill(frameCount, centered));
        }

        TrackingState state = new TrackingState(
                new SmoothedCameraman(
                        frameWidth,
                        frameHeight,
                        cropWidth,
                        cropHeight,
                        settings.smoothingGain(fps),
                        settings.safeZoneMargin()),
                new SpeakerTracker(settings.stabilizationFrames(), settings.cooldownFrames()),
                settings.stabilizationFrames());

        CropWindow[] windows = new CropWindow[frameCount];
        CropWindow letterbox = new CropWindow(0, 0, frameWidth, frameHeight, FramingMode.MULTI_SUBJECT_LETTERBOX);

        for (int frameIndex = 0; frameIndex < frameCount; frameIndex++) {
            List<Detection> detections = byFrame.get(frameIndex);
            if (detections == null || detections.isEmpty()) {
                windows[frameIndex] = state.lastWindow;
                continue;
            }

            Detection leading = detections.stream()
                    .max(Comparator.comparingDouble(settings.activeSpeakerSignal()::score))
                    .orElseThrow();
            String activeId = state.speakerTracker.observe(leading.trackId());
            Detection subject = findById(detections, activeId);

            FramingMode desired = isFarApart(detections, cropWidth)
                    ? FramingMode.MULTI_SUBJECT_LETTERBOX
                    : FramingMode.SINGLE_SUBJECT;
            FramingMode mode = state.resolveMode(desired);

            CropWindow single;
            if (subject != null) {
                single = state.cameraman.follow(subject);
            } else if (state.cameraman.isPositioned()) {
                single = state.cameraman.current();
            } else {
                single = state.cameraman.lockOn(leading);
            }

            CropWindow window = mode == FramingMode.MULTI_SUBJECT_LETTERBOX ? letterbox : single;
            windows[frameIndex] = window;
            state.lastWindow = window;
        }

        backfillLeadingFrames(windows);
        return List.of(windows);
    }

    boolean isFarApart(List<Detection> detections, int cropWidth) {
        if (detections.size() < 2) {
            return false;
        }
        double left = Double.MAX_VALUE;
        double right = -Double.MAX_VALUE;
        for (Detection detection : detections) {
            left = Math.min(left, detection.x());
            right = Math.max(right, detection.right());
        }
        return right - left > settings.farApartRatio() * cropWidth;
    }

    /**
     * Largest even-sized 9:16 window that fits inside the source frame.
     */
    public static int[] verticalCropSize(int frameWidth, int frameHeight) {
        if (frameWidth <= 0 || frameHeight <= 0) {
            throw new IllegalArgumentException("Frame dimensions must be positive.");
        }
        int cropHeight = even(frameHeight);
        int cropWidth = even((int) Math.round(frameHeight * 9.0 / 16.0));
        if (cropWidth > frameWidth) {
            cropWidth = even(frameWidth);
            cropHeight = Math.min(even((int) Math.round(frameWidth * 16.0 / 9.0)), even(frameHeight));
        }
        return new int[] {Math.max(cropWidth, 2), Math.max(cropHeight, 2)};
    }

    private Map<Integer, List<Detection>> indexByFrame(List<FrameDetections> frames, int frameCount) {
        Map<Integer, List<Detection>> byFrame = new HashMap<>();
        if (frames == null) {
            return byFrame;
        }
        for (FrameDetections frame : frames) {
            if (frame.frameIndex() < 0 || frame.frameIndex() >= frameCount || frame.detections().isEmpty()) {
                continue;
            }
            List<Detection> identified = new ArrayList<>(frame.detections().size());
            for (int index = 0; index < frame.detections().size(); index++) {
                Detection detection = frame.detections().get(index);
                identified.add(detection.trackId() == null
                        ? new Detection("untracked-" + index, detection.x(), detection.y(), detection.width(),
                                detection.height(), detection.confidence())
                        : detection);
            }
            byFrame.computeIfAbsent(frame.frameIndex(), ignored -> new ArrayList<>()).addAll(identified);
        }
        return byFrame;
    }

    private Detection findById(List<Detection> detections, String trackId) {
        if (trackId == null) {
            return null;
        }
        for (Detection detection : detections) {
            if (trackId.equals(detection.trackId())) {
                return detection;
            }
        }
        return null;
    }

    private void backfillLeadingFrames(CropWindow[] windows) {
        CropWindow first = null;
        for (CropWindow window : windows) {
            if (window != null) {
                first = window;
                break;
            }
        }
        for (int index = 0; index < windows.length && windows[index] == null; index++) {
            windows[index] = first;
        }
    }

    private CropWindow[] fill(int frameCount, CropWindow window) {
        CropWindow[] windows = new CropWindow[frameCount];
        Arrays.fill(windows, window);
        return windows;
    }

    private static int even(int value) {
        return value - (value % 2);
    }
}
