package github.sarthakdev143.clip_factory.integration.video;

import github.sarthakdev143.clip_factory.integration.process.ProcessRunner;
import github.sarthakdev143.clip_factory.model.VideoInfo;
import github.sarthakdev143.clip_factory.service.ClipRenderer;
import github.sarthakdev143.clip_factory.service.JobFailureException;
import github.sarthakdev143.clip_factory.service.TransientStageException;
import github.sarthakdev143.clip_factory.tracking.CropWindow;
import github.sarthakdev143.clip_factory.tracking.FramingMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Renders vertical clips with FFmpeg. A crop trajectory is split into runs of the same framing mode;
 * single-subject runs move a {@code crop} filter through {@code sendcmd} files, letterbox runs scale the
 * whole frame and pad it. The runs are concatenated and captions, when present, are burned in the same pass.
 */
@Component
public class FfmpegClipRenderer implements ClipRenderer {

    private static final Logger logger = LoggerFactory.getLogger(FfmpegClipRenderer.class);
    private static final String FFMPEG_PATH_ENV = "FFMPEG_PATH";
    private static final String DEFAULT_FFMPEG_BINARY = "ffmpeg";
    private static final Duration ENCODE_TIMEOUT = Duration.ofMinutes(30);

    private final ProcessRunner processRunner;

    public FfmpegClipRenderer(ProcessRunner processRunner) {
        this.processRunner = processRunner;
    }

    @Override
    public void extractSegment(Path source, double startSec, double endSec, Path output)
            throws TransientStageException, JobFailureException {
        if (endSec <= startSec) {
            throw new JobFailureException("Segment end " + endSec + "s is not after its start " + startSec + "s.");
        }
        processRunner.run(buildExtractCommand(source, startSec, endSec, output), "extract segment", ENCODE_TIMEOUT);
    }

    @Override
    public void renderVertical(Path segment, VideoInfo info, List<CropWindow> trajectory, Path captionFile, Path output)
            throws TransientStageException, JobFailureException {
        if (trajectory.isEmpty()) {
            throw new JobFailureException("Cannot render " + segment.getFileName() + " without a crop trajectory.");
        }

        List<FramingRun> runs = splitRuns(trajectory);
        List<Path> commandFiles = new ArrayList<>();
        try {
            for (int index = 0; index < runs.size(); index++) {
                FramingRun run = runs.get(index);
                if (run.mode() == FramingMode.SINGLE_SUBJECT) {
                    Path commandFile = segment.resolveSibling(baseName(segment) + "_crop_" + index + ".cmd");
                    Files.writeString(commandFile, buildCropCommands(index, run, trajectory, info.fps()), StandardCharsets.UTF_8);
                    commandFiles.add(commandFile);
                } else {
                    commandFiles.add(null);
                }
            }
        } catch (IOException e) {
            throw new TransientStageException("Could not write crop commands for " + segment.getFileName(), e);
        }

        try {
            processRunner.run(
                    buildRenderCommand(segment, trajectory, runs, commandFiles, captionFile, output),
                    "render vertical clip",
                    ENCODE_TIMEOUT);
        } finally {
            for (Path commandFile : commandFiles) {
                deleteIfExists(commandFile);
            }
        }
    }

    List<String> buildExtractCommand(Path source, double startSec, double endSec, Path output) {
        List<String> command = new ArrayList<>();
        command.add(resolveFfmpegBinary());
        command.add("-y");
        command.add("-ss");
        command.add(formatSeconds(startSec));
        command.add("-t");
        command.add(formatSeconds(endSec - startSec));
        command.add("-i");
        command.add(source.toString());
        command.add("-map");
        command.add("0:v:0");
        command.add("-map");
        command.add("0:a:0?");
        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add("veryfast");
        command.add("-crf");
        command.add("18");
        command.add("-pix_fmt");
        command.add("yuv420p");
        command.add("-c:a");
        command.add("aac");
        command.add("-b:a");
        command.add("192k");
        command.add(output.toString());
        return command;
    }

    List<String> buildRenderCommand(
            Path segment,
            List<CropWindow> trajectory,
            List<FramingRun> runs,
            List<Path> commandFiles,
            Path captionFile,
            Path output) {
        List<String> command = new ArrayList<>();
        command.add(resolveFfmpegBinary());
        command.add("-y");
        command.add("-i");
        command.add(segment.toString());
        command.add("-filter_complex");
        command.add(buildFilterGraph(trajectory, runs, commandFiles, captionFile));
        command.add("-map");
        command.add("[vout]");
        command.add("-map");
        command.add("0:a:0?");
        command.add("-c:v");
        command.add("libx264");
        command.add("-preset");
        command.add("veryfast");
        command.add("-crf");
        command.add("23");
        command.add("-pix_fmt");
        command.add("yuv420p");
        command.add("-c:a");
        command.add("aac");
        command.add("-b:a");
        command.add("192k");
        command.add("-movflags");
        command.add("+faststart");
        command.add(output.toString());
        return command;
    }

    String buildFilterGraph(List<CropWindow> trajectory, List<FramingRun> runs, List<Path> commandFiles, Path captionFile) {
        StringBuilder graph = new StringBuilder();
        if (runs.size() == 1) {
            graph.append("[0:v]");
        } else {
            graph.append("[0:v]split=").append(runs.size());
            for (int index = 0; index < runs.size(); index++) {
                graph.append("[src").append(index).append("]");
            }
            graph.append(";");
        }

        for (int index = 0; index < runs.size(); index++) {
            FramingRun run = runs.get(index);
            if (runs.size() > 1) {
                graph.append("[src").append(index).append("]")
                        .append("trim=start_frame=").append(run.startFrame())
                        .append(":end_frame=").append(run.endFrame())
                        .append(",setpts=PTS-STARTPTS,");
            }
            if (run.mode() == FramingMode.SINGLE_SUBJECT) {
                CropWindow first = trajectory.get(run.startFrame());
                graph.append("sendcmd=f=").append(escapeFilterPath(commandFiles.get(index)))
                        .append(",").append(cropInstance(index))
                        .append("=").append(first.width()).append(":").append(first.height())
                        .append(":").append(first.x()).append(":").append(first.y())
                        .append(",scale=").append(OUTPUT_WIDTH).append(":").append(OUTPUT_HEIGHT);
            } else {
                graph.append("scale=").append(OUTPUT_WIDTH).append(":").append(OUTPUT_HEIGHT)
                        .append(":force_original_aspect_ratio=decrease,pad=")
                        .append(OUTPUT_WIDTH).append(":").append(OUTPUT_HEIGHT)
                        .append(":(ow-iw)/2:(oh-ih)/2:black");
            }
            graph.append(",setsar=1[run").append(index).append("]");
            if (runs.size() > 1) {
                graph.append(";");
            }
        }

        String videoLabel;
        if (runs.size() > 1) {
            for (int index = 0; index < runs.size(); index++) {
                graph.append("[run").append(index).append("]");
            }
            graph.append("concat=n=").append(runs.size()).append(":v=1:a=0[joined]");
            videoLabel = "[joined]";
        } else {
            videoLabel = "[run0]";
        }

        if (captionFile != null) {
            graph.append(";").append(videoLabel)
                    .append("ass=filename=").append(escapeFilterPath(captionFile))
                    .append("[vout]");
        } else {
            graph.append(";").append(videoLabel).append("null[vout]");
        }
        return graph.toString();
    }

    /**
     * One {@code sendcmd} entry per frame where the crop moves, timed relative to the run's first frame.
     * Commands address the run's own named crop instance so other runs in the graph ignore them.
     */
    String buildCropCommands(int runIndex, FramingRun run, List<CropWindow> trajectory, double fps) {
        String target = cropInstance(runIndex);
        StringBuilder commands = new StringBuilder();
        CropWindow previous = null;
        for (int frame = run.startFrame(); frame < run.endFrame(); frame++) {
            CropWindow window = trajectory.get(frame);
            if (previous == null || !window.samePlacement(previous)) {
                double time = (frame - run.startFrame()) / fps;
                commands.append(formatSeconds(time))
                        .append(" ").append(target).append(" x ").append(window.x())
                        .append(", ").append(target).append(" y ").append(window.y())
                        .append(";\n");
            }
            previous = window;
        }
        return commands.toString();
    }

    static String cropInstance(int runIndex) {
        return "crop@run" + runIndex;
    }

    static List<FramingRun> splitRuns(List<CropWindow> trajectory) {
        List<FramingRun> runs = new ArrayList<>();
        int start = 0;
        for (int frame = 1; frame <= trajectory.size(); frame++) {
            if (frame == trajectory.size() || trajectory.get(frame).mode() != trajectory.get(start).mode()) {
                runs.add(new FramingRun(trajectory.get(start).mode(), start, frame));
                start = frame;
            }
        }
        return runs;
    }

    static String escapeFilterPath(Path path) {
        String value = path.toAbsolutePath().toString().replace('\\', '/');
        return "'" + value.replace(":", "\\:").replace("'", "'\\''") + "'";
    }

    private String baseName(Path path) {
        String fileName = path.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private String formatSeconds(double seconds) {
        return String.format(Locale.ROOT, "%.3f", seconds);
    }

    private String resolveFfmpegBinary() {
        String configuredPath = System.getenv(FFMPEG_PATH_ENV);
        if (configuredPath != null && !configuredPath.isBlank()) {
            return configuredPath;
        }
        return DEFAULT_FFMPEG_BINARY;
    }

    private void deleteIfExists(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            logger.debug("Could not delete {}", path, e);
        }
    }

    /**
     * Frames {@code [startFrame, endFrame)} rendered with one framing mode.
     */
    record FramingRun(FramingMode mode, int startFrame, int endFrame) {
    }
}
