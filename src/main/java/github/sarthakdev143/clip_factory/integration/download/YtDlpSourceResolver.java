package github.sarthakdev143.clip_factory.integration.download;

import github.sarthakdev143.clip_factory.config.ClipFactoryProperties;
import github.sarthakdev143.clip_factory.integration.process.ProcessRunner;
import github.sarthakdev143.clip_factory.model.JobInput;
import github.sarthakdev143.clip_factory.service.JobFailureException;
import github.sarthakdev143.clip_factory.service.SourceResolver;
import github.sarthakdev143.clip_factory.service.TransientStageException;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Downloads URL sources with yt-dlp into the job's work directory. Uploaded sources are already on disk.
 */
@Component
public class YtDlpSourceResolver implements SourceResolver {

    static final String SOURCE_BASENAME = "source";

    private final ProcessRunner processRunner;
    private final ClipFactoryProperties.Download settings;

    public YtDlpSourceResolver(ProcessRunner processRunner, ClipFactoryProperties properties) {
        this.processRunner = processRunner;
        this.settings = properties.download();
    }

    @Override
    public Path resolve(JobInput input, Path workDir) throws TransientStageException, JobFailureException {
        if (input.isUpload()) {
            Path upload = Path.of(input.uploadPath());
            if (!Files.isRegularFile(upload)) {
                throw new JobFailureException("Uploaded file is no longer available: " + upload.getFileName());
            }
            return upload;
        }
        if (input.url() == null) {
            throw new JobFailureException("Job has neither a URL nor an uploaded file.");
        }

        processRunner.run(buildDownloadCommand(input.url(), workDir), "download", settings.timeout());
        return findDownloadedFile(workDir);
    }

    List<String> buildDownloadCommand(String url, Path workDir) {
        List<String> command = new ArrayList<>();
        command.add(settings.binary());
        command.add("--no-playlist");
        command.add("-f");
        command.add("bv*[ext=mp4]+ba[ext=m4a]/b[ext=mp4]/bv*+ba/b");
        command.add("--merge-output-format");
        command.add("mp4");
        if (settings.cookiesFile() != null) {
            command.add("--cookies");
            command.add(settings.cookiesFile().toString());
        }
        command.add("-o");
        command.add(workDir.resolve(SOURCE_BASENAME + ".%(ext)s").toString());
        command.add(url);
        return command;
    }

    private Path findDownloadedFile(Path workDir) throws TransientStageException {
        try (Stream<Path> files = Files.list(workDir)) {
            return files
                    .filter(path -> path.getFileName().toString().startsWith(SOURCE_BASENAME + "."))
                    .filter(path -> !path.getFileName().toString().endsWith(".part"))
                    .findFirst()
                    .orElseThrow(() -> new TransientStageException("yt-dlp finished without producing a file."));
        } catch (IOException e) {
            throw new TransientStageException("Could not list download directory " + workDir, e);
        }
    }
}
