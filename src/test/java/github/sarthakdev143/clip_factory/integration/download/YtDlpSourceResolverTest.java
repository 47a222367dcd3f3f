package github.sarthakdev143.clip_factory.integration.download;

import github.sarthakdev143.clip_factory.config.ClipFactoryProperties;
import github.sarthakdev143.clip_factory.integration.process.ProcessRunner;
import github.sarthakdev143.clip_factory.model.JobInput;
import github.sarthakdev143.clip_factory.service.JobFailureException;
import github.sarthakdev143.clip_factory.service.TransientStageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class YtDlpSourceResolverTest {

    @Mock
    private ProcessRunner processRunner;

    @TempDir
    Path tempDir;

    @Test
    void returnsStoredUploadWithoutDownloading() throws Exception {
        Path upload = Files.writeString(tempDir.resolve("abc_talk.mp4"), "video");

        Path resolved = resolver(null).resolve(JobInput.ofUpload(upload.toString()), tempDir);

        assertThat(resolved).isEqualTo(upload);
        verifyNoInteractions(processRunner);
    }

    @Test
    void missingUploadFailsTheJob() {
        assertThatThrownBy(() -> resolver(null).resolve(JobInput.ofUpload(tempDir.resolve("gone.mp4").toString()), tempDir))
                .isInstanceOf(JobFailureException.class)
                .hasMessageContaining("gone.mp4");
    }

    @Test
    void downloadsUrlAndPicksMergedFile() throws Exception {
        Path workDir = Files.createDirectories(tempDir.resolve("work"));
        when(processRunner.run(any(), eq("download"), eq(Duration.ofMinutes(15)))).thenAnswer(invocation -> {
            Files.writeString(workDir.resolve("source.mp4.part"), "partial");
            Files.writeString(workDir.resolve("source.mp4"), "video");
            return "";
        });

        Path resolved = resolver(null).resolve(JobInput.ofUrl("https://www.youtube.com/watch?v=abc"), workDir);

        assertThat(resolved).isEqualTo(workDir.resolve("source.mp4"));
    }

    @Test
    void downloadWithoutOutputIsTransient() throws Exception {
        when(processRunner.run(any(), any(), any())).thenReturn("");

        assertThatThrownBy(() -> resolver(null).resolve(JobInput.ofUrl("https://example.com/v"), tempDir))
                .isInstanceOf(TransientStageException.class);
    }

    @Test
    void buildsCommandWithCookiesWhenConfigured() {
        Path cookies = tempDir.resolve("cookies.txt");

        List<String> command = resolver(cookies).buildDownloadCommand("https://example.com/v", tempDir);

        assertThat(command.get(0)).isEqualTo("yt-dlp");
        assertThat(command).containsSubsequence("--no-playlist", "-f")
                .containsSubsequence("--merge-output-format", "mp4", "--cookies", cookies.toString(), "-o",
                        tempDir.resolve("source.%(ext)s").toString(), "https://example.com/v");
    }

    @Test
    void omitsCookiesByDefault() {
        assertThat(resolver(null).buildDownloadCommand("https://example.com/v", tempDir)).doesNotContain("--cookies");
    }

    private YtDlpSourceResolver resolver(Path cookies) {
        ClipFactoryProperties properties = new ClipFactoryProperties(null, null, null, null, null, null, null,
                null, new ClipFactoryProperties.Download(null, cookies, null), null, null, null, null, null);
        return new YtDlpSourceResolver(processRunner, properties);
    }
}
