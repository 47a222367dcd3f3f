package github.sarthakdev143.clip_factory.integration.process;

import github.sarthakdev143.clip_factory.service.JobFailureException;
import github.sarthakdev143.clip_factory.service.TransientStageException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProcessRunnerTest {

    private final ProcessRunner runner = new ProcessRunner();

    @Test
    void expandsPlaceholdersPerToken() {
        List<String> command = ProcessRunner.expandTemplate(
                "  whisper-json  --model small {input} {output} ",
                Map.of("input", "/tmp/my video.mp4", "output", "/tmp/out.json"));

        assertThat(command).containsExactly("whisper-json", "--model", "small", "/tmp/my video.mp4", "/tmp/out.json");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void returnsCombinedOutput() throws Exception {
        String output = runner.run(List.of("sh", "-c", "echo out; echo err 1>&2"), "test", Duration.ofSeconds(10));

        assertThat(output).contains("out").contains("err");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void nonZeroExitIsTransient() {
        assertThatThrownBy(() -> runner.run(List.of("sh", "-c", "echo broken; exit 3"), "test", Duration.ofSeconds(10)))
                .isInstanceOf(TransientStageException.class)
                .hasMessageContaining("exit code 3")
                .hasMessageContaining("broken");
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    void timeoutIsTransient() {
        assertThatThrownBy(() -> runner.run(List.of("sleep", "5"), "test", Duration.ofMillis(200)))
                .isInstanceOf(TransientStageException.class)
                .hasMessageContaining("timed out");
    }

    @Test
    @EnabledOnOs(OS.LINUX)
    void interruptKillsTheChildProcess() throws Exception {
        AtomicReference<Throwable> thrown = new AtomicReference<>();
        Thread worker = new Thread(() -> {
            try {
                runner.run(List.of("sleep", "37"), "render", Duration.ofSeconds(60));
            } catch (Exception e) {
                thrown.set(e);
            }
        });
        worker.start();

        long deadline = System.currentTimeMillis() + 5000;
        while (sleepChildren().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertThat(sleepChildren()).isNotEmpty();

        worker.interrupt();
        worker.join(5000);

        assertThat(thrown.get())
                .isInstanceOf(JobFailureException.class)
                .hasMessageContaining("Interrupted while running sleep");
        deadline = System.currentTimeMillis() + 5000;
        while (!sleepChildren().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(50);
        }
        assertThat(sleepChildren()).isEmpty();
    }

    @Test
    void missingBinaryIsTransient() {
        assertThatThrownBy(() -> runner.run(List.of("definitely-not-a-real-binary-xyz"), "test", Duration.ofSeconds(5)))
                .isInstanceOf(TransientStageException.class)
                .hasMessageContaining("Could not run");
    }

    private static List<ProcessHandle> sleepChildren() {
        return ProcessHandle.current().children()
                .filter(ProcessHandle::isAlive)
                .filter(child -> child.info().arguments().map(args -> Arrays.asList(args).contains("37")).orElse(false))
                .toList();
    }

    @Test
    void keepsOnlyTheTailOfLongOutput() {
        String tail = ProcessRunner.tail("x".repeat(5000) + "END");

        assertThat(tail).startsWith("...").endsWith("END").hasSize(4003);
    }
}
