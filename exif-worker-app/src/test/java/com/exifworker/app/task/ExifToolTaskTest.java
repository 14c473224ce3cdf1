package com.exifworker.app.task;

import com.exifworker.core.files.PipeResultInputFileResolver;
import com.exifworker.core.files.UuidOutputFileAllocator;
import com.exifworker.core.model.InputFile;
import com.exifworker.core.model.OutputFile;
import com.exifworker.core.model.TaskConfig;
import com.exifworker.core.model.TaskRequest;
import com.exifworker.core.model.TaskResult;
import com.exifworker.core.result.TaskResultCodec;
import com.exifworker.runtime.EmptyResultException;
import com.exifworker.runtime.TaskContext;
import com.exifworker.runtime.TaskException;
import com.exifworker.runtime.ToolExecutionException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

class ExifToolTaskTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper mapper = new ObjectMapper();
    private final TaskResultCodec codec = new TaskResultCodec(mapper);
    private RecordingProcessRunner runner;
    private Path outputDir;

    @BeforeEach
    void setUp() {
        runner = new RecordingProcessRunner();
        outputDir = tempDir.resolve("output");
    }

    private ExifToolTask task(Duration timeout) {
        return new ExifToolTask(
            new PipeResultInputFileResolver(codec, mapper),
            new UuidOutputFileAllocator(),
            codec,
            runner,
            "exiftool",
            timeout);
    }

    private ExifToolTask task() {
        return task(null);
    }

    static Stream<Arguments> configurations() {
        return Stream.of(
            Arguments.of(TaskConfig.of(Map.of("json_output", true)), "exiftool -json", ".json", "application/json"),
            Arguments.of(TaskConfig.of(Map.of("json_output", false)), "exiftool", ".txt", "text/plain"),
            Arguments.of(TaskConfig.empty(), "exiftool", ".txt", "text/plain"),
            Arguments.of(null, "exiftool", ".txt", "text/plain")
        );
    }

    @ParameterizedTest
    @MethodSource("configurations")
    @DisplayName("Configuration selects command, extension and MIME type")
    void run_shouldFollowConfiguration(TaskConfig config, String expectedCommand,
                                       String expectedExtension, String expectedDataType) throws Exception {
        InputFile photo = InputFile.of("/evidence/photo.jpg", "photo.jpg");

        TaskResult result = task().run(null, List.of(photo), outputDir.toString(), "wf-1", config);

        assertThat(result.command()).isEqualTo(expectedCommand);
        assertThat(result.workflowId()).isEqualTo("wf-1");
        assertThat(result.meta()).isEmpty();
        assertThat(result.outputFiles()).singleElement().satisfies(file -> {
            assertThat(file).containsEntry(OutputFile.EXTENSION, expectedExtension);
            assertThat(file).containsEntry(OutputFile.DATA_TYPE, expectedDataType);
            assertThat(file).containsEntry(OutputFile.DISPLAY_NAME, "photo.jpg" + expectedExtension);
        });

        List<String> expectedArguments = new java.util.ArrayList<>(List.of(expectedCommand.split(" ")));
        expectedArguments.add("/evidence/photo.jpg");
        assertThat(runner.invocations()).singleElement()
            .satisfies(invocation -> assertThat(invocation.command()).isEqualTo(expectedArguments));
    }

    @Test
    @DisplayName("JSON output for one photo produces one JSON artifact holding the tool output")
    void run_jsonScenario() throws Exception {
        InputFile photo = InputFile.of("/evidence/photo.jpg", "photo.jpg");

        TaskResult result = task().run(null, List.of(photo), outputDir.toString(), "wf-1",
            TaskConfig.of(Map.of("json_output", true)));

        assertThat(result.command()).isEqualTo("exiftool -json");
        Map<String, Object> artifact = result.outputFiles().get(0);
        Path written = Path.of((String) artifact.get(OutputFile.PATH));
        assertThat(written).hasParentRaw(outputDir);
        assertThat(written.getFileName().toString()).endsWith(".json");
        assertThat(Files.readString(written))
            .isEqualTo(RecordingProcessRunner.stdoutFor(List.of("exiftool", "-json"), "/evidence/photo.jpg"));
        assertThat(artifact).containsEntry(OutputFile.ORIGINAL_PATH, "/evidence/photo.jpg");
    }

    @Test
    @DisplayName("Every input file gets its own invocation and output file, in order")
    void run_multipleFiles() throws Exception {
        List<InputFile> inputs = List.of(
            InputFile.of("/evidence/a.jpg"),
            InputFile.of("/evidence/b.png"),
            InputFile.of("/evidence/c.tiff"));

        TaskResult result = task().run(null, inputs, outputDir.toString(), "wf-2", null);

        assertThat(runner.invocations())
            .extracting(invocation -> invocation.command().get(invocation.command().size() - 1))
            .containsExactly("/evidence/a.jpg", "/evidence/b.png", "/evidence/c.tiff");
        assertThat(new HashSet<>(runner.invocations().stream()
            .map(RecordingProcessRunner.Invocation::stdoutTarget).toList()))
            .hasSize(3);
        assertThat(result.outputFiles()).hasSize(3);
        assertThat(result.outputFiles())
            .extracting(file -> file.get(OutputFile.DISPLAY_NAME))
            .containsExactly("a.jpg.txt", "b.png.txt", "c.tiff.txt");
        for (int i = 0; i < 3; i++) {
            assertThat(Path.of((String) result.outputFiles().get(i).get(OutputFile.PATH)))
                .isEqualTo(runner.invocations().get(i).stdoutTarget());
        }
    }

    @Test
    @DisplayName("Non-zero exit aborts with the failing path and stderr")
    void run_toolFailure() {
        runner.failFor("/evidence/broken.jpg", 1, "bad file");
        List<InputFile> inputs = List.of(
            InputFile.of("/evidence/ok.jpg"),
            InputFile.of("/evidence/broken.jpg"),
            InputFile.of("/evidence/never.jpg"));

        assertThatThrownBy(() -> task().run(null, inputs, outputDir.toString(), "wf-3", null))
            .isInstanceOfSatisfying(ToolExecutionException.class, e -> {
                assertThat(e.getMessage()).contains("bad file").contains("/evidence/broken.jpg");
                assertThat(e.getInputPath()).isEqualTo("/evidence/broken.jpg");
                assertThat(e.getStderr()).isEqualTo("bad file");
                assertThat(e.getExitCode()).isEqualTo(1);
                assertThat(e.isRetryable()).isFalse();
            });

        assertThat(runner.invocations()).hasSize(2);
    }

    @Test
    @DisplayName("Failure on the only file yields no result")
    void run_singleFileFailure() {
        runner.failFor("/evidence/photo.jpg", 1, "bad file");

        assertThatThrownBy(() -> task().run(null, List.of(InputFile.of("/evidence/photo.jpg")),
                outputDir.toString(), "wf-4", null))
            .isInstanceOf(ToolExecutionException.class)
            .hasMessage("ExifTool failed for /evidence/photo.jpg: bad file");
    }

    @Test
    @DisplayName("No input files is an error, not an empty success")
    void run_noInputs() {
        assertThatThrownBy(() -> task().run(null, List.of(), outputDir.toString(), "wf-5", null))
            .isInstanceOf(EmptyResultException.class)
            .hasMessage("No input files were processed or ExifTool produced no output.");

        assertThatThrownBy(() -> task().run(null, null, outputDir.toString(), "wf-5", null))
            .isInstanceOf(EmptyResultException.class);
        assertThat(runner.invocations()).isEmpty();
    }

    @Test
    @DisplayName("Piped result takes precedence over the explicit input list")
    void run_pipeResultPrecedence() throws Exception {
        String pipeResult = codec.encode(new TaskResult(
            List.of(Map.of("path", "/stage1/f00d.jpg", "display_name", "extracted.jpg", "uuid", "f00d")),
            "wf-6", "unzip", Map.of()));

        TaskResult result = task().run(pipeResult, List.of(InputFile.of("/evidence/ignored.jpg")),
            outputDir.toString(), "wf-6", null);

        assertThat(runner.invocations()).singleElement()
            .satisfies(invocation -> assertThat(invocation.command()).containsExactly("exiftool", "/stage1/f00d.jpg"));
        assertThat(result.outputFiles()).singleElement()
            .satisfies(file -> assertThat(file).containsEntry(OutputFile.DISPLAY_NAME, "extracted.jpg.txt"));
    }

    @Test
    @DisplayName("Configured timeout is passed to the runner and enforced")
    void run_timeout() {
        runner.timeOutFor("/evidence/slow.jpg");

        assertThatThrownBy(() -> task(Duration.ofSeconds(2)).run(null, List.of(InputFile.of("/evidence/slow.jpg")),
                outputDir.toString(), "wf-7", null))
            .isInstanceOfSatisfying(TaskException.class,
                e -> assertThat(e.getErrorCode()).isEqualTo(ExifToolTask.TOOL_TIMEOUT));

        assertThat(runner.invocations().get(0).timeout()).isEqualTo(Duration.ofSeconds(2));
    }

    @Test
    @DisplayName("A tool that cannot be started fails the task")
    void run_startFailure() {
        runner.failToStart(new IOException("Cannot run program \"exiftool\": error=2, No such file or directory"));

        assertThatThrownBy(() -> task().run(null, List.of(InputFile.of("/evidence/photo.jpg")),
                outputDir.toString(), "wf-8", null))
            .isInstanceOfSatisfying(TaskException.class, e -> {
                assertThat(e.getErrorCode()).isEqualTo(ExifToolTask.TOOL_START_FAILED);
                assertThat(e.getMessage()).contains("/evidence/photo.jpg");
            });
    }

    @Test
    @DisplayName("Handler entry point reads its parameters from the context")
    void execute_usesContext() throws Exception {
        TaskRequest request = TaskRequest.forFiles(List.of(InputFile.of("/evidence/photo.jpg")),
            outputDir.toString(), "wf-9", TaskConfig.of(Map.of("json_output", "true")));

        TaskResult result = task().execute(new TaskContext(ExifToolTask.TASK_NAME, request));

        assertThat(result.workflowId()).isEqualTo("wf-9");
        assertThat(result.command()).isEqualTo("exiftool -json");
    }

    @Test
    void metadata_shouldDeclareJsonOutputCheckbox() {
        assertThat(ExifToolTask.METADATA.option(ExifToolTask.JSON_OUTPUT)).hasValueSatisfying(option -> {
            assertThat(option.defaultValue()).isEqualTo(false);
            assertThat(option.required()).isFalse();
            assertThat(option.label()).isEqualTo("Output in JSON format");
        });
    }
}
