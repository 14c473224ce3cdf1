package com.exifworker.core.result;

import com.exifworker.core.exception.PipeResultException;
import com.exifworker.core.model.TaskResult;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class TaskResultCodecTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final TaskResultCodec codec = new TaskResultCodec(mapper);

    @Test
    void encode_shouldProduceBase64JsonWithSnakeCaseKeys() throws Exception {
        TaskResult result = codec.build(
            List.of(Map.of("uuid", "abc", "path", "/out/abc.txt")),
            "wf-1",
            "exiftool",
            Map.of());

        String encoded = codec.encode(result);
        JsonNode json = mapper.readTree(Base64.getDecoder().decode(encoded));

        assertThat(json.get("workflow_id").asText()).isEqualTo("wf-1");
        assertThat(json.get("command").asText()).isEqualTo("exiftool");
        assertThat(json.get("meta").isEmpty()).isTrue();
        assertThat(json.get("output_files").size()).isEqualTo(1);
        assertThat(json.get("output_files").get(0).get("path").asText()).isEqualTo("/out/abc.txt");
    }

    @Test
    void decode_shouldReadDocumentsFromOtherStages() {
        String json = "{\"output_files\":[{\"path\":\"/out/a.txt\",\"display_name\":\"a.txt\"}],"
            + "\"workflow_id\":\"wf-9\",\"command\":\"strings\",\"meta\":{},\"task_files\":[]}";
        String encoded = Base64.getEncoder().encodeToString(json.getBytes(StandardCharsets.UTF_8));

        TaskResult result = codec.decode(encoded);

        assertThat(result.workflowId()).isEqualTo("wf-9");
        assertThat(result.command()).isEqualTo("strings");
        assertThat(result.outputFiles()).singleElement()
            .satisfies(file -> assertThat(file).containsEntry("path", "/out/a.txt"));
    }

    @Test
    void decode_withInvalidBase64_shouldFail() {
        assertThatThrownBy(() -> codec.decode("not base64 !!"))
            .isInstanceOf(PipeResultException.class)
            .hasMessageContaining("Base64");
    }

    @Test
    void decode_withNonJsonPayload_shouldFail() {
        String encoded = Base64.getEncoder().encodeToString("plain text".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> codec.decode(encoded))
            .isInstanceOf(PipeResultException.class)
            .extracting("errorCode").isEqualTo(PipeResultException.ERROR_CODE);
    }

    @Test
    void decode_withJsonNull_shouldFail() {
        String encoded = Base64.getEncoder().encodeToString("null".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(() -> codec.decode(encoded))
            .isInstanceOf(PipeResultException.class)
            .hasMessageContaining("not a task result document")
            .extracting("errorCode").isEqualTo(PipeResultException.ERROR_CODE);
    }

    @Test
    void build_withNullMeta_shouldUseEmptyMap() {
        TaskResult result = codec.build(List.of(), "wf-1", "exiftool", null);

        assertThat(result.meta()).isEmpty();
        assertThat(result.outputFiles()).isEmpty();
    }
}
