package conveyor.orchestrator.model;

import com.fasterxml.jackson.databind.JsonNode;
import conveyor.orchestrator.util.Json;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PipelineSpecJsonTest {

    private static final String PIPELINE = """
            {
              "name": "train",
              "inputs": [{"name": "epochs", "default": "3"}],
              "tasks": [
                {
                  "id": "prepare",
                  "component": {
                    "name": "prepare",
                    "outputs": [{"name": "dataset", "type": "CSV"}],
                    "implementation": {"image": "python:3.11", "command": ["prep", "{{outputPath:dataset}}"]}
                  }
                },
                {
                  "id": "fit",
                  "component": {
                    "name": "fit",
                    "inputs": [{"name": "data", "type": "CSV"}, {"name": "epochs"}],
                    "outputs": [{"name": "model"}]
                  },
                  "arguments": {
                    "data": {"type": "taskOutput", "taskId": "prepare", "outputName": "dataset"},
                    "epochs": {"type": "pipelineInput", "inputName": "epochs"}
                  },
                  "annotations": {"resources": {"gpu": 1}}
                }
              ],
              "outputs": {"model": {"type": "taskOutput", "taskId": "fit", "outputName": "model"}}
            }
            """;

    @Test
    void parsesPipelineDocument() {
        PipelineSpec pipeline = Json.read(PIPELINE, PipelineSpec.class);

        assertEquals("train", pipeline.name());
        assertEquals("3", pipeline.input("epochs").orElseThrow().defaultValue());
        TaskSpec fit = pipeline.task("fit").orElseThrow();
        assertEquals(ArgumentSource.taskOutput("prepare", "dataset"), fit.arguments().get("data"));
        assertEquals(ArgumentSource.pipelineInput("epochs"), fit.arguments().get("epochs"));
        assertEquals(List.of("data", "epochs"), List.copyOf(fit.arguments().keySet()));
        assertEquals(Map.of("gpu", 1), fit.annotations().get("resources"));
        assertEquals(ArgumentSource.taskOutput("fit", "model"), pipeline.outputs().get("model"));
        assertEquals(List.of("prep", "{{outputPath:dataset}}"),
                pipeline.task("prepare").orElseThrow().component().implementation().command());
    }

    @Test
    void argumentSourcesCarryTypeDiscriminator() throws Exception {
        TaskSpec task = TaskSpec.builder("join", TestPipelines.join())
                .argument("left", ArgumentSource.collection(
                        ArgumentSource.taskOutput("A", "out"), ArgumentSource.taskOutput("B", "out")))
                .literal("right", "x")
                .build();

        JsonNode json = Json.mapper().readTree(Json.write(task));

        assertEquals("collection", json.at("/arguments/left/type").asText());
        assertEquals("B", json.at("/arguments/left/members/1/taskId").asText());
        assertEquals("literal", json.at("/arguments/right/type").asText());
        assertEquals(task, Json.read(Json.write(task), TaskSpec.class));
    }

    @Test
    void resolvedInputsCarryKindDiscriminator() throws Exception {
        ResolvedInput input = new ResolvedInput.Collection(List.of(
                ResolvedInput.artifact("/data/a"), ResolvedInput.value("7")));

        JsonNode json = Json.mapper().readTree(Json.mapper().writerFor(ResolvedInput.class).writeValueAsString(input));

        assertEquals("collection", json.get("kind").asText());
        assertEquals("artifact", json.at("/items/0/kind").asText());
        assertEquals("value", json.at("/items/1/kind").asText());
    }

    @Test
    void unknownArgumentTypeIsRejected() {
        String json = """
                {"id": "t", "component": {"name": "c"}, "arguments": {"x": {"type": "magic"}}}
                """;

        assertThrows(IllegalArgumentException.class, () -> Json.read(json, TaskSpec.class));
    }

    @Test
    void componentDigestDependsOnContentOnly() {
        ComponentSpec a = TestPipelines.step();
        ComponentSpec b = TestPipelines.step();
        ComponentSpec other = ComponentSpec.builder("step").input("in").output("out").version("2").build();

        assertEquals(a.digest(), b.digest());
        assertEquals(64, a.digest().length());
        assertNotEquals(a.digest(), other.digest());
        assertFalse(Json.write(a).contains("digest"));
    }
}
