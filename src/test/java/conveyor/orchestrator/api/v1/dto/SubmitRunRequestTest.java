package conveyor.orchestrator.api.v1.dto;

import com.fasterxml.jackson.databind.ObjectMapper;
import conveyor.orchestrator.model.ArgumentSource;
import conveyor.orchestrator.model.TaskSpec;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SubmitRunRequestTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    void deserializeFromJson() throws Exception {
        String json = """
                {
                  "pipeline": {
                    "name": "nightly",
                    "inputs": [{"name": "date"}],
                    "tasks": [
                      {
                        "id": "dump",
                        "component": {"name": "dump", "inputs": [{"name": "day"}], "outputs": [{"name": "file"}]},
                        "arguments": {"day": {"type": "pipelineInput", "inputName": "date"}},
                        "optional": true
                      }
                    ]
                  },
                  "arguments": {"date": "2024-05-01"},
                  "annotations": {"priority": "low"}
                }
                """;

        SubmitRunRequest req = mapper.readValue(json, SubmitRunRequest.class);

        assertEquals("nightly", req.pipeline().name());
        TaskSpec dump = req.pipeline().tasks().get(0);
        assertTrue(dump.optional());
        assertEquals(ArgumentSource.pipelineInput("date"), dump.arguments().get("day"));
        assertEquals(Map.of("date", "2024-05-01"), req.arguments());
        assertEquals(Map.of("priority", "low"), req.annotations());
        req.validate();
    }

    @Test
    void pipelineIsRequired() throws Exception {
        SubmitRunRequest req = mapper.readValue("{\"arguments\": {}}", SubmitRunRequest.class);

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, req::validate);
        assertEquals("pipeline is required", e.getMessage());
    }

    @Test
    void argumentsAndAnnotationsAreOptional() throws Exception {
        SubmitRunRequest req = mapper.readValue("{\"pipeline\": {\"name\": \"empty\"}}", SubmitRunRequest.class);

        req.validate();
        assertNull(req.arguments());
        assertTrue(req.pipeline().tasks().isEmpty());
    }
}
