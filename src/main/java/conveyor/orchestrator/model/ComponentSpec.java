package conveyor.orchestrator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import conveyor.orchestrator.util.Json;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Reusable containerized program with typed input and output ports.
 * Identity is the SHA-256 digest of its canonical JSON form.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ComponentSpec(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("inputs") List<InputSpec> inputs,
        @JsonProperty("outputs") List<OutputSpec> outputs,
        @JsonProperty("implementation") ContainerSpec implementation) {

    public ComponentSpec {
        Objects.requireNonNull(name, "component name is required");
        inputs = inputs != null ? List.copyOf(inputs) : List.of();
        outputs = outputs != null ? List.copyOf(outputs) : List.of();
    }

    public Optional<InputSpec> input(String portName) {
        return inputs.stream().filter(i -> i.name().equals(portName)).findFirst();
    }

    public Optional<OutputSpec> output(String portName) {
        return outputs.stream().filter(o -> o.name().equals(portName)).findFirst();
    }

    /**
     * Hex SHA-256 of the canonical JSON form. Two structurally equal components
     * always share a digest.
     */
    @JsonIgnore
    public String digest() {
        try {
            byte[] canonical = Json.canonical().writeValueAsString(this).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(canonical));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            throw new IllegalStateException("Failed to compute digest of component " + name, e);
        }
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static final class Builder {
        private final String name;
        private String version;
        private final List<InputSpec> inputs = new ArrayList<>();
        private final List<OutputSpec> outputs = new ArrayList<>();
        private ContainerSpec implementation;

        private Builder(String name) {
            this.name = name;
        }

        public Builder version(String version) {
            this.version = version;
            return this;
        }

        public Builder input(InputSpec input) {
            inputs.add(input);
            return this;
        }

        public Builder input(String name) {
            return input(InputSpec.of(name));
        }

        public Builder output(OutputSpec output) {
            outputs.add(output);
            return this;
        }

        public Builder output(String name) {
            return output(OutputSpec.of(name));
        }

        public Builder implementation(ContainerSpec implementation) {
            this.implementation = implementation;
            return this;
        }

        public ComponentSpec build() {
            return new ComponentSpec(name, version, inputs, outputs, implementation);
        }
    }
}
