package conveyor.orchestrator.launcher;

import conveyor.orchestrator.model.ResolvedInput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Runs the resolved command line as a host process, for development without a
 * container runtime. The image is ignored.
 * <p>
 * Artifact URIs are treated as local file paths. Inline values bound to
 * {@code inputPath} placeholders are written next to the attempt's outputs.
 * Standard output and error go to the attempt's log URI.
 */
public final class LocalProcessLauncher implements Launcher {

    private static final Logger log = LoggerFactory.getLogger(LocalProcessLauncher.class);

    private final Path dataRoot;
    private final Map<String, Process> processes = new ConcurrentHashMap<>();
    private final Map<String, LaunchSpec> specs = new ConcurrentHashMap<>();
    private final Map<String, Boolean> cancelled = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<CompletionListener> listeners = new CopyOnWriteArrayList<>();

    public LocalProcessLauncher(String dataRoot) {
        this.dataRoot = Path.of(dataRoot);
    }

    @Override
    public String launch(LaunchSpec spec) {
        String handle = "proc-" + spec.executionId();
        List<String> commandLine;
        try {
            commandLine = new CommandLineResolver(bindingsFor(spec)).resolve(spec);
            for (String uri : spec.outputUris().values()) {
                createParent(Path.of(uri));
            }
            if (spec.logUri() != null) {
                createParent(Path.of(spec.logUri()));
            }
        } catch (UncheckedIOException e) {
            throw new LaunchFailureException("Failed to prepare task " + spec.taskId() + ": " + e.getMessage(), e);
        }
        if (commandLine.isEmpty()) {
            throw new LaunchFailureException("Task " + spec.taskId() + " has an empty command line");
        }

        ProcessBuilder builder = new ProcessBuilder(commandLine).redirectErrorStream(true);
        builder.environment().putAll(spec.env());
        if (spec.logUri() != null) {
            builder.redirectOutput(Path.of(spec.logUri()).toFile());
        } else {
            builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        }

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new LaunchFailureException("Failed to start " + commandLine.get(0) + ": " + e.getMessage(), e);
        }

        processes.put(handle, process);
        specs.put(handle, spec);
        process.onExit().thenRun(() -> notifyListeners(handle));

        log.info("Started process {} (pid {}) for task {}: {}", handle, process.pid(), spec.taskId(), commandLine);
        return handle;
    }

    @Override
    public PollResult poll(String handle) {
        Process process = processes.get(handle);
        if (process == null) {
            return PollResult.unknown("Unknown handle: " + handle);
        }
        if (process.isAlive()) {
            return PollResult.running();
        }
        if (cancelled.containsKey(handle)) {
            return PollResult.failed("Cancelled");
        }
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            return PollResult.failed("Process exited with code " + exitCode);
        }

        Map<String, String> produced = new LinkedHashMap<>();
        specs.get(handle).outputUris().forEach((name, uri) -> {
            if (Files.exists(Path.of(uri))) {
                produced.put(name, uri);
            }
        });
        return PollResult.succeeded(produced);
    }

    @Override
    public boolean cancel(String handle) {
        Process process = processes.get(handle);
        if (process == null || !process.isAlive()) {
            return false;
        }
        cancelled.put(handle, Boolean.TRUE);
        process.destroy();
        log.info("Cancelled process {}", handle);
        return true;
    }

    @Override
    public void onCompletion(CompletionListener listener) {
        listeners.add(listener);
    }

    private void notifyListeners(String handle) {
        for (CompletionListener listener : listeners) {
            try {
                listener.completed(handle);
            } catch (RuntimeException e) {
                log.warn("Completion listener failed for {}: {}", handle, e.getMessage());
            }
        }
    }

    private CommandLineResolver.PortBindings bindingsFor(LaunchSpec spec) {
        return new CommandLineResolver.PortBindings() {
            @Override
            public String inputValue(String name, ResolvedInput input) {
                if (input instanceof ResolvedInput.Artifact artifact) {
                    return readArtifact(artifact.uri());
                }
                return CommandLineResolver.render(input);
            }

            @Override
            public String inputPath(String name, ResolvedInput input) {
                if (input instanceof ResolvedInput.Value value) {
                    Path path = dataRoot.resolve("by_execution").resolve(spec.executionId())
                            .resolve("inputs").resolve(name).resolve("data");
                    writeFile(path, value.value());
                    return path.toString();
                }
                return CommandLineResolver.render(input);
            }

            @Override
            public String outputPath(String name, String uri) {
                return uri;
            }
        };
    }

    private static String readArtifact(String uri) {
        try {
            return Files.readString(Path.of(uri), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read artifact " + uri, e);
        }
    }

    private static void writeFile(Path path, String content) {
        try {
            createParent(path);
            Files.writeString(path, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write " + path, e);
        }
    }

    private static void createParent(Path path) {
        Path parent = path.toAbsolutePath().getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create directory " + parent, e);
        }
    }

    @Override
    public void close() {
        for (Map.Entry<String, Process> entry : processes.entrySet()) {
            if (entry.getValue().isAlive()) {
                log.warn("Destroying process {} on shutdown", entry.getKey());
                entry.getValue().destroy();
            }
        }
    }
}
