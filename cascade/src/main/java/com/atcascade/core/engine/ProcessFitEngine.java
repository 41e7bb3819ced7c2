package com.atcascade.core.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Runs the fit and predict commands as child processes. Standard output and
 * error of each run go to {@code engine.log} next to the database.
 */
public class ProcessFitEngine implements FitEngine {

    private static final Logger logger = LoggerFactory.getLogger(ProcessFitEngine.class);

    static final String LOG_FILE_NAME = "engine.log";

    private static final long KILL_WAIT_SECONDS = 30;

    private final List<String> fitCommand;
    private final List<String> predictCommand;
    private final long timeoutSeconds;

    public ProcessFitEngine(List<String> fitCommand, List<String> predictCommand, long timeoutSeconds) {
        this.fitCommand = List.copyOf(fitCommand);
        this.predictCommand = predictCommand == null ? List.of() : List.copyOf(predictCommand);
        this.timeoutSeconds = timeoutSeconds;
    }

    @Override
    public EngineResult fit(Path database, FitMode mode) throws IOException, InterruptedException {
        List<String> command = expand(fitCommand, Map.of(
                "{database}", database.toString(),
                "{mode}", mode.label()));
        return run(command, database.getParent());
    }

    @Override
    public EngineResult predict(Path database, Path outputDir, String target)
            throws IOException, InterruptedException {
        if (predictCommand.isEmpty()) {
            throw new IOException("no predict command configured for the fit engine");
        }
        Files.createDirectories(outputDir);
        List<String> command = expand(predictCommand, Map.of(
                "{database}", database.toString(),
                "{output}", outputDir.toString(),
                "{target}", target));
        return run(command, outputDir);
    }

    static List<String> expand(List<String> template, Map<String, String> values) {
        List<String> command = new ArrayList<>(template.size());
        for (String arg : template) {
            String expanded = arg;
            for (Map.Entry<String, String> e : values.entrySet()) {
                expanded = expanded.replace(e.getKey(), e.getValue());
            }
            command.add(expanded);
        }
        return command;
    }

    private EngineResult run(List<String> command, Path workDir) throws IOException, InterruptedException {
        logger.debug("Running {}", command);
        Path logFile = workDir.resolve(LOG_FILE_NAME);
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.directory(workDir.toFile());
        pb.redirectErrorStream(true);
        pb.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile.toFile()));
        Process process = pb.start();

        boolean finished;
        try {
            finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for {}, killing it", command.get(0));
            kill(process);
            throw e;
        }
        if (!finished) {
            kill(process);
            logger.warn("{} did not finish within {} seconds", command.get(0), timeoutSeconds);
            return EngineResult.timeout(timeoutSeconds);
        }
        int exitCode = process.exitValue();
        if (exitCode != 0) {
            logger.warn("{} exited with status {}, see {}", command.get(0), exitCode, logFile);
            return EngineResult.exitStatus(exitCode);
        }
        return EngineResult.ok();
    }

    /**
     * Kills the process and everything it started, and waits for it to exit
     * so nothing is left writing to the job directory.
     */
    private static void kill(Process process) throws InterruptedException {
        List<ProcessHandle> descendants = process.descendants().collect(Collectors.toList());
        process.destroyForcibly();
        descendants.forEach(ProcessHandle::destroyForcibly);
        if (!process.waitFor(KILL_WAIT_SECONDS, TimeUnit.SECONDS)) {
            logger.error("Process {} still running {} seconds after kill", process.pid(), KILL_WAIT_SECONDS);
        }
    }
}
