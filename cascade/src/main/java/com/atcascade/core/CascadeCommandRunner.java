package com.atcascade.core;

import com.atcascade.core.config.CascadeConfig;
import com.atcascade.core.driver.CascadeReport;
import com.atcascade.core.driver.JobReport;
import com.atcascade.core.log.JobLogStatus;
import com.atcascade.core.predict.PredictOutcome;
import com.atcascade.core.predict.PredictResult;
import com.atcascade.core.service.CascadeService;
import com.atcascade.core.service.JobSummary;
import com.atcascade.util.CascadeConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * {@code cascade <command> [--config=<file>] [options]}
 */
@Component
public class CascadeCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger logger = LoggerFactory.getLogger(CascadeCommandRunner.class);

    static final String USAGE = "Usage: cascade <command> [--config=<file>] [options]\n"
            + "  setup                        write the all-node database\n"
            + "  cleanup                      delete the results below the root node\n"
            + "  drill                        fit the whole cascade from the root node\n"
            + "  display                      print the job table\n"
            + "  continue --job=<name>        continue below a fitted job\n"
            + "  continue --database=<path>   same, naming the job by its database\n"
            + "  predict [--start-job=<name>] [--max-job-depth=<n>]\n"
            + "  summary                      print the status of every job";

    private final CascadeService cascadeService;
    private final PrintStream out;
    private int exitCode;

    @Autowired
    public CascadeCommandRunner(CascadeService cascadeService) {
        this(cascadeService, System.out);
    }

    CascadeCommandRunner(CascadeService cascadeService, PrintStream out) {
        this.cascadeService = cascadeService;
        this.out = out;
    }

    @Override
    public void run(ApplicationArguments args) {
        List<String> commands = args.getNonOptionArgs();
        if (commands.size() != 1) {
            System.err.println(USAGE);
            exitCode = 1;
            return;
        }
        String command = commands.get(0);
        try {
            CascadeConfig config = CascadeConfigLoader.load(option(args, "config"));
            exitCode = execute(command, config, args);
        } catch (ConfigurationException | IntegrityException e) {
            logger.error("{} failed: {}", command, e.getMessage());
            exitCode = 1;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("{} interrupted", command);
            exitCode = 1;
        } catch (RuntimeException e) {
            logger.error("{} failed", command, e);
            exitCode = 1;
        }
    }

    private int execute(String command, CascadeConfig config, ApplicationArguments args)
            throws InterruptedException {
        switch (command) {
            case "setup":
                cascadeService.setup(config);
                return 0;
            case "cleanup":
                cascadeService.cleanup(config);
                return 0;
            case "drill":
                return report(cascadeService.drill(config, null));
            case "continue":
                return report(cascadeService.continueCascade(config,
                        option(args, "job"), option(args, "database"), null));
            case "display":
                cascadeService.display(config).forEach(out::println);
                return 0;
            case "predict":
                return predict(cascadeService.predict(config,
                        option(args, "start-job"), intOption(args, "max-job-depth")));
            case "summary":
                return summary(cascadeService.summary(config));
            default:
                System.err.println("Unknown command '" + command + "'");
                System.err.println(USAGE);
                return 1;
        }
    }

    private int report(CascadeReport report) {
        for (JobReport job : report.getJobs()) {
            out.println(job);
        }
        out.println("done " + report.getDoneCount()
                + ", failed " + report.getFailedCount()
                + ", skipped " + report.getSkippedCount());
        return 0;
    }

    private int predict(List<PredictResult> results) {
        int predicted = 0;
        for (PredictResult result : results) {
            out.println(result);
            if (result.getOutcome() == PredictOutcome.PREDICTED) {
                predicted++;
            }
        }
        out.println("predicted " + predicted + " of " + results.size());
        return 0;
    }

    private int summary(List<JobSummary> rows) {
        Map<JobLogStatus, Integer> totals = new EnumMap<>(JobLogStatus.class);
        for (JobSummary row : rows) {
            totals.merge(row.getStatus(), 1, Integer::sum);
            out.println(String.format("%-30s %-8s %s", row.getJob().getJobName(), row.getStatus(),
                    row.getDatabaseDir()));
            for (String error : row.getErrors()) {
                out.println("    error: " + error);
            }
        }
        StringBuilder line = new StringBuilder();
        for (JobLogStatus status : JobLogStatus.values()) {
            if (line.length() > 0) {
                line.append(", ");
            }
            line.append(status.name().toLowerCase()).append(' ').append(totals.getOrDefault(status, 0));
        }
        out.println(line);
        return 0;
    }

    private static String option(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return null;
        }
        return values.get(values.size() - 1);
    }

    private static Integer intOption(ApplicationArguments args, String name) {
        String value = option(args, name);
        if (value == null) {
            return null;
        }
        try {
            return Integer.valueOf(value);
        } catch (NumberFormatException e) {
            throw new ConfigurationException("--" + name + " must be an integer, found '" + value + "'", e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
