package dev.aparikh.hybridsearch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.hybridsearch.evaluation.EvaluationService;
import dev.aparikh.hybridsearch.rerank.DocumentTextSource;
import dev.aparikh.hybridsearch.search.HybridSearchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import picocli.CommandLine;

import java.util.Set;

/**
 * Runs the picocli command line inside the Spring context when the application is started as a
 * CLI, and hands its exit code to {@link org.springframework.boot.SpringApplication#exit}.
 */
@Component
@ConditionalOnProperty(name = "hybrid.cli.enabled", havingValue = "true")
public class HybridSearchCli implements CommandLineRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(HybridSearchCli.class);

    private static final Set<String> COMMANDS = Set.of("search", "eval");

    private final HybridSearchService searchService;
    private final EvaluationService evaluationService;
    private final DocumentTextSource textSource;
    private final ObjectMapper objectMapper;

    private int exitCode = ExitCodes.OK;

    public HybridSearchCli(HybridSearchService searchService,
                           EvaluationService evaluationService,
                           DocumentTextSource textSource,
                           ObjectMapper objectMapper) {
        this.searchService = searchService;
        this.evaluationService = evaluationService;
        this.textSource = textSource;
        this.objectMapper = objectMapper;
    }

    /**
     * Whether the program arguments name a CLI command rather than starting the web service.
     */
    public static boolean isCliInvocation(String... args) {
        return args.length > 0 && COMMANDS.contains(args[0]);
    }

    @Override
    public void run(String... args) {
        exitCode = commandLine().execute(args);
        log.debug("Command {} finished with exit code {}", args.length > 0 ? args[0] : "", exitCode);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    CommandLine commandLine() {
        return new CommandLine(new HybridSearchCommand())
                .addSubcommand(new SearchCommand(searchService, textSource))
                .addSubcommand(new EvalCommand(evaluationService, searchService, objectMapper))
                .setCaseInsensitiveEnumValuesAllowed(true)
                .setExecutionExceptionHandler((ex, cmd, parseResult) -> {
                    cmd.getErr().println("error: " + ex.getMessage());
                    log.debug("Command failed", ex);
                    return ExitCodes.of(ex);
                });
    }
}
