package dev.aparikh.hybridsearch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.aparikh.hybridsearch.evaluation.EvalResult;
import dev.aparikh.hybridsearch.evaluation.EvaluationService;
import dev.aparikh.hybridsearch.evaluation.QueryEvaluation;
import dev.aparikh.hybridsearch.evaluation.RejectedJudgment;
import dev.aparikh.hybridsearch.search.HybridSearchService;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Evaluates the pipeline against a JSON Lines judgment file and prints MRR@N and Recall@N.
 */
@Command(name = "eval", mixinStandardHelpOptions = true, description = "Evaluate MRR@N and Recall@N on labeled queries")
public class EvalCommand implements Callable<Integer> {

    private final EvaluationService evaluationService;
    private final HybridSearchService searchService;
    private final ObjectMapper objectMapper;

    @Spec
    CommandSpec spec;

    @Option(names = "--queries", required = true, paramLabel = "FILE",
            description = "JSON Lines file of {\"query\": ..., \"relevant\": [...]} records")
    Path queries;

    @Option(names = "--json", description = "Print the full evaluation result as JSON")
    boolean json;

    @Mixin
    PipelineOptions pipelineOptions;

    public EvalCommand(EvaluationService evaluationService, HybridSearchService searchService, ObjectMapper objectMapper) {
        this.evaluationService = evaluationService;
        this.searchService = searchService;
        this.objectMapper = objectMapper;
    }

    @Override
    public Integer call() throws Exception {
        EvalResult result = evaluationService.evaluate(queries,
                pipelineOptions.toOverrides().applyTo(searchService.defaultOptions()));

        PrintWriter out = spec.commandLine().getOut();
        if (json) {
            out.println(objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(result));
            out.flush();
            return ExitCodes.OK;
        }

        PrintWriter err = spec.commandLine().getErr();
        for (RejectedJudgment rejected : result.rejected()) {
            err.printf("warning: line %d rejected: %s%n", rejected.lineNumber(), rejected.reason());
        }
        for (QueryEvaluation evaluation : result.perQuery()) {
            if (!evaluation.flags().isEmpty()) {
                err.printf("warning: query '%s' flagged %s%n", evaluation.query(), evaluation.flags());
            }
        }

        EvalResult.Aggregate aggregate = result.aggregate();
        if (result.perQuery().isEmpty()) {
            out.printf("No queries found in %s%n", queries);
        }
        out.printf(Locale.ROOT, "MRR@%d: %.4f (%d queries)%n", aggregate.n(), aggregate.mrrAtN(), aggregate.queriesEvaluated());
        out.printf(Locale.ROOT, "Recall@%d: %.4f (%d queries)%n", aggregate.n(), aggregate.recallAtN(), aggregate.recallQueries());
        out.flush();
        return ExitCodes.OK;
    }
}
