package dev.aparikh.hybridsearch.evaluation;

import dev.aparikh.hybridsearch.search.HybridSearchService;
import dev.aparikh.hybridsearch.search.SearchOptions;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Evaluates the hybrid search pipeline, configured by {@link SearchOptions}, at {@code n = topN}.
 */
@Service
public class EvaluationService {

    private final Evaluator evaluator;
    private final HybridSearchService searchService;
    private final JudgmentLoader judgmentLoader;

    public EvaluationService(Evaluator evaluator, HybridSearchService searchService, JudgmentLoader judgmentLoader) {
        this.evaluator = evaluator;
        this.searchService = searchService;
        this.judgmentLoader = judgmentLoader;
    }

    public EvalResult evaluate(List<RelevanceJudgment> judgments, SearchOptions options) {
        return evaluator.evaluate(judgments, searchService.pipeline(options), options.topN());
    }

    /**
     * @throws IOException if the judgment file cannot be read
     */
    public EvalResult evaluate(Path judgmentFile, SearchOptions options) throws IOException {
        LoadedJudgments loaded = judgmentLoader.load(judgmentFile);
        return evaluator.evaluate(loaded, searchService.pipeline(options), options.topN());
    }
}
