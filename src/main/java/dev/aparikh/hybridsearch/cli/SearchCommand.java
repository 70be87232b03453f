package dev.aparikh.hybridsearch.cli;

import dev.aparikh.hybridsearch.fusion.ScoredDocument;
import dev.aparikh.hybridsearch.fusion.Sources;
import dev.aparikh.hybridsearch.rerank.DocumentTextSource;
import dev.aparikh.hybridsearch.search.HybridSearchService;
import dev.aparikh.hybridsearch.search.model.SearchResponse;
import dev.aparikh.hybridsearch.search.model.SourceStatus;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Runs one hybrid search and prints the ranked results with their per-source raw scores, title and
 * a snippet of the body.
 */
@Command(name = "search", mixinStandardHelpOptions = true, description = "Run a hybrid search")
public class SearchCommand implements Callable<Integer> {

    static final int SNIPPET_LENGTH = 160;

    private final HybridSearchService searchService;
    private final DocumentTextSource textSource;

    @Spec
    CommandSpec spec;

    @Parameters(arity = "1..*", paramLabel = "QUERY", description = "Query text")
    List<String> queryWords;

    @Mixin
    PipelineOptions pipelineOptions;

    public SearchCommand(HybridSearchService searchService, DocumentTextSource textSource) {
        this.searchService = searchService;
        this.textSource = textSource;
    }

    @Override
    public Integer call() {
        String query = String.join(" ", queryWords);
        SearchResponse response = searchService.search(query,
                pipelineOptions.toOverrides().applyTo(searchService.defaultOptions()));

        PrintWriter err = spec.commandLine().getErr();
        for (SourceStatus status : response.sources()) {
            if (status.degraded()) {
                err.printf("warning: %s source %s: %s%n", status.source(), status.state(), status.message());
            }
        }
        if (response.rerankFailed()) {
            err.println("warning: reranking failed, showing fused order");
        }

        PrintWriter out = spec.commandLine().getOut();
        List<ScoredDocument> documents = response.documents();
        if (documents.isEmpty()) {
            out.println("No results.");
            return ExitCodes.OK;
        }
        Map<String, String> texts = textSource.fetchTexts(documents.stream().map(ScoredDocument::docId).toList());
        out.printf("%nResults (%s%s):%n%n", response.strategy().name().toLowerCase(Locale.ROOT),
                response.reranked() ? ", reranked" : "");
        for (int i = 0; i < documents.size(); i++) {
            ScoredDocument doc = documents.get(i);
            out.printf(Locale.ROOT, "%02d. %s | score=%.4f lexical=%s vector=%s%n", i + 1, doc.docId(), doc.score(),
                    formatRaw(doc, Sources.LEXICAL), formatRaw(doc, Sources.VECTOR));
            String text = texts.getOrDefault(doc.docId(), "");
            int newline = text.indexOf('\n');
            out.printf("    %s%n", newline < 0 ? text : text.substring(0, newline));
            out.printf("    %s%n%n", snippet(newline < 0 ? "" : text.substring(newline + 1), SNIPPET_LENGTH));
        }
        out.flush();
        return ExitCodes.OK;
    }

    private static String formatRaw(ScoredDocument doc, String source) {
        Double raw = doc.rawScores().get(source);
        return raw == null ? "-" : String.format(Locale.ROOT, "%.4f", raw);
    }

    /**
     * Collapses whitespace and cuts the text to {@code length} characters, ending in {@code ...} when cut.
     */
    static String snippet(String text, int length) {
        String collapsed = String.join(" ", text.trim().split("\\s+")).trim();
        if (collapsed.length() <= length) {
            return collapsed;
        }
        return collapsed.substring(0, length - 3) + "...";
    }
}
