package dev.aparikh.hybridsearch.search;

import dev.aparikh.hybridsearch.fusion.ScoredDocument;

import java.util.List;

/**
 * A complete query-to-ranking pipeline. The evaluation harness only depends on this, so stages can be
 * swapped for ablation runs.
 */
@FunctionalInterface
public interface SearchPipeline {

    List<ScoredDocument> search(String query);
}
