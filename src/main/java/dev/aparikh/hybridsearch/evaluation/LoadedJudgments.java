package dev.aparikh.hybridsearch.evaluation;

import java.util.List;

/**
 * Judgments read from a file, together with the lines that could not be read.
 */
public record LoadedJudgments(List<RelevanceJudgment> judgments, List<RejectedJudgment> rejected) {

    public LoadedJudgments {
        judgments = List.copyOf(judgments);
        rejected = List.copyOf(rejected);
    }
}
