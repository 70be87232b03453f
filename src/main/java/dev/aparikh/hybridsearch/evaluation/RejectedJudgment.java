package dev.aparikh.hybridsearch.evaluation;

/**
 * A judgment-file line that could not be parsed.
 *
 * @param lineNumber 1-based line number in the file
 * @param reason     parse error
 */
public record RejectedJudgment(int lineNumber, String reason) {
}
