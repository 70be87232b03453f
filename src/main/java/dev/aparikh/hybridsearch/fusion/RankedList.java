package dev.aparikh.hybridsearch.fusion;

import dev.aparikh.hybridsearch.ScoringException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * An immutable ranking produced by exactly one retrieval source.
 *
 * <p>Entries are sorted by {@link RankingOrder#SCORE_DESCENDING_THEN_ID} on construction, whatever
 * order the source returned them in, so the 1-based position of a document is a deterministic rank.
 * A document id may appear at most once.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
public final class RankedList implements Iterable<ScoredDocument> {

    private final String source;
    private final List<ScoredDocument> documents;

    private RankedList(String source, List<ScoredDocument> documents) {
        this.source = source;
        this.documents = documents;
    }

    /**
     * Creates a ranked list, sorting the documents and rejecting duplicated ids.
     *
     * @throws ScoringException if a document id occurs more than once
     */
    public static RankedList of(String source, List<ScoredDocument> documents) {
        Objects.requireNonNull(source, "source must not be null");
        Set<String> seen = new HashSet<>();
        for (ScoredDocument document : documents) {
            if (!seen.add(document.docId())) {
                throw new ScoringException("Document '" + document.docId()
                        + "' appears more than once in the '" + source + "' ranking");
            }
        }
        List<ScoredDocument> sorted = new ArrayList<>(documents);
        sorted.sort(RankingOrder.SCORE_DESCENDING_THEN_ID);
        return new RankedList(source, Collections.unmodifiableList(sorted));
    }

    /**
     * An explicit empty ranking, used when a source has no matches or could not be queried.
     */
    public static RankedList empty(String source) {
        return new RankedList(source, List.of());
    }

    public static Builder builder(String source) {
        return new Builder(source);
    }

    public String source() {
        return source;
    }

    public List<ScoredDocument> documents() {
        return documents;
    }

    public ScoredDocument get(int index) {
        return documents.get(index);
    }

    public int size() {
        return documents.size();
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }

    @Override
    public Iterator<ScoredDocument> iterator() {
        return documents.iterator();
    }

    @Override
    public String toString() {
        return "RankedList[source=" + source + ", size=" + documents.size() + "]";
    }

    /**
     * Collects {@code (docId, rawScore)} pairs as a source reports them.
     */
    public static final class Builder {

        private final String source;
        private final List<ScoredDocument> documents = new ArrayList<>();

        private Builder(String source) {
            this.source = source;
        }

        public Builder add(String docId, double rawScore) {
            documents.add(ScoredDocument.fromSource(source, docId, rawScore));
            return this;
        }

        public RankedList build() {
            return RankedList.of(source, documents);
        }
    }
}
