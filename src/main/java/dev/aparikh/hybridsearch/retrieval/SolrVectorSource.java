package dev.aparikh.hybridsearch.retrieval;

import dev.aparikh.hybridsearch.SourceUnavailableException;
import dev.aparikh.hybridsearch.config.HybridSearchProperties;
import dev.aparikh.hybridsearch.embedding.VectorFormatUtils;
import dev.aparikh.hybridsearch.fusion.RankedList;
import dev.aparikh.hybridsearch.fusion.Sources;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrRequest;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.client.solrj.response.QueryResponse;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.SolrException;
import org.apache.solr.common.params.ModifiableSolrParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;

/**
 * Vector retrieval backed by Solr's KNN query parser.
 *
 * <p>The vector field must be declared with {@code similarityFunction="euclidean"}. Solr scores such
 * a field as {@code 1 / (1 + d^2)}; the euclidean distance {@code d} is recovered from it and reported
 * as {@code 1 / (1 + d)}.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
@Repository
public class SolrVectorSource implements VectorSource {

    private static final String FIELD_SCORE = "score";

    private static final Logger log = LoggerFactory.getLogger(SolrVectorSource.class);

    private final SolrClient solrClient;
    private final HybridSearchProperties.Solr solr;

    public SolrVectorSource(SolrClient solrClient, HybridSearchProperties properties) {
        this.solrClient = solrClient;
        this.solr = properties.solr();
    }

    @Override
    public RankedList search(float[] queryVector, int topK) {
        String vectorString = VectorFormatUtils.formatVectorForSolr(queryVector);

        ModifiableSolrParams params = new ModifiableSolrParams();
        params.set("q", SolrQueryUtils.buildKnnQuery(solr.vectorField(), topK, vectorString));
        params.set("rows", topK);
        params.set("fl", solr.idField() + "," + FIELD_SCORE);

        QueryResponse response;
        try {
            response = solrClient.query(solr.collection(), params, SolrRequest.METHOD.POST);
        } catch (SolrServerException | IOException | SolrException e) {
            throw new SourceUnavailableException(Sources.VECTOR, "Solr vector search failed: " + e.getMessage(), e);
        }

        RankedList.Builder ranking = RankedList.builder(Sources.VECTOR);
        for (SolrDocument doc : response.getResults()) {
            Object score = doc.getFieldValue(FIELD_SCORE);
            if (!(score instanceof Number number)) {
                throw new IllegalStateException("Solr result is missing its score: " + doc);
            }
            double distance = VectorScores.distanceFromSolrEuclideanScore(number.doubleValue());
            ranking.add(String.valueOf(doc.getFieldValue(solr.idField())), VectorScores.similarityFromDistance(distance));
        }
        RankedList result = ranking.build();
        log.debug("Vector search in {} returned {} results", solr.collection(), result.size());
        return result;
    }
}
