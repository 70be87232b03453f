package dev.aparikh.hybridsearch.retrieval;

import dev.aparikh.hybridsearch.InvalidQueryException;
import dev.aparikh.hybridsearch.SourceUnavailableException;
import dev.aparikh.hybridsearch.config.HybridSearchProperties;
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
import java.util.Map;

/**
 * Lexical retrieval backed by Solr's edismax query parser.
 *
 * <p>Field weights become the {@code qf} boosts, so {@code {title=2.0, body=1.0}} searches
 * {@code title^2.0 body^1.0}. Only the id and score are fetched; document text is looked up separately
 * if the rerank stage needs it.</p>
 *
 * @author Aditya Parikh
 * @since 1.0.0
 */
@Repository
public class SolrLexicalSource implements LexicalSource {

    private static final String QUERY_TYPE_EDISMAX = "edismax";
    private static final String FIELD_SCORE = "score";

    private static final Logger log = LoggerFactory.getLogger(SolrLexicalSource.class);

    private final SolrClient solrClient;
    private final HybridSearchProperties.Solr solr;

    public SolrLexicalSource(SolrClient solrClient, HybridSearchProperties properties) {
        this.solrClient = solrClient;
        this.solr = properties.solr();
    }

    @Override
    public RankedList search(String query, Map<String, Double> fieldWeights, int topK) {
        ModifiableSolrParams params = new ModifiableSolrParams();
        params.set("q", query);
        params.set("defType", QUERY_TYPE_EDISMAX);
        params.set("qf", SolrQueryUtils.buildQueryFields(fieldWeights));
        params.set("rows", topK);
        params.set("fl", solr.idField() + "," + FIELD_SCORE);

        QueryResponse response;
        try {
            response = solrClient.query(solr.collection(), params, SolrRequest.METHOD.POST);
        } catch (SolrException e) {
            if (e.code() == SolrException.ErrorCode.BAD_REQUEST.code) {
                throw new InvalidQueryException("Malformed lexical query '" + query + "': " + e.getMessage(), e);
            }
            throw new SourceUnavailableException(Sources.LEXICAL, "Solr rejected the lexical search: " + e.getMessage(), e);
        } catch (SolrServerException | IOException e) {
            throw new SourceUnavailableException(Sources.LEXICAL, "Solr lexical search failed: " + e.getMessage(), e);
        }

        RankedList.Builder ranking = RankedList.builder(Sources.LEXICAL);
        for (SolrDocument doc : response.getResults()) {
            ranking.add(String.valueOf(doc.getFieldValue(solr.idField())), scoreOf(doc));
        }
        RankedList result = ranking.build();
        log.debug("Lexical search in {} returned {} results", solr.collection(), result.size());
        return result;
    }

    private static double scoreOf(SolrDocument doc) {
        Object score = doc.getFieldValue(FIELD_SCORE);
        if (score instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalStateException("Solr result is missing its score: " + doc);
    }
}
