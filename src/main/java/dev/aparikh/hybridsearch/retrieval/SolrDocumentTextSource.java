package dev.aparikh.hybridsearch.retrieval;

import dev.aparikh.hybridsearch.SourceUnavailableException;
import dev.aparikh.hybridsearch.config.HybridSearchProperties;
import dev.aparikh.hybridsearch.rerank.DocumentTextSource;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrServerException;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.SolrDocumentList;
import org.apache.solr.common.SolrException;
import org.apache.solr.common.params.ModifiableSolrParams;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Fetches candidate text from Solr by id, joining the configured text fields with newlines.
 */
@Repository
public class SolrDocumentTextSource implements DocumentTextSource {

    private final SolrClient solrClient;
    private final HybridSearchProperties.Solr solr;

    public SolrDocumentTextSource(SolrClient solrClient, HybridSearchProperties properties) {
        this.solrClient = solrClient;
        this.solr = properties.solr();
    }

    @Override
    public Map<String, String> fetchTexts(List<String> docIds) {
        if (docIds.isEmpty()) {
            return Map.of();
        }
        ModifiableSolrParams params = new ModifiableSolrParams();
        params.set("fl", solr.idField() + "," + String.join(",", solr.textFields()));

        SolrDocumentList documents;
        try {
            documents = solrClient.getById(solr.collection(), docIds, params);
        } catch (SolrServerException | IOException | SolrException e) {
            throw new SourceUnavailableException("documents", "Could not fetch document text: " + e.getMessage(), e);
        }

        Map<String, String> texts = new HashMap<>();
        for (SolrDocument doc : documents) {
            texts.put(String.valueOf(doc.getFieldValue(solr.idField())), joinTextFields(doc));
        }
        return texts;
    }

    private String joinTextFields(SolrDocument doc) {
        List<String> parts = new ArrayList<>();
        for (String field : solr.textFields()) {
            Object value = doc.getFirstValue(field);
            if (value != null) {
                parts.add(value.toString());
            }
        }
        return String.join("\n", parts).strip();
    }
}
