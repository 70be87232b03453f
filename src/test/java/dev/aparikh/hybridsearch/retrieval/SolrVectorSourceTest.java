package dev.aparikh.hybridsearch.retrieval;

import dev.aparikh.hybridsearch.SourceUnavailableException;
import dev.aparikh.hybridsearch.TestProperties;
import dev.aparikh.hybridsearch.fusion.RankedList;
import dev.aparikh.hybridsearch.fusion.Sources;
import org.apache.solr.client.solrj.SolrClient;
import org.apache.solr.client.solrj.SolrRequest;
import org.apache.solr.client.solrj.response.QueryResponse;
import org.apache.solr.common.SolrDocument;
import org.apache.solr.common.SolrDocumentList;
import org.apache.solr.common.params.SolrParams;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SolrVectorSourceTest {

    @Mock
    private SolrClient solrClient;

    @Mock
    private QueryResponse queryResponse;

    private SolrVectorSource vectorSource;

    @BeforeEach
    void setUp() {
        vectorSource = new SolrVectorSource(solrClient, TestProperties.defaults());
    }

    @Test
    void shouldSendKnnQuery() throws Exception {
        // Given
        when(queryResponse.getResults()).thenReturn(new SolrDocumentList());
        when(solrClient.query(eq("tickets"), any(SolrParams.class), eq(SolrRequest.METHOD.POST))).thenReturn(queryResponse);

        // When
        vectorSource.search(new float[]{0.6f, 0.8f}, 5);

        // Then
        ArgumentCaptor<SolrParams> params = ArgumentCaptor.forClass(SolrParams.class);
        verify(solrClient).query(eq("tickets"), params.capture(), eq(SolrRequest.METHOD.POST));
        assertThat(params.getValue().get("q")).isEqualTo("{!knn f=vector topK=5}[0.6, 0.8]");
        assertThat(params.getValue().get("fl")).isEqualTo("id,score");
    }

    @Test
    void shouldConvertSolrEuclideanScoreToDistanceSimilarity() throws Exception {
        // Given: Solr reports 1 / (1 + d^2); d = 1 gives 0.5 and d = 3 gives 0.1
        SolrDocumentList results = new SolrDocumentList();
        SolrDocument near = new SolrDocument();
        near.setField("id", "near");
        near.setField("score", 0.5f);
        SolrDocument far = new SolrDocument();
        far.setField("id", "far");
        far.setField("score", 0.1f);
        results.add(far);
        results.add(near);
        when(queryResponse.getResults()).thenReturn(results);
        when(solrClient.query(eq("tickets"), any(SolrParams.class), eq(SolrRequest.METHOD.POST))).thenReturn(queryResponse);

        // When
        RankedList ranking = vectorSource.search(new float[]{1f}, 10);

        // Then: reported as 1 / (1 + d)
        assertThat(ranking.get(0).docId()).isEqualTo("near");
        assertThat(ranking.get(0).score()).isCloseTo(0.5, within(1e-6));
        assertThat(ranking.get(1).score()).isCloseTo(0.25, within(1e-6));
        assertThat(ranking.source()).isEqualTo(Sources.VECTOR);
    }

    @Test
    void shouldReportIoFailureAsSourceUnavailable() throws Exception {
        // Given
        when(solrClient.query(eq("tickets"), any(SolrParams.class), eq(SolrRequest.METHOD.POST)))
                .thenThrow(new IOException("timeout"));

        // When / Then
        assertThatThrownBy(() -> vectorSource.search(new float[]{1f}, 10))
                .isInstanceOf(SourceUnavailableException.class)
                .hasMessageContaining("timeout");
    }
}
