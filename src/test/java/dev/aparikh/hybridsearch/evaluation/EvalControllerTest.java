package dev.aparikh.hybridsearch.evaluation;

import dev.aparikh.hybridsearch.fusion.FusionConfig;
import dev.aparikh.hybridsearch.fusion.FusionMethod;
import dev.aparikh.hybridsearch.search.HybridSearchService;
import dev.aparikh.hybridsearch.search.SearchOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(EvalController.class)
class EvalControllerTest {

    private static final SearchOptions DEFAULTS = new SearchOptions(FusionConfig.defaults(), 10, 50, false, 20);

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private EvaluationService evaluationService;

    @MockitoBean
    private HybridSearchService searchService;

    @BeforeEach
    void setUp() {
        when(searchService.defaultOptions()).thenReturn(DEFAULTS);
    }

    @Test
    void shouldEvaluatePostedJudgments() throws Exception {
        EvalResult result = new EvalResult(
                List.of(new QueryEvaluation("printer offline", 0.5, 1.0, List.of("TCK-4", "TCK-1"), Set.of(), null)),
                new EvalResult.Aggregate(5, 0.5, 1.0, 1, 1),
                List.of());
        when(evaluationService.evaluate(anyList(), any(SearchOptions.class))).thenReturn(result);

        mockMvc.perform(post("/api/v1/eval")
                        .param("topN", "5")
                        .param("blend", "rrf")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[{\"query\": \"printer offline\", \"relevant\": [\"TCK-1\"]}]"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.aggregate.mrrAtN").value(0.5))
                .andExpect(jsonPath("$.aggregate.recallAtN").value(1.0))
                .andExpect(jsonPath("$.perQuery[0].retrieved[1]").value("TCK-1"));

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<RelevanceJudgment>> judgments = ArgumentCaptor.forClass(List.class);
        ArgumentCaptor<SearchOptions> options = ArgumentCaptor.forClass(SearchOptions.class);
        verify(evaluationService).evaluate(judgments.capture(), options.capture());
        assertThat(judgments.getValue()).containsExactly(RelevanceJudgment.of("printer offline", "TCK-1"));
        assertThat(options.getValue().topN()).isEqualTo(5);
        assertThat(options.getValue().fusion().strategy()).isEqualTo(FusionMethod.RRF);
    }

    @Test
    void shouldRejectUnreadableBody() throws Exception {
        mockMvc.perform(post("/api/v1/eval")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("bad_request"));

        verify(evaluationService, never()).evaluate(anyList(), any(SearchOptions.class));
    }

    @Test
    void shouldRejectNonPositiveTopN() throws Exception {
        mockMvc.perform(post("/api/v1/eval")
                        .param("topN", "0")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("invalid_configuration"));
    }
}
