package com.ecosnap.backend.analysis.controller;

import com.ecosnap.backend.analysis.ProductFixtures;
import com.ecosnap.backend.analysis.aggregate.UnifiedAggregator;
import com.ecosnap.backend.analysis.enrichment.FallbackHeuristicProvider;
import com.ecosnap.backend.analysis.model.AnalysisOptions;
import com.ecosnap.backend.analysis.model.HeuristicBaseline;
import com.ecosnap.backend.analysis.model.ProductFacts;
import com.ecosnap.backend.analysis.model.SubScoreSet;
import com.ecosnap.backend.analysis.model.UnifiedAnalysisResult;
import com.ecosnap.backend.analysis.normalize.NormalizationException;
import com.ecosnap.backend.analysis.scoring.EnvironmentalScorer;
import com.ecosnap.backend.analysis.scoring.ScoringWeights;
import com.ecosnap.backend.analysis.service.SustainabilityAnalysisService;
import com.ecosnap.backend.analysis.web.AnalysisExceptionAdvice;
import com.ecosnap.backend.common.web.RequestIdFilter;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.not;
import static org.hamcrest.Matchers.emptyString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ActiveProfiles("test")
@WebMvcTest(controllers = ProductAnalysisController.class)
@Import({AnalysisExceptionAdvice.class, RequestIdFilter.class})
class ProductAnalysisControllerTest {

    @Autowired MockMvc mvc;

    @MockitoBean SustainabilityAnalysisService service;

    private static UnifiedAnalysisResult bottleResult() {
        EnvironmentalScorer env = new EnvironmentalScorer(new ScoringWeights());
        ProductFacts f = ProductFixtures.plasticBottle();
        SubScoreSet e = env.scoreEnvironment(f);
        HeuristicBaseline b = new HeuristicBaseline(e, env.overall(e), null);
        return new UnifiedAggregator(env).aggregate(f, e, null,
                new FallbackHeuristicProvider().fallbackEnrich(f, b, "AI_DISABLED"));
    }

    @Test
    void analyze_should_200_with_snake_case_result() throws Exception {
        Mockito.when(service.analyze(anyMap(), any(AnalysisOptions.class))).thenReturn(bottleResult());

        mvc.perform(post("/api/v1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"productName\":\"Spring Water 500ml\",\"packaging\":\"single-use plastic bottle\"}"))
                .andExpect(status().isOk())
                .andExpect(header().string(RequestIdFilter.HEADER, not(emptyString())))
                .andExpect(jsonPath("$.product_name").value("Spring Water 500ml"))
                .andExpect(jsonPath("$.analysis_type").value("environmental_only"))
                .andExpect(jsonPath("$.sustainability_grade").value("D"))
                .andExpect(jsonPath("$.eco_score.breakdown.packaging").value(40))
                .andExpect(jsonPath("$.enrichment.fallback_reason").value("AI_DISABLED"))
                .andExpect(jsonPath("$.food_analysis").doesNotExist());
    }

    @Test
    void environmental_param_should_reach_service_options() throws Exception {
        Mockito.when(service.analyze(anyMap(), eq(new AnalysisOptions(false)))).thenReturn(bottleResult());

        mvc.perform(post("/api/v1/analysis")
                        .param("environmental", "false")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Spring Water 500ml\"}"))
                .andExpect(status().isOk());

        Mockito.verify(service).analyze(anyMap(), eq(new AnalysisOptions(false)));
    }

    @Test
    void missing_product_name_should_400_with_code_and_requestId() throws Exception {
        Mockito.when(service.analyze(anyMap(), any(AnalysisOptions.class)))
                .thenThrow(NormalizationException.productNameRequired());

        mvc.perform(post("/api/v1/analysis")
                        .header(RequestIdFilter.HEADER, "RID-123")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"brand\":\"Acme\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(header().string(RequestIdFilter.HEADER, "RID-123"))
                .andExpect(jsonPath("$.errorCode").value("PRODUCT_NAME_REQUIRED"))
                .andExpect(jsonPath("$.requestId").value("RID-123"));
    }

    @Test
    void non_object_body_should_400_INVALID_BODY() throws Exception {
        mvc.perform(post("/api/v1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("[1,2,3]"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("INVALID_BODY"));
    }

    @Test
    void unexpected_error_should_500_without_leaking_message() throws Exception {
        Mockito.when(service.analyze(anyMap(), any(AnalysisOptions.class)))
                .thenThrow(new IllegalStateException("db password is hunter2"));

        mvc.perform(post("/api/v1/analysis")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"X\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.errorCode").value("INTERNAL_ERROR"))
                .andExpect(jsonPath("$.message").value("unexpected error"));
    }

    @Test
    void unsafe_request_id_should_be_replaced() throws Exception {
        Mockito.when(service.analyze(anyMap(), any(AnalysisOptions.class)))
                .thenThrow(NormalizationException.productNameRequired());

        mvc.perform(post("/api/v1/analysis")
                        .header(RequestIdFilter.HEADER, "bad id\r\ninjected")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(header().string(RequestIdFilter.HEADER, not("bad id\r\ninjected")))
                .andExpect(jsonPath("$.requestId").value(not("bad id\r\ninjected")));
    }
}
