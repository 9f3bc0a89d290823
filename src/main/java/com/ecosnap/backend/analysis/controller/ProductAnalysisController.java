package com.ecosnap.backend.analysis.controller;

import com.ecosnap.backend.analysis.model.AnalysisOptions;
import com.ecosnap.backend.analysis.model.UnifiedAnalysisResult;
import com.ecosnap.backend.analysis.service.SustainabilityAnalysisService;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@Tag(name = "Analysis", description = "Unified sustainability analysis (environment + nutrition)")
@RequiredArgsConstructor
@RestController
@RequestMapping("/api/v1/analysis")
public class ProductAnalysisController {

    private final SustainabilityAnalysisService service;

    /**
     * body：任意 key 寫法的商品資料（productName / product_name / Origin-Country ...）。
     * environmental=false：跳過環境評分（只在有營養資料時生效）。
     */
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public UnifiedAnalysisResult analyze(
            @RequestBody Map<String, Object> body,
            @RequestParam(value = "environmental", defaultValue = "true") boolean environmental
    ) {
        return service.analyze(body, new AnalysisOptions(environmental));
    }
}
