package com.ecosnap.backend.analysis.enrichment;

import com.ecosnap.backend.analysis.model.HeuristicBaseline;
import com.ecosnap.backend.analysis.model.ProductFacts;

/**
 * 外部生成式模型。只負責把請求送出去、拿回文字；驗證交給 {@link EnrichmentResponseParser}。
 */
public interface EnrichmentProvider {

    String providerCode();

    String modelId();

    /**
     * @return 模型輸出的原始文字（可能包 markdown fence）
     * @throws Exception 網路、HTTP 或拒答；由 gateway 統一轉換
     */
    String generate(ProductFacts facts, HeuristicBaseline baseline) throws Exception;
}
