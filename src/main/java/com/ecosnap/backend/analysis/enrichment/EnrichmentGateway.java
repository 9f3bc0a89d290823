package com.ecosnap.backend.analysis.enrichment;

import com.ecosnap.backend.analysis.config.EnrichmentProperties;
import com.ecosnap.backend.analysis.model.EnrichedSignals;
import com.ecosnap.backend.analysis.model.FoodAssessment;
import com.ecosnap.backend.analysis.model.HeuristicBaseline;
import com.ecosnap.backend.analysis.model.ProductFacts;
import com.ecosnap.backend.analysis.model.Sourced;
import com.ecosnap.backend.analysis.model.SubScoreSet;
import com.ecosnap.backend.analysis.scoring.EnvironmentalScorer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 呼叫外部模型補強分數與文字。
 * - 在獨立 executor 上跑，超過 deadline 就 cancel(true)
 * - 模型輸出逐欄驗證，缺的欄位用 heuristic 補（AI/HEURISTIC 各自標記）
 * - 任何失敗都丟 {@link EnrichmentException}，由引擎改走 fallback
 */
@Slf4j
@Service
public class EnrichmentGateway {

    public static final String AI_DISABLED = "AI_DISABLED";

    private final EnrichmentProvider provider; // 沒設定 AI 時為 null
    private final EnrichmentResponseParser parser;
    private final FallbackHeuristicProvider heuristics;
    private final EnvironmentalScorer environmentalScorer;
    private final ThreadPoolTaskExecutor executor;
    private final EnrichmentTelemetry telemetry;
    private final Duration deadline;

    @Autowired
    public EnrichmentGateway(
            ObjectProvider<EnrichmentProvider> provider,
            EnrichmentResponseParser parser,
            FallbackHeuristicProvider heuristics,
            EnvironmentalScorer environmentalScorer,
            @Qualifier("enrichmentExecutor") ThreadPoolTaskExecutor executor,
            EnrichmentTelemetry telemetry,
            EnrichmentProperties props
    ) {
        this(provider.getIfAvailable(), parser, heuristics, environmentalScorer, executor, telemetry, props.getDeadline());
    }

    public EnrichmentGateway(
            EnrichmentProvider provider,
            EnrichmentResponseParser parser,
            FallbackHeuristicProvider heuristics,
            EnvironmentalScorer environmentalScorer,
            ThreadPoolTaskExecutor executor,
            EnrichmentTelemetry telemetry,
            Duration deadline
    ) {
        this.provider = provider;
        this.parser = parser;
        this.heuristics = heuristics;
        this.environmentalScorer = environmentalScorer;
        this.executor = executor;
        this.telemetry = telemetry;
        this.deadline = deadline;
    }

    public boolean isEnabled() {
        return provider != null;
    }

    public EnrichedSignals enrich(ProductFacts facts, HeuristicBaseline baseline) {
        if (provider == null) {
            throw new TransportException(AI_DISABLED, "no enrichment provider configured");
        }

        String fp = facts.fingerprint();
        long t0 = System.nanoTime();
        try {
            String text = callWithDeadline(facts, baseline);
            EnrichmentPayload payload = parser.parse(text);
            EnrichedSignals signals = merge(facts, baseline, payload);

            telemetry.ok(provider.providerCode(), provider.modelId(), fp, msSince(t0), payload.acceptedFields());
            return signals;
        } catch (EnrichmentException e) {
            Integer ra = (e instanceof TransportException te) ? te.retryAfterSec() : null;
            telemetry.fail(provider.providerCode(), provider.modelId(), fp, msSince(t0), e.getCode(), ra);
            throw e;
        }
    }

    private String callWithDeadline(ProductFacts facts, HeuristicBaseline baseline) {
        Future<String> f;
        try {
            f = executor.submit(() -> provider.generate(facts, baseline));
        } catch (TaskRejectedException e) {
            // ✅ 排隊滿了：不等，直接 fallback
            throw new TransportException("PROVIDER_BUSY", "enrichment executor saturated", null, e);
        }

        try {
            return f.get(deadline.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            throw new EnrichmentTimeoutException(deadline);
        } catch (ExecutionException e) {
            Throwable cause = (e.getCause() == null) ? e : e.getCause();
            throw EnrichmentErrorMapper.toException(cause);
        } catch (InterruptedException e) {
            f.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransportException("PROVIDER_INTERRUPTED", "interrupted while waiting for enrichment", null, e);
        }
    }

    /**
     * 逐欄合併。AI 只能覆蓋 baseline 已有的分數名稱（例如沒有營養資料時，AI 給的 health_score 會被忽略）。
     * 文字欄位缺的話，用合併後的分數重新產生 heuristic 文字。
     */
    EnrichedSignals merge(ProductFacts facts, HeuristicBaseline baseline, EnrichmentPayload p) {
        Map<String, Sourced<Integer>> scores = new LinkedHashMap<>();
        double diffSum = 0.0;
        int diffN = 0;

        for (Map.Entry<String, Integer> e : baseline.allScores().asMap().entrySet()) {
            Integer ai = p.subScores().get(e.getKey());
            if (ai != null) {
                scores.put(e.getKey(), Sourced.ai(ai));
                diffSum += Math.abs(ai - e.getValue());
                diffN++;
            } else {
                scores.put(e.getKey(), Sourced.heuristic(e.getValue()));
            }
        }

        boolean anyText = p.certifications() != null || p.insights() != null
                          || p.recommendations() != null || p.impactSummary() != null;
        if (diffN == 0 && !anyText) {
            throw new SchemaValidationException("NO_APPLICABLE_SCHEMA_FIELD");
        }

        HeuristicBaseline merged = mergedBaseline(baseline, scores);

        Sourced<List<String>> certs = (p.certifications() != null)
                ? Sourced.ai(p.certifications())
                : Sourced.heuristic(heuristics.certifications(facts));
        Sourced<List<String>> insights = (p.insights() != null)
                ? Sourced.ai(p.insights())
                : Sourced.heuristic(heuristics.insights(facts, merged));
        Sourced<List<String>> recs = (p.recommendations() != null)
                ? Sourced.ai(p.recommendations())
                : Sourced.heuristic(heuristics.recommendations(facts, merged));
        Sourced<String> summary = (p.impactSummary() != null)
                ? Sourced.ai(p.impactSummary())
                : Sourced.heuristic(heuristics.impactSummary(merged));

        return new EnrichedSignals(
                scores,
                certs,
                insights,
                recs,
                summary,
                true,
                provider.providerCode(),
                null,
                diffN == 0 ? null : diffSum / diffN
        );
    }

    private HeuristicBaseline mergedBaseline(HeuristicBaseline baseline, Map<String, Sourced<Integer>> scores) {
        SubScoreSet env = baseline.environmental();
        int overall = baseline.environmentalOverall();
        if (env != null) {
            env = overlay(env, scores);
            overall = environmentalScorer.overall(env);
        }

        FoodAssessment food = baseline.food();
        if (food != null) {
            food = food.withScores(overlay(food.scores(), scores));
        }
        return new HeuristicBaseline(env, overall, food);
    }

    private static SubScoreSet overlay(SubScoreSet base, Map<String, Sourced<Integer>> scores) {
        SubScoreSet out = base;
        for (String name : base.names()) {
            Sourced<Integer> s = scores.get(name);
            if (s != null && s.fromAi()) out = out.with(name, s.value());
        }
        return out;
    }

    private static long msSince(long t0) {
        return (System.nanoTime() - t0) / 1_000_000;
    }
}
