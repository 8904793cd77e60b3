package com.trippy.server.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * 统一的业务指标记录器。
 *
 * 说明：
 * - 使用 Micrometer 的 MeterRegistry 记录 Counter / Timer；
 * - 记录失败只打 debug 日志，绝不影响推荐主流程；
 * - 指标命名参考「组件.业务.动作」，如 trippy.recommend.request。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsRecorder {

    private final MeterRegistry meterRegistry;

    /**
     * 记录一次排序请求的结果：ok 表示有结果，empty 表示无候选或无信号。
     */
    public void recordRecommendation(String outcome) {
        try {
            meterRegistry.counter("trippy.recommend.request", "outcome", safe(outcome)).increment();
        } catch (Exception e) {
            log.debug("记录推荐请求指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录一次排序请求耗时。
     */
    public void recordRecommendationLatencyMs(long latencyMs) {
        try {
            meterRegistry.timer("trippy.recommend.latency").record(latencyMs, TimeUnit.MILLISECONDS);
        } catch (Exception e) {
            log.debug("记录推荐耗时指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录某一路打分器异常后被降级为空结果。
     */
    public void recordScorerFailure(String scorer) {
        try {
            meterRegistry.counter("trippy.recommend.scorer.failure", "scorer", safe(scorer)).increment();
        } catch (Exception e) {
            log.debug("记录打分器失败指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录语义检索调用结果（success / fail / skipped）。
     */
    public void recordSemanticCall(String operation, String outcome, String reason) {
        try {
            meterRegistry.counter("trippy.semantic.call",
                    "operation", safe(operation),
                    "outcome", safe(outcome),
                    "reason", safe(reason)).increment();
        } catch (Exception e) {
            log.debug("记录语义检索指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录候选集 / 物品缓存命中情况。
     */
    public void recordCacheHit(String cache, boolean hit) {
        try {
            meterRegistry.counter("trippy.cache", "cache", safe(cache), "outcome", hit ? "hit" : "miss").increment();
        } catch (Exception e) {
            log.debug("记录缓存命中指标失败: {}", e.getMessage());
        }
    }

    /**
     * 记录滑动操作（like / dislike）。
     */
    public void recordSwipe(String action) {
        try {
            meterRegistry.counter("trippy.swipe", "action", safe(action)).increment();
        } catch (Exception e) {
            log.debug("记录滑动指标失败: {}", e.getMessage());
        }
    }

    private String safe(String s) {
        if (s == null || s.isBlank()) {
            return "unknown";
        }
        // tag 不宜过长，避免高基数
        return s.length() > 32 ? s.substring(0, 32) : s;
    }
}
