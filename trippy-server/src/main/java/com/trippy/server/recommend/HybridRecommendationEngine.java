package com.trippy.server.recommend;

import com.trippy.common.properties.RecommendProperties;
import com.trippy.pojo.entity.Interaction;
import com.trippy.pojo.entity.TravelUser;
import com.trippy.pojo.model.CandidateItems;
import com.trippy.pojo.model.RecommendableItem;
import com.trippy.server.metrics.MetricsRecorder;
import com.trippy.server.semantic.SemanticSimilarityProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * 混合推荐引擎：协同过滤 + 内容特征 + 语义相似度三路融合，再乘以年龄适配系数。
 * Hybrid ranker; the single entry point that owns the combination policy.
 *
 * 流程：
 * 1. 读取目的地候选集（地点 + 活动），为空直接返回空列表；
 * 2. 尽力把候选集写入语义索引（失败不影响后续）；
 * 3. 三路打分器互不依赖，并行执行，各自过量召回 3 * topN；
 * 4. 三路 item_id 取并集，缺失记 0：base = 0.4 * collab + 0.3 * content + 0.3 * semantic；
 * 5. final = base * 年龄系数；
 * 6. 按 final 稳定降序（同分保持并集顺序），截取前 topN。
 *
 * 引擎本身无状态，不同用户/目的地的并发调用互不影响。
 */
@Component
@Slf4j
public class HybridRecommendationEngine {

    static final double COLLAB_WEIGHT = 0.4;
    static final double CONTENT_WEIGHT = 0.3;
    static final double SEMANTIC_WEIGHT = 0.3;
    static final int OVER_FETCH_FACTOR = 3;

    private final RecommendationDataAccessor dataAccessor;
    private final CollaborativeFilter collaborativeFilter;
    private final ContentBasedFilter contentBasedFilter;
    private final SemanticSimilarityProvider semanticProvider;
    private final AgeSuitabilityScorer ageScorer;
    private final RecommendProperties recommendProperties;
    private final MetricsRecorder metricsRecorder;
    private final Executor scoringExecutor;

    public HybridRecommendationEngine(RecommendationDataAccessor dataAccessor,
                                      CollaborativeFilter collaborativeFilter,
                                      ContentBasedFilter contentBasedFilter,
                                      SemanticSimilarityProvider semanticProvider,
                                      AgeSuitabilityScorer ageScorer,
                                      RecommendProperties recommendProperties,
                                      MetricsRecorder metricsRecorder,
                                      @Qualifier("recommendScoringExecutor") Executor scoringExecutor) {
        this.dataAccessor = dataAccessor;
        this.collaborativeFilter = collaborativeFilter;
        this.contentBasedFilter = contentBasedFilter;
        this.semanticProvider = semanticProvider;
        this.ageScorer = ageScorer;
        this.recommendProperties = recommendProperties;
        this.metricsRecorder = metricsRecorder;
        this.scoringExecutor = scoringExecutor;
    }

    /**
     * 为用户生成目的地推荐，返回按最终分非递增排列的结果，长度不超过 min(topN, 候选数)。
     * 任何情况下都不抛业务异常：无候选、topN 非法、冷启动都返回（可能为空的）列表。
     */
    public List<ScoredItem> getRecommendations(TravelUser user, String destination, int topN) {
        long startNs = System.nanoTime();
        if (user == null || topN <= 0 || destination == null || destination.isBlank()) {
            metricsRecorder.recordRecommendation("empty");
            return Collections.emptyList();
        }

        CandidateItems candidateItems = dataAccessor.getCandidateItems(destination);
        if (candidateItems == null || candidateItems.isEmpty()) {
            log.info("目的地无候选物品: userId={}, destination={}", user.getId(), destination);
            metricsRecorder.recordRecommendation("empty");
            return Collections.emptyList();
        }
        List<RecommendableItem> candidates = candidateItems.all();

        try {
            semanticProvider.upsert(candidates);
        } catch (RuntimeException e) {
            log.warn("候选集写入语义索引失败，继续排序: destination={}", destination, e);
        }

        List<Interaction> interactions = dataAccessor.getUserInteractions(user.getId());
        int fetch = ScoreMaps.overFetch(topN, OVER_FETCH_FACTOR);

        CompletableFuture<Map<String, Double>> collabFuture = scoreAsync("collab",
                () -> collaborativeFilter.recommend(user, interactions, candidates, fetch));
        CompletableFuture<Map<String, Double>> contentFuture = scoreAsync("content",
                () -> contentBasedFilter.recommend(interactions, candidates, fetch));
        CompletableFuture<Map<String, Double>> semanticFuture = scoreAsync("semantic",
                () -> semanticProvider.query(interactions, candidates, destination, fetch));

        Map<String, Double> collab = collabFuture.join();
        Map<String, Double> content = contentFuture.join();
        Map<String, Double> semantic = semanticFuture.join();

        List<ScoredItem> ranked = merge(user, candidates, collab, content, semantic);
        List<ScoredItem> result = ranked.size() > topN ? new ArrayList<>(ranked.subList(0, topN)) : ranked;

        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNs);
        metricsRecorder.recordRecommendationLatencyMs(latencyMs);
        metricsRecorder.recordRecommendation(result.isEmpty() ? "empty" : "ok");
        log.info("推荐完成: userId={}, destination={}, candidates={}, collab={}, content={}, semantic={}, returned={}, latencyMs={}",
                user.getId(), destination, candidates.size(), collab.size(), content.size(), semantic.size(),
                result.size(), latencyMs);
        return result;
    }

    /**
     * 三路分数融合 + 年龄系数，返回全部物品的稳定降序排列。
     */
    List<ScoredItem> merge(TravelUser user,
                           List<RecommendableItem> candidates,
                           Map<String, Double> collab,
                           Map<String, Double> content,
                           Map<String, Double> semantic) {
        Map<String, RecommendableItem> byId = new LinkedHashMap<>();
        for (RecommendableItem item : candidates) {
            if (item != null && item.getId() != null) {
                byId.putIfAbsent(item.getId(), item);
            }
        }

        Set<String> union = new LinkedHashSet<>();
        union.addAll(collab.keySet());
        union.addAll(content.keySet());
        union.addAll(semantic.keySet());

        int age = resolveAge(user);
        List<ScoredItem> scored = new ArrayList<>(union.size());
        for (String itemId : union) {
            RecommendableItem item = byId.get(itemId);
            if (item == null) {
                // 不在当前候选集中的物品直接忽略
                continue;
            }
            double c = collab.getOrDefault(itemId, 0.0);
            double t = content.getOrDefault(itemId, 0.0);
            double s = semantic.getOrDefault(itemId, 0.0);
            double base = COLLAB_WEIGHT * c + CONTENT_WEIGHT * t + SEMANTIC_WEIGHT * s;
            double multiplier = ageScorer.multiplier(age, item);
            scored.add(new ScoredItem(item, base * multiplier, c, t, s, multiplier));
        }
        scored.sort(Comparator.comparingDouble(ScoredItem::getScore).reversed());
        return scored;
    }

    private int resolveAge(TravelUser user) {
        Integer age = user.getAge();
        return (age == null || age <= 0) ? recommendProperties.getDefaultUserAge() : age;
    }

    private CompletableFuture<Map<String, Double>> scoreAsync(String scorer, Supplier<Map<String, Double>> supplier) {
        return CompletableFuture.supplyAsync(supplier, scoringExecutor)
                .thenApply(scores -> scores == null ? Collections.<String, Double>emptyMap() : scores)
                .exceptionally(ex -> {
                    log.warn("打分器执行失败，按空结果处理: scorer={}", scorer, ex);
                    metricsRecorder.recordScorerFailure(scorer);
                    return Collections.emptyMap();
                });
    }
}
