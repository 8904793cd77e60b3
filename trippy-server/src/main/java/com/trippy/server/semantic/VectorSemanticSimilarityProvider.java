package com.trippy.server.semantic;

import com.trippy.common.properties.RecommendProperties;
import com.trippy.common.properties.VectorProperties;
import com.trippy.pojo.entity.Interaction;
import com.trippy.pojo.model.RecommendableItem;
import com.trippy.server.metrics.MetricsRecorder;
import com.trippy.server.recommend.ScoreMaps;
import com.trippy.server.semantic.VectorIndexClient.VectorMatch;
import com.trippy.server.semantic.VectorIndexClient.VectorRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 基于 Embedding + 向量索引的语义相似度提供方。
 * Semantic similarity backed by an embedding endpoint and a Pinecone-compatible index.
 *
 * 说明：
 * - 未启用或配置不完整时视为“没有语义信号”，upsert 直接跳过、query 返回空表；
 * - 任意调用失败都在这里被捕获并降级，记录 WARN 日志与指标，不影响排序主流程；
 * - 索引使用 cosine 度量，分数理论区间 [-1, 1]，这里统一截断到 [0, 1] 再交给融合层。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class VectorSemanticSimilarityProvider implements SemanticSimilarityProvider {

    /** 向索引多要一些近邻，给“排除已交互 + 限定候选集”留出余量 */
    static final int QUERY_OVER_FETCH = 4;

    private final VectorProperties vectorProperties;
    private final RecommendProperties recommendProperties;
    private final EmbeddingClient embeddingClient;
    private final VectorIndexClient vectorIndexClient;
    private final MetricsRecorder metricsRecorder;

    public boolean isAvailable() {
        return vectorProperties.isEnabled() && embeddingClient.isConfigured() && vectorIndexClient.isConfigured();
    }

    @Override
    public void upsert(List<RecommendableItem> items) {
        if (items == null || items.isEmpty()) {
            return;
        }
        if (!isAvailable()) {
            metricsRecorder.recordSemanticCall("upsert", "skipped", "disabled");
            return;
        }
        try {
            List<RecommendableItem> indexable = new ArrayList<>(items.size());
            List<String> texts = new ArrayList<>(items.size());
            for (RecommendableItem item : items) {
                if (item == null || item.getId() == null || item.getKind() == null) {
                    continue;
                }
                indexable.add(item);
                texts.add(SemanticText.of(item));
            }
            if (indexable.isEmpty()) {
                return;
            }
            List<List<Double>> vectors = embeddingClient.embed(texts);
            List<VectorRecord> records = new ArrayList<>(indexable.size());
            for (int i = 0; i < indexable.size(); i++) {
                RecommendableItem item = indexable.get(i);
                records.add(new VectorRecord(vectorId(item), vectors.get(i), metadata(item)));
            }
            vectorIndexClient.upsert(records);
            metricsRecorder.recordSemanticCall("upsert", "success", "ok");
            log.debug("向量索引写入完成: count={}", records.size());
        } catch (VectorIndexException e) {
            metricsRecorder.recordSemanticCall("upsert", "fail", e.getErrorType());
            log.warn("向量索引写入失败，跳过: errorType={}, msg={}", e.getErrorType(), e.getMessage());
        } catch (RuntimeException e) {
            metricsRecorder.recordSemanticCall("upsert", "fail", "exception");
            log.warn("向量索引写入异常，跳过", e);
        }
    }

    @Override
    public Map<String, Double> query(List<Interaction> interactions,
                                     List<RecommendableItem> candidates,
                                     String destination,
                                     int topN) {
        if (topN <= 0 || candidates == null || candidates.isEmpty()) {
            return Collections.emptyMap();
        }
        if (!isAvailable()) {
            metricsRecorder.recordSemanticCall("query", "skipped", "disabled");
            return Collections.emptyMap();
        }
        try {
            String queryText = buildQueryText(interactions, candidates, destination);
            List<Double> vector = embeddingClient.embed(queryText);
            List<VectorMatch> matches = vectorIndexClient.query(vector, ScoreMaps.overFetch(topN, QUERY_OVER_FETCH));

            Set<String> seen = new HashSet<>();
            if (interactions != null) {
                for (Interaction inter : interactions) {
                    seen.add(inter.getItemId());
                }
            }
            Set<String> candidateIds = ScoreMaps.idsOf(candidates);

            Map<String, Double> scores = new LinkedHashMap<>();
            for (VectorMatch match : matches) {
                String itemId = itemIdOf(match);
                if (itemId == null || seen.contains(itemId) || !candidateIds.contains(itemId)) {
                    continue;
                }
                scores.putIfAbsent(itemId, clamp(match.getScore()));
            }
            metricsRecorder.recordSemanticCall("query", "success", "ok");
            return ScoreMaps.topN(scores, topN);
        } catch (VectorIndexException e) {
            metricsRecorder.recordSemanticCall("query", "fail", e.getErrorType());
            log.warn("语义检索失败，按无语义信号处理: errorType={}, msg={}", e.getErrorType(), e.getMessage());
            return Collections.emptyMap();
        } catch (RuntimeException e) {
            metricsRecorder.recordSemanticCall("query", "fail", "exception");
            log.warn("语义检索异常，按无语义信号处理", e);
            return Collections.emptyMap();
        }
    }

    /**
     * 查询文本：最近喜欢的若干物品的文本表示拼接；没有喜欢记录时退化为目的地通用查询。
     */
    String buildQueryText(List<Interaction> interactions, List<RecommendableItem> candidates, String destination) {
        List<Interaction> liked = new ArrayList<>();
        if (interactions != null) {
            for (Interaction inter : interactions) {
                if (inter.isLike()) {
                    liked.add(inter);
                }
            }
        }
        if (liked.isEmpty()) {
            return SemanticText.destinationQuery(destination);
        }
        liked.sort(Comparator.comparing(Interaction::getTimestamp,
                Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder())));

        Set<String> likedIds = new LinkedHashSet<>();
        for (Interaction inter : liked) {
            if (likedIds.size() >= recommendProperties.getMaxQueryLikes()) {
                break;
            }
            likedIds.add(inter.getItemId());
        }

        Map<String, RecommendableItem> byId = new HashMap<>();
        for (RecommendableItem item : candidates) {
            if (item != null && item.getId() != null) {
                byId.putIfAbsent(item.getId(), item);
            }
        }
        List<String> parts = new ArrayList<>();
        for (String id : likedIds) {
            RecommendableItem item = byId.get(id);
            if (item != null) {
                parts.add(SemanticText.of(item));
            }
        }
        return parts.isEmpty() ? SemanticText.placesQuery(destination) : String.join(" ", parts);
    }

    static String vectorId(RecommendableItem item) {
        return item.getKind().getCode() + "_" + item.getId();
    }

    private Map<String, String> metadata(RecommendableItem item) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("item_id", item.getId());
        metadata.put("item_type", item.getKind().getCode());
        metadata.put("name", item.getName() == null ? "" : item.getName());
        if (item.isPlace() && item.getLocation() != null) {
            metadata.put("location", item.getLocation());
        }
        return metadata;
    }

    private String itemIdOf(VectorMatch match) {
        if (match.getMetadata() != null && match.getMetadata().get("item_id") != null) {
            return match.getMetadata().get("item_id");
        }
        // 兼容没有写 metadata 的旧向量：place_{id} / activity_{id}
        String id = match.getId();
        if (id == null) {
            return null;
        }
        int idx = id.indexOf('_');
        return idx > 0 ? id.substring(idx + 1) : null;
    }

    private static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
