package com.trippy.server.semantic;

import com.trippy.pojo.entity.Interaction;
import com.trippy.pojo.model.RecommendableItem;

import java.util.List;
import java.util.Map;

/**
 * 语义相似度提供方（外部协作方边界）。
 * Semantic similarity provider. Implementations must never throw: any failure or absence
 * is reported as an empty score map, which the ranker treats as "no semantic signal".
 */
public interface SemanticSimilarityProvider {

    /**
     * 以文本表示把物品写入向量索引，可重复调用；失败只记录日志，不向上抛出。
     */
    void upsert(List<RecommendableItem> items);

    /**
     * 基于用户最近喜欢的物品查询相似物品，排除已交互物品，只保留候选集内的物品。
     *
     * @return item_id -> [0, 1] 分数，降序，最多 topN 个
     */
    Map<String, Double> query(List<Interaction> interactions,
                              List<RecommendableItem> candidates,
                              String destination,
                              int topN);
}
