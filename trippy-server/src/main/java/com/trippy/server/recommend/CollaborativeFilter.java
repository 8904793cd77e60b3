package com.trippy.server.recommend;

import com.trippy.common.properties.RecommendProperties;
import com.trippy.pojo.entity.Interaction;
import com.trippy.pojo.entity.TravelUser;
import com.trippy.pojo.model.RecommendableItem;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 基于用户的协同过滤（user-user CF）。
 * User-based collaborative filtering over +1/-1 ratings.
 *
 * - 相似度：两个用户共同评价过的物品上的评分向量余弦值，负相关截断为 0；
 * - 推荐：把 Top-K 近邻喜欢过、目标用户未接触过的物品按相似度累加，再除以最大值归一到 (0, 1]。
 * 没有近邻或近邻没有可推荐物品时返回空表（冷启动），不是错误。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CollaborativeFilter {

    private final RecommendationDataAccessor dataAccessor;
    private final RecommendProperties recommendProperties;

    /**
     * 两个用户交互记录之间的相似度，取值 [0, 1]；没有共同物品时恰好为 0。
     * 同一物品有多条记录时，评分向量取最后一条。
     */
    public static double similarity(List<Interaction> interactionsA, List<Interaction> interactionsB) {
        Map<String, Integer> ratingsA = ratingVector(interactionsA);
        Map<String, Integer> ratingsB = ratingVector(interactionsB);
        if (ratingsA.isEmpty() || ratingsB.isEmpty()) {
            return 0.0;
        }

        double dot = 0.0;
        double normA = 0.0;
        double normB = 0.0;
        for (Map.Entry<String, Integer> e : ratingsA.entrySet()) {
            Integer rb = ratingsB.get(e.getKey());
            if (rb == null) {
                continue;
            }
            int ra = e.getValue();
            dot += (double) ra * rb;
            normA += (double) ra * ra;
            normB += (double) rb * rb;
        }
        if (normA == 0 || normB == 0) {
            return 0.0;
        }
        double cosine = dot / (Math.sqrt(normA) * Math.sqrt(normB));
        return Math.max(0.0, cosine);
    }

    /**
     * 找出与目标用户最相似的 topK 个用户，只保留相似度严格大于 0 的，按相似度降序（稳定排序）。
     */
    public List<SimilarUser> findSimilarUsers(TravelUser target,
                                              List<Interaction> targetInteractions,
                                              List<TravelUser> allUsers,
                                              int topK) {
        if (target == null || allUsers == null || allUsers.isEmpty() || topK <= 0) {
            return Collections.emptyList();
        }
        List<SimilarUser> similar = new ArrayList<>();
        for (TravelUser other : allUsers) {
            if (other == null || other.getId() == null || Objects.equals(other.getId(), target.getId())) {
                continue;
            }
            List<Interaction> otherInteractions = dataAccessor.getUserInteractions(other.getId());
            double sim = similarity(targetInteractions, otherInteractions);
            if (sim > 0) {
                similar.add(new SimilarUser(other, sim, otherInteractions));
            }
        }
        similar.sort(Comparator.comparingDouble(SimilarUser::getSimilarity).reversed());
        return similar.size() > topK ? new ArrayList<>(similar.subList(0, topK)) : similar;
    }

    public Map<String, Double> recommend(TravelUser target, List<RecommendableItem> candidates, int topN) {
        if (target == null) {
            return Collections.emptyMap();
        }
        return recommend(target, dataAccessor.getUserInteractions(target.getId()), candidates, topN);
    }

    /**
     * 协同过滤推荐，返回 item_id -> 分数（降序）。
     *
     * @param targetInteractions 目标用户的交互快照，由调用方读取一次后复用
     */
    public Map<String, Double> recommend(TravelUser target,
                                         List<Interaction> targetInteractions,
                                         List<RecommendableItem> candidates,
                                         int topN) {
        if (target == null || candidates == null || candidates.isEmpty() || topN <= 0) {
            return Collections.emptyMap();
        }
        List<SimilarUser> neighbours = findSimilarUsers(target, targetInteractions,
                dataAccessor.getAllUsers(), recommendProperties.getSimilarUserTopK());
        if (neighbours.isEmpty()) {
            log.debug("协同过滤无相似用户: userId={}", target.getId());
            return Collections.emptyMap();
        }

        Set<String> seen = new HashSet<>();
        if (targetInteractions != null) {
            for (Interaction inter : targetInteractions) {
                seen.add(inter.getItemId());
            }
        }

        Map<String, Double> scores = new LinkedHashMap<>();
        for (SimilarUser neighbour : neighbours) {
            for (Interaction inter : neighbour.getInteractions()) {
                if (!inter.isLike() || inter.getItemId() == null || seen.contains(inter.getItemId())) {
                    continue;
                }
                scores.merge(inter.getItemId(), neighbour.getSimilarity() * inter.getRating(), Double::sum);
            }
        }
        if (scores.isEmpty()) {
            return Collections.emptyMap();
        }

        double max = Collections.max(scores.values());
        if (max > 0) {
            scores.replaceAll((id, s) -> s / max);
        }

        Set<String> candidateIds = ScoreMaps.idsOf(candidates);
        scores.keySet().retainAll(candidateIds);

        log.debug("协同过滤完成: userId={}, neighbours={}, scored={}", target.getId(), neighbours.size(), scores.size());
        return ScoreMaps.topN(scores, topN);
    }

    private static Map<String, Integer> ratingVector(List<Interaction> interactions) {
        Map<String, Integer> vector = new LinkedHashMap<>();
        if (interactions == null) {
            return vector;
        }
        for (Interaction inter : interactions) {
            if (inter == null || inter.getItemId() == null || inter.getRating() == null) {
                continue;
            }
            vector.put(inter.getItemId(), inter.getRating());
        }
        return vector;
    }

    /**
     * 近邻用户及其交互快照，避免推荐阶段重复读库。
     */
    @Getter
    @AllArgsConstructor
    public static class SimilarUser {
        private final TravelUser user;
        private final double similarity;
        private final List<Interaction> interactions;
    }
}
