package com.trippy.server.recommend;

import com.trippy.pojo.entity.Interaction;
import com.trippy.pojo.model.ItemFeatures;
import com.trippy.pojo.model.RecommendableItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 基于内容特征的推荐。
 * Content-based scoring: a weighted feature profile built from liked items, matched against each candidate.
 *
 * 画像只由喜欢（rating > 0）构建，不喜欢的记录完全不参与。
 * 画像为空时所有候选都给中性分 0.5，因此本打分器总是为每个候选返回分数。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ContentBasedFilter {

    public static final double NEUTRAL_SCORE = 0.5;

    /** 标签是比类别/能量/年龄画像更弱的信号 */
    private static final double TAG_WEIGHT = 0.5;

    private final RecommendationDataAccessor dataAccessor;

    /**
     * 从交互记录提取特征画像：小写特征 -> 权重。
     * 桶的值除以所有已处理喜欢记录的评分总和（不是桶的个数）。
     */
    public Map<String, Double> extractProfile(List<Interaction> interactions) {
        if (interactions == null || interactions.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, Double> weights = new LinkedHashMap<>();
        double total = 0.0;
        for (Interaction inter : interactions) {
            if (!inter.isLike()) {
                continue;
            }
            Optional<RecommendableItem> found = dataAccessor.getItemById(inter.getItemId(), inter.getItemType());
            if (found.isEmpty()) {
                continue;
            }
            RecommendableItem item = found.get();
            ItemFeatures features = item.featuresOrEmpty();
            double rating = inter.getRating();

            accumulate(weights, item.normalizedCategory(), rating);
            accumulate(weights, features.normalizedEnergyLevel(), rating);
            for (String tag : features.normalizedTags()) {
                accumulate(weights, tag, rating);
            }
            accumulate(weights, features.normalizedAgeProfile(), rating);
            total += rating;
        }
        if (total > 0) {
            final double divisor = total;
            weights.replaceAll((k, v) -> v / divisor);
        }
        return weights;
    }

    /**
     * 单个物品的内容分，取值 [0, 1]。
     * score / (matches + 1)：分母的 +1 是平滑项，单个强匹配不会直接顶到 1.0。
     */
    public double scoreItem(RecommendableItem item, Map<String, Double> profile) {
        if (profile == null || profile.isEmpty()) {
            return NEUTRAL_SCORE;
        }
        ItemFeatures features = item.featuresOrEmpty();
        double score = 0.0;
        int matches = 0;

        Double category = profile.get(item.normalizedCategory());
        if (category != null) {
            score += category;
            matches++;
        }
        Double energy = profile.get(features.normalizedEnergyLevel());
        if (energy != null) {
            score += energy;
            matches++;
        }
        for (String tag : features.normalizedTags()) {
            Double w = profile.get(tag);
            if (w != null) {
                score += w * TAG_WEIGHT;
                matches++;
            }
        }
        String ageProfile = features.normalizedAgeProfile();
        if (!ageProfile.isEmpty()) {
            Double w = profile.get(ageProfile);
            if (w != null) {
                score += w;
                matches++;
            }
        }

        if (matches == 0) {
            return 0.0;
        }
        return Math.min(1.0, Math.max(0.0, score / (matches + 1)));
    }

    /**
     * 为每个候选打分，按分数降序返回前 topN 个。
     */
    public Map<String, Double> recommend(List<Interaction> interactions, List<RecommendableItem> candidates, int topN) {
        if (candidates == null || candidates.isEmpty() || topN <= 0) {
            return Collections.emptyMap();
        }
        Map<String, Double> profile = extractProfile(interactions);
        Map<String, Double> scores = new LinkedHashMap<>();
        for (RecommendableItem item : candidates) {
            if (item == null || item.getId() == null) {
                continue;
            }
            scores.putIfAbsent(item.getId(), scoreItem(item, profile));
        }
        log.debug("内容打分完成: profileSize={}, scored={}", profile.size(), scores.size());
        return ScoreMaps.topN(scores, topN);
    }

    private static void accumulate(Map<String, Double> weights, String key, double rating) {
        if (key == null || key.isEmpty()) {
            return;
        }
        weights.merge(key, rating, Double::sum);
    }
}
