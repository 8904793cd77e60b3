package com.trippy.server.semantic;

import com.trippy.pojo.model.ItemFeatures;
import com.trippy.pojo.model.RecommendableItem;

import java.util.ArrayList;
import java.util.List;

/**
 * 物品的文本表示，用于生成 Embedding：
 * name + category + description + energy_level + age_suitability_profile + tags，空格拼接，空字段跳过。
 */
public final class SemanticText {

    private SemanticText() {
    }

    public static String of(RecommendableItem item) {
        ItemFeatures features = item.featuresOrEmpty();
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, item.getName());
        addIfPresent(parts, item.getCategory());
        addIfPresent(parts, item.getDescription());
        addIfPresent(parts, features.getEnergyLevel());
        addIfPresent(parts, features.getAgeSuitabilityProfile());
        if (features.getTags() != null) {
            List<String> tags = new ArrayList<>();
            for (String tag : features.getTags()) {
                addIfPresent(tags, tag);
            }
            addIfPresent(parts, String.join(" ", tags));
        }
        return String.join(" ", parts);
    }

    public static String destinationQuery(String destination) {
        return "places and activities in " + destination;
    }

    /**
     * 用户有喜欢记录、但这些物品都不在当前候选集中时使用的查询。
     */
    public static String placesQuery(String destination) {
        return "places in " + destination;
    }

    private static void addIfPresent(List<String> parts, String value) {
        if (value != null && !value.isBlank()) {
            parts.add(value.trim());
        }
    }
}
