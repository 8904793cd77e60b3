package com.trippy.server.recommend;

import com.trippy.pojo.model.RecommendableItem;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * item_id -> score 分数表的通用操作。分数表一律用 LinkedHashMap，迭代顺序即排名顺序。
 */
public final class ScoreMaps {

    private ScoreMaps() {
    }

    /**
     * 按分数降序取前 n 个；排序稳定，同分保持原迭代顺序。
     */
    public static Map<String, Double> topN(Map<String, Double> scores, int n) {
        if (scores == null || scores.isEmpty() || n <= 0) {
            return Collections.emptyMap();
        }
        List<Map.Entry<String, Double>> entries = new ArrayList<>(scores.entrySet());
        entries.sort((a, b) -> Double.compare(b.getValue(), a.getValue()));

        Map<String, Double> result = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : entries) {
            if (result.size() >= n) {
                break;
            }
            result.put(e.getKey(), e.getValue());
        }
        return result;
    }

    public static Set<String> idsOf(Collection<RecommendableItem> items) {
        Set<String> ids = new HashSet<>();
        if (items == null) {
            return ids;
        }
        for (RecommendableItem item : items) {
            if (item != null && item.getId() != null) {
                ids.add(item.getId());
            }
        }
        return ids;
    }

    /**
     * 过量召回条数：topN * factor，溢出时取 Integer.MAX_VALUE。
     */
    public static int overFetch(int topN, int factor) {
        long n = (long) topN * factor;
        return n > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) n;
    }
}
