package com.trippy.server.recommend;

import com.trippy.pojo.model.RecommendableItem;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * 排序结果中的一项：最终分 + 各路信号分解，便于解释与排查。
 */
@Getter
@ToString
@AllArgsConstructor
public class ScoredItem {

    private final RecommendableItem item;

    /**
     * (0.4 * collab + 0.3 * content + 0.3 * semantic) * ageMultiplier，无固定上界。
     */
    private final double score;

    private final double collabScore;

    private final double contentScore;

    private final double semanticScore;

    private final double ageMultiplier;

    /**
     * 在保留信号分解的前提下替换最终分（多人推荐加成时使用）。
     */
    public ScoredItem withScore(double newScore) {
        return new ScoredItem(item, newScore, collabScore, contentScore, semanticScore, ageMultiplier);
    }
}
