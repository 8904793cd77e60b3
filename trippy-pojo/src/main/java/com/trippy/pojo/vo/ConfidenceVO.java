package com.trippy.pojo.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 用户在某个目的地上的滑动置信度统计。
 * meetsThreshold 表示喜欢数与喜欢占比都达到阈值，可以进入行程确认阶段。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConfidenceVO {

    private String userId;

    private int likes;

    private int dislikes;

    private int total;

    private double confidenceRatio;

    private boolean meetsThreshold;

    public static ConfidenceVO empty(String userId) {
        return new ConfidenceVO(userId, 0, 0, 0, 0.0, false);
    }
}
