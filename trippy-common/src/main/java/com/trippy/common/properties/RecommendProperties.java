package com.trippy.common.properties;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 推荐链路的可调参数。
 * Tunables for the hybrid recommendation pipeline and the confidence / group features built on it.
 *
 * 三路信号的融合权重（0.4 / 0.3 / 0.3）与过量召回倍数是固定策略，不在这里配置。
 */
@Data
@ConfigurationProperties(prefix = "trippy.recommend")
public class RecommendProperties {

    /**
     * 协同过滤取最相似的 K 个用户。
     */
    private int similarUserTopK = 10;

    /**
     * 语义查询最多使用的最近喜欢物品数。
     */
    private int maxQueryLikes = 5;

    /**
     * 请求未指定 topN 时的默认值。
     */
    private int defaultTopN = 20;

    /**
     * 新用户未提供年龄时的默认年龄。
     */
    private int defaultUserAge = 25;

    /**
     * 置信度检查：最少喜欢次数。
     */
    private int confidenceMinLikes = 20;

    /**
     * 置信度检查：最少喜欢占比。
     */
    private double confidenceMinRatio = 0.95;

    /**
     * 高置信度推荐的分数下限。
     */
    private double highConfidenceScore = 0.8;

    /**
     * 计算高置信度推荐时先取的排序条数。
     */
    private int highConfidenceTopN = 100;

    /**
     * 多人推荐：每个参与者喜欢该物品时的加成。
     */
    private double groupBoostStep = 0.1;

    /**
     * 多人推荐：加成上限。
     */
    private double groupBoostCap = 0.5;

    /**
     * 三路打分并行执行的线程数。
     */
    private int scoringThreads = 4;
}
