package com.trippy.pojo.dto;

import lombok.Data;

/**
 * 单用户推荐请求。
 */
@Data
public class RecommendationRequestDTO {

    private UserPreferenceDTO user;

    private String destination;

    /**
     * 为空时使用配置的默认值；小于等于 0 时返回空列表。
     */
    private Integer topN;
}
