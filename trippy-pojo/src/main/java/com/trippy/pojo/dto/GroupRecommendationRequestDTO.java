package com.trippy.pojo.dto;

import lombok.Data;

import java.util.ArrayList;
import java.util.List;

/**
 * 多人行程推荐请求：以发起人为主体排序，再按同行者的喜欢记录加成。
 */
@Data
public class GroupRecommendationRequestDTO {

    private String userId;

    private List<UserPreferenceDTO> participantPreferences = new ArrayList<>();

    private String destination;

    private Integer topN;
}
