package com.trippy.pojo.vo;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.trippy.pojo.model.ItemFeatures;
import com.trippy.pojo.model.RecommendableItem;
import lombok.Data;

/**
 * 推荐结果视图 VO。
 * Recommended place or activity with its final score; location is set for places, placeId for activities.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
public class RecommendedItemVO {

    private String id;

    private String name;

    private String category;

    private String description;

    private ItemFeatures features;

    private Double score;

    /**
     * place / activity
     */
    private String type;

    private String location;

    private String placeId;

    public static RecommendedItemVO of(RecommendableItem item, double score) {
        RecommendedItemVO vo = new RecommendedItemVO();
        vo.setId(item.getId());
        vo.setName(item.getName());
        vo.setCategory(item.getCategory());
        vo.setDescription(item.getDescription() == null ? "" : item.getDescription());
        vo.setFeatures(item.getFeatures());
        vo.setScore(score);
        vo.setType(item.getKind() == null ? null : item.getKind().getCode());
        if (item.isPlace()) {
            vo.setLocation(item.getLocation());
        } else {
            vo.setPlaceId(item.getPlaceId());
        }
        return vo;
    }
}
