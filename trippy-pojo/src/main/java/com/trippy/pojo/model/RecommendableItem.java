package com.trippy.pojo.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.trippy.pojo.entity.Activity;
import com.trippy.pojo.entity.Place;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Locale;

/**
 * 可推荐物品：地点或活动的统一视图，由 {@link ItemKind} 显式区分。
 * A place or an activity, tagged by {@link #kind} so scorers never need to probe for fields.
 *
 * location 仅对 PLACE 有值，placeId 仅对 ACTIVITY 有值。
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecommendableItem {

    private ItemKind kind;

    private String id;

    private String name;

    private String category;

    private ItemFeatures features;

    private String description;

    private String location;

    private String placeId;

    public static RecommendableItem ofPlace(Place place) {
        return RecommendableItem.builder()
                .kind(ItemKind.PLACE)
                .id(place.getId())
                .name(place.getName())
                .category(place.getCategory())
                .features(place.getFeatures())
                .description(place.getDescription())
                .location(place.getLocation())
                .build();
    }

    public static RecommendableItem ofActivity(Activity activity) {
        return RecommendableItem.builder()
                .kind(ItemKind.ACTIVITY)
                .id(activity.getId())
                .name(activity.getName())
                .category(activity.getCategory())
                .features(activity.getFeatures())
                .description(activity.getDescription())
                .placeId(activity.getPlaceId())
                .build();
    }

    @JsonIgnore
    public boolean isPlace() {
        return kind == ItemKind.PLACE;
    }

    public String normalizedCategory() {
        return category == null ? "" : category.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * 特征为空时返回一个空特征对象，调用方无需判空。
     */
    public ItemFeatures featuresOrEmpty() {
        return features == null ? new ItemFeatures() : features;
    }
}
