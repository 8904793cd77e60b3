package com.trippy.pojo.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 某个目的地下的候选物品集合（地点 + 活动）。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CandidateItems {

    private List<RecommendableItem> places = new ArrayList<>();

    private List<RecommendableItem> activities = new ArrayList<>();

    public static CandidateItems empty() {
        return new CandidateItems(new ArrayList<>(), new ArrayList<>());
    }

    /**
     * 地点在前、活动在后，保持各自的原始顺序。
     */
    public List<RecommendableItem> all() {
        List<RecommendableItem> all = new ArrayList<>(size());
        if (places != null) {
            all.addAll(places);
        }
        if (activities != null) {
            all.addAll(activities);
        }
        return all;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return size() == 0;
    }

    public int size() {
        return (places == null ? 0 : places.size()) + (activities == null ? 0 : activities.size());
    }
}
