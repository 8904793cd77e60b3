package com.trippy.pojo.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AccessLevel;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 物品特征：结构化的已知字段 + 保留未知键的扩展 Map。
 * Item features stored as a JSON column; keys follow the snake_case names used by the content pipeline.
 *
 * 打分逻辑只读取 normalized* 方法：统一小写、缺省能量等级视为 medium、缺省年龄画像视为空串。
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ItemFeatures {

    public static final String DEFAULT_ENERGY_LEVEL = "medium";

    /**
     * low / medium / high
     */
    @JsonProperty("energy_level")
    private String energyLevel;

    private List<String> tags = new ArrayList<>();

    /**
     * cultural / family-friendly / nightlife / educational，可为空
     */
    @JsonProperty("age_suitability_profile")
    private String ageSuitabilityProfile;

    @JsonProperty("price_range")
    private String priceRange;

    @Setter(AccessLevel.NONE)
    private Map<String, Object> extra = new LinkedHashMap<>();

    @JsonAnySetter
    public void putExtra(String key, Object value) {
        extra.put(key, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getExtra() {
        return extra;
    }

    public String normalizedEnergyLevel() {
        if (energyLevel == null || energyLevel.isBlank()) {
            return DEFAULT_ENERGY_LEVEL;
        }
        return energyLevel.trim().toLowerCase(Locale.ROOT);
    }

    public String normalizedAgeProfile() {
        if (ageSuitabilityProfile == null) {
            return "";
        }
        return ageSuitabilityProfile.trim().toLowerCase(Locale.ROOT);
    }

    public List<String> normalizedTags() {
        if (tags == null || tags.isEmpty()) {
            return List.of();
        }
        List<String> result = new ArrayList<>(tags.size());
        for (String tag : tags) {
            if (tag != null && !tag.isBlank()) {
                result.add(tag.trim().toLowerCase(Locale.ROOT));
            }
        }
        return result;
    }
}
