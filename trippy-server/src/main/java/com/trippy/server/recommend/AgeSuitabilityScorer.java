package com.trippy.server.recommend;

import com.trippy.pojo.model.ItemFeatures;
import com.trippy.pojo.model.RecommendableItem;
import org.springframework.stereotype.Component;

/**
 * 年龄适配系数：按固定优先级匹配规则，命中第一条即返回，均未命中为 1.0。
 * Age suitability multiplier, always within [0.5, 1.5]. Stateless.
 *
 * 优先级：
 * 1. 高能量 / 夜生活 / 俱乐部：18-35 -> 1.3，36-50 -> 1.0，其它 -> 0.6
 * 2. 低能量 / 文化 / 博物馆：30 岁及以上 -> 1.1，否则 1.0
 * 3. 亲子：25-45 -> 1.2，25 岁以下 -> 0.9，其它 -> 1.1
 * 4. 教育：40 岁及以上 -> 1.15，否则 1.0
 * 5. 中等能量：25-45 -> 1.1，否则 1.0
 */
@Component
public class AgeSuitabilityScorer {

    public static final double MIN_MULTIPLIER = 0.5;
    public static final double MAX_MULTIPLIER = 1.5;

    public double multiplier(int age, RecommendableItem item) {
        ItemFeatures features = item.featuresOrEmpty();
        String energy = features.normalizedEnergyLevel();
        String ageProfile = features.normalizedAgeProfile();
        String category = item.normalizedCategory();

        double multiplier = 1.0;
        if ("high".equals(energy) || ageProfile.contains("nightlife") || category.contains("club")) {
            if (age >= 18 && age <= 35) {
                multiplier = 1.3;
            } else if (age >= 36 && age <= 50) {
                multiplier = 1.0;
            } else {
                multiplier = 0.6;
            }
        } else if ("low".equals(energy) || ageProfile.contains("cultural") || category.contains("museum")) {
            multiplier = age >= 30 ? 1.1 : 1.0;
        } else if (ageProfile.contains("family") || category.contains("family-friendly")) {
            if (age >= 25 && age <= 45) {
                multiplier = 1.2;
            } else if (age < 25) {
                multiplier = 0.9;
            } else {
                multiplier = 1.1;
            }
        } else if (ageProfile.contains("educational") || category.contains("educational")) {
            multiplier = age >= 40 ? 1.15 : 1.0;
        } else if ("medium".equals(energy)) {
            multiplier = (age >= 25 && age <= 45) ? 1.1 : 1.0;
        }
        return Math.max(MIN_MULTIPLIER, Math.min(MAX_MULTIPLIER, multiplier));
    }
}
