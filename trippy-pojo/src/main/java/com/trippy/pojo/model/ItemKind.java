package com.trippy.pojo.model;

import com.baomidou.mybatisplus.annotation.EnumValue;

/**
 * 可推荐物品的类型标识（地点 / 活动）。
 * Explicit discriminator for {@link RecommendableItem}; persisted as its lowercase code.
 */
public enum ItemKind {

    PLACE("place"),

    ACTIVITY("activity");

    @EnumValue
    private final String code;

    ItemKind(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }

    /**
     * 按持久化编码解析，未知编码返回 null。
     */
    public static ItemKind fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (ItemKind kind : values()) {
            if (kind.code.equalsIgnoreCase(code.trim())) {
                return kind;
            }
        }
        return null;
    }
}
