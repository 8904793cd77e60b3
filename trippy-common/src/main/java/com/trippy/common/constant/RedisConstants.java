package com.trippy.common.constant;

public class RedisConstants {

    private RedisConstants() {
    }

    /** 目的地候选集缓存前缀 cache:candidates:{destination 小写} */
    public static final String CACHE_CANDIDATES_KEY = "cache:candidates:";

    /** 候选集缓存 TTL（分钟） */
    public static final long CACHE_CANDIDATES_TTL = 10L;

    /** 地点缓存前缀 cache:place:{id} */
    public static final String CACHE_PLACE_KEY = "cache:place:";

    /** 活动缓存前缀 cache:activity:{id} */
    public static final String CACHE_ACTIVITY_KEY = "cache:activity:";

    /** 单个物品缓存 TTL（分钟） */
    public static final long CACHE_ITEM_TTL = 30L;

    /** 缓存空值 TTL（分钟） */
    public static final long CACHE_NULL_TTL = 2L;
}
