package com.trippy.server.recommend;

import com.trippy.pojo.entity.Interaction;
import com.trippy.pojo.entity.TravelUser;
import com.trippy.pojo.model.CandidateItems;
import com.trippy.pojo.model.ItemKind;
import com.trippy.pojo.model.RecommendableItem;

import java.util.List;
import java.util.Optional;

/**
 * 推荐链路读取数据的唯一入口（只读）。
 * Read-only view of the rating store used by the scorers; every call reads the current snapshot.
 */
public interface RecommendationDataAccessor {

    /**
     * 目的地下的全部地点与活动；未知目的地返回空集合，不返回 null。
     */
    CandidateItems getCandidateItems(String destination);

    /**
     * 用户全部交互记录，按写入顺序返回；无记录返回空列表。
     */
    List<Interaction> getUserInteractions(String userId);

    /**
     * 按 ID 查询物品。ID 只在同类型内唯一，kind 为空时先查地点再查活动。
     */
    Optional<RecommendableItem> getItemById(String itemId, ItemKind kind);

    /**
     * 全部用户，用于协同过滤的近邻搜索。
     */
    List<TravelUser> getAllUsers();
}
