package com.trippy.server.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.trippy.pojo.entity.Interaction;
import com.trippy.pojo.model.ItemKind;

import java.util.List;

public interface InteractionService extends IService<Interaction> {

    /**
     * 用户全部交互，按写入顺序返回。
     */
    List<Interaction> listByUser(String userId);

    /**
     * 追加一条交互记录（时间戳取当前时间），同一物品重复滑动不去重。
     */
    Interaction append(String userId, String itemId, ItemKind itemType, int rating);
}
