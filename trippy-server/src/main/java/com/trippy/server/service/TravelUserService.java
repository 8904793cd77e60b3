package com.trippy.server.service;

import com.baomidou.mybatisplus.extension.service.IService;
import com.trippy.pojo.entity.TravelUser;

import java.util.List;

public interface TravelUserService extends IService<TravelUser> {

    /**
     * 查询用户，不存在时按给定属性建档并返回。
     *
     * @param age           为空或非正数时使用默认年龄
     * @param preferences   初始喜欢列表，可为空
     * @param travelHistory 初始旅行记录，可为空
     */
    TravelUser getOrCreate(String userId, Integer age, List<String> preferences, List<String> travelHistory);
}
