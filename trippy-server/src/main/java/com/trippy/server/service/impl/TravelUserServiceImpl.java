package com.trippy.server.service.impl;

import com.baomidou.mybatisplus.extension.service.impl.ServiceImpl;
import com.trippy.common.exception.BaseException;
import com.trippy.common.properties.RecommendProperties;
import com.trippy.common.result.ErrorCode;
import com.trippy.pojo.entity.TravelUser;
import com.trippy.server.mapper.TravelUserMapper;
import com.trippy.server.service.TravelUserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class TravelUserServiceImpl extends ServiceImpl<TravelUserMapper, TravelUser> implements TravelUserService {

    private final RecommendProperties recommendProperties;

    @Override
    public TravelUser getOrCreate(String userId, Integer age, List<String> preferences, List<String> travelHistory) {
        if (!StringUtils.hasText(userId)) {
            throw new BaseException(ErrorCode.INVALID_PARAM, "userId 不能为空");
        }
        TravelUser user = getById(userId);
        if (user != null) {
            return user;
        }
        user = new TravelUser();
        user.setId(userId);
        user.setAge(age == null || age <= 0 ? recommendProperties.getDefaultUserAge() : age);
        user.setPreferences(preferences == null ? new ArrayList<>() : new ArrayList<>(preferences));
        user.setTravelHistory(travelHistory == null ? new ArrayList<>() : new ArrayList<>(travelHistory));
        LocalDateTime now = LocalDateTime.now();
        user.setCreateTime(now);
        user.setUpdateTime(now);
        save(user);
        log.info("新用户建档: userId={}, age={}", userId, user.getAge());
        return user;
    }
}
