package com.trippy.server.recommend;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.trippy.common.constant.RedisConstants;
import com.trippy.pojo.entity.Activity;
import com.trippy.pojo.entity.Interaction;
import com.trippy.pojo.entity.Place;
import com.trippy.pojo.entity.TravelUser;
import com.trippy.pojo.model.CandidateItems;
import com.trippy.pojo.model.ItemKind;
import com.trippy.pojo.model.RecommendableItem;
import com.trippy.server.mapper.ActivityMapper;
import com.trippy.server.mapper.PlaceMapper;
import com.trippy.server.service.InteractionService;
import com.trippy.server.service.TravelUserService;
import com.trippy.server.utils.CacheClient;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * 基于 MyBatis-Plus + Redis 缓存的数据访问实现。
 *
 * - 目的地按 place.location 不区分大小写匹配，活动通过所属地点归入目的地；
 * - 候选集按目的地（小写）缓存，物品按类型 + ID 缓存；
 * - 交互记录与用户列表不缓存，每次读取最新数据。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecommendationDataAccessorImpl implements RecommendationDataAccessor {

    private final PlaceMapper placeMapper;
    private final ActivityMapper activityMapper;
    private final TravelUserService travelUserService;
    private final InteractionService interactionService;
    private final CacheClient cacheClient;

    @Override
    public CandidateItems getCandidateItems(String destination) {
        if (!StringUtils.hasText(destination)) {
            return CandidateItems.empty();
        }
        String key = destination.trim().toLowerCase(Locale.ROOT);
        CandidateItems items = cacheClient.queryWithPassThrough(
                "candidates", RedisConstants.CACHE_CANDIDATES_KEY, key, CandidateItems.class,
                this::loadCandidates, RedisConstants.CACHE_CANDIDATES_TTL, TimeUnit.MINUTES);
        return items == null ? CandidateItems.empty() : items;
    }

    /**
     * 回源查询；目的地下没有任何物品时返回 null，交给缓存层做空值缓存。
     */
    CandidateItems loadCandidates(String destination) {
        List<Place> places = placeMapper.selectList(new LambdaQueryWrapper<Place>()
                .apply("LOWER(location) = {0}", destination)
                .orderByAsc(Place::getId));
        if (places.isEmpty()) {
            log.debug("目的地无地点: destination={}", destination);
            return null;
        }
        List<String> placeIds = places.stream().map(Place::getId).collect(Collectors.toList());
        List<Activity> activities = activityMapper.selectList(new LambdaQueryWrapper<Activity>()
                .in(Activity::getPlaceId, placeIds)
                .orderByAsc(Activity::getId));

        List<RecommendableItem> placeItems = new ArrayList<>(places.size());
        for (Place place : places) {
            placeItems.add(RecommendableItem.ofPlace(place));
        }
        List<RecommendableItem> activityItems = new ArrayList<>(activities.size());
        for (Activity activity : activities) {
            activityItems.add(RecommendableItem.ofActivity(activity));
        }
        return new CandidateItems(placeItems, activityItems);
    }

    @Override
    public List<Interaction> getUserInteractions(String userId) {
        if (!StringUtils.hasText(userId)) {
            return Collections.emptyList();
        }
        List<Interaction> interactions = interactionService.listByUser(userId);
        return interactions == null ? Collections.emptyList() : interactions;
    }

    @Override
    public Optional<RecommendableItem> getItemById(String itemId, ItemKind kind) {
        if (!StringUtils.hasText(itemId)) {
            return Optional.empty();
        }
        if (kind == ItemKind.PLACE) {
            return Optional.ofNullable(findPlace(itemId));
        }
        if (kind == ItemKind.ACTIVITY) {
            return Optional.ofNullable(findActivity(itemId));
        }
        RecommendableItem place = findPlace(itemId);
        return place != null ? Optional.of(place) : Optional.ofNullable(findActivity(itemId));
    }

    private RecommendableItem findPlace(String id) {
        return cacheClient.queryWithPassThrough(
                "item", RedisConstants.CACHE_PLACE_KEY, id, RecommendableItem.class,
                placeId -> {
                    Place place = placeMapper.selectById(placeId);
                    return place == null ? null : RecommendableItem.ofPlace(place);
                },
                RedisConstants.CACHE_ITEM_TTL, TimeUnit.MINUTES);
    }

    private RecommendableItem findActivity(String id) {
        return cacheClient.queryWithPassThrough(
                "item", RedisConstants.CACHE_ACTIVITY_KEY, id, RecommendableItem.class,
                activityId -> {
                    Activity activity = activityMapper.selectById(activityId);
                    return activity == null ? null : RecommendableItem.ofActivity(activity);
                },
                RedisConstants.CACHE_ITEM_TTL, TimeUnit.MINUTES);
    }

    @Override
    public List<TravelUser> getAllUsers() {
        List<TravelUser> users = travelUserService.list();
        return users == null ? Collections.emptyList() : users;
    }
}
