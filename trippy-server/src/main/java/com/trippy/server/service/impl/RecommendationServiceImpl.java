package com.trippy.server.service.impl;

import com.trippy.common.exception.BaseException;
import com.trippy.common.properties.RecommendProperties;
import com.trippy.common.result.ErrorCode;
import com.trippy.pojo.dto.ConfidenceCheckDTO;
import com.trippy.pojo.dto.GroupConfidenceCheckDTO;
import com.trippy.pojo.dto.GroupRecommendationRequestDTO;
import com.trippy.pojo.dto.RecommendationRequestDTO;
import com.trippy.pojo.dto.SwipeActionDTO;
import com.trippy.pojo.dto.UserPreferenceDTO;
import com.trippy.pojo.entity.Interaction;
import com.trippy.pojo.entity.TravelUser;
import com.trippy.pojo.model.CandidateItems;
import com.trippy.pojo.model.ItemKind;
import com.trippy.pojo.model.RecommendableItem;
import com.trippy.pojo.vo.ConfidenceVO;
import com.trippy.pojo.vo.GroupConfidenceVO;
import com.trippy.pojo.vo.RecommendedItemVO;
import com.trippy.server.metrics.MetricsRecorder;
import com.trippy.server.recommend.HybridRecommendationEngine;
import com.trippy.server.recommend.RecommendationDataAccessor;
import com.trippy.server.recommend.ScoreMaps;
import com.trippy.server.recommend.ScoredItem;
import com.trippy.server.service.InteractionService;
import com.trippy.server.service.RecommendationService;
import com.trippy.server.service.TravelUserService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Service
@RequiredArgsConstructor
@Slf4j
public class RecommendationServiceImpl implements RecommendationService {

    private static final String ACTION_LIKE = "like";
    private static final double LIKED_ITEM_SCORE = 1.0;

    private final HybridRecommendationEngine engine;
    private final RecommendationDataAccessor dataAccessor;
    private final TravelUserService travelUserService;
    private final InteractionService interactionService;
    private final RecommendProperties recommendProperties;
    private final MetricsRecorder metricsRecorder;

    @Override
    public List<RecommendedItemVO> recommend(RecommendationRequestDTO request) {
        UserPreferenceDTO pref = request == null ? null : request.getUser();
        if (pref == null || !StringUtils.hasText(pref.getUserId())) {
            throw new BaseException(ErrorCode.INVALID_PARAM, "userId 不能为空");
        }
        String destination = requireDestination(request.getDestination());

        List<String> history = pref.getTravelHistory() == null || pref.getTravelHistory().isEmpty()
                ? Collections.singletonList(destination)
                : pref.getTravelHistory();
        TravelUser user = travelUserService.getOrCreate(pref.getUserId(), pref.getAge(), pref.getLikedItems(), history);

        int topN = request.getTopN() == null ? recommendProperties.getDefaultTopN() : request.getTopN();
        return toVOs(engine.getRecommendations(user, destination, topN));
    }

    @Override
    public void recordSwipe(SwipeActionDTO action) {
        if (action == null || !StringUtils.hasText(action.getUserId())) {
            throw new BaseException(ErrorCode.INVALID_PARAM, "userId 不能为空");
        }
        if (!StringUtils.hasText(action.getItemId())) {
            throw new BaseException(ErrorCode.SWIPE_ITEM_MISSING);
        }
        String destination = requireDestination(action.getDestination());
        travelUserService.getOrCreate(action.getUserId(), null, null, Collections.singletonList(destination));

        boolean like = ACTION_LIKE.equals(action.getAction());
        int rating = like ? Interaction.LIKE : Interaction.DISLIKE;

        CandidateItems candidates = dataAccessor.getCandidateItems(destination);
        ItemKind kind = ScoreMaps.idsOf(candidates.getPlaces()).contains(action.getItemId())
                ? ItemKind.PLACE
                : ItemKind.ACTIVITY;

        interactionService.append(action.getUserId(), action.getItemId(), kind, rating);
        metricsRecorder.recordSwipe(like ? "like" : "dislike");
        log.info("记录滑动: userId={}, itemId={}, kind={}, rating={}",
                action.getUserId(), action.getItemId(), kind.getCode(), rating);
    }

    @Override
    public ConfidenceVO checkConfidence(ConfidenceCheckDTO request) {
        if (request == null || !StringUtils.hasText(request.getUserId())) {
            throw new BaseException(ErrorCode.INVALID_PARAM, "userId 不能为空");
        }
        String destination = requireDestination(request.getDestination());
        Set<String> destinationItemIds = ScoreMaps.idsOf(dataAccessor.getCandidateItems(destination).all());
        return confidenceOf(request.getUserId(), destinationItemIds);
    }

    @Override
    public List<RecommendedItemVO> highConfidenceItems(ConfidenceCheckDTO request) {
        if (request == null || !StringUtils.hasText(request.getUserId())) {
            throw new BaseException(ErrorCode.INVALID_PARAM, "userId 不能为空");
        }
        String destination = requireDestination(request.getDestination());
        TravelUser user = travelUserService.getById(request.getUserId());
        if (user == null) {
            return Collections.emptyList();
        }

        List<Interaction> interactions = dataAccessor.getUserInteractions(user.getId());
        Set<String> likedIds = new LinkedHashSet<>();
        Set<String> interactedIds = new HashSet<>();
        for (Interaction interaction : interactions) {
            interactedIds.add(interaction.getItemId());
            if (interaction.isLike()) {
                likedIds.add(interaction.getItemId());
            }
        }

        Map<String, RecommendableItem> byId = new HashMap<>();
        for (RecommendableItem item : dataAccessor.getCandidateItems(destination).all()) {
            byId.putIfAbsent(item.getId(), item);
        }

        Map<String, RecommendedItemVO> result = new LinkedHashMap<>();
        for (String likedId : likedIds) {
            RecommendableItem item = byId.get(likedId);
            if (item != null) {
                result.putIfAbsent(likedId, RecommendedItemVO.of(item, LIKED_ITEM_SCORE));
            }
        }

        List<ScoredItem> ranked = engine.getRecommendations(user, destination, recommendProperties.getHighConfidenceTopN());
        for (ScoredItem scored : ranked) {
            String id = scored.getItem().getId();
            if (scored.getScore() >= recommendProperties.getHighConfidenceScore() && !interactedIds.contains(id)) {
                result.putIfAbsent(id, RecommendedItemVO.of(scored.getItem(), scored.getScore()));
            }
        }
        log.info("高置信度物品: userId={}, destination={}, liked={}, total={}",
                user.getId(), destination, likedIds.size(), result.size());
        return new ArrayList<>(result.values());
    }

    @Override
    public List<RecommendedItemVO> groupRecommend(GroupRecommendationRequestDTO request) {
        if (request == null || !StringUtils.hasText(request.getUserId())) {
            throw new BaseException(ErrorCode.INVALID_PARAM, "userId 不能为空");
        }
        String destination = requireDestination(request.getDestination());
        TravelUser user = travelUserService.getOrCreate(request.getUserId(), null, null,
                Collections.singletonList(destination));

        int topN = request.getTopN() == null ? recommendProperties.getDefaultTopN() : request.getTopN();
        if (topN <= 0 || dataAccessor.getCandidateItems(destination).isEmpty()) {
            return Collections.emptyList();
        }

        Map<String, Double> boosts = new HashMap<>();
        if (request.getParticipantPreferences() != null) {
            for (UserPreferenceDTO participant : request.getParticipantPreferences()) {
                if (participant == null || participant.getLikedItems() == null) {
                    continue;
                }
                for (String itemId : participant.getLikedItems()) {
                    boosts.merge(itemId, recommendProperties.getGroupBoostStep(), Double::sum);
                }
            }
        }

        List<ScoredItem> ranked = engine.getRecommendations(user, destination, ScoreMaps.overFetch(topN, 2));
        List<ScoredItem> boosted = new ArrayList<>(ranked.size());
        for (ScoredItem scored : ranked) {
            double boost = Math.min(boosts.getOrDefault(scored.getItem().getId(), 0.0),
                    recommendProperties.getGroupBoostCap());
            boosted.add(scored.withScore(scored.getScore() * (1.0 + boost)));
        }
        boosted.sort(Comparator.comparingDouble(ScoredItem::getScore).reversed());
        List<ScoredItem> top = boosted.size() > topN ? boosted.subList(0, topN) : boosted;
        return toVOs(top);
    }

    @Override
    public GroupConfidenceVO checkGroupConfidence(GroupConfidenceCheckDTO request) {
        if (request == null || request.getParticipantIds() == null || request.getParticipantIds().isEmpty()) {
            throw new BaseException(ErrorCode.PARTICIPANTS_MISSING);
        }
        String destination = requireDestination(request.getDestination());
        Set<String> destinationItemIds = ScoreMaps.idsOf(dataAccessor.getCandidateItems(destination).all());

        boolean allReady = true;
        List<ConfidenceVO> participants = new ArrayList<>(request.getParticipantIds().size());
        for (String participantId : request.getParticipantIds()) {
            ConfidenceVO confidence = confidenceOf(participantId, destinationItemIds);
            participants.add(confidence);
            if (!confidence.isMeetsThreshold()) {
                allReady = false;
            }
        }
        return new GroupConfidenceVO(allReady, participants);
    }

    private ConfidenceVO confidenceOf(String userId, Set<String> destinationItemIds) {
        if (!StringUtils.hasText(userId) || travelUserService.getById(userId) == null) {
            return ConfidenceVO.empty(userId);
        }
        int likes = 0;
        int dislikes = 0;
        for (Interaction interaction : dataAccessor.getUserInteractions(userId)) {
            if (!destinationItemIds.contains(interaction.getItemId())) {
                continue;
            }
            if (interaction.isLike()) {
                likes++;
            } else if (interaction.isDislike()) {
                dislikes++;
            }
        }
        int total = likes + dislikes;
        double ratio = total > 0 ? (double) likes / total : 0.0;
        boolean meets = likes >= recommendProperties.getConfidenceMinLikes()
                && ratio >= recommendProperties.getConfidenceMinRatio();
        return new ConfidenceVO(userId, likes, dislikes, total, ratio, meets);
    }

    private String requireDestination(String destination) {
        if (!StringUtils.hasText(destination)) {
            throw new BaseException(ErrorCode.INVALID_PARAM, "destination 不能为空");
        }
        return destination.trim();
    }

    private List<RecommendedItemVO> toVOs(List<ScoredItem> items) {
        List<RecommendedItemVO> result = new ArrayList<>(items.size());
        for (ScoredItem scored : items) {
            result.add(RecommendedItemVO.of(scored.getItem(), scored.getScore()));
        }
        return result;
    }
}
