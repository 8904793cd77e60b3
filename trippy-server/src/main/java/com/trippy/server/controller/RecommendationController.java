package com.trippy.server.controller;

import com.trippy.common.result.Result;
import com.trippy.pojo.dto.ConfidenceCheckDTO;
import com.trippy.pojo.dto.GroupConfidenceCheckDTO;
import com.trippy.pojo.dto.GroupRecommendationRequestDTO;
import com.trippy.pojo.dto.RecommendationRequestDTO;
import com.trippy.pojo.dto.SwipeActionDTO;
import com.trippy.pojo.vo.ConfidenceVO;
import com.trippy.pojo.vo.GroupConfidenceVO;
import com.trippy.pojo.vo.RecommendedItemVO;
import com.trippy.server.service.RecommendationService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Collections;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "推荐接口")
public class RecommendationController {

    private static final String USER_ID_KEY = "userId";

    private final RecommendationService recommendationService;

    @GetMapping("/health")
    @Operation(summary = "健康检查")
    public Result<Map<String, String>> health() {
        return Result.success(Collections.singletonMap("status", "healthy"));
    }

    /**
     * 单用户目的地推荐。topN 为空时取默认值，小于等于 0 时返回空列表。
     */
    @PostMapping("/recommendations")
    @Operation(summary = "单用户推荐")
    public Result<List<RecommendedItemVO>> recommend(@RequestBody RecommendationRequestDTO request) {
        if (request.getUser() != null) {
            MDC.put(USER_ID_KEY, request.getUser().getUserId());
        }
        return Result.success(recommendationService.recommend(request));
    }

    @PostMapping("/swipe")
    @Operation(summary = "记录滑动（喜欢 / 不喜欢）")
    public Result<Boolean> swipe(@RequestBody SwipeActionDTO action) {
        MDC.put(USER_ID_KEY, action.getUserId());
        recommendationService.recordSwipe(action);
        return Result.success(true);
    }

    @PostMapping("/confidence-check")
    @Operation(summary = "单用户置信度检查")
    public Result<ConfidenceVO> checkConfidence(@RequestBody ConfidenceCheckDTO request) {
        MDC.put(USER_ID_KEY, request.getUserId());
        return Result.success(recommendationService.checkConfidence(request));
    }

    @PostMapping("/high-confidence-items")
    @Operation(summary = "已喜欢物品 + 高置信度推荐")
    public Result<List<RecommendedItemVO>> highConfidenceItems(@RequestBody ConfidenceCheckDTO request) {
        MDC.put(USER_ID_KEY, request.getUserId());
        return Result.success(recommendationService.highConfidenceItems(request));
    }

    @PostMapping("/multi-user-recommendations")
    @Operation(summary = "多人行程推荐")
    public Result<List<RecommendedItemVO>> groupRecommend(@RequestBody GroupRecommendationRequestDTO request) {
        MDC.put(USER_ID_KEY, request.getUserId());
        return Result.success(recommendationService.groupRecommend(request));
    }

    @PostMapping("/multi-user-confidence-check")
    @Operation(summary = "多人置信度检查")
    public Result<GroupConfidenceVO> checkGroupConfidence(@RequestBody GroupConfidenceCheckDTO request) {
        return Result.success(recommendationService.checkGroupConfidence(request));
    }
}
