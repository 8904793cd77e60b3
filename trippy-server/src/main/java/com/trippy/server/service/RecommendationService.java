package com.trippy.server.service;

import com.trippy.pojo.dto.ConfidenceCheckDTO;
import com.trippy.pojo.dto.GroupConfidenceCheckDTO;
import com.trippy.pojo.dto.GroupRecommendationRequestDTO;
import com.trippy.pojo.dto.RecommendationRequestDTO;
import com.trippy.pojo.dto.SwipeActionDTO;
import com.trippy.pojo.vo.ConfidenceVO;
import com.trippy.pojo.vo.GroupConfidenceVO;
import com.trippy.pojo.vo.RecommendedItemVO;

import java.util.List;

/**
 * 推荐相关的业务门面：在混合排序之上提供滑动记录、置信度检查与多人推荐。
 */
public interface RecommendationService {

    /**
     * 单用户推荐；未知用户按请求信息建档后再排序。
     */
    List<RecommendedItemVO> recommend(RecommendationRequestDTO request);

    /**
     * 记录一次滑动：like 记为 +1，其余一律记为 -1。
     */
    void recordSwipe(SwipeActionDTO action);

    /**
     * 统计用户在目的地上的喜欢 / 不喜欢次数，判断是否达到确认阈值。
     */
    ConfidenceVO checkConfidence(ConfidenceCheckDTO request);

    /**
     * 已喜欢的目的地物品（分数 1.0）在前，随后是用户未交互过的高分推荐。
     */
    List<RecommendedItemVO> highConfidenceItems(ConfidenceCheckDTO request);

    /**
     * 多人推荐：以发起人排序结果为基础，按同行者的喜欢记录加成后重排。
     */
    List<RecommendedItemVO> groupRecommend(GroupRecommendationRequestDTO request);

    /**
     * 多人置信度检查，所有参与者都达标时 allReady 为 true。
     */
    GroupConfidenceVO checkGroupConfidence(GroupConfidenceCheckDTO request);
}
