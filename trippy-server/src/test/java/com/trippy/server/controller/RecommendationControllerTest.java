package com.trippy.server.controller;

import com.trippy.common.exception.BaseException;
import com.trippy.common.result.ErrorCode;
import com.trippy.pojo.dto.RecommendationRequestDTO;
import com.trippy.pojo.model.ItemKind;
import com.trippy.pojo.model.RecommendableItem;
import com.trippy.pojo.vo.RecommendedItemVO;
import com.trippy.server.handler.GlobalExceptionHandler;
import com.trippy.server.service.RecommendationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.Collections;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

/**
 * 控制器只做参数透传与 Result 包装，这里用 standalone MockMvc 验证序列化与异常映射。
 */
@ExtendWith(MockitoExtension.class)
class RecommendationControllerTest {

    @Mock
    private RecommendationService recommendationService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new RecommendationController(recommendationService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void health_shouldReportHealthy() throws Exception {
        mockMvc.perform(get("/api/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(0))
                .andExpect(jsonPath("$.data.status").value("healthy"));
    }

    @Test
    void recommendations_shouldWrapItemsInResult() throws Exception {
        RecommendableItem item = RecommendableItem.builder()
                .kind(ItemKind.PLACE).id("p1").name("Belem Tower").category("monument").location("Lisbon").build();
        when(recommendationService.recommend(any(RecommendationRequestDTO.class)))
                .thenReturn(Collections.singletonList(RecommendedItemVO.of(item, 0.42)));

        mockMvc.perform(post("/api/recommendations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user\":{\"userId\":\"u1\",\"age\":30},\"destination\":\"Lisbon\",\"topN\":5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(0))
                .andExpect(jsonPath("$.data[0].id").value("p1"))
                .andExpect(jsonPath("$.data[0].type").value("place"))
                .andExpect(jsonPath("$.data[0].location").value("Lisbon"))
                .andExpect(jsonPath("$.data[0].score").value(0.42));
    }

    @Test
    void missingParams_shouldBecomeErrorResult() throws Exception {
        when(recommendationService.recommend(any(RecommendationRequestDTO.class)))
                .thenThrow(new BaseException(ErrorCode.INVALID_PARAM, "destination 不能为空"));

        mockMvc.perform(post("/api/recommendations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"user\":{\"userId\":\"u1\"}}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(ErrorCode.INVALID_PARAM.getCode()));
    }
}
