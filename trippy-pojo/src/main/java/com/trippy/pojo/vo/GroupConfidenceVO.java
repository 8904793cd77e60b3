package com.trippy.pojo.vo;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 多人置信度检查结果：所有参与者都达标时 allReady 才为 true。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class GroupConfidenceVO {

    private boolean allReady;

    private List<ConfidenceVO> participants = new ArrayList<>();
}
