package com.trippy.pojo.dto;

import lombok.Data;

/**
 * 滑动操作：action 为 like 记为 +1，其他取值一律记为 -1。
 */
@Data
public class SwipeActionDTO {

    private String userId;

    private String itemId;

    private String action;

    private String destination;
}
