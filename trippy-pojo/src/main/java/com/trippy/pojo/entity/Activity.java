package com.trippy.pojo.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import com.trippy.pojo.model.ItemFeatures;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 活动实体，对应 activity 表，通过 place_id 归属到某个地点（多对一）。
 */
@Data
@TableName(value = "activity", autoResultMap = true)
public class Activity {

    @TableId(type = IdType.INPUT)
    private String id;

    private String name;

    private String placeId;

    private String category;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private ItemFeatures features;

    private String description;

    private LocalDateTime createTime;

    private LocalDateTime updateTime;
}
