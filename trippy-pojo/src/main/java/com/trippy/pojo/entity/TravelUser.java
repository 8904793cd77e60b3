package com.trippy.pojo.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.baomidou.mybatisplus.extension.handlers.JacksonTypeHandler;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * 旅行用户实体，对应 travel_user 表。
 * Travel user; id is assigned by the caller (front end user id).
 *
 * preferences 只是展示用的喜欢列表，打分时的偏好一律从 interaction 表实时推导。
 */
@Data
@TableName(value = "travel_user", autoResultMap = true)
public class TravelUser {

    @TableId(type = IdType.INPUT)
    private String id;

    private Integer age;

    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<String> preferences = new ArrayList<>();

    @TableField(typeHandler = JacksonTypeHandler.class)
    private List<String> travelHistory = new ArrayList<>();

    private LocalDateTime createTime;

    private LocalDateTime updateTime;
}
