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
 * 地点实体，对应 place 表。
 * location 即目的地城市，按不区分大小写匹配。
 */
@Data
@TableName(value = "place", autoResultMap = true)
public class Place {

    @TableId(type = IdType.INPUT)
    private String id;

    private String name;

    private String location;

    private String category;

    /**
     * 特征 JSON（energy_level / tags / age_suitability_profile / price_range ...）
     */
    @TableField(typeHandler = JacksonTypeHandler.class)
    private ItemFeatures features;

    private String description;

    private LocalDateTime createTime;

    private LocalDateTime updateTime;
}
