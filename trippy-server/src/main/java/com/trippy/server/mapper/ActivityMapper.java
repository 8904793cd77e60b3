package com.trippy.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.trippy.pojo.entity.Activity;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface ActivityMapper extends BaseMapper<Activity> {
}
