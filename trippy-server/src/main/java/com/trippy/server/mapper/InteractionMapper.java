package com.trippy.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.trippy.pojo.entity.Interaction;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface InteractionMapper extends BaseMapper<Interaction> {
}
