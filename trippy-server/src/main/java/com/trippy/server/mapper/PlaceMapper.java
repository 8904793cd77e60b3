package com.trippy.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.trippy.pojo.entity.Place;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface PlaceMapper extends BaseMapper<Place> {
}
