package com.trippy.server.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.trippy.pojo.entity.TravelUser;
import org.apache.ibatis.annotations.Mapper;

@Mapper
public interface TravelUserMapper extends BaseMapper<TravelUser> {
}
