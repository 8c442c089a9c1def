package com.fastdispatch.mapper;

import com.baomidou.mybatisplus.core.mapper.BaseMapper;
import com.fastdispatch.model.entity.AlertEventEntity;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Select;

import java.util.List;

@Mapper
public interface AlertEventMapper extends BaseMapper<AlertEventEntity> {

    /**
     * 全部事件, 按 id 升序
     */
    @Select("""
        select id, created_at, payload from alert_event
        order by id asc
    """)
    List<AlertEventEntity> selectAllOrdered();
}
