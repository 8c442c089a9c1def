package com.fastdispatch.model.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

@TableName("alert_event")
@Data
public class AlertEventEntity {

    @TableId(type = IdType.AUTO)
    private Long id;

    /** 创建时间（UTC） */
    private LocalDateTime createdAt;

    /** 事件 JSON */
    private String payload;
}
