package com.example.research_insights_backend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 集群配置刷新通知
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ConfigReloadMessage {
    // 发起刷新的节点，收到自己发出的通知时跳过
    private String originNodeId;
    private long timestamp;
}
