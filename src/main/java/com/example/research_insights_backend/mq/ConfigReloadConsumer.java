package com.example.research_insights_backend.mq;

import com.example.research_insights_backend.dto.ConfigReloadMessage;
import com.example.research_insights_backend.service.SnapshotReloadService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

/**
 * 配置刷新通知消费者 - 收到其它节点的通知后刷新本节点快照
 */
@Component
public class ConfigReloadConsumer {
    private static final Logger log = LoggerFactory.getLogger(ConfigReloadConsumer.class);

    private final SnapshotReloadService snapshotReloadService;
    private final ConfigReloadProducer configReloadProducer;

    public ConfigReloadConsumer(SnapshotReloadService snapshotReloadService,
                                ConfigReloadProducer configReloadProducer) {
        this.snapshotReloadService = snapshotReloadService;
        this.configReloadProducer = configReloadProducer;
    }

    @RabbitListener(queues = "#{configReloadQueue.name}")
    public void onMessage(ConfigReloadMessage message) {
        if (message == null) {
            return;
        }
        if (configReloadProducer.getNodeId().equals(message.getOriginNodeId())) {
            // 本节点发出的通知，发送前已经刷新过
            log.debug("[RabbitMQ] 忽略本节点发出的刷新通知");
            return;
        }
        log.info("[RabbitMQ] 收到节点{}的配置刷新通知", message.getOriginNodeId());
        snapshotReloadService.reloadLocal();
    }
}
