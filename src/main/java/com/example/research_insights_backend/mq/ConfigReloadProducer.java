package com.example.research_insights_backend.mq;

import com.example.research_insights_backend.dto.ConfigReloadMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.AmqpException;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * 配置刷新通知生产者 - 本节点刷新后通知集群内其它节点
 */
@Component
public class ConfigReloadProducer {
    private static final Logger log = LoggerFactory.getLogger(ConfigReloadProducer.class);

    private final RabbitTemplate rabbitTemplate;

    // 本节点标识，进程内唯一
    private final String nodeId = UUID.randomUUID().toString();

    public ConfigReloadProducer(RabbitTemplate rabbitTemplate) {
        this.rabbitTemplate = rabbitTemplate;
    }

    public String getNodeId() {
        return nodeId;
    }

    /**
     * 广播刷新通知，发送失败只记录日志，不影响本节点已完成的刷新
     *
     * @return 是否发送成功
     */
    public boolean publishReload() {
        String messageId = UUID.randomUUID().toString();
        ConfigReloadMessage message = new ConfigReloadMessage(nodeId, System.currentTimeMillis());
        try {
            rabbitTemplate.convertAndSend(InsightMQConstants.CONFIG_EXCHANGE, "", message, msg -> {
                msg.getMessageProperties().setHeader(InsightMQConstants.HEADER_MESSAGE_ID, messageId);
                return msg;
            });
            log.info("[RabbitMQ] 已广播配置刷新通知 - MessageId: {}, Node: {}", messageId, nodeId);
            return true;
        } catch (AmqpException e) {
            log.warn("[RabbitMQ] 配置刷新通知发送失败，其它节点需手动刷新: {}", e.getMessage());
            return false;
        }
    }
}
