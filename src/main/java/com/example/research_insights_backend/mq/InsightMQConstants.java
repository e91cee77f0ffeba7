package com.example.research_insights_backend.mq;

/**
 * 配置刷新消息相关常量
 *
 * 刷新通知走 fanout 交换机：每个节点声明一个自己的匿名队列绑定到交换机，
 * 一条通知会被所有节点各收到一份。
 */
public final class InsightMQConstants {

    /** 配置刷新交换机名称 */
    public static final String CONFIG_EXCHANGE = "insights.config.exchange";

    /** 节点匿名队列名前缀 */
    public static final String CONFIG_QUEUE_PREFIX = "insights.config.reload.";

    /** 消息头：通知ID，用于日志追踪 */
    public static final String HEADER_MESSAGE_ID = "x-message-id";

    private InsightMQConstants() {}
}
