package com.example.research_insights_backend.mq;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.amqp.core.AnonymousQueue;
import org.springframework.amqp.core.Base64UrlNamingStrategy;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.BindingBuilder;
import org.springframework.amqp.core.FanoutExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.rabbit.annotation.EnableRabbit;
import org.springframework.amqp.rabbit.connection.ConnectionFactory;
import org.springframework.amqp.rabbit.core.RabbitTemplate;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * RabbitMQ配置类 - 配置刷新通知的广播
 *
 * 主要功能：
 * 1. 声明 fanout 交换机和本节点的匿名队列
 * 2. 配置消息序列化方式（JSON格式）
 */
@Configuration
@EnableRabbit
public class RabbitMQConfig {
    private static final Logger log = LoggerFactory.getLogger(RabbitMQConfig.class);

    /**
     * JSON消息转换器 - 直接收发 ConfigReloadMessage 对象
     */
    @Bean
    public Jackson2JsonMessageConverter jackson2JsonMessageConverter() {
        return new Jackson2JsonMessageConverter();
    }

    @Bean
    public RabbitTemplate rabbitTemplate(ConnectionFactory connectionFactory,
                                         Jackson2JsonMessageConverter converter) {
        RabbitTemplate template = new RabbitTemplate(connectionFactory);
        template.setMessageConverter(converter);
        template.setConfirmCallback((correlationData, ack, cause) -> {
            if (!ack) {
                log.error("[RabbitMQ] 配置刷新通知未确认: {}, cause: {}", correlationData, cause);
            }
        });
        return template;
    }

    /**
     * 配置刷新交换机 - Fanout类型，持久化
     */
    @Bean
    public FanoutExchange configExchange() {
        log.info("[RabbitMQ] Creating config exchange: {}", InsightMQConstants.CONFIG_EXCHANGE);
        return new FanoutExchange(InsightMQConstants.CONFIG_EXCHANGE, true, false);
    }

    /**
     * 本节点的刷新队列 - 非持久、排他、自动删除，节点下线后队列随之消失
     */
    @Bean
    public Queue configReloadQueue() {
        Queue queue = new AnonymousQueue(new Base64UrlNamingStrategy(InsightMQConstants.CONFIG_QUEUE_PREFIX));
        log.info("[RabbitMQ] Creating node reload queue: {}", queue.getName());
        return queue;
    }

    @Bean
    public Binding bindConfigReloadQueue(Queue configReloadQueue, FanoutExchange configExchange) {
        return BindingBuilder.bind(configReloadQueue).to(configExchange);
    }
}
