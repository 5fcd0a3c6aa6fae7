package io.fwaas.orchestrator;

import io.fwaas.orchestrator.config.OrchestratorProperties;
import org.springframework.amqp.core.ExchangeBuilder;
import org.springframework.amqp.core.FanoutExchange;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.QueueBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RabbitConfig {

    @Bean
    FanoutExchange agentExchange(OrchestratorProperties properties) {
        return ExchangeBuilder.fanoutExchange(properties.getRabbit().getAgentExchange())
            .durable(true)
            .build();
    }

    @Bean
    Queue pluginQueue(OrchestratorProperties properties) {
        return QueueBuilder.durable(properties.getRabbit().getPluginQueue()).build();
    }
}
