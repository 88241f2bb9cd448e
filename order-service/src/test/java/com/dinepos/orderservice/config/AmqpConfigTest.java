package com.dinepos.orderservice.config;

import org.junit.jupiter.api.Test;
import org.springframework.amqp.core.Binding;
import org.springframework.amqp.core.Queue;
import org.springframework.amqp.core.TopicExchange;
import org.springframework.amqp.support.converter.Jackson2JsonMessageConverter;
import org.springframework.amqp.support.converter.MessageConverter;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

class AmqpConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(AmqpConfig.class);

    @Test
    void declaresOnlyTheOrderEventsExchange() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(TopicExchange.class);
            assertThat(context.getBean(TopicExchange.class).getName()).isEqualTo(AmqpConfig.ORDER_EXCHANGE);
            assertThat(context).doesNotHaveBean(Queue.class);
            assertThat(context).doesNotHaveBean(Binding.class);
            assertThat(context.getBean(MessageConverter.class)).isInstanceOf(Jackson2JsonMessageConverter.class);
        });
    }
}
