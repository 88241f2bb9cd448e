package com.dinepos.orderservice.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "pos")
@Data
public class PosConfig {

    private Printing printing = new Printing();
    private Seating seating = new Seating();
    private OrderNumber orderNumber = new OrderNumber();
    private Outbox outbox = new Outbox();

    @Data
    public static class Printing {
        // fills every line without a menu-configured printer
        private String orderPrinter = "DefaultPrinter";
        private String kitchenPrinter = "KitchenPrinter";
    }

    @Data
    public static class Seating {
        // counter whose staged seats are consumed when no seats are sent
        private String counterName = "DefaultCounter";
    }

    @Data
    public static class OrderNumber {
        private String strategy = "sequence"; // sequence or max-plus-one
    }

    @Data
    public static class Outbox {
        private boolean enabled = true;
        private int retentionDays = 1;
    }
}
