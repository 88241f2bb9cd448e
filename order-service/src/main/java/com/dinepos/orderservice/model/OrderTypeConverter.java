package com.dinepos.orderservice.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

// stored as the register's numeric option (1, 2, 3)
@Converter
public class OrderTypeConverter implements AttributeConverter<OrderType, Integer> {

    @Override
    public Integer convertToDatabaseColumn(OrderType attribute) {
        return attribute == null ? null : attribute.getCode();
    }

    @Override
    public OrderType convertToEntityAttribute(Integer dbData) {
        return OrderType.fromCode(dbData)
                .orElseThrow(() -> new IllegalStateException("Unknown order option in database: " + dbData));
    }
}
