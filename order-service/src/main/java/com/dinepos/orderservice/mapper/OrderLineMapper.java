package com.dinepos.orderservice.mapper;

import com.dinepos.orderservice.dto.OrderItemRequest;
import com.dinepos.orderservice.model.KotLine;
import com.dinepos.orderservice.model.OrderLine;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;
import org.mapstruct.ReportingPolicy;

/**
 * Submitted items to line rows. Missing numbers become 0 and missing text "",
 * the same way the register's own database layer stored them.
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface OrderLineMapper {

    @Mapping(target = "id", ignore = true)
    @Mapping(target = "orderNo", source = "orderNo")
    @Mapping(target = "slNo", source = "item.slNo", defaultValue = "0")
    @Mapping(target = "itemCode", source = "item.itemCode", defaultValue = "0")
    @Mapping(target = "itemName", source = "item.itemName", defaultValue = "")
    @Mapping(target = "qty", source = "item.qty", defaultValue = "0")
    @Mapping(target = "rate", source = "item.rate", defaultValue = "0")
    @Mapping(target = "amount", source = "item.amount", defaultValue = "0")
    @Mapping(target = "cost", source = "item.cost", defaultValue = "0")
    @Mapping(target = "vat", source = "item.vat", defaultValue = "0")
    @Mapping(target = "vatAmt", source = "item.vatAmt", defaultValue = "0")
    @Mapping(target = "taxLedger", source = "item.taxLedger", defaultValue = "0")
    @Mapping(target = "localizedName", source = "item.arabic", defaultValue = "")
    @Mapping(target = "notes", source = "item.notes", defaultValue = "")
    OrderLine toOrderLine(OrderItemRequest item, Integer orderNo);

    // KOT lines are linked to their ticket as well as the order
    @Mapping(target = "id", ignore = true)
    @Mapping(target = "kotId", source = "kotId")
    @Mapping(target = "orderNo", source = "orderNo")
    @Mapping(target = "slNo", source = "item.slNo", defaultValue = "0")
    @Mapping(target = "itemCode", source = "item.itemCode", defaultValue = "0")
    @Mapping(target = "itemName", source = "item.itemName", defaultValue = "")
    @Mapping(target = "qty", source = "item.qty", defaultValue = "0")
    @Mapping(target = "rate", source = "item.rate", defaultValue = "0")
    @Mapping(target = "amount", source = "item.amount", defaultValue = "0")
    @Mapping(target = "cost", source = "item.cost", defaultValue = "0")
    @Mapping(target = "vat", source = "item.vat", defaultValue = "0")
    @Mapping(target = "vatAmt", source = "item.vatAmt", defaultValue = "0")
    @Mapping(target = "taxLedger", source = "item.taxLedger", defaultValue = "0")
    @Mapping(target = "localizedName", source = "item.arabic", defaultValue = "")
    @Mapping(target = "notes", source = "item.notes", defaultValue = "")
    KotLine toKotLine(OrderItemRequest item, Long kotId, Integer orderNo);
}
