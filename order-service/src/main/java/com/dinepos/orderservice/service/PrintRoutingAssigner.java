package com.dinepos.orderservice.service;

import com.dinepos.orderservice.config.PosConfig;
import com.dinepos.orderservice.dto.OrderItemRequest;
import com.dinepos.orderservice.model.PrintChannel;
import com.dinepos.orderservice.model.PrinterAssignment;
import com.dinepos.orderservice.repository.MenuItemRepository;
import com.dinepos.orderservice.repository.PrinterAssignmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Decides which printer each line goes to. Lines whose menu item has no printer
 * are written blank first and backfilled with the channel default in one update.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PrintRoutingAssigner {

    private final PrinterAssignmentRepository printerAssignmentRepository;
    private final MenuItemRepository menuItemRepository;
    private final PosConfig posConfig;

    /**
     * Replaces the order's routing on the given channel.
     *
     * @return the stored routing, one row per line, ordered by line number
     */
    public List<PrinterAssignment> assign(int orderNo, List<OrderItemRequest> items, PrintChannel channel) {
        printerAssignmentRepository.deleteByOrderNoAndChannel(orderNo, channel);

        for (OrderItemRequest item : items) {
            int itemId = item.getItemCode() == null ? 0 : item.getItemCode();
            int slNo = item.getSlNo() == null ? 0 : item.getSlNo();
            String printer = menuItemRepository.findPrinterNameByItemId(itemId).orElse("");

            printerAssignmentRepository.save(PrinterAssignment.builder()
                    .orderNo(orderNo)
                    .slNo(slNo)
                    .itemId(itemId)
                    .printer(printer)
                    .channel(channel)
                    .build());
            log.debug("Line routed. orderNo={}, slNo={}, itemId={}, printer='{}'", orderNo, slNo, itemId, printer);
        }

        String defaultPrinter = defaultPrinterFor(channel);
        int backfilled = printerAssignmentRepository.assignDefaultPrinter(orderNo, channel, defaultPrinter);
        if (backfilled > 0) {
            log.debug("Default printer assigned. orderNo={}, channel={}, printer={}, lines={}",
                    orderNo, channel, defaultPrinter, backfilled);
        }

        return printerAssignmentRepository.findByOrderNoAndChannelOrderBySlNoAsc(orderNo, channel);
    }

    String defaultPrinterFor(PrintChannel channel) {
        return channel == PrintChannel.KITCHEN
                ? posConfig.getPrinting().getKitchenPrinter()
                : posConfig.getPrinting().getOrderPrinter();
    }
}
