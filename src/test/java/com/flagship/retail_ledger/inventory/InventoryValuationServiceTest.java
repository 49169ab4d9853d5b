package com.flagship.retail_ledger.inventory;

import com.flagship.retail_ledger.config.LedgerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class InventoryValuationServiceTest {

    private InventoryItemRepository itemRepository;
    private InventoryValuationService service;

    @BeforeEach
    void setUp() {
        itemRepository = mock(InventoryItemRepository.class);
        service = new InventoryValuationService(itemRepository, new LedgerProperties());
    }

    @Test
    @DisplayName("Items with a cost are valued at quantity times cost")
    void testValue_AtCost() {
        when(itemRepository.findByQuantityGreaterThan(0)).thenReturn(List.of(
            InventoryItemEntity.of("SH-001", "Shirt", 10, new BigDecimal("12000.00"), new BigDecimal("25000.00")),
            InventoryItemEntity.of("PA-001", "Pants", 3, new BigDecimal("30000.50"), new BigDecimal("60000.00"))
        ));

        InventoryValuation valuation = service.value();

        assertEquals(new BigDecimal("210001.50"), valuation.getTotal());
        assertFalse(valuation.isEstimated());
        assertEquals(2, valuation.getItemCount());
    }

    @Test
    @DisplayName("Items without a cost are estimated at 80% of the sale price, rounded to cents")
    void testValue_EstimatedFromPrice() {
        when(itemRepository.findByQuantityGreaterThan(0)).thenReturn(List.of(
            InventoryItemEntity.of("SH-001", "Shirt", 10, new BigDecimal("100.00"), new BigDecimal("200.00")),
            InventoryItemEntity.of("SO-001", "Socks", 3, null, new BigDecimal("10.01"))
        ));

        InventoryValuation valuation = service.value();

        // 3 x 10.01 x 0.80 = 24.024
        assertEquals(new BigDecimal("24.02"), valuation.getEstimatedValue());
        assertEquals(new BigDecimal("1024.02"), valuation.getTotal());
        assertTrue(valuation.isEstimated());
        assertEquals(1, valuation.getEstimatedItemCount());
    }

    @Test
    @DisplayName("No stock is worth zero")
    void testValue_Empty() {
        when(itemRepository.findByQuantityGreaterThan(0)).thenReturn(List.of());

        assertEquals(new BigDecimal("0.00"), service.value().getTotal());
    }
}
