package com.flagship.retail_ledger.inventory;

import com.flagship.retail_ledger.common.Amounts;
import com.flagship.retail_ledger.config.LedgerProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Values the stock on hand at cost: {@code quantity x unitCost}, or
 * {@code quantity x unitPrice x ratio} when no cost is recorded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InventoryValuationService {

    private final InventoryItemRepository itemRepository;
    private final LedgerProperties properties;

    @Transactional(readOnly = true)
    public InventoryValuation value() {
        BigDecimal ratio = properties.getInventory().getEstimatedCostRatio();
        BigDecimal total = Amounts.zero();
        BigDecimal estimated = Amounts.zero();
        int items = 0;
        int estimatedItems = 0;

        for (InventoryItemEntity item : itemRepository.findByQuantityGreaterThan(0)) {
            BigDecimal quantity = BigDecimal.valueOf(item.getQuantity());
            items++;
            if (item.getUnitCost() != null) {
                total = total.add(quantity.multiply(item.getUnitCost()));
            } else {
                // cents are the unit of account; the ratio can leave a fraction of one
                BigDecimal value = quantity.multiply(item.getUnitPrice()).multiply(ratio)
                    .setScale(Amounts.SCALE, RoundingMode.HALF_EVEN);
                total = total.add(value);
                estimated = estimated.add(value);
                estimatedItems++;
            }
        }

        total = total.setScale(Amounts.SCALE, RoundingMode.UNNECESSARY);
        if (estimatedItems > 0) {
            log.debug("Inventory valued at {} ({} of {} items estimated from sale price)", total, estimatedItems, items);
        }
        return new InventoryValuation(total, estimated, items, estimatedItems);
    }
}
