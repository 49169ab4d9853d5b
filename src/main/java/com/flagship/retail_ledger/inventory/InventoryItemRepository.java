package com.flagship.retail_ledger.inventory;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface InventoryItemRepository extends JpaRepository<InventoryItemEntity, UUID> {

    List<InventoryItemEntity> findByQuantityGreaterThan(int quantity);
}
