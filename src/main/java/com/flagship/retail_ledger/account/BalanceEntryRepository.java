package com.flagship.retail_ledger.account;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface BalanceEntryRepository extends JpaRepository<BalanceEntryEntity, Long> {

    List<BalanceEntryEntity> findByAccountIdOrderByIdAsc(UUID accountId);
}
