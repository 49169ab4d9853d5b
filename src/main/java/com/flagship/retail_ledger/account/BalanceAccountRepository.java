package com.flagship.retail_ledger.account;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BalanceAccountRepository extends JpaRepository<BalanceAccountEntity, UUID> {

    /**
     * Loads an account with a row lock (SELECT ... FOR UPDATE) held until the
     * surrounding transaction ends. Every balance mutation goes through here.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT a FROM BalanceAccountEntity a WHERE a.id = :id")
    Optional<BalanceAccountEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<BalanceAccountEntity> findByCode(String code);

    boolean existsByCode(String code);

    List<BalanceAccountEntity> findByActiveTrueOrderByCodeAsc();

    @Query("SELECT a FROM BalanceAccountEntity a WHERE a.active = true AND a.kind IN :kinds AND a.balance < 0")
    List<BalanceAccountEntity> findNegative(@Param("kinds") Collection<AccountKind> kinds);
}
