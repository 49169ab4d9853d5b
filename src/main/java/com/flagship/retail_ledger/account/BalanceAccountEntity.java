package com.flagship.retail_ledger.account;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for balance accounts.
 *
 * No setters: the balance only changes through {@link #updateFromDomain},
 * which is called with a domain object that already enforced the funds rule.
 * The version column turns a stale write into an optimistic locking failure.
 */
@Entity
@Table(
    name = "balance_accounts",
    indexes = {
        @Index(name = "idx_balance_accounts_kind", columnList = "kind")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BalanceAccountEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(nullable = false, unique = true, updatable = false, length = 20)
    private String code;

    @Column(nullable = false, length = 100)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 30)
    private AccountKind kind;

    @Column(nullable = false, precision = 19, scale = 2)
    private BigDecimal balance;

    @Column(nullable = false)
    private boolean active;

    @Version
    @Column(nullable = false)
    private long version;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    static BalanceAccountEntity fromDomain(BalanceAccount account) {
        return new BalanceAccountEntity(
            account.getId(),
            account.getCode(),
            account.getName(),
            account.getKind(),
            account.getBalance(),
            account.isActive(),
            0L,
            null, // createdAt - set by @PrePersist
            null  // updatedAt - set by @PrePersist
        );
    }

    public BalanceAccount toDomain() {
        return new BalanceAccount(id, code, name, kind, balance, active, createdAt, updatedAt);
    }

    /**
     * Copies the mutable state (balance, active flag) from the domain object.
     * Identity, code and kind never change.
     */
    void updateFromDomain(BalanceAccount account) {
        if (!this.id.equals(account.getId())) {
            throw new IllegalArgumentException("Cannot update account " + id + " from " + account.getId());
        }
        this.balance = account.getBalance();
        this.active = account.isActive();
    }
}
