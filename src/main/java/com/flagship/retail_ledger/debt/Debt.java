package com.flagship.retail_ledger.debt;

import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A receivable or payable with incremental payment.
 *
 * {@code 0 <= amountPaid <= amount} holds for every instance. Overdue is not
 * stored: it depends on the day it is asked.
 */
@Value
public class Debt {
    UUID id;
    DebtKind kind;
    String description;
    String counterparty;
    BigDecimal amount;
    BigDecimal amountPaid;
    LocalDate invoiceDate;
    LocalDate dueDate;
    Instant paidAt;
    Instant createdAt;
    Instant updatedAt;

    public Debt(UUID id, DebtKind kind, String description, String counterparty, BigDecimal amount,
                BigDecimal amountPaid, LocalDate invoiceDate, LocalDate dueDate, Instant paidAt,
                Instant createdAt, Instant updatedAt) {
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("Debt amount must be positive: " + amount);
        }
        if (amountPaid == null || amountPaid.signum() < 0 || amountPaid.compareTo(amount) > 0) {
            throw new IllegalArgumentException(
                String.format("Amount paid %s must be between 0 and the debt amount %s", amountPaid, amount));
        }
        this.id = id;
        this.kind = kind;
        this.description = description;
        this.counterparty = counterparty;
        this.amount = amount;
        this.amountPaid = amountPaid;
        this.invoiceDate = invoiceDate;
        this.dueDate = dueDate;
        this.paidAt = paidAt;
        this.createdAt = createdAt;
        this.updatedAt = updatedAt;
    }

    public static Debt create(UUID id, DebtKind kind, String description, String counterparty, BigDecimal amount,
                              LocalDate invoiceDate, LocalDate dueDate) {
        Instant now = Instant.now();
        return new Debt(id, kind, description, counterparty, amount, BigDecimal.ZERO.setScale(amount.scale()),
            invoiceDate, dueDate, null, now, now);
    }

    public BigDecimal getBalance() {
        return amount.subtract(amountPaid);
    }

    public boolean isPaid() {
        return amountPaid.compareTo(amount) >= 0;
    }

    public boolean isOverdue(LocalDate today) {
        return dueDate != null && dueDate.isBefore(today) && !isPaid();
    }

    /**
     * @throws IllegalArgumentException if the payment exceeds the balance
     */
    public Debt applyPayment(BigDecimal payment, Instant at) {
        if (payment.signum() <= 0 || payment.compareTo(getBalance()) > 0) {
            throw new IllegalArgumentException(
                String.format("Payment %s must be positive and at most the balance %s", payment, getBalance()));
        }
        BigDecimal newPaid = amountPaid.add(payment);
        return new Debt(id, kind, description, counterparty, amount, newPaid, invoiceDate, dueDate,
            newPaid.compareTo(amount) == 0 ? at : null, createdAt, Instant.now());
    }
}
