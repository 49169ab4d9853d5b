package com.flagship.retail_ledger.debt.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.debt.Debt;
import com.flagship.retail_ledger.debt.DebtKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class DebtResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("kind")
    DebtKind kind;

    @JsonProperty("description")
    String description;

    @JsonProperty("counterparty")
    String counterparty;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("amount_paid")
    BigDecimal amountPaid;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("invoice_date")
    LocalDate invoiceDate;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("is_paid")
    boolean paid;

    @JsonProperty("is_overdue")
    boolean overdue;

    @JsonProperty("paid_at")
    Instant paidAt;

    @JsonProperty("created_at")
    Instant createdAt;

    /**
     * @param today the day overdue is judged against
     */
    public static DebtResponse from(Debt debt, LocalDate today) {
        return DebtResponse.builder()
            .id(debt.getId())
            .kind(debt.getKind())
            .description(debt.getDescription())
            .counterparty(debt.getCounterparty())
            .amount(debt.getAmount())
            .amountPaid(debt.getAmountPaid())
            .balance(debt.getBalance())
            .invoiceDate(debt.getInvoiceDate())
            .dueDate(debt.getDueDate())
            .paid(debt.isPaid())
            .overdue(debt.isOverdue(today))
            .paidAt(debt.getPaidAt())
            .createdAt(debt.getCreatedAt())
            .build();
    }
}
