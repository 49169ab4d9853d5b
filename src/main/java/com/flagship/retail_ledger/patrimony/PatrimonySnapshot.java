package com.flagship.retail_ledger.patrimony;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.retail_ledger.account.AccountKind;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Point-in-time net worth of the business.
 *
 * {@code assets.total - liabilities.total == netPatrimony} holds exactly.
 * Equity accounts are listed for information and take no part in the
 * equation.
 */
@Value
@Builder
public class PatrimonySnapshot {

    @JsonProperty("assets")
    Assets assets;

    @JsonProperty("liabilities")
    Liabilities liabilities;

    @JsonProperty("equity")
    Equity equity;

    @JsonProperty("net_patrimony")
    BigDecimal netPatrimony;

    @JsonProperty("computed_at")
    Instant computedAt;

    @Value
    @Builder
    public static class Assets {

        @JsonProperty("liquid")
        BigDecimal liquid;

        @JsonProperty("liquid_accounts")
        List<AccountLine> liquidAccounts;

        @JsonProperty("inventory")
        BigDecimal inventory;

        @JsonProperty("inventory_estimated")
        boolean inventoryEstimated;

        @JsonProperty("receivables")
        BigDecimal receivables;

        @JsonProperty("current_total")
        BigDecimal currentTotal;

        @JsonProperty("fixed")
        BigDecimal fixed;

        @JsonProperty("other")
        BigDecimal other;

        @JsonProperty("total")
        BigDecimal total;
    }

    @Value
    @Builder
    public static class Liabilities {

        @JsonProperty("payables")
        BigDecimal payables;

        @JsonProperty("pending_expenses")
        BigDecimal pendingExpenses;

        @JsonProperty("current_accounts")
        BigDecimal currentAccounts;

        @JsonProperty("current_total")
        BigDecimal currentTotal;

        @JsonProperty("long_term")
        BigDecimal longTerm;

        @JsonProperty("total")
        BigDecimal total;
    }

    @Value
    @Builder
    public static class Equity {

        @JsonProperty("accounts")
        List<AccountLine> accounts;

        @JsonProperty("total")
        BigDecimal total;
    }

    @Value
    public static class AccountLine {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("code")
        String code;

        @JsonProperty("name")
        String name;

        @JsonProperty("kind")
        AccountKind kind;

        @JsonProperty("balance")
        BigDecimal balance;
    }
}
