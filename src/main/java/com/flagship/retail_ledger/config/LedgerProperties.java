package com.flagship.retail_ledger.config;

import com.flagship.retail_ledger.account.AccountKind;
import com.flagship.retail_ledger.common.PaymentMethod;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Ledger configuration bound from the {@code ledger.*} properties.
 *
 * The cash fallback pairing lives here rather than in code: any two cash
 * accounts can be paired by their ledger codes.
 */
@ConfigurationProperties(prefix = "ledger")
@Validated
@Getter
@Setter
public class LedgerProperties {

    /**
     * Minimum length of adjustment descriptions and balance override reasons.
     */
    @Min(1)
    private int minDescriptionLength = 10;

    private Fallback fallback = new Fallback();

    private Accounts accounts = new Accounts();

    private Income income = new Income();

    @Valid
    private Inventory inventory = new Inventory();

    @Getter
    @Setter
    public static class Fallback {

        /**
         * Primary account code to fallback account code, e.g. 1101 (petty cash) to 1102 (vault cash).
         */
        private Map<String, String> pairs = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Accounts {

        /**
         * Creates the default accounts at startup when they do not exist yet.
         */
        private boolean seedDefaults = true;

        private List<DefaultAccount> defaults = new ArrayList<>();
    }

    @Getter
    @Setter
    public static class Income {

        /**
         * Account code that receives income paid with each method. Methods left
         * out (credit sales, for instance) do not move money.
         */
        private Map<PaymentMethod, String> methodAccounts = new EnumMap<>(PaymentMethod.class);
    }

    @Getter
    @Setter
    public static class Inventory {

        /**
         * Share of the sale price assumed as cost for items with no recorded cost.
         */
        @DecimalMin("0.00")
        @DecimalMax("1.00")
        private BigDecimal estimatedCostRatio = new BigDecimal("0.80");
    }

    @Getter
    @Setter
    public static class DefaultAccount {
        private String code;
        private String name;
        private AccountKind kind;
        private BigDecimal openingBalance = BigDecimal.ZERO;
    }
}
