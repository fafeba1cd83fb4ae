package com.kreasipositif.ledgerservice.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Binds the {@code ledger} section from application.yml.
 * <p>
 * The service keeps everything in memory; these entries are the state it starts with.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "ledger")
public class LedgerSeedProperties {

    /** The organization that owns the imported statements. */
    private Company company = new Company();

    private List<ClientEntry> clients = new ArrayList<>();

    /** Manually entered ledger entries awaiting a bank statement. */
    private List<TransactionEntry> transactions = new ArrayList<>();

    private List<AliasEntry> aliases = new ArrayList<>();

    @Getter
    @Setter
    public static class Company {
        /** 12-digit business identification number. */
        private String bin = "";
        /** Settlement account (IBAN). */
        private String iban = "";
    }

    @Getter
    @Setter
    public static class ClientEntry {
        private String id;
        /** Contact or display name. */
        private String name;
        /** Registered company name, if different from {@link #name}. */
        private String company;
        /** Empty until learned from a statement. */
        private String bin;
    }

    @Getter
    @Setter
    public static class TransactionEntry {
        private String id;
        private String clientId;
        private BigDecimal amount;
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate date;
        /** {@code INCOME} or {@code EXPENSE}. */
        private String direction = "INCOME";
        private String description;
        private String paymentType = "FULL_PAYMENT";
        /** {@code MANUAL}, {@code VERIFIED}, {@code DISCREPANCY} or {@code BANK_IMPORT}. */
        private String reconciliationStatus = "MANUAL";
    }

    @Getter
    @Setter
    public static class AliasEntry {
        private String bankName;
        private String bankBin;
        private String clientId;
    }
}
