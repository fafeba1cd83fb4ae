package com.kreasipositif.statementprocessor.config;

import com.kreasipositif.statementprocessor.domain.PaymentType;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binds the {@code statement} section from application.yml.
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "statement")
public class StatementImportProperties {

    /** ISO 4217 code all amounts are converted to. Default: KZT. */
    private String baseCurrency = "KZT";

    private PaymentTypes paymentTypes = new PaymentTypes();

    private Matching matching = new Matching();

    @Getter
    @Setter
    public static class PaymentTypes {
        /**
         * KNP code to payment type. Consulted before the purpose-text keywords; codes not
         * listed here fall through to the keywords.
         */
        private Map<String, PaymentType> knpCodes = new LinkedHashMap<>();
    }

    @Getter
    @Setter
    public static class Matching {
        /**
         * Largest edit distance accepted by the name tier after exact keys fail.
         * {@code 0} disables the fuzzy fallback.
         */
        private int maxEditDistance = 0;

        /** Shorter keys are only ever matched exactly. */
        private int minFuzzyKeyLength = 8;
    }
}
