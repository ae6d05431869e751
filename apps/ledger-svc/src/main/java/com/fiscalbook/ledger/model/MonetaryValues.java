package com.fiscalbook.ledger.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Parses the free-form monetary strings stored on transactions ("1500,00", "1.500,00", "1,500.00", "R$ 10").
 */
public final class MonetaryValues {

    private MonetaryValues() {
    }

    /**
     * Signed value with two decimals; blank or unparseable input yields zero.
     */
    public static BigDecimal parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return zero();
        }
        String value = raw.trim().replaceAll("[R$\\s]", "");
        boolean negative = value.startsWith("-");
        value = value.replace("-", "");

        int lastComma = value.lastIndexOf(',');
        int lastPeriod = value.lastIndexOf('.');
        if (lastComma > lastPeriod) {
            // "1.500,00": comma is the decimal separator
            value = value.replace(".", "").replace(',', '.');
        } else if (lastPeriod > lastComma) {
            value = value.replace(",", "");
        }
        if (value.isEmpty()) {
            return zero();
        }
        try {
            BigDecimal parsed = new BigDecimal(value).setScale(2, RoundingMode.HALF_UP);
            return negative ? parsed.negate() : parsed;
        } catch (NumberFormatException ex) {
            return zero();
        }
    }

    private static BigDecimal zero() {
        return BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
    }
}
