package com.flagship.trade_ledger.codec;

import com.flagship.trade_ledger.exception.ValidationException;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Argument checks shared by the account and invoice ledgers.
 */
public final class FieldValidator {

    private static final Pattern CURRENCY = Pattern.compile("^[A-Za-z]{3}$");

    private FieldValidator() {
        // Utility class
    }

    public static String requireNonEmpty(String value, String field) {
        if (value == null || value.isEmpty()) {
            throw new ValidationException(field + " must be a non-empty string");
        }
        return value;
    }

    /**
     * @return the ISO currency code in upper case
     */
    public static String requireCurrency(String value) {
        requireNonEmpty(value, "currency");
        if (!CURRENCY.matcher(value).matches()) {
            throw new ValidationException("currency must be a 3-letter ISO code, got '" + value + "'");
        }
        return value.toUpperCase(Locale.ROOT);
    }

    /**
     * @return the date in ISO-8601 form, or null when no date was given
     */
    public static String optionalIsoDate(String value, String field) {
        if (value == null || value.isEmpty()) {
            return null;
        }
        try {
            return LocalDate.parse(value).toString();
        } catch (DateTimeParseException e) {
            throw new ValidationException(field + " must be an ISO-8601 date (yyyy-MM-dd), got '" + value + "'");
        }
    }
}
