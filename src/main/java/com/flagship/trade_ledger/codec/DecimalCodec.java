package com.flagship.trade_ledger.codec;

import com.flagship.trade_ledger.exception.CorruptRecordException;
import com.flagship.trade_ledger.exception.ValidationException;

import java.math.BigDecimal;

/**
 * Conversion between monetary amounts and their string form in the ledger.
 *
 * Amounts are always {@link BigDecimal}. Input accepts plain and exponential
 * notation ({@code "500.00"}, {@code "5E+2"}); output is always plain notation
 * with the scale preserved. Amounts are bounded to {@value #MAX_SCALE} fractional
 * digits and {@value #MAX_INTEGER_DIGITS} integer digits, which keeps exponent
 * notation from producing values the ledger arithmetic cannot handle.
 */
public final class DecimalCodec {

    static final int MAX_SCALE = 18;
    static final int MAX_INTEGER_DIGITS = 30;

    private DecimalCodec() {
        // Utility class
    }

    /**
     * Parses a caller-supplied amount.
     *
     * @throws ValidationException if the string is empty, not a decimal number,
     *         or outside the supported range
     */
    public static BigDecimal parse(String raw, String field) {
        if (raw == null || raw.isEmpty()) {
            throw new ValidationException(field + " must be a non-empty numeric string");
        }
        BigDecimal value;
        try {
            value = new BigDecimal(raw);
        } catch (NumberFormatException e) {
            throw new ValidationException(field + " must be a numeric string, got '" + raw + "'");
        }
        requireWithinBounds(value, field);
        return value;
    }

    /**
     * @throws ValidationException if the value has more digits than a stored amount may carry
     */
    public static void requireWithinBounds(BigDecimal value, String field) {
        if (!withinBounds(value)) {
            throw new ValidationException(String.format(
                "%s must have at most %d integer and %d fractional digits, got '%s'",
                field, MAX_INTEGER_DIGITS, MAX_SCALE, value));
        }
    }

    public static BigDecimal parsePositive(String raw, String field) {
        BigDecimal value = parse(raw, field);
        if (value.signum() <= 0) {
            throw new ValidationException(field + " must be positive, got '" + raw + "'");
        }
        return value;
    }

    public static BigDecimal parseNonNegative(String raw, String field) {
        BigDecimal value = parse(raw, field);
        if (value.signum() < 0) {
            throw new ValidationException(field + " must not be negative, got '" + raw + "'");
        }
        return value;
    }

    public static String format(BigDecimal value) {
        return value.toPlainString();
    }

    /**
     * Parses an amount read back from a stored record.
     *
     * @throws CorruptRecordException if the stored value is not a decimal number
     *         or outside the supported range
     */
    static BigDecimal decodeStored(String key, String field, String raw) {
        BigDecimal value;
        try {
            value = new BigDecimal(raw);
        } catch (NumberFormatException | NullPointerException e) {
            throw new CorruptRecordException(key, "field '" + field + "' is not a decimal: " + raw);
        }
        if (!withinBounds(value)) {
            throw new CorruptRecordException(key, "field '" + field + "' is out of range: " + raw);
        }
        return value;
    }

    private static boolean withinBounds(BigDecimal value) {
        return value.scale() <= MAX_SCALE && value.precision() - value.scale() <= MAX_INTEGER_DIGITS;
    }
}
