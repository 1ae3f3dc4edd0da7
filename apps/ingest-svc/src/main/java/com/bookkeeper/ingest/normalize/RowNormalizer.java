package com.bookkeeper.ingest.normalize;

import com.bookkeeper.ingest.model.CanonicalTransaction;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Turns one raw statement row into a {@link CanonicalTransaction}. Pure: the same row and profile
 * always give the same result.
 *
 * <p>Some exports occasionally emit an extra leading column, or drop one, on individual rows. When
 * the mapped date column does not hold a date, the columns on either side are tried and the whole
 * row is read with that offset.
 */
@Component
public class RowNormalizer {

    private static final Pattern CURRENCY_NOISE = Pattern.compile("[$€£,\\s]");
    private static final int MAX_TIME_PART = 10;
    // source, txn_id and reference are VARCHAR(100)
    static final int MAX_LABEL = 100;

    public CanonicalTransaction normalize(RawRow row, FormatProfile profile, String defaultSource) {
        int shift = detectShift(row, profile);
        ShiftedRow shifted = new ShiftedRow(row, shift);

        LocalDate date = profile.dateParser().parse(shifted.get(profile.dateColumn()))
                .orElseThrow(() -> new MalformedRowException(row.lineNumber(), "unparsable date"));
        BigDecimal amount = amount(shifted, profile);
        if (profile.invertSign()) {
            amount = amount.negate();
        }

        String source = defaultSource;
        String sourceValue = shifted.get(profile.sourceColumn());
        if (sourceValue != null && !sourceValue.isBlank()) {
            source = sourceValue;
        }

        return new CanonicalTransaction(
                date,
                nullToEmpty(shifted.get(profile.descriptionColumn())),
                amount,
                truncate(source, MAX_LABEL),
                blankToNull(truncate(shifted.get(profile.txnIdColumn()), MAX_LABEL)),
                blankToNull(truncate(shifted.get(profile.referenceColumn()), MAX_LABEL)),
                normalizeAccount(shifted.get(profile.accountColumn())),
                parseBalance(shifted.get(profile.balanceColumn())),
                truncate(shifted.get(profile.timeColumn()), MAX_TIME_PART)
        );
    }

    /**
     * Offset applied to every mapped column: 0 when the date column parses, otherwise -1 or +1
     * when the neighbouring column does.
     */
    int detectShift(RawRow row, FormatProfile profile) {
        DateParser dates = profile.dateParser();
        int dateColumn = profile.dateColumn();
        String expected = row.valueAt(dateColumn);
        if (dates.parses(expected)) {
            return 0;
        }
        if (dates.parses(row.valueAt(dateColumn - 1))) {
            return -1;
        }
        if (dates.parses(row.valueAt(dateColumn + 1))) {
            return 1;
        }
        if (expected == null || expected.isBlank()) {
            throw new MalformedRowException(row.lineNumber(), "missing date");
        }
        throw new MalformedRowException(row.lineNumber(), "unparsable date '" + expected + "'");
    }

    private BigDecimal amount(ShiftedRow row, FormatProfile profile) {
        long line = row.lineNumber();
        return switch (profile.amountConvention()) {
            case SIGNED_COLUMN -> requireAmount(row.get(profile.amountColumn()), line);
            case TYPE_COLUMN -> {
                BigDecimal magnitude = requireAmount(row.get(profile.amountColumn()), line).abs();
                yield isDebitType(row.get(profile.typeColumn())) ? magnitude.negate() : magnitude;
            }
            case DEBIT_CREDIT -> {
                Optional<BigDecimal> debit = parseAmount(row.get(profile.debitColumn()), line);
                Optional<BigDecimal> credit = parseAmount(row.get(profile.creditColumn()), line);
                if (debit.isEmpty() && credit.isEmpty()) {
                    throw new MalformedRowException(line, "missing amount");
                }
                yield credit.orElse(BigDecimal.ZERO).abs().subtract(debit.orElse(BigDecimal.ZERO).abs());
            }
        };
    }

    private BigDecimal requireAmount(String raw, long line) {
        return parseAmount(raw, line).orElseThrow(() -> new MalformedRowException(line, "missing amount"));
    }

    private Optional<BigDecimal> parseAmount(String raw, long line) {
        try {
            return parseAmount(raw);
        } catch (NumberFormatException ex) {
            throw new MalformedRowException(line, "unparsable amount '" + raw + "'");
        }
    }

    /**
     * Accepts {@code $1,234.50}, {@code (4.50)}, {@code 4.50-}, {@code 4.50 DR} and {@code 4.50 CR}.
     *
     * @throws NumberFormatException for non-blank values that are not amounts
     */
    static Optional<BigDecimal> parseAmount(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim().toUpperCase(Locale.ROOT);
        boolean negate = false;
        if (value.startsWith("(") && value.endsWith(")")) {
            negate = true;
            value = value.substring(1, value.length() - 1);
        }
        if (value.endsWith("DR")) {
            negate = !negate;
            value = value.substring(0, value.length() - 2);
        } else if (value.endsWith("CR")) {
            value = value.substring(0, value.length() - 2);
        }
        value = CURRENCY_NOISE.matcher(value).replaceAll("");
        if (value.endsWith("-")) {
            negate = !negate;
            value = value.substring(0, value.length() - 1);
        }
        if (value.isEmpty() || "-".equals(value)) {
            throw new NumberFormatException("no digits in '" + raw + "'");
        }
        BigDecimal amount = new BigDecimal(value);
        return Optional.of(negate ? amount.negate() : amount);
    }

    // a running balance is informational; an unreadable one is dropped rather than failing the row
    private static BigDecimal parseBalance(String raw) {
        try {
            return parseAmount(raw).orElse(null);
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static boolean isDebitType(String type) {
        if (type == null) {
            return false;
        }
        String value = type.trim().toLowerCase(Locale.ROOT);
        return value.contains("debit") || value.equals("dr") || value.equals("withdrawal") || value.equals("charge");
    }

    /**
     * Keeps the last four digits of an account number; non-numeric labels are kept (max 12 chars).
     */
    static String normalizeAccount(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String value = raw.trim();
        String digits = value.replaceAll("\\D", "");
        if (!digits.isEmpty()) {
            return digits.length() <= 4 ? digits : digits.substring(digits.length() - 4);
        }
        return truncate(value, 12);
    }

    private static String truncate(String value, int max) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max);
    }

    private static String blankToNull(String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }

    private record ShiftedRow(RawRow row, int shift) {
        String get(int column) {
            if (column < 0) {
                return null;
            }
            return row.valueAt(column + shift);
        }

        long lineNumber() {
            return row.lineNumber();
        }
    }
}
