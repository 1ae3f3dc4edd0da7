package com.bookkeeper.ingest.normalize;

import com.bookkeeper.ingest.config.BookkeepingProperties;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds a {@link FormatProfile} from a statement header by matching known column names.
 */
@Component
public class FormatDetector {

    private static final Logger log = LoggerFactory.getLogger(FormatDetector.class);

    static final List<String> DATE_CANDIDATES = List.of(
            "Date", "Transaction Date", "Trans Date", "Posted Date", "Post Date", "TransactionDate", "Posting Date");
    static final List<String> DESC_CANDIDATES = List.of(
            "Description", "Payee", "Memo", "Name", "Details", "Transaction Description", "Merchant", "Vendor", "Narrative");
    static final List<String> AMOUNT_CANDIDATES = List.of(
            "Amount", "Amount ($)", "Transaction Amount", "Purchase Amount", "Amt");
    static final List<String> DEBIT_CANDIDATES = List.of("Debit", "Withdrawal", "Withdrawals", "Outflow", "Charges");
    static final List<String> CREDIT_CANDIDATES = List.of("Credit", "Deposit", "Deposits", "Inflow", "Income");
    static final List<String> TYPE_CANDIDATES = List.of("Type", "Transaction Type", "Category", "Debit/Credit");
    static final List<String> TXN_ID_CANDIDATES = List.of("Transaction ID", "FITID", "ID", "TxnId", "Confirmation Number");
    static final List<String> REFERENCE_CANDIDATES = List.of("Reference", "Ref", "Check Number", "Check #", "Reference Number");
    static final List<String> TIME_CANDIDATES = List.of("Time", "Transaction Time", "Posted Time");
    static final List<String> ACCOUNT_CANDIDATES = List.of("Account", "Account Number", "Acct", "Account #");
    static final List<String> BALANCE_CANDIDATES = List.of("Balance", "Running Balance", "Current Balance", "Bal");

    private final DateParser dateParser;

    public FormatDetector(BookkeepingProperties properties) {
        this(DateParser.withExtraPatterns(properties.ingest().dateFormats()));
    }

    FormatDetector(DateParser dateParser) {
        this.dateParser = dateParser;
    }

    /**
     * @param sourceColumnName optional header carrying the source label; {@code null} when the label
     *                         comes from the file name
     * @throws FileReadException when no date or amount column can be found
     */
    public FormatProfile detect(Path file, List<String> headers, String sourceColumnName) {
        int dateColumn = pick(headers, DATE_CANDIDATES);
        if (dateColumn == FormatProfile.ABSENT) {
            throw new FileReadException(file, "could not detect a date column in " + headers);
        }
        int descriptionColumn = pick(headers, DESC_CANDIDATES);
        if (descriptionColumn == FormatProfile.ABSENT) {
            descriptionColumn = 0;
            log.debug("No description column in {}; using first column '{}'", file.getFileName(), headers.get(0));
        }

        int amountColumn = pick(headers, AMOUNT_CANDIDATES);
        int debitColumn = pick(headers, DEBIT_CANDIDATES);
        int creditColumn = pick(headers, CREDIT_CANDIDATES);
        int typeColumn = pick(headers, TYPE_CANDIDATES);
        AmountConvention convention;
        if (amountColumn != FormatProfile.ABSENT) {
            convention = AmountConvention.SIGNED_COLUMN;
        } else if (debitColumn != FormatProfile.ABSENT || creditColumn != FormatProfile.ABSENT) {
            convention = AmountConvention.DEBIT_CREDIT;
        } else if (typeColumn != FormatProfile.ABSENT && (amountColumn = valueLikeColumn(headers, typeColumn)) != FormatProfile.ABSENT) {
            convention = AmountConvention.TYPE_COLUMN;
        } else {
            throw new FileReadException(file, "could not detect an amount column in " + headers);
        }

        int sourceColumn = FormatProfile.ABSENT;
        if (sourceColumnName != null) {
            sourceColumn = indexOf(headers, sourceColumnName);
            if (sourceColumn == FormatProfile.ABSENT) {
                log.warn("Source column '{}' not present in {}; falling back to file name", sourceColumnName, file.getFileName());
            }
        }

        FormatProfile profile = new FormatProfile(
                dateColumn,
                descriptionColumn,
                amountColumn,
                debitColumn,
                creditColumn,
                typeColumn,
                pick(headers, TXN_ID_CANDIDATES),
                pick(headers, REFERENCE_CANDIDATES),
                pick(headers, TIME_CANDIDATES),
                pick(headers, ACCOUNT_CANDIDATES),
                pick(headers, BALANCE_CANDIDATES),
                sourceColumn,
                convention,
                false,
                dateParser
        );
        log.debug("Detected profile for {}: date={} desc={} amount={} convention={}",
                file.getFileName(), dateColumn, descriptionColumn, amountColumn, convention);
        return profile;
    }

    /**
     * First candidate present in the header wins; comparison ignores case and surrounding whitespace.
     */
    static int pick(List<String> headers, List<String> candidates) {
        for (String candidate : candidates) {
            int index = indexOf(headers, candidate);
            if (index != FormatProfile.ABSENT) {
                return index;
            }
        }
        return FormatProfile.ABSENT;
    }

    private static int indexOf(List<String> headers, String name) {
        String wanted = normalize(name);
        for (int i = 0; i < headers.size(); i++) {
            if (normalize(headers.get(i)).equals(wanted)) {
                return i;
            }
        }
        return FormatProfile.ABSENT;
    }

    private static int valueLikeColumn(List<String> headers, int typeColumn) {
        for (int i = 0; i < headers.size(); i++) {
            if (i == typeColumn) {
                continue;
            }
            String header = normalize(headers.get(i));
            if (header.contains("amount") || header.contains("value")) {
                return i;
            }
        }
        return FormatProfile.ABSENT;
    }

    private static String normalize(String header) {
        return header == null ? "" : header.trim().toLowerCase(Locale.ROOT);
    }
}
