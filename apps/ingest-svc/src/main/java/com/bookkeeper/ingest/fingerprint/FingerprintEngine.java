package com.bookkeeper.ingest.fingerprint;

import com.bookkeeper.ingest.model.CanonicalTransaction;
import com.bookkeeper.ingest.normalize.RawRow;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.LocalDate;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Computes the dedup fingerprints of a batch.
 *
 * <p>The row hash only looks at date, normalized description and amount, so re-exports of the same
 * line collapse even when incidental fields such as the running balance differ. The original hash
 * covers every raw field and is kept for lineage.
 */
@Component
public class FingerprintEngine {

    static final int HASH_LENGTH = 32;

    private static final Pattern PUNCTUATION = Pattern.compile("[\\p{Punct}\\p{IsPunctuation}]+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final ObjectMapper objectMapper;

    public FingerprintEngine(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public FingerprintedTransaction fingerprint(CanonicalTransaction transaction, RawRow raw) {
        return new FingerprintedTransaction(
                transaction,
                raw.lineNumber(),
                rowHash(transaction.date(), transaction.description(), transaction.amount()),
                originalHash(raw),
                nearDupKey(transaction.date(), transaction.amount())
        );
    }

    /**
     * Near-duplicate keys that occur more than once within the batch, in first-seen order.
     */
    public Set<String> collidingKeys(List<FingerprintedTransaction> batch) {
        Map<String, Long> counts = batch.stream()
                .collect(Collectors.groupingBy(FingerprintedTransaction::nearDupKey, LinkedHashMap::new, Collectors.counting()));
        return counts.entrySet().stream()
                .filter(entry -> entry.getValue() > 1)
                .map(Map.Entry::getKey)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public String rowHash(LocalDate date, String description, BigDecimal amount) {
        return sha256(date + "|" + normalizeDescription(description) + "|" + amountKey(amount));
    }

    public String nearDupKey(LocalDate date, BigDecimal amount) {
        return date + "|" + amountKey(amount);
    }

    String originalHash(RawRow raw) {
        try {
            return sha256(objectMapper.writeValueAsString(raw.values()));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Unable to serialize raw row for hashing", ex);
        }
    }

    /**
     * Lower-cases, turns punctuation into spaces and collapses whitespace.
     */
    public static String normalizeDescription(String description) {
        if (description == null) {
            return "";
        }
        String value = description.toLowerCase(Locale.ROOT);
        value = PUNCTUATION.matcher(value).replaceAll(" ");
        value = WHITESPACE.matcher(value).replaceAll(" ");
        return value.trim();
    }

    private static String amountKey(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP).toPlainString();
    }

    private static String sha256(String payload) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(payload.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash).substring(0, HASH_LENGTH);
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
