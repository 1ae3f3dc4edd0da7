package com.bookkeeper.ingest.ai;

import java.util.regex.Pattern;

/**
 * Redacts account numbers, phone numbers and e-mail addresses from a description before it is sent
 * to an external classifier.
 */
public final class DescriptionMasker {

    private static final Pattern EMAIL_PATTERN = Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}");
    private static final Pattern ACCOUNT_PATTERN = Pattern.compile("\\b\\d{10,}\\b");
    private static final Pattern CARD_TAIL_PATTERN = Pattern.compile("(?i)\\b(?:x{2,}|\\*{2,})\\d{4}\\b");
    private static final Pattern PHONE_PATTERN = Pattern.compile("(?:\\+?\\d{1,3}[\\s-])?(?:\\(\\d{3}\\)|\\b\\d{3})[\\s-]?\\d{3}[\\s-]\\d{4}\\b");

    private DescriptionMasker() {
    }

    public static String mask(String input) {
        if (input == null || input.isBlank()) {
            return input;
        }
        String value = EMAIL_PATTERN.matcher(input).replaceAll("***@***");
        value = ACCOUNT_PATTERN.matcher(value).replaceAll("***");
        value = CARD_TAIL_PATTERN.matcher(value).replaceAll("***");
        value = PHONE_PATTERN.matcher(value).replaceAll("***-***-****");
        return value;
    }
}
