package com.bookkeeper.ingest.rules;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Derives a display vendor from a raw statement description.
 */
public final class VendorNameCleaner {

    static final int MAX_LENGTH = 100;

    private static final List<Pattern> NOISE = List.of(
            Pattern.compile("#\\d+"),
            Pattern.compile("\\d{4,}"),
            Pattern.compile("STORE \\d+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("LOCATION \\d+", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bLLC\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bINC\\b\\.?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bCORP\\b\\.?", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bCO\\.?$", Pattern.CASE_INSENSITIVE)
    );
    private static final Pattern WHITESPACE = Pattern.compile("\\s{2,}");

    private VendorNameCleaner() {
    }

    public static String clean(String description) {
        if (description == null) {
            return "";
        }
        String vendor = description.trim();
        for (Pattern pattern : NOISE) {
            vendor = pattern.matcher(vendor).replaceAll("").trim();
        }
        vendor = WHITESPACE.matcher(vendor).replaceAll(" ");
        return vendor.length() <= MAX_LENGTH ? vendor : vendor.substring(0, MAX_LENGTH);
    }
}
