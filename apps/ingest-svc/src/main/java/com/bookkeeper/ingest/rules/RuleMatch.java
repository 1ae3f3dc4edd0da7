package com.bookkeeper.ingest.rules;

import com.bookkeeper.ingest.model.VendorMappingRule;

public record RuleMatch(VendorMappingRule rule, String category, String vendor) {
}
