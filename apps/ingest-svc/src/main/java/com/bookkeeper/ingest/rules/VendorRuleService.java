package com.bookkeeper.ingest.rules;

import com.bookkeeper.ingest.model.VendorMappingRule;
import com.bookkeeper.ingest.repository.RecordStore;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

@Service
public class VendorRuleService {

    private static final Logger log = LoggerFactory.getLogger(VendorRuleService.class);

    private final RecordStore recordStore;

    public VendorRuleService(RecordStore recordStore) {
        this.recordStore = recordStore;
    }

    public VendorMappingRule addRule(String pattern, String category, boolean regex, int priority) {
        if (pattern == null || pattern.isBlank()) {
            throw new IllegalArgumentException("pattern must be provided");
        }
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category must be provided");
        }
        if (regex) {
            try {
                Pattern.compile(pattern);
            } catch (PatternSyntaxException ex) {
                throw new IllegalArgumentException("Invalid regex '" + pattern + "': " + ex.getDescription(), ex);
            }
        }
        VendorMappingRule rule = recordStore.addVendorRule(pattern.trim(), category.trim(), regex, priority);
        log.info("Added vendor rule sequence={} pattern='{}' category={} regex={} priority={}",
                rule.sequence(), rule.pattern(), rule.category(), rule.regex(), rule.priority());
        return rule;
    }

    public List<VendorMappingRule> activeRules() {
        return recordStore.findActiveVendorRules();
    }
}
