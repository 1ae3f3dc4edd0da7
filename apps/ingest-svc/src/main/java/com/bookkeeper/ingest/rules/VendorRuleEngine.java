package com.bookkeeper.ingest.rules;

import com.bookkeeper.ingest.model.VendorMappingRule;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Matches descriptions against vendor rules. The engine only reads rules; persisting them is the
 * job of {@link VendorRuleService}.
 */
@Component
public class VendorRuleEngine {

    private static final Logger log = LoggerFactory.getLogger(VendorRuleEngine.class);

    static final Comparator<VendorMappingRule> RULE_ORDER = Comparator
            .comparingInt(VendorMappingRule::priority).reversed()
            .thenComparingLong(VendorMappingRule::sequence);

    /**
     * Sorts and compiles the rules once so a whole batch resolves against the same order.
     * Regex rules that do not compile are skipped.
     */
    public RuleSet prepare(List<VendorMappingRule> rules) {
        List<CompiledRule> compiled = new ArrayList<>();
        for (VendorMappingRule rule : rules.stream().sorted(RULE_ORDER).toList()) {
            if (rule.regex()) {
                try {
                    compiled.add(new CompiledRule(rule, Pattern.compile(rule.pattern(), Pattern.CASE_INSENSITIVE), null));
                } catch (PatternSyntaxException ex) {
                    log.warn("Skipping vendor rule sequence={} with invalid regex '{}': {}",
                            rule.sequence(), rule.pattern(), ex.getDescription());
                }
            } else {
                compiled.add(new CompiledRule(rule, null, rule.pattern().toLowerCase(Locale.ROOT)));
            }
        }
        return new RuleSet(List.copyOf(compiled));
    }

    public static final class RuleSet {
        private final List<CompiledRule> rules;

        private RuleSet(List<CompiledRule> rules) {
            this.rules = rules;
        }

        public Optional<String> categorize(String description) {
            return match(description).map(RuleMatch::category);
        }

        public Optional<RuleMatch> match(String description) {
            if (description == null || description.isBlank()) {
                return Optional.empty();
            }
            String lowered = description.toLowerCase(Locale.ROOT);
            for (CompiledRule candidate : rules) {
                if (candidate.matches(description, lowered)) {
                    VendorMappingRule rule = candidate.rule();
                    return Optional.of(new RuleMatch(rule, rule.category(), VendorNameCleaner.clean(description)));
                }
            }
            return Optional.empty();
        }

        public int size() {
            return rules.size();
        }
    }

    private record CompiledRule(VendorMappingRule rule, Pattern regex, String literal) {
        boolean matches(String description, String lowered) {
            if (regex != null) {
                return regex.matcher(description).find();
            }
            return lowered.contains(literal);
        }
    }
}
