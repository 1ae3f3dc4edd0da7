package com.bookkeeper.ingest.rules;

import static org.assertj.core.api.Assertions.assertThat;

import com.bookkeeper.ingest.model.VendorMappingRule;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class VendorRuleEngineTest {

    private final VendorRuleEngine engine = new VendorRuleEngine();

    @Test
    void higherPriorityRuleWins() {
        VendorRuleEngine.RuleSet rules = engine.prepare(List.of(
                new VendorMappingRule(1, "STAR", "Shopping", false, 1),
                new VendorMappingRule(2, "STARBUCKS", "Dining", false, 5)));

        assertThat(rules.categorize("STARBUCKS #123")).contains("Dining");
        assertThat(rules.categorize("STAR MARKET")).contains("Shopping");
    }

    @Test
    void olderRuleWinsPriorityTie() {
        VendorRuleEngine.RuleSet rules = engine.prepare(List.of(
                new VendorMappingRule(7, "COFFEE", "Groceries", false, 3),
                new VendorMappingRule(4, "coffee", "Dining", false, 3)));

        assertThat(rules.categorize("BLUE BOTTLE COFFEE")).contains("Dining");
    }

    @Test
    void regexRulesMatchCaseInsensitively() {
        VendorRuleEngine.RuleSet rules = engine.prepare(List.of(
                new VendorMappingRule(1, "^uber\\s+(eats|\\*eats)", "Dining", true, 2),
                new VendorMappingRule(2, "UBER", "Transportation", false, 1)));

        assertThat(rules.categorize("UBER EATS 8005928996")).contains("Dining");
        assertThat(rules.categorize("UBER *TRIP HELP.UBER.COM")).contains("Transportation");
    }

    @Test
    void invalidRegexIsSkipped() {
        VendorRuleEngine.RuleSet rules = engine.prepare(List.of(
                new VendorMappingRule(1, "([", "Broken", true, 10),
                new VendorMappingRule(2, "NETFLIX", "Subscriptions", false, 0)));

        assertThat(rules.size()).isEqualTo(1);
        assertThat(rules.categorize("NETFLIX.COM")).contains("Subscriptions");
    }

    @Test
    void matchCarriesRuleAndCleanedVendor() {
        VendorMappingRule starbucks = new VendorMappingRule(1, "STARBUCKS", "Dining", false, 5);

        Optional<RuleMatch> match = engine.prepare(List.of(starbucks)).match("STARBUCKS #123");

        assertThat(match).isPresent();
        assertThat(match.get().rule()).isEqualTo(starbucks);
        assertThat(match.get().vendor()).isEqualTo("STARBUCKS");
    }

    @Test
    void noRuleMeansNoCategory() {
        VendorRuleEngine.RuleSet rules = engine.prepare(List.of(new VendorMappingRule(1, "STARBUCKS", "Dining", false, 5)));

        assertThat(rules.categorize("PAYROLL")).isEmpty();
        assertThat(rules.categorize("")).isEmpty();
        assertThat(rules.categorize(null)).isEmpty();
        assertThat(engine.prepare(List.of()).size()).isZero();
    }
}
