package com.bookkeeper.ingest.ai;

import static org.assertj.core.api.Assertions.assertThat;

import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class DescriptionMaskerTest {

    @Test
    void masksAccountNumbersCardTailsAndEmails() {
        String masked = DescriptionMasker.mask("ZELLE TO jane.doe@example.com ACCT 1234567890123 CARD XXXX4821");

        assertThat(masked)
                .doesNotContain("jane.doe@example.com")
                .doesNotContain("1234567890123")
                .doesNotContain("4821")
                .contains("***@***")
                .startsWith("ZELLE TO");
    }

    @Test
    void masksPhoneNumbers() {
        assertThat(DescriptionMasker.mask("COMCAST (555) 123-4567")).isEqualTo("COMCAST ***-***-****");
        assertThat(DescriptionMasker.mask("AT&T 555-123-4567 BILL")).isEqualTo("AT&T ***-***-**** BILL");
    }

    @Test
    void leavesOrdinaryDescriptionsAlone() {
        assertThat(DescriptionMasker.mask("STARBUCKS #123")).isEqualTo("STARBUCKS #123");
        assertThat(DescriptionMasker.mask("")).isEmpty();
        assertThat(DescriptionMasker.mask(null)).isNull();
    }

    @Test
    void classificationRequestIsMaskedOnConstruction() {
        ClassificationRequest request = new ClassificationRequest(1, LocalDate.of(2024, 1, 15),
                "TRANSFER 9876543210 TO SAVINGS", new BigDecimal("-100.00"));

        assertThat(request.description()).isEqualTo("TRANSFER *** TO SAVINGS");
    }
}
