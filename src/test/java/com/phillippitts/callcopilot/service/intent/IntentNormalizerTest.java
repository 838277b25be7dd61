package com.phillippitts.callcopilot.service.intent;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IntentNormalizerTest {

    @Test
    void lowerCasesAndJoinsWords() {
        assertThat(IntentNormalizer.normalize("Credit Card Fraud")).isEqualTo("credit_card_fraud");
        assertThat(IntentNormalizer.normalize("  account_balance ")).isEqualTo("account_balance");
    }

    @Test
    void foldsAliases() {
        assertThat(IntentNormalizer.normalize("creditcard")).isEqualTo("credit_card");
        assertThat(IntentNormalizer.normalize("debit_card_blocking")).isEqualTo("debit_card_block");
        assertThat(IntentNormalizer.normalize("card block")).isEqualTo("credit_card_block");
    }

    @Test
    void blankBecomesUnknown() {
        assertThat(IntentNormalizer.normalize(null)).isEqualTo("unknown");
        assertThat(IntentNormalizer.normalize(" ")).isEqualTo("unknown");
    }

    @Test
    void clampsConfidence() {
        assertThat(IntentNormalizer.clampConfidence(1.7)).isEqualTo(1.0);
        assertThat(IntentNormalizer.clampConfidence(-0.2)).isEqualTo(0.0);
        assertThat(IntentNormalizer.clampConfidence(Double.NaN)).isEqualTo(0.0);
        assertThat(IntentNormalizer.clampConfidence(0.42)).isEqualTo(0.42);
    }
}
