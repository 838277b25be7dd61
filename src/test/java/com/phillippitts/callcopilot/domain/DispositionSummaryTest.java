package com.phillippitts.callcopilot.domain;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DispositionSummaryTest {

    @Test
    void notesJoinNonBlankSections() {
        DispositionSummary summary = new DispositionSummary("Lost card", " ", "Ship replacement",
                List.of(new Disposition("credit_card_block", 0.9, null)), 0.9);

        assertThat(summary.notes()).isEqualTo("Lost card\n\nShip replacement");
    }

    @Test
    void emptySummaryHasPlaceholderNotes() {
        DispositionSummary summary = new DispositionSummary(null, null, null, List.of(), 0.5);

        assertThat(summary.notes()).isEqualTo(DispositionSummary.NO_NOTES);
        assertThat(summary.dispositions()).containsExactly(new Disposition(Disposition.GENERAL_INQUIRY, 0.5, null));
    }

    @Test
    void clampsScores() {
        DispositionSummary summary = new DispositionSummary("x", "", "",
                List.of(new Disposition("fraud", 3.0, null)), -1.0);

        assertThat(summary.confidence()).isZero();
        assertThat(summary.dispositions().get(0).score()).isEqualTo(1.0);
    }

    @Test
    void fallbackIsLowConfidenceGeneralInquiry() {
        DispositionSummary fallback = DispositionSummary.fallback();

        assertThat(fallback.confidence()).isEqualTo(0.1);
        assertThat(fallback.dispositions()).extracting(Disposition::code).containsExactly("general_inquiry");
        assertThat(fallback.notes()).contains("review the call transcript manually");
    }

    @Test
    void titleCapitalizesWords() {
        assertThat(new Disposition("credit_card_block", 0.9, null).title()).isEqualTo("Credit Card Block");
        assertThat(new Disposition("FRAUD", 0.9, null).title()).isEqualTo("Fraud");
    }
}
