package com.healthassist.common;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

class AdvisoryConstantsTest {

    private Locale previous;

    @BeforeEach
    void useTurkishLocale() {
        previous = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
    }

    @AfterEach
    void restoreLocale() {
        Locale.setDefault(previous);
    }

    @Test
    void severityMatchIgnoresCaseAndDefaultLocale() {
        assertThat(AdvisoryConstants.isSevere(" VERY SEVERE ")).isTrue();
        assertThat(AdvisoryConstants.isSevere("Severe")).isTrue();
        assertThat(AdvisoryConstants.isSevere("MILD")).isFalse();
        assertThat(AdvisoryConstants.isSevere(null)).isFalse();
    }

    @Test
    void durationMatchIgnoresCaseAndDefaultLocale() {
        assertThat(AdvisoryConstants.isProlonged("3 WEEKS")).isTrue();
        assertThat(AdvisoryConstants.isProlonged("About a Month")).isTrue();
        assertThat(AdvisoryConstants.isProlonged("2 DAYS")).isFalse();
        assertThat(AdvisoryConstants.isProlonged(null)).isFalse();
    }
}
