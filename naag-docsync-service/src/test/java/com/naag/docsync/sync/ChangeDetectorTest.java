package com.naag.docsync.sync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.format.DateTimeParseException;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChangeDetectorTest {

    private final ChangeDetector detector = new ChangeDetector();

    @Test
    @DisplayName("Never-seen files are changed")
    void missingStoredValueIsChanged() {
        assertThat(detector.isChanged("2024-01-01T00:00:00Z", Optional.empty())).isTrue();
    }

    @Test
    @DisplayName("Newer remote timestamp is changed")
    void newerIsChanged() {
        assertThat(detector.isChanged("2024-02-01T00:00:00Z", Optional.of("2024-01-01T00:00:00Z"))).isTrue();
    }

    @Test
    @DisplayName("Equal timestamps are unchanged")
    void equalIsUnchanged() {
        assertThat(detector.isChanged("2024-01-01T00:00:00Z", Optional.of("2024-01-01T00:00:00Z"))).isFalse();
    }

    @Test
    @DisplayName("Older remote timestamp is unchanged")
    void olderIsUnchanged() {
        assertThat(detector.isChanged("2023-12-31T23:59:59Z", Optional.of("2024-01-01T00:00:00Z"))).isFalse();
    }

    @Test
    @DisplayName("Same instant in different notations compares equal")
    void comparesInstantsNotStrings() {
        assertThat(detector.isChanged("2024-01-01T07:00:00+07:00", Optional.of("2024-01-01T00:00:00Z"))).isFalse();
        assertThat(detector.isChanged("2024-01-01T00:00:00.000Z", Optional.of("2024-01-01T00:00:00Z"))).isFalse();
    }

    @Test
    @DisplayName("Unparseable stored value forces reprocessing")
    void badStoredValueIsChanged() {
        assertThat(detector.isChanged("2024-01-01T00:00:00Z", Optional.of("yesterday"))).isTrue();
    }

    @Test
    @DisplayName("Unparseable remote value is an error")
    void badRemoteValueThrows() {
        assertThatThrownBy(() -> detector.isChanged("not-a-date", Optional.empty()))
                .isInstanceOf(DateTimeParseException.class);
    }
}
