package com.pocketledger.dto;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class RequestDatesTest {

    @Test @DisplayName("bare date → midnight UTC")
    void bareDate() {
        assertThat(RequestDates.parse("2024-03-01")).isEqualTo(Instant.parse("2024-03-01T00:00:00Z"));
    }

    @Test @DisplayName("instant with Z → as given")
    void utcInstant() {
        assertThat(RequestDates.parse("2024-03-01T10:15:30Z")).isEqualTo(Instant.parse("2024-03-01T10:15:30Z"));
    }

    @Test @DisplayName("offset date-time → converted to UTC")
    void offsetDateTime() {
        assertThat(RequestDates.parse("2024-03-01T10:15:30-03:00"))
            .isEqualTo(Instant.parse("2024-03-01T13:15:30Z"));
    }

    @Test @DisplayName("local date-time → read as UTC")
    void localDateTime() {
        assertThat(RequestDates.parse("2024-03-01T10:15:30")).isEqualTo(Instant.parse("2024-03-01T10:15:30Z"));
    }

    @Test @DisplayName("blank or null → null")
    void blank() {
        assertThat(RequestDates.parse(null)).isNull();
        assertThat(RequestDates.parse("  ")).isNull();
    }

    @Test @DisplayName("garbage → IllegalArgumentException")
    void garbage() {
        assertThatThrownBy(() -> RequestDates.parse("yesterday"))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("yesterday");
        assertThatThrownBy(() -> RequestDates.parse("2024-13-01"))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
