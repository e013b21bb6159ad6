package com.gomflow.smartagent.fusion;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("TimestampParser Unit Tests")
class TimestampParserTest {

    private static final ZoneId MANILA = ZoneId.of("Asia/Manila");

    @ParameterizedTest(name = "{0}")
    @CsvSource(delimiter = '|', value = {
            "2026-03-15T11:42:00+08:00 | 2026-03-15T03:42:00Z",
            "2026-03-15T03:42:00Z      | 2026-03-15T03:42:00Z",
            "2026-03-15T11:42:00       | 2026-03-15T03:42:00Z",
            "2026-03-15 11:42          | 2026-03-15T03:42:00Z",
            "Mar 15, 2026 11:42 AM     | 2026-03-15T03:42:00Z",
            "mar 15, 2026 11:42:30 pm  | 2026-03-15T15:42:30Z",
            "15 Mar 2026 23:05         | 2026-03-15T15:05:00Z",
            "03/15/2026 9:05 PM        | 2026-03-15T13:05:00Z",
            "03/15/2026                | 2026-03-14T16:00:00Z",
            "Mar 15, 2026              | 2026-03-14T16:00:00Z"
    })
    @DisplayName("Should read receipt timestamp formats in the local zone")
    void shouldParseReceiptFormats(String raw, String expected) {
        assertThat(TimestampParser.parse(raw, MANILA)).contains(Instant.parse(expected));
    }

    @Test
    @DisplayName("Should collapse repeated whitespace before parsing")
    void shouldCollapseWhitespace() {
        assertThat(TimestampParser.parse("Mar 15,  2026\n11:42 AM", MANILA))
                .contains(Instant.parse("2026-03-15T03:42:00Z"));
    }

    @Test
    @DisplayName("Should return empty for unreadable values")
    void shouldRejectGarbage() {
        assertThat(TimestampParser.parse("yesterday afternoon", MANILA)).isEmpty();
        assertThat(TimestampParser.parse("", MANILA)).isEmpty();
        assertThat(TimestampParser.parse(null, MANILA)).isEmpty();
    }
}
