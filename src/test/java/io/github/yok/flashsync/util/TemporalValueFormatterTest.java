package io.github.yok.flashsync.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import java.sql.Date;
import java.sql.Time;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;

class TemporalValueFormatterTest {

    private final TemporalValueFormatter utc =
            new TemporalValueFormatter("yyyy-MM-dd'T'HH:mm:ssXXX", ZoneId.of("UTC"));

    @Test
    void format_正常ケース_LocalDateTimeを指定する_UTCオフセット付きで整形されること() {
        assertEquals("2024-03-01T12:34:56Z",
                utc.format(LocalDateTime.of(2024, 3, 1, 12, 34, 56)).get());
    }

    @Test
    void format_正常ケース_LocalDateとsqlDateを指定する_日の開始時刻で整形されること() {
        assertEquals("2024-03-01T00:00:00Z", utc.format(LocalDate.of(2024, 3, 1)).get());
        assertEquals("2024-03-01T00:00:00Z", utc.format(Date.valueOf("2024-03-01")).get());
    }

    @Test
    void format_正常ケース_OffsetDateTimeを指定する_設定ゾーンへ変換されること() {
        OffsetDateTime value = OffsetDateTime.of(2024, 3, 1, 9, 0, 0, 0, ZoneOffset.ofHours(9));
        assertEquals("2024-03-01T00:00:00Z", utc.format(value).get());
    }

    @Test
    void format_正常ケース_InstantとTimestampを指定する_同じ瞬間で整形されること() {
        Instant instant = Instant.parse("2024-03-01T00:00:00Z");
        assertEquals("2024-03-01T00:00:00Z", utc.format(instant).get());
        assertEquals("2024-03-01T00:00:00Z", utc.format(Timestamp.from(instant)).get());
    }

    @Test
    void format_正常ケース_ゾーン指定あり_オフセットが反映されること() {
        TemporalValueFormatter tokyo =
                new TemporalValueFormatter("yyyy-MM-dd'T'HH:mm:ssXXX", ZoneId.of("Asia/Tokyo"));
        assertEquals("2024-03-01T12:00:00+09:00",
                tokyo.format(LocalDateTime.of(2024, 3, 1, 12, 0, 0)).get());
    }

    @Test
    void format_正常ケース_日時以外を指定する_空が返ること() {
        assertFalse(utc.format("2024-03-01").isPresent());
        assertFalse(utc.format(42).isPresent());
        assertFalse(utc.format(Time.valueOf("12:00:00")).isPresent());
        assertFalse(utc.format(null).isPresent());
    }
}
