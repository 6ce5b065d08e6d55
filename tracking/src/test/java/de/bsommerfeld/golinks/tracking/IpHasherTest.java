package de.bsommerfeld.golinks.tracking;

import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

class IpHasherTest {

    @Test
    void hash_shouldBeSha256OfAddressAndDay() {
        String hash = IpHasher.hash("127.0.0.1", LocalDate.of(2026, 1, 1));

        assertEquals("5393da342d27278bc84a6649adee71bf1568900e65d5c285798f32b68a48661d", hash);
    }

    @Test
    void hash_shouldChangeWithDayAndAddress() {
        LocalDate day = LocalDate.of(2026, 1, 1);

        assertNotEquals(IpHasher.hash("127.0.0.1", day), IpHasher.hash("127.0.0.1", day.plusDays(1)));
        assertNotEquals(IpHasher.hash("127.0.0.1", day), IpHasher.hash("127.0.0.2", day));
    }

    @Test
    void hash_shouldUseUtcDay() {
        // 23:30 in New York on Jan 1 is already Jan 2 in UTC
        Clock clock = Clock.fixed(Instant.parse("2026-01-02T04:30:00Z"), ZoneId.of("America/New_York"));

        assertEquals(IpHasher.hash("10.0.0.1", LocalDate.of(2026, 1, 2)), IpHasher.hash("10.0.0.1", clock));
    }
}
