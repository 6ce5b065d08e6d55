package de.bsommerfeld.golinks.tracking;

import com.google.common.hash.Hashing;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Pseudonymizes client addresses before they are stored. The digest is salted
 * with the UTC day, so the same address hashes identically within a day and
 * differently across days.
 */
public final class IpHasher {

    private static final DateTimeFormatter DAY = DateTimeFormatter.BASIC_ISO_DATE;

    private IpHasher() {
    }

    /** Hex SHA-256 of {@code ip + ":" + yyyyMMdd} for today (UTC). */
    public static String hash(String ip) {
        return hash(ip, Clock.systemUTC());
    }

    static String hash(String ip, Clock clock) {
        return hash(ip, LocalDate.now(clock.withZone(ZoneOffset.UTC)));
    }

    static String hash(String ip, LocalDate day) {
        String input = (ip == null ? "" : ip) + ":" + DAY.format(day);
        return Hashing.sha256().hashString(input, StandardCharsets.UTF_8).toString();
    }
}
