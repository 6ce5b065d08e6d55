package de.bsommerfeld.golinks.db;

import com.google.inject.Inject;
import com.google.inject.Singleton;
import de.bsommerfeld.golinks.core.domain.ClickEvent;
import de.bsommerfeld.golinks.core.domain.ClickStats;
import de.bsommerfeld.golinks.core.domain.RecentClick;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * {@link ClickStore} writing to {@code link_clicks}, plus the per-link
 * aggregates read back from it.
 */
@Singleton
public class SqlClickStore implements ClickStore {

    static final int MAX_USER_AGENT_LENGTH = 512;
    static final int MAX_REFERRER_LENGTH = 2048;

    private final Database database;
    private final Clock clock;

    @Inject
    public SqlClickStore(Database database) {
        this(database, Clock.systemUTC());
    }

    SqlClickStore(Database database, Clock clock) {
        this.database = database;
        this.clock = clock;
    }

    @Override
    public void recordClick(ClickEvent event) {
        Instant clickedAt = event.clickedAt() != null ? event.clickedAt() : clock.instant();
        database.withConnection("recordClick", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(SqlLoader.load(database.dialect(), "insert-click"))) {
                ps.setString(1, UUID.randomUUID().toString());
                ps.setString(2, event.linkId());
                if (event.userId() == null || event.userId().isBlank())
                    ps.setNull(3, Types.VARCHAR);
                else
                    ps.setString(3, event.userId());
                ps.setString(4, event.ipHash() == null ? "" : event.ipHash());
                ps.setString(5, truncate(event.userAgent(), MAX_USER_AGENT_LENGTH));
                ps.setString(6, truncate(event.referrer(), MAX_REFERRER_LENGTH));
                ps.setLong(7, clickedAt.toEpochMilli());
                return ps.executeUpdate();
            }
        });
    }

    /**
     * Total clicks of a link and those within the last 7 and 30 days.
     */
    public ClickStats getClickStats(String linkId) {
        Instant now = clock.instant();
        return database.withConnection("getClickStats", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    SqlLoader.load(database.dialect(), "select-click-stats"))) {
                ps.setLong(1, now.minus(Duration.ofDays(7)).toEpochMilli());
                ps.setLong(2, now.minus(Duration.ofDays(30)).toEpochMilli());
                ps.setString(3, linkId);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next())
                        return new ClickStats(0, 0, 0);
                    return new ClickStats(rs.getLong("total"), rs.getLong("last_7_days"), rs.getLong("last_30_days"));
                }
            }
        });
    }

    /**
     * Newest clicks of a link, with the clicking user's display name when the
     * click was made by a known user.
     */
    public List<RecentClick> listRecentClicks(String linkId, int limit) {
        return database.withConnection("listRecentClicks", conn -> {
            try (PreparedStatement ps = conn.prepareStatement(
                    SqlLoader.load(database.dialect(), "select-recent-clicks"))) {
                ps.setString(1, linkId);
                ps.setInt(2, Math.max(limit, 0));
                try (ResultSet rs = ps.executeQuery()) {
                    List<RecentClick> clicks = new ArrayList<>();
                    while (rs.next()) {
                        clicks.add(new RecentClick(
                                Instant.ofEpochMilli(rs.getLong("clicked_at")),
                                rs.getString("referrer"),
                                rs.getString("user_id"),
                                rs.getString("display_name")));
                    }
                    return clicks;
                }
            }
        });
    }

    /**
     * Cuts {@code value} to at most {@code max} chars without splitting a
     * surrogate pair.
     */
    static String truncate(String value, int max) {
        if (value == null || value.length() <= max)
            return value;
        int end = Character.isHighSurrogate(value.charAt(max - 1)) ? max - 1 : max;
        return value.substring(0, end);
    }
}
