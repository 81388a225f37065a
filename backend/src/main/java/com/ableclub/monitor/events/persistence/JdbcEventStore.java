package com.ableclub.monitor.events.persistence;

import com.ableclub.monitor.events.model.ScrapedEvent;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;

@Repository
public class JdbcEventStore implements EventStore {
    private static final int MAX_TITLE_LENGTH = 1000;
    private static final int MAX_BODY_LENGTH = 4000;

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcEventStore(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public boolean exists(String externalId) {
        Integer count = jdbc.queryForObject(
            """
                SELECT COUNT(*)
                FROM scraped_events
                WHERE external_id = :externalId
                """,
            new MapSqlParameterSource().addValue("externalId", externalId),
            Integer.class
        );
        return count != null && count > 0;
    }

    @Override
    public boolean insert(ScrapedEvent event, Instant discoveredAt) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("externalId", event.externalId())
            .addValue("title", truncate(event.title(), MAX_TITLE_LENGTH))
            .addValue("body", truncate(event.body(), MAX_BODY_LENGTH))
            .addValue("startDate", event.startDate())
            .addValue("endDate", event.endDate())
            .addValue("discoveredAt", Timestamp.from(discoveredAt));
        try {
            int updated = jdbc.update(
                """
                    INSERT INTO scraped_events (
                        external_id,
                        title,
                        body,
                        start_date_text,
                        end_date_text,
                        discovered_at
                    )
                    VALUES (
                        :externalId,
                        :title,
                        :body,
                        :startDate,
                        :endDate,
                        :discoveredAt
                    )
                    """,
                params
            );
            return updated > 0;
        } catch (DuplicateKeyException e) {
            return false;
        }
    }

    /** Stored events, most recently discovered first. */
    public List<ScrapedEvent> findRecent(int offset, int limit) {
        return jdbc.query(
            """
                SELECT external_id,
                       title,
                       body,
                       start_date_text,
                       end_date_text
                FROM scraped_events
                ORDER BY discovered_at DESC, id DESC
                LIMIT :limit OFFSET :offset
                """,
            new MapSqlParameterSource()
                .addValue("limit", Math.max(1, limit))
                .addValue("offset", Math.max(0, offset)),
            (rs, rowNum) -> new ScrapedEvent(
                rs.getString("external_id"),
                rs.getString("title"),
                rs.getString("body"),
                rs.getString("start_date_text"),
                rs.getString("end_date_text")
            )
        );
    }

    public long countEvents() {
        Long count = jdbc.getJdbcTemplate().queryForObject("SELECT COUNT(*) FROM scraped_events", Long.class);
        return count == null ? 0L : count;
    }

    private String truncate(String value, int maxLength) {
        if (value == null || value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength);
    }
}
