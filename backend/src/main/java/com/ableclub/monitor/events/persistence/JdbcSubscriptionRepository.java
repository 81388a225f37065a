package com.ableclub.monitor.events.persistence;

import com.ableclub.monitor.events.model.NotificationChannel;
import com.ableclub.monitor.events.model.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Read-only view over the notification settings and keyword lists owned by
 * the account management side of the application.
 */
@Repository
public class JdbcSubscriptionRepository implements SubscriptionSource {
    private static final Logger log = LoggerFactory.getLogger(JdbcSubscriptionRepository.class);

    private final NamedParameterJdbcTemplate jdbc;

    public JdbcSubscriptionRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public List<Subscription> listActiveSubscriptions() {
        Map<Long, SubscriptionRow> rows = new LinkedHashMap<>();
        jdbc.query(
            """
                SELECT ns.user_id,
                       ns.notify_type,
                       ns.address,
                       k.keyword
                FROM notify_settings ns
                JOIN users u ON u.id = ns.user_id
                LEFT JOIN keywords k ON k.user_id = ns.user_id
                WHERE ns.is_active = TRUE
                  AND u.is_active = TRUE
                  AND ns.address IS NOT NULL
                  AND TRIM(ns.address) <> ''
                ORDER BY ns.user_id ASC, k.id ASC
                """,
            new MapSqlParameterSource(),
            rs -> {
                long userId = rs.getLong("user_id");
                SubscriptionRow row = rows.get(userId);
                if (row == null) {
                    row = new SubscriptionRow(rs.getString("notify_type"), rs.getString("address"));
                    rows.put(userId, row);
                }
                String keyword = rs.getString("keyword");
                if (keyword != null) {
                    row.keywords.add(keyword);
                }
            }
        );

        List<Subscription> subscriptions = new ArrayList<>(rows.size());
        for (Map.Entry<Long, SubscriptionRow> entry : rows.entrySet()) {
            SubscriptionRow row = entry.getValue();
            NotificationChannel channel = NotificationChannel.fromCode(row.notifyType);
            if (channel == null) {
                log.warn("Skipping subscription for user {} with unsupported channel {}", entry.getKey(), row.notifyType);
                continue;
            }
            subscriptions.add(new Subscription(entry.getKey(), row.keywords, channel, row.address.trim()));
        }
        return subscriptions;
    }

    private static final class SubscriptionRow {
        private final String notifyType;
        private final String address;
        private final List<String> keywords = new ArrayList<>();

        private SubscriptionRow(String notifyType, String address) {
            this.notifyType = notifyType;
            this.address = address;
        }
    }
}
