/*
 * Where: Relay data access
 * What: Per-user delivery preferences (email address, channel switches, muted kinds)
 */
package com.mysocial.relay.repository;

import static com.mysocial.common.JdbcTimestampUtils.toInstant;
import static com.mysocial.common.JdbcTimestampUtils.toTimestamp;

import com.mysocial.relay.model.UserPreferences;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class UserPreferencesRepository {

  private static final String KIND_SEPARATOR = ",";

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<UserPreferences> findByUser(String userAddress) {
    final String sql =
        """
        SELECT user_address,
               email_address,
               push_enabled,
               email_enabled,
               array_to_string(muted_kinds, ',') AS muted_kinds_csv,
               updated_at
        FROM relay_user_preferences
        WHERE user_address = :userAddress
        """;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("userAddress", userAddress), this::mapRow)
        .stream()
        .findFirst();
  }

  public int upsert(UserPreferences preferences) {
    // event kinds never contain commas, so a joined string round-trips through text[]
    final String sql =
        """
        INSERT INTO relay_user_preferences (
          user_address, email_address, push_enabled, email_enabled, muted_kinds, updated_at
        ) VALUES (
          :userAddress,
          :emailAddress,
          :pushEnabled,
          :emailEnabled,
          COALESCE(string_to_array(:mutedKinds, ','), '{}'),
          :updatedAt
        )
        ON CONFLICT (user_address) DO UPDATE
        SET email_address = EXCLUDED.email_address,
            push_enabled = EXCLUDED.push_enabled,
            email_enabled = EXCLUDED.email_enabled,
            muted_kinds = EXCLUDED.muted_kinds,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userAddress", preferences.userAddress())
            .addValue("emailAddress", preferences.emailAddress())
            .addValue("pushEnabled", preferences.pushEnabled())
            .addValue("emailEnabled", preferences.emailEnabled())
            .addValue("mutedKinds", String.join(KIND_SEPARATOR, preferences.mutedKinds()))
            .addValue("updatedAt", toTimestamp(preferences.updatedAt()));
    return jdbcTemplate.update(sql, params);
  }

  private UserPreferences mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new UserPreferences(
        rs.getString("user_address"),
        rs.getString("email_address"),
        rs.getBoolean("push_enabled"),
        rs.getBoolean("email_enabled"),
        splitKinds(rs.getString("muted_kinds_csv")),
        toInstant(rs.getTimestamp("updated_at")));
  }

  private Set<String> splitKinds(String csv) {
    if (csv == null || csv.isBlank()) {
      return Set.of();
    }
    return Arrays.stream(csv.split(KIND_SEPARATOR))
        .map(String::trim)
        .filter(kind -> !kind.isEmpty())
        .collect(Collectors.toUnmodifiableSet());
  }
}
