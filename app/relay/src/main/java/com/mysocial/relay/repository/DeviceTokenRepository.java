/*
 * Where: Relay data access
 * What: Device token registration and lookup per user
 */
package com.mysocial.relay.repository;

import static com.mysocial.common.JdbcTimestampUtils.toInstant;
import static com.mysocial.common.JdbcTimestampUtils.toTimestamp;

import com.mysocial.relay.model.DevicePlatform;
import com.mysocial.relay.model.DeviceTokenRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class DeviceTokenRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public int upsert(DeviceTokenRecord token) {
    final String sql =
        """
        INSERT INTO relay_device_tokens (
          user_address, device_token, platform, platform_id, created_at, updated_at
        ) VALUES (
          :userAddress, :deviceToken, :platform, :platformId, :updatedAt, :updatedAt
        )
        ON CONFLICT (user_address, device_token) DO UPDATE
        SET platform = EXCLUDED.platform,
            platform_id = EXCLUDED.platform_id,
            updated_at = EXCLUDED.updated_at
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("userAddress", token.userAddress())
            .addValue("deviceToken", token.deviceToken())
            .addValue("platform", token.platform().wireName())
            .addValue("platformId", token.platformId())
            .addValue("updatedAt", toTimestamp(token.updatedAt()));
    return jdbcTemplate.update(sql, params);
  }

  public List<DeviceTokenRecord> findByUser(String userAddress) {
    final String sql =
        """
        SELECT user_address, device_token, platform, platform_id, updated_at
        FROM relay_device_tokens
        WHERE user_address = :userAddress
        ORDER BY updated_at DESC
        """;
    return jdbcTemplate.query(
        sql, new MapSqlParameterSource("userAddress", userAddress), this::mapRow);
  }

  public int delete(String userAddress, String deviceToken) {
    final String sql =
        """
        DELETE FROM relay_device_tokens
        WHERE user_address = :userAddress
          AND device_token = :deviceToken
        """;
    return jdbcTemplate.update(
        sql,
        new MapSqlParameterSource()
            .addValue("userAddress", userAddress)
            .addValue("deviceToken", deviceToken));
  }

  private DeviceTokenRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DeviceTokenRecord(
        rs.getString("user_address"),
        rs.getString("device_token"),
        DevicePlatform.fromWireName(rs.getString("platform")),
        rs.getString("platform_id"),
        toInstant(rs.getTimestamp("updated_at")));
  }
}
