/*
 * Where: Relay data access
 * What: Reads per-platform provider credentials
 * Why: Platform rows are maintained by the platform admin flow; the relay only reads them
 */
package com.mysocial.relay.repository;

import com.mysocial.relay.model.DeliveryConfig;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class PlatformDeliveryConfigRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  public Optional<DeliveryConfig> findByPlatformId(String platformId) {
    final String sql =
        """
        SELECT apns_key_id,
               apns_team_id,
               apns_bundle_id,
               apns_key_path,
               apns_key_content,
               apns_production,
               fcm_server_key,
               resend_api_key,
               resend_from_email
        FROM relay_platform_delivery_config
        WHERE platform_id = :platformId
        """;
    return jdbcTemplate
        .query(sql, new MapSqlParameterSource("platformId", platformId), this::mapRow)
        .stream()
        .findFirst();
  }

  private DeliveryConfig mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new DeliveryConfig(
        rs.getString("apns_key_id"),
        rs.getString("apns_team_id"),
        rs.getString("apns_bundle_id"),
        rs.getString("apns_key_path"),
        rs.getString("apns_key_content"),
        rs.getObject("apns_production", Boolean.class),
        rs.getString("fcm_server_key"),
        rs.getString("resend_api_key"),
        rs.getString("resend_from_email"));
  }
}
