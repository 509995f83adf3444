/*
 * どこで: DDE データアクセス
 * 何を: field_entries の参照/更新を行う
 * なぜ: 比較の入力取得と解決値の書き戻しを一箇所にまとめるため
 */
package com.example.dde.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dde.model.FieldEntryRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcFieldEntryRepository implements FieldEntryRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public List<FieldEntryRecord> findByFormInstanceId(long formInstanceId) {
    final String sql =
        """
        SELECT field_entry_id, form_instance_id, field_name, value, updated_by, updated_at
        FROM field_entries
        WHERE form_instance_id = :formInstanceId
        ORDER BY field_entry_id ASC
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("formInstanceId", formInstanceId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  @Override
  public Optional<FieldEntryRecord> findById(long fieldEntryId) {
    final String sql =
        """
        SELECT field_entry_id, form_instance_id, field_name, value, updated_by, updated_at
        FROM field_entries
        WHERE field_entry_id = :fieldEntryId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("fieldEntryId", fieldEntryId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public int updateValue(
      long fieldEntryId, String value, String actingUserId, Instant updatedAt) {
    final String sql =
        """
        UPDATE field_entries
        SET value = :value,
            updated_by = :actingUserId,
            updated_at = :updatedAt
        WHERE field_entry_id = :fieldEntryId
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("fieldEntryId", fieldEntryId)
            .addValue("value", value)
            .addValue("actingUserId", actingUserId)
            .addValue("updatedAt", toTimestamp(updatedAt));
    return jdbcTemplate.update(sql, params);
  }

  private FieldEntryRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new FieldEntryRecord(
        rs.getLong("field_entry_id"),
        rs.getLong("form_instance_id"),
        rs.getString("field_name"),
        rs.getString("value"),
        rs.getString("updated_by"),
        rs.getTimestamp("updated_at").toInstant());
  }
}
