/*
 * どこで: DDE データアクセス
 * 何を: dde_discrepancies の登録/解決/参照を行う
 * なぜ: OPEN から RESOLVED への遷移を条件付き更新で 1 回に限定するため
 */
package com.example.dde.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dde.model.DiscrepancyRecord;
import com.example.dde.model.DiscrepancyStatus;
import com.example.dde.model.ResolutionStrategy;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class JdbcDiscrepancyRepository implements DiscrepancyRepository {

  private static final String SELECT_COLUMNS =
      """
      SELECT
        d.discrepancy_id,
        d.form_instance_id,
        d.field_entry_id,
        fe.field_name,
        d.first_value,
        d.second_value,
        d.status,
        d.strategy,
        d.resolved_value,
        d.resolver_id,
        d.resolved_at,
        d.resolution_notes,
        d.created_at
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public long insert(
      long formInstanceId,
      long fieldEntryId,
      String firstValue,
      String secondValue,
      Instant createdAt) {
    final String sql =
        """
        INSERT INTO dde_discrepancies (
          form_instance_id,
          field_entry_id,
          first_value,
          second_value,
          status,
          created_at
        ) VALUES (
          :formInstanceId,
          :fieldEntryId,
          :firstValue,
          :secondValue,
          'OPEN',
          :createdAt
        )
        RETURNING discrepancy_id
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("formInstanceId", formInstanceId)
            .addValue("fieldEntryId", fieldEntryId)
            .addValue("firstValue", firstValue)
            .addValue("secondValue", secondValue)
            .addValue("createdAt", toTimestamp(createdAt));
    final Long id = jdbcTemplate.queryForObject(sql, params, Long.class);
    if (id == null) {
      throw new IllegalStateException("discrepancy_id was not returned");
    }
    return id;
  }

  @Override
  public Optional<DiscrepancyRecord> findById(long discrepancyId) {
    final String sql =
        SELECT_COLUMNS
            + """
            FROM dde_discrepancies d
            JOIN field_entries fe ON fe.field_entry_id = d.field_entry_id
            WHERE d.discrepancy_id = :discrepancyId
            """;
    return jdbcTemplate.query(sql, idParams(discrepancyId), this::mapRow).stream().findFirst();
  }

  @Override
  @Transactional(propagation = Propagation.MANDATORY)
  public Optional<DiscrepancyRecord> findByIdForUpdate(long discrepancyId) {
    final String sql =
        SELECT_COLUMNS
            + """
            FROM dde_discrepancies d
            JOIN field_entries fe ON fe.field_entry_id = d.field_entry_id
            WHERE d.discrepancy_id = :discrepancyId
            FOR UPDATE OF d
            """;
    return jdbcTemplate.query(sql, idParams(discrepancyId), this::mapRow).stream().findFirst();
  }

  @Override
  public Optional<DiscrepancyRecord> findLatestByFieldEntryId(long fieldEntryId) {
    final String sql =
        SELECT_COLUMNS
            + """
            FROM dde_discrepancies d
            JOIN field_entries fe ON fe.field_entry_id = d.field_entry_id
            WHERE d.field_entry_id = :fieldEntryId
            ORDER BY d.created_at DESC, d.discrepancy_id DESC
            LIMIT 1
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("fieldEntryId", fieldEntryId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public Optional<DiscrepancyRecord> markResolved(
      long discrepancyId,
      ResolutionStrategy strategy,
      String resolvedValue,
      String resolverId,
      String resolutionNotes,
      Instant resolvedAt) {
    // 既に RESOLVED の行は更新しない (解決は 1 回限り)
    final String sql =
        "WITH d AS ("
            + """
            UPDATE dde_discrepancies
            SET status = 'RESOLVED',
                strategy = :strategy,
                resolved_value = :resolvedValue,
                resolver_id = :resolverId,
                resolution_notes = :resolutionNotes,
                resolved_at = :resolvedAt
            WHERE discrepancy_id = :discrepancyId
              AND status = 'OPEN'
            RETURNING *
            """
            + ") "
            + SELECT_COLUMNS
            + " FROM d JOIN field_entries fe ON fe.field_entry_id = d.field_entry_id";
    final MapSqlParameterSource params =
        idParams(discrepancyId)
            .addValue("strategy", strategy.name())
            .addValue("resolvedValue", resolvedValue)
            .addValue("resolverId", resolverId)
            .addValue("resolutionNotes", resolutionNotes)
            .addValue("resolvedAt", toTimestamp(resolvedAt));
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  @Override
  public int countOpenByFormInstanceId(long formInstanceId) {
    final String sql =
        """
        SELECT count(*)
        FROM dde_discrepancies
        WHERE form_instance_id = :formInstanceId
          AND status = 'OPEN'
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("formInstanceId", formInstanceId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  @Override
  public List<DiscrepancyRecord> findByFormInstanceId(long formInstanceId) {
    final String sql =
        SELECT_COLUMNS
            + """
            FROM dde_discrepancies d
            JOIN field_entries fe ON fe.field_entry_id = d.field_entry_id
            WHERE d.form_instance_id = :formInstanceId
            ORDER BY d.created_at ASC, d.discrepancy_id ASC
            """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource().addValue("formInstanceId", formInstanceId);
    return jdbcTemplate.query(sql, params, this::mapRow);
  }

  private MapSqlParameterSource idParams(long discrepancyId) {
    return new MapSqlParameterSource().addValue("discrepancyId", discrepancyId);
  }

  private DiscrepancyRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final String strategy = rs.getString("strategy");
    return new DiscrepancyRecord(
        rs.getLong("discrepancy_id"),
        rs.getLong("form_instance_id"),
        rs.getLong("field_entry_id"),
        rs.getString("field_name"),
        rs.getString("first_value"),
        rs.getString("second_value"),
        DiscrepancyStatus.valueOf(rs.getString("status")),
        strategy == null ? null : ResolutionStrategy.valueOf(strategy),
        rs.getString("resolved_value"),
        rs.getString("resolver_id"),
        toInstant(rs, "resolved_at"),
        rs.getString("resolution_notes"),
        rs.getTimestamp("created_at").toInstant());
  }
}
