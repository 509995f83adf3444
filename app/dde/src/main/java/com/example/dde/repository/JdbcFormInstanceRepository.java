/*
 * どこで: DDE データアクセス
 * 何を: form_instances の参照/条件付き遷移/集計を PostgreSQL で実装する
 * なぜ: 遷移元状態を WHERE 句で固定し、不正な遷移を DB 側でも起こさないため
 */
package com.example.dde.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dde.model.CompletionStatus;
import com.example.dde.model.FormInstanceRecord;
import com.example.dde.model.PendingFormInstance;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@SuppressFBWarnings(
    value = "EI_EXPOSE_REP2",
    justification = "JdbcTemplate と ObjectMapper は Spring 管理の共有コンポーネントのため")
public class JdbcFormInstanceRepository implements FormInstanceRepository {

  private static final Logger logger = LoggerFactory.getLogger(JdbcFormInstanceRepository.class);

  private static final TypeReference<Map<Long, String>> SNAPSHOT_TYPE = new TypeReference<>() {};

  // fi は form_instances もしくは同じ列を持つ CTE を指す
  private static final String SELECT_COLUMNS =
      """
      SELECT
        fi.form_instance_id,
        fi.form_id,
        f.name AS form_name,
        fi.site_id,
        fi.subject_label,
        fi.event_name,
        fi.completion_status_id,
        f.double_entry,
        fi.first_entrant_id,
        fi.first_entry_at,
        fi.second_entrant_id,
        fi.second_entry_at,
        fi.second_entry_values,
        fi.completed_at,
        fi.version
      """;

  private final NamedParameterJdbcTemplate jdbcTemplate;
  private final ObjectMapper objectMapper;

  public JdbcFormInstanceRepository(
      NamedParameterJdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
    this.jdbcTemplate = jdbcTemplate;
    this.objectMapper = objectMapper;
  }

  @Override
  public Optional<FormInstanceRecord> findById(long formInstanceId) {
    final String sql =
        SELECT_COLUMNS
            + """
            FROM form_instances fi
            JOIN crf_forms f ON f.form_id = fi.form_id
            WHERE fi.form_instance_id = :formInstanceId
            """;
    return jdbcTemplate.query(sql, idParams(formInstanceId), this::mapRow).stream().findFirst();
  }

  @Override
  @Transactional(propagation = Propagation.MANDATORY)
  public Optional<FormInstanceRecord> findByIdForUpdate(long formInstanceId) {
    // 同一フォームインスタンスへの遷移をトランザクション内で直列化する。
    // crf_forms はロック対象から外す。
    final String sql =
        SELECT_COLUMNS
            + """
            FROM form_instances fi
            JOIN crf_forms f ON f.form_id = fi.form_id
            WHERE fi.form_instance_id = :formInstanceId
            FOR UPDATE OF fi
            """;
    return jdbcTemplate.query(sql, idParams(formInstanceId), this::mapRow).stream().findFirst();
  }

  @Override
  public boolean isDoubleEntryRequired(long formInstanceId) {
    final String sql =
        """
        SELECT f.double_entry
        FROM form_instances fi
        JOIN crf_forms f ON f.form_id = fi.form_id
        WHERE fi.form_instance_id = :formInstanceId
        """;
    final List<Boolean> rows =
        jdbcTemplate.query(sql, idParams(formInstanceId), (rs, rowNum) -> rs.getBoolean(1));
    return !rows.isEmpty() && Boolean.TRUE.equals(rows.get(0));
  }

  @Override
  public Optional<FormInstanceRecord> startFirstEntry(long formInstanceId, Instant updatedAt) {
    final String update =
        """
        UPDATE form_instances
        SET completion_status_id = :toStatus,
            version = version + 1,
            updated_at = :updatedAt
        WHERE form_instance_id = :formInstanceId
          AND completion_status_id IN (:fromStatuses)
        """;
    final MapSqlParameterSource params =
        idParams(formInstanceId)
            .addValue("toStatus", CompletionStatus.FIRST_ENTRY_IN_PROGRESS.code())
            .addValue("fromStatuses", List.of(CompletionStatus.NOT_STARTED.code()))
            .addValue("updatedAt", toTimestamp(updatedAt));
    return updateReturning(update, params);
  }

  @Override
  public Optional<FormInstanceRecord> markFirstEntryComplete(
      long formInstanceId, String firstEntrantId, Instant completedAt) {
    final String update =
        """
        UPDATE form_instances
        SET completion_status_id = :toStatus,
            first_entrant_id = :firstEntrantId,
            first_entry_at = :completedAt,
            version = version + 1,
            updated_at = :completedAt
        WHERE form_instance_id = :formInstanceId
          AND completion_status_id IN (:fromStatuses)
        """;
    final MapSqlParameterSource params =
        idParams(formInstanceId)
            .addValue("toStatus", CompletionStatus.FIRST_ENTRY_COMPLETE.code())
            .addValue(
                "fromStatuses",
                List.of(
                    CompletionStatus.NOT_STARTED.code(),
                    CompletionStatus.FIRST_ENTRY_IN_PROGRESS.code()))
            .addValue("firstEntrantId", firstEntrantId)
            .addValue("completedAt", toTimestamp(completedAt));
    return updateReturning(update, params);
  }

  @Override
  public Optional<FormInstanceRecord> storeSecondEntry(
      long formInstanceId,
      String secondEntrantId,
      Map<Long, String> secondEntryValues,
      Instant submittedAt) {
    // 2 回目入力者が埋まっている場合は更新しない (二重提出の防止)。
    final String update =
        """
        UPDATE form_instances
        SET completion_status_id = :toStatus,
            second_entrant_id = :secondEntrantId,
            second_entry_at = :submittedAt,
            second_entry_values = :secondEntryValues,
            version = version + 1,
            updated_at = :submittedAt
        WHERE form_instance_id = :formInstanceId
          AND completion_status_id IN (:fromStatuses)
          AND second_entrant_id IS NULL
        """;
    final MapSqlParameterSource params =
        idParams(formInstanceId)
            .addValue("toStatus", CompletionStatus.SECOND_ENTRY_IN_PROGRESS.code())
            .addValue("fromStatuses", List.of(CompletionStatus.FIRST_ENTRY_COMPLETE.code()))
            .addValue("secondEntrantId", secondEntrantId)
            .addValue("secondEntryValues", writeSnapshot(secondEntryValues))
            .addValue("submittedAt", toTimestamp(submittedAt));
    return updateReturning(update, params);
  }

  @Override
  public Optional<FormInstanceRecord> markReconciled(long formInstanceId, Instant completedAt) {
    final String update =
        """
        UPDATE form_instances
        SET completion_status_id = :toStatus,
            completed_at = :completedAt,
            version = version + 1,
            updated_at = :completedAt
        WHERE form_instance_id = :formInstanceId
          AND completion_status_id IN (:fromStatuses)
        """;
    final MapSqlParameterSource params =
        idParams(formInstanceId)
            .addValue("toStatus", CompletionStatus.RECONCILED.code())
            .addValue("fromStatuses", List.of(CompletionStatus.SECOND_ENTRY_IN_PROGRESS.code()))
            .addValue("completedAt", toTimestamp(completedAt));
    return updateReturning(update, params);
  }

  @Override
  public List<PendingFormInstance> findPendingSecondEntry(Long siteId, int limit) {
    final StringBuilder sql =
        new StringBuilder(SELECT_COLUMNS)
            .append(
                """
                , 0 AS open_discrepancies
                FROM form_instances fi
                JOIN crf_forms f ON f.form_id = fi.form_id
                WHERE fi.completion_status_id = :status
                  AND f.double_entry = TRUE
                """);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", CompletionStatus.FIRST_ENTRY_COMPLETE.code())
            .addValue("limit", limit);
    appendSiteFilter(sql, params, siteId);
    sql.append(" ORDER BY fi.first_entry_at ASC NULLS LAST, fi.form_instance_id ASC LIMIT :limit");
    return jdbcTemplate.query(sql.toString(), params, this::mapPendingRow);
  }

  @Override
  public List<PendingFormInstance> findPendingResolution(Long siteId, int limit) {
    final StringBuilder sql =
        new StringBuilder(SELECT_COLUMNS)
            .append(
                """
                , oc.open_count AS open_discrepancies
                FROM form_instances fi
                JOIN crf_forms f ON f.form_id = fi.form_id
                JOIN (
                  SELECT form_instance_id, count(*) AS open_count
                  FROM dde_discrepancies
                  WHERE status = 'OPEN'
                  GROUP BY form_instance_id
                ) oc ON oc.form_instance_id = fi.form_instance_id
                WHERE fi.completion_status_id = :status
                  AND f.double_entry = TRUE
                """);
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("status", CompletionStatus.SECOND_ENTRY_IN_PROGRESS.code())
            .addValue("limit", limit);
    appendSiteFilter(sql, params, siteId);
    sql.append(
        " ORDER BY fi.second_entry_at ASC NULLS LAST, fi.form_instance_id ASC LIMIT :limit");
    return jdbcTemplate.query(sql.toString(), params, this::mapPendingRow);
  }

  @Override
  public Map<CompletionStatus, Long> countByStatus(Long siteId) {
    final StringBuilder sql =
        new StringBuilder(
            """
            SELECT fi.completion_status_id, count(*) AS cnt
            FROM form_instances fi
            JOIN crf_forms f ON f.form_id = fi.form_id
            WHERE f.double_entry = TRUE
            """);
    final MapSqlParameterSource params = new MapSqlParameterSource();
    appendSiteFilter(sql, params, siteId);
    sql.append(" GROUP BY fi.completion_status_id");
    final Map<CompletionStatus, Long> counts = new EnumMap<>(CompletionStatus.class);
    jdbcTemplate.query(
        sql.toString(),
        params,
        (RowCallbackHandler)
            rs ->
                counts.put(
                    CompletionStatus.fromCode(rs.getInt("completion_status_id")),
                    rs.getLong("cnt")));
    return counts;
  }

  private Optional<FormInstanceRecord> updateReturning(
      String update, MapSqlParameterSource params) {
    // 更新できた場合のみ、フォーム定義を JOIN した最新行を返す
    final String sql =
        "WITH fi AS ("
            + update
            + " RETURNING *) "
            + SELECT_COLUMNS
            + " FROM fi JOIN crf_forms f ON f.form_id = fi.form_id";
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  private void appendSiteFilter(StringBuilder sql, MapSqlParameterSource params, Long siteId) {
    if (siteId == null) {
      return;
    }
    sql.append(" AND fi.site_id = :siteId");
    params.addValue("siteId", siteId);
  }

  private MapSqlParameterSource idParams(long formInstanceId) {
    return new MapSqlParameterSource().addValue("formInstanceId", formInstanceId);
  }

  private String writeSnapshot(Map<Long, String> secondEntryValues) {
    try {
      return objectMapper.writeValueAsString(
          secondEntryValues == null ? Map.of() : secondEntryValues);
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("failed to serialize second entry snapshot", ex);
    }
  }

  private Map<Long, String> readSnapshot(long formInstanceId, String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      final Map<Long, String> values = objectMapper.readValue(json, SNAPSHOT_TYPE);
      return values == null ? Map.of() : values;
    } catch (JsonProcessingException ex) {
      // 壊れたスナップショットは空として扱い、比較自体は継続させる。
      logger.warn(
          "could not parse second entry snapshot. formInstanceId={} reason={}",
          formInstanceId,
          ex.getOriginalMessage());
      return Map.of();
    }
  }

  private FormInstanceRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    final long formInstanceId = rs.getLong("form_instance_id");
    return new FormInstanceRecord(
        formInstanceId,
        rs.getLong("form_id"),
        rs.getString("form_name"),
        rs.getLong("site_id"),
        rs.getString("subject_label"),
        rs.getString("event_name"),
        CompletionStatus.fromCode(rs.getInt("completion_status_id")),
        rs.getBoolean("double_entry"),
        rs.getString("first_entrant_id"),
        toInstant(rs, "first_entry_at"),
        rs.getString("second_entrant_id"),
        toInstant(rs, "second_entry_at"),
        readSnapshot(formInstanceId, rs.getString("second_entry_values")),
        toInstant(rs, "completed_at"),
        rs.getLong("version"));
  }

  private PendingFormInstance mapPendingRow(ResultSet rs, int rowNum) throws SQLException {
    return new PendingFormInstance(mapRow(rs, rowNum), rs.getInt("open_discrepancies"));
  }
}
