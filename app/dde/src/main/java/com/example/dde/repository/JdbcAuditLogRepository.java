/*
 * どこで: DDE データアクセス
 * 何を: audit_log_events への追記を行う
 * なぜ: 状態遷移と解決の根拠を後から確認できるようにするため
 */
package com.example.dde.repository;

import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.dde.model.AuditRecord;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.stereotype.Repository;

@Repository
@RequiredArgsConstructor
public class JdbcAuditLogRepository implements AuditLogRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Override
  public void insert(AuditRecord record) {
    final String sql =
        """
        INSERT INTO audit_log_events (
          audit_id,
          occurred_at,
          actor_user_id,
          entity_table,
          entity_id,
          entity_name,
          old_value,
          new_value,
          reason,
          form_instance_id
        ) VALUES (
          :auditId,
          :occurredAt,
          :actorUserId,
          :entityTable,
          :entityId,
          :entityName,
          :oldValue,
          :newValue,
          :reason,
          :formInstanceId
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("auditId", record.auditId())
            .addValue("occurredAt", toTimestamp(record.occurredAt()))
            .addValue("actorUserId", record.actorUserId())
            .addValue("entityTable", record.entityTable())
            .addValue("entityId", record.entityId())
            .addValue("entityName", record.entityName())
            .addValue("oldValue", record.oldValue())
            .addValue("newValue", record.newValue())
            .addValue("reason", record.reason())
            .addValue("formInstanceId", record.formInstanceId());
    jdbcTemplate.update(sql, params);
  }
}
