/*
 * どこで: Newsletter データアクセス
 * 何を: newsletter_issues の登録/取得と issue_delivery_queue への配信タスク投入を担う
 * なぜ: 発行の副作用を冪等キー確保と同じトランザクションに載せるため
 */
package com.example.newsletter.repository;

import static com.example.common.JdbcTimestampUtils.toInstant;
import static com.example.common.JdbcTimestampUtils.toTimestamp;

import com.example.newsletter.model.NewsletterIssueRecord;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

@Repository
@RequiredArgsConstructor
public class NewsletterIssueRepository {

  private final NamedParameterJdbcTemplate jdbcTemplate;

  @Transactional(propagation = Propagation.MANDATORY)
  public void insertIssue(NewsletterIssueRecord record) {
    final String sql =
        """
        INSERT INTO newsletter_issues (
          issue_id,
          title,
          text_content,
          html_content,
          published_by,
          published_at
        ) VALUES (
          :issueId,
          :title,
          :textContent,
          :htmlContent,
          :publishedBy,
          :publishedAt
        )
        """;
    final MapSqlParameterSource params =
        new MapSqlParameterSource()
            .addValue("issueId", record.issueId())
            .addValue("title", record.title())
            .addValue("textContent", record.textContent())
            .addValue("htmlContent", record.htmlContent())
            .addValue("publishedBy", record.publishedBy())
            .addValue("publishedAt", toTimestamp(record.publishedAt()));
    jdbcTemplate.update(sql, params);
  }

  @Transactional(propagation = Propagation.MANDATORY)
  public int enqueueDeliveryTasks(UUID issueId, List<String> subscriberEmails) {
    // 実配信は外部ワーカーの責務。ここでは宛先ごとのタスクを積むだけ。
    if (subscriberEmails.isEmpty()) {
      return 0;
    }
    final String sql =
        """
        INSERT INTO issue_delivery_queue (
          issue_id,
          subscriber_email
        ) VALUES (
          :issueId,
          :subscriberEmail
        )
        """;
    final SqlParameterSource[] batch =
        subscriberEmails.stream()
            .map(
                email ->
                    new MapSqlParameterSource()
                        .addValue("issueId", issueId)
                        .addValue("subscriberEmail", email))
            .toArray(SqlParameterSource[]::new);
    jdbcTemplate.batchUpdate(sql, batch);
    return batch.length;
  }

  public Optional<NewsletterIssueRecord> findById(UUID issueId) {
    final String sql =
        """
        SELECT issue_id, title, text_content, html_content, published_by, published_at
        FROM newsletter_issues
        WHERE issue_id = :issueId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("issueId", issueId);
    return jdbcTemplate.query(sql, params, this::mapRow).stream().findFirst();
  }

  public int countDeliveryTasks(UUID issueId) {
    final String sql =
        """
        SELECT count(*)
        FROM issue_delivery_queue
        WHERE issue_id = :issueId
        """;
    final MapSqlParameterSource params = new MapSqlParameterSource().addValue("issueId", issueId);
    final Integer count = jdbcTemplate.queryForObject(sql, params, Integer.class);
    return count == null ? 0 : count;
  }

  private NewsletterIssueRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
    return new NewsletterIssueRecord(
        rs.getObject("issue_id", UUID.class),
        rs.getString("title"),
        rs.getString("text_content"),
        rs.getString("html_content"),
        rs.getObject("published_by", UUID.class),
        toInstant(rs.getTimestamp("published_at")));
  }
}
