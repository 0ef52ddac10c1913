package com.dsaflow.adapter.out.persistence;

import com.dsaflow.application.port.out.ReviewerRepository;
import com.dsaflow.domain.model.ReactivationRequest;
import com.dsaflow.domain.model.ReactivationStatus;
import com.dsaflow.domain.model.ReviewVerdict;
import com.dsaflow.domain.model.Reviewer;
import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.Tuple;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.sql.SQLIntegrityConstraintViolationException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.dsaflow.adapter.out.persistence.JdbcTimestamps.fromDb;
import static com.dsaflow.adapter.out.persistence.JdbcTimestamps.toDb;

/**
 * JDBC implementation of ReviewerRepository.
 * Counters are incremented in SQL; reactivation writes are conditional statements.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcReviewerPersistenceAdapter implements ReviewerRepository {

    private static final String SELECT_REVIEWER =
            "SELECT r.ID, r.NAME, r.EMAIL, r.PHONE, r.ACTIVE, r.VERIFIED, r.VERIFIED_BY, r.VERIFIED_AT, " +
            "r.MISSED_DEADLINE_COUNT, r.TOTAL_REVIEWED, r.APPROVED_COUNT, r.REJECTED_COUNT, " +
            "r.LAST_ACTIVITY_AT, r.CREATED_AT, " +
            "q.REASON, q.CLARIFICATION, q.STATUS AS REQUEST_STATUS, q.REQUESTED_AT, " +
            "q.REVIEWED_BY, q.REVIEWED_AT, q.ADMIN_NOTES " +
            "FROM REVIEWER r " +
            "LEFT JOIN (SELECT rr.*, ROW_NUMBER() OVER (PARTITION BY rr.REVIEWER_ID ORDER BY rr.ID DESC) AS RN " +
            "           FROM REACTIVATION_REQUEST rr) q " +
            "ON q.REVIEWER_ID = r.ID AND q.RN = 1 ";

    private final Pool pool;

    @Override
    public Future<Void> insert(Reviewer reviewer) {
        String sql = "INSERT INTO REVIEWER " +
                "(ID, NAME, EMAIL, PHONE, ACTIVE, VERIFIED, VERIFIED_BY, VERIFIED_AT, MISSED_DEADLINE_COUNT, " +
                "TOTAL_REVIEWED, APPROVED_COUNT, REJECTED_COUNT, LAST_ACTIVITY_AT, CREATED_AT) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";

        Tuple params = Tuple.tuple()
                .addString(reviewer.getId())
                .addString(reviewer.getName())
                .addString(reviewer.getEmail())
                .addString(reviewer.getPhone())
                .addInteger(reviewer.isActive() ? 1 : 0)
                .addInteger(reviewer.isVerified() ? 1 : 0)
                .addString(reviewer.getVerifiedBy())
                .addLocalDateTime(toDb(reviewer.getVerifiedAt()))
                .addInteger(reviewer.getMissedDeadlineCount())
                .addLong(reviewer.getTotalReviewed())
                .addLong(reviewer.getApprovedCount())
                .addLong(reviewer.getRejectedCount())
                .addLocalDateTime(toDb(reviewer.getLastActivityAt()))
                .addLocalDateTime(toDb(reviewer.getCreatedAt()));

        return pool.preparedQuery(sql)
                .execute(params)
                .onSuccess(result -> log.debug("Inserted reviewer {}", reviewer.getId()))
                .onFailure(error -> log.error("Failed to insert reviewer {}: {}", reviewer.getId(), error.getMessage()))
                .mapEmpty();
    }

    @Override
    public Future<Optional<Reviewer>> findById(String reviewerId) {
        return pool.preparedQuery(SELECT_REVIEWER + "WHERE r.ID = ?")
                .execute(Tuple.of(reviewerId))
                .<Optional<Reviewer>>map(rows -> {
                    if (rows.size() == 0) {
                        return Optional.empty();
                    }
                    return Optional.of(mapReviewer(rows.iterator().next()));
                })
                .onFailure(error -> log.error("Failed to load reviewer {}: {}", reviewerId, error.getMessage()));
    }

    @Override
    public Future<List<Reviewer>> findAvailable() {
        return pool.query(SELECT_REVIEWER + "WHERE r.ACTIVE = 1 AND r.VERIFIED = 1 ORDER BY r.CREATED_AT")
                .execute()
                .map(this::mapReviewers)
                .onFailure(error -> log.error("Failed to list available reviewers: {}", error.getMessage()));
    }

    @Override
    public Future<List<Reviewer>> findWithPendingReactivation() {
        return pool.query(SELECT_REVIEWER + "WHERE q.STATUS = 'pending' ORDER BY q.REQUESTED_AT")
                .execute()
                .map(this::mapReviewers)
                .onFailure(error -> log.error("Failed to list pending reactivation requests: {}", error.getMessage()));
    }

    @Override
    public Future<Boolean> recordOutcome(String reviewerId, ReviewVerdict verdict, Instant at) {
        String counter = verdict == ReviewVerdict.APPROVED ? "APPROVED_COUNT" : "REJECTED_COUNT";
        String sql = "UPDATE REVIEWER SET TOTAL_REVIEWED = TOTAL_REVIEWED + 1, " +
                counter + " = " + counter + " + 1, LAST_ACTIVITY_AT = ? WHERE ID = ?";

        return pool.preparedQuery(sql)
                .execute(Tuple.of(toDb(at), reviewerId))
                .map(result -> result.rowCount() > 0)
                .onFailure(error -> log.error("Failed to record outcome for reviewer {}: {}", reviewerId, error.getMessage()));
    }

    @Override
    public Future<Optional<Integer>> incrementMissedDeadlines(String reviewerId) {
        String update = "UPDATE REVIEWER SET MISSED_DEADLINE_COUNT = MISSED_DEADLINE_COUNT + 1 WHERE ID = ?";
        String select = "SELECT MISSED_DEADLINE_COUNT FROM REVIEWER WHERE ID = ?";

        return pool.withTransaction(connection -> connection.preparedQuery(update)
                        .execute(Tuple.of(reviewerId))
                        .compose(updated -> {
                            if (updated.rowCount() == 0) {
                                return Future.succeededFuture(Optional.<Integer>empty());
                            }
                            return connection.preparedQuery(select)
                                    .execute(Tuple.of(reviewerId))
                                    .map(rows -> Optional.of(rows.iterator().next().getInteger("MISSED_DEADLINE_COUNT")));
                        }))
                .onFailure(error -> log.error("Failed to count missed deadline for reviewer {}: {}", reviewerId, error.getMessage()));
    }

    @Override
    public Future<Boolean> freeze(String reviewerId) {
        String sql = "UPDATE REVIEWER SET ACTIVE = 0, VERIFIED = 0, VERIFIED_BY = NULL, VERIFIED_AT = NULL " +
                "WHERE ID = ? AND ACTIVE = 1";

        return pool.preparedQuery(sql)
                .execute(Tuple.of(reviewerId))
                .map(result -> result.rowCount() > 0)
                .onFailure(error -> log.error("Failed to freeze reviewer {}: {}", reviewerId, error.getMessage()));
    }

    @Override
    public Future<Boolean> reactivate(String reviewerId) {
        String sql = "UPDATE REVIEWER SET ACTIVE = 1, MISSED_DEADLINE_COUNT = 0 WHERE ID = ?";

        return pool.preparedQuery(sql)
                .execute(Tuple.of(reviewerId))
                .map(result -> result.rowCount() > 0)
                .onFailure(error -> log.error("Failed to reactivate reviewer {}: {}", reviewerId, error.getMessage()));
    }

    @Override
    public Future<Boolean> markVerified(String reviewerId, String adminId, Instant at) {
        String sql = "UPDATE REVIEWER SET VERIFIED = 1, VERIFIED_BY = ?, VERIFIED_AT = ? WHERE ID = ?";

        return pool.preparedQuery(sql)
                .execute(Tuple.of(adminId, toDb(at), reviewerId))
                .map(result -> result.rowCount() > 0)
                .onFailure(error -> log.error("Failed to verify reviewer {}: {}", reviewerId, error.getMessage()));
    }

    @Override
    public Future<Boolean> savePendingReactivationRequest(String reviewerId, ReactivationRequest request) {
        String sql = "INSERT INTO REACTIVATION_REQUEST (REVIEWER_ID, REASON, CLARIFICATION, STATUS, REQUESTED_AT) " +
                "SELECT ?, ?, ?, 'pending', ? FROM DUAL " +
                "WHERE NOT EXISTS (SELECT 1 FROM REACTIVATION_REQUEST WHERE REVIEWER_ID = ? AND STATUS = 'pending')";

        Tuple params = Tuple.of(
                reviewerId,
                request.getReason(),
                request.getClarification(),
                toDb(request.getRequestedAt()),
                reviewerId
        );

        return pool.preparedQuery(sql)
                .execute(params)
                .map(result -> result.rowCount() > 0)
                .recover(error -> {
                    // lost the race on the unique pending index
                    if (error instanceof SQLIntegrityConstraintViolationException) {
                        log.debug("Concurrent pending reactivation request for reviewer {}", reviewerId);
                        return Future.succeededFuture(false);
                    }
                    log.error("Failed to save reactivation request for reviewer {}: {}", reviewerId, error.getMessage());
                    return Future.failedFuture(error);
                });
    }

    @Override
    public Future<Boolean> completeReactivationRequest(
            String reviewerId,
            ReactivationStatus status,
            String adminId,
            Instant reviewedAt,
            String adminNotes
    ) {
        String sql = "UPDATE REACTIVATION_REQUEST SET STATUS = ?, REVIEWED_BY = ?, REVIEWED_AT = ?, ADMIN_NOTES = ? " +
                "WHERE REVIEWER_ID = ? AND STATUS = 'pending'";

        Tuple params = Tuple.of(status.getValue(), adminId, toDb(reviewedAt), adminNotes, reviewerId);

        return pool.preparedQuery(sql)
                .execute(params)
                .map(result -> result.rowCount() > 0)
                .onFailure(error -> log.error("Failed to complete reactivation request for reviewer {}: {}",
                        reviewerId, error.getMessage()));
    }

    @Override
    public Future<Boolean> approveReactivationRequest(
            String reviewerId,
            String adminId,
            Instant reviewedAt,
            String adminNotes
    ) {
        String complete = "UPDATE REACTIVATION_REQUEST SET STATUS = 'approved', REVIEWED_BY = ?, REVIEWED_AT = ?, " +
                "ADMIN_NOTES = ? WHERE REVIEWER_ID = ? AND STATUS = 'pending'";
        String reinstate = "UPDATE REVIEWER SET ACTIVE = 1, MISSED_DEADLINE_COUNT = 0, VERIFIED = 1, " +
                "VERIFIED_BY = ?, VERIFIED_AT = ? WHERE ID = ?";

        return pool.withTransaction(connection -> connection.preparedQuery(complete)
                        .execute(Tuple.of(adminId, toDb(reviewedAt), adminNotes, reviewerId))
                        .compose(completed -> {
                            if (completed.rowCount() == 0) {
                                return Future.succeededFuture(false);
                            }
                            return connection.preparedQuery(reinstate)
                                    .execute(Tuple.of(adminId, toDb(reviewedAt), reviewerId))
                                    .map(reinstated -> true);
                        }))
                .onFailure(error -> log.error("Failed to approve reactivation request for reviewer {}: {}",
                        reviewerId, error.getMessage()));
    }

    private List<Reviewer> mapReviewers(RowSet<Row> rows) {
        List<Reviewer> reviewers = new ArrayList<>();
        rows.forEach(row -> reviewers.add(mapReviewer(row)));
        return reviewers;
    }

    private Reviewer mapReviewer(Row row) {
        ReactivationRequest request = null;
        String requestStatus = row.getString("REQUEST_STATUS");
        if (requestStatus != null) {
            request = ReactivationRequest.builder()
                    .reason(row.getString("REASON"))
                    .clarification(row.getString("CLARIFICATION"))
                    .status(ReactivationStatus.fromValue(requestStatus))
                    .requestedAt(fromDb(row.getLocalDateTime("REQUESTED_AT")))
                    .reviewedBy(row.getString("REVIEWED_BY"))
                    .reviewedAt(fromDb(row.getLocalDateTime("REVIEWED_AT")))
                    .adminNotes(row.getString("ADMIN_NOTES"))
                    .build();
        }

        return Reviewer.builder()
                .id(row.getString("ID"))
                .name(row.getString("NAME"))
                .email(row.getString("EMAIL"))
                .phone(row.getString("PHONE"))
                .active(row.getInteger("ACTIVE") == 1)
                .verified(row.getInteger("VERIFIED") == 1)
                .verifiedBy(row.getString("VERIFIED_BY"))
                .verifiedAt(fromDb(row.getLocalDateTime("VERIFIED_AT")))
                .missedDeadlineCount(row.getInteger("MISSED_DEADLINE_COUNT"))
                .reactivationRequest(request)
                .totalReviewed(row.getLong("TOTAL_REVIEWED"))
                .approvedCount(row.getLong("APPROVED_COUNT"))
                .rejectedCount(row.getLong("REJECTED_COUNT"))
                .lastActivityAt(fromDb(row.getLocalDateTime("LAST_ACTIVITY_AT")))
                .createdAt(fromDb(row.getLocalDateTime("CREATED_AT")))
                .build();
    }
}
