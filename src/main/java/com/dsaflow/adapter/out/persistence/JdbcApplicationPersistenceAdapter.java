package com.dsaflow.adapter.out.persistence;

import com.dsaflow.application.port.out.ApplicationRepository;
import com.dsaflow.domain.exception.ErrorCode;
import com.dsaflow.domain.exception.WorkflowException;
import com.dsaflow.domain.model.ApplicationStatus;
import com.dsaflow.domain.model.AuditAction;
import com.dsaflow.domain.model.LoanApplication;
import com.dsaflow.domain.model.ReviewAuditEntry;
import com.dsaflow.domain.model.ReviewDecision;
import com.dsaflow.domain.model.ReviewVerdict;
import io.vertx.core.Future;
import io.vertx.sqlclient.Pool;
import io.vertx.sqlclient.Row;
import io.vertx.sqlclient.RowSet;
import io.vertx.sqlclient.SqlClient;
import io.vertx.sqlclient.SqlConnection;
import io.vertx.sqlclient.Tuple;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.dsaflow.adapter.out.persistence.JdbcTimestamps.fromDb;
import static com.dsaflow.adapter.out.persistence.JdbcTimestamps.toDb;

/**
 * JDBC implementation of ApplicationRepository.
 * Decisions and audit entries live in child tables and are rewritten with the parent row
 * in one transaction; the parent row carries the optimistic VERSION.
 */
@Slf4j
@RequiredArgsConstructor
public class JdbcApplicationPersistenceAdapter implements ApplicationRepository {

    private static final String SELECT_APPLICATION =
            "SELECT a.ID, a.APPLICATION_NUMBER, a.APPLICANT_ID, a.STATUS, a.APPROVAL_THRESHOLD, " +
            "a.REVIEW_DEADLINE, a.ASSIGNED_AT, a.APPROVED_AT, a.APPROVED_BY, a.REJECTED_AT, a.REJECTED_BY, " +
            "a.REJECTION_REASON, a.CREATED_AT, a.UPDATED_AT, a.VERSION FROM LOAN_APPLICATION a ";

    private static final String HAS_PENDING_DECISION =
            "EXISTS (SELECT 1 FROM REVIEW_DECISION d WHERE d.APPLICATION_ID = a.ID AND d.VERDICT = 'pending') ";

    private final Pool pool;

    @Override
    public Future<Void> insert(LoanApplication application) {
        String sql = "INSERT INTO LOAN_APPLICATION " +
                "(ID, APPLICATION_NUMBER, APPLICANT_ID, STATUS, APPROVAL_THRESHOLD, CREATED_AT, UPDATED_AT, VERSION) " +
                "VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

        Tuple params = Tuple.of(
                application.getId(),
                application.getApplicationNumber(),
                application.getApplicantId(),
                application.getStatus().getValue(),
                application.getApprovalThreshold(),
                toDb(application.getCreatedAt()),
                toDb(application.getUpdatedAt()),
                application.getVersion()
        );

        return pool.preparedQuery(sql)
                .execute(params)
                .onSuccess(result -> log.debug("Inserted application {}", application.getId()))
                .onFailure(error -> log.error("Failed to insert application {}: {}", application.getId(), error.getMessage()))
                .mapEmpty();
    }

    @Override
    public Future<Optional<LoanApplication>> findById(String applicationId) {
        return pool.preparedQuery(SELECT_APPLICATION + "WHERE a.ID = ?")
                .execute(Tuple.of(applicationId))
                .compose(this::loadAll)
                .<Optional<LoanApplication>>map(applications -> applications.stream().findFirst())
                .onFailure(error -> log.error("Failed to load application {}: {}", applicationId, error.getMessage()));
    }

    @Override
    public Future<LoanApplication> update(LoanApplication application) {
        String sql = "UPDATE LOAN_APPLICATION SET STATUS = ?, APPROVAL_THRESHOLD = ?, REVIEW_DEADLINE = ?, " +
                "ASSIGNED_AT = ?, APPROVED_AT = ?, APPROVED_BY = ?, REJECTED_AT = ?, REJECTED_BY = ?, " +
                "REJECTION_REASON = ?, UPDATED_AT = ?, VERSION = VERSION + 1 " +
                "WHERE ID = ? AND VERSION = ?";

        Tuple params = Tuple.of(
                application.getStatus().getValue(),
                application.getApprovalThreshold(),
                toDb(application.getReviewDeadline()),
                toDb(application.getAssignedAt()),
                toDb(application.getApprovedAt()),
                application.getApprovedBy(),
                toDb(application.getRejectedAt()),
                application.getRejectedBy(),
                application.getRejectionReason(),
                toDb(application.getUpdatedAt()),
                application.getId(),
                application.getVersion()
        );

        return pool.withTransaction(connection -> connection.preparedQuery(sql)
                        .execute(params)
                        .compose(result -> {
                            if (result.rowCount() == 0) {
                                return Future.failedFuture(new WorkflowException(ErrorCode.CONCURRENT_UPDATE,
                                        "Application " + application.getId() + " was modified concurrently"));
                            }
                            return replaceDecisions(connection, application)
                                    .compose(v -> replaceAuditTrail(connection, application));
                        }))
                .map(v -> {
                    LoanApplication saved = application.copy();
                    saved.setVersion(application.getVersion() + 1);
                    return saved;
                })
                .onFailure(error -> log.error("Failed to update application {}: {}", application.getId(), error.getMessage()));
    }

    private Future<Void> replaceDecisions(SqlConnection connection, LoanApplication application) {
        String delete = "DELETE FROM REVIEW_DECISION WHERE APPLICATION_ID = ?";
        String insert = "INSERT INTO REVIEW_DECISION " +
                "(APPLICATION_ID, SLOT_NO, REVIEWER_ID, VERDICT, REVIEW_COMMENT, DECIDED_AT) VALUES (?, ?, ?, ?, ?, ?)";

        List<Tuple> batch = new ArrayList<>();
        List<ReviewDecision> decisions = application.getReviewDecisions();
        for (int slot = 0; slot < decisions.size(); slot++) {
            ReviewDecision decision = decisions.get(slot);
            batch.add(Tuple.of(
                    application.getId(),
                    slot + 1,
                    decision.getReviewerId(),
                    decision.getVerdict().getValue(),
                    decision.getComment(),
                    toDb(decision.getDecidedAt())));
        }

        return connection.preparedQuery(delete)
                .execute(Tuple.of(application.getId()))
                .compose(deleted -> executeBatch(connection, insert, batch));
    }

    private Future<Void> replaceAuditTrail(SqlConnection connection, LoanApplication application) {
        String delete = "DELETE FROM APPLICATION_AUDIT WHERE APPLICATION_ID = ?";
        String insert = "INSERT INTO APPLICATION_AUDIT " +
                "(APPLICATION_ID, SEQ_NO, ACTION, ACTOR_ID, ACTION_AT, RESULTING_STATUS, NOTE) VALUES (?, ?, ?, ?, ?, ?, ?)";

        List<Tuple> batch = new ArrayList<>();
        List<ReviewAuditEntry> trail = application.getAuditTrail();
        for (int seq = 0; seq < trail.size(); seq++) {
            ReviewAuditEntry entry = trail.get(seq);
            batch.add(Tuple.of(
                    application.getId(),
                    seq + 1,
                    entry.getAction().name(),
                    entry.getActorId(),
                    toDb(entry.getAt()),
                    entry.getResultingStatus().getValue(),
                    entry.getNote()));
        }

        return connection.preparedQuery(delete)
                .execute(Tuple.of(application.getId()))
                .compose(deleted -> executeBatch(connection, insert, batch));
    }

    private Future<Void> executeBatch(SqlClient client, String sql, List<Tuple> batch) {
        if (batch.isEmpty()) {
            return Future.succeededFuture();
        }
        return client.preparedQuery(sql).executeBatch(batch).mapEmpty();
    }

    @Override
    public Future<List<LoanApplication>> findExpiredUnderReview(Instant now) {
        String sql = SELECT_APPLICATION +
                "WHERE a.STATUS = 'under_review' AND a.REVIEW_DEADLINE < ? AND " + HAS_PENDING_DECISION +
                "ORDER BY a.REVIEW_DEADLINE";

        return pool.preparedQuery(sql)
                .execute(Tuple.of(toDb(now)))
                .compose(this::loadAll)
                .onFailure(error -> log.error("Failed to query expired applications: {}", error.getMessage()));
    }

    @Override
    public Future<List<LoanApplication>> findUnderReviewDueBetween(Instant from, Instant to) {
        String sql = SELECT_APPLICATION +
                "WHERE a.STATUS = 'under_review' AND a.REVIEW_DEADLINE BETWEEN ? AND ? AND " + HAS_PENDING_DECISION +
                "ORDER BY a.REVIEW_DEADLINE";

        return pool.preparedQuery(sql)
                .execute(Tuple.of(toDb(from), toDb(to)))
                .compose(this::loadAll)
                .onFailure(error -> log.error("Failed to query upcoming deadlines: {}", error.getMessage()));
    }

    @Override
    public Future<List<LoanApplication>> findUnassignedPending(int limit) {
        String sql = SELECT_APPLICATION +
                "WHERE a.STATUS = 'pending' " +
                "AND NOT EXISTS (SELECT 1 FROM REVIEW_DECISION d WHERE d.APPLICATION_ID = a.ID) " +
                "ORDER BY a.CREATED_AT FETCH FIRST ? ROWS ONLY";

        return pool.preparedQuery(sql)
                .execute(Tuple.of(limit))
                .compose(this::loadAll)
                .onFailure(error -> log.error("Failed to query unassigned applications: {}", error.getMessage()));
    }

    @Override
    public Future<List<LoanApplication>> findOpenAssignmentsFor(String reviewerId, Instant now) {
        String sql = SELECT_APPLICATION +
                "WHERE a.STATUS = 'under_review' AND a.REVIEW_DEADLINE >= ? " +
                "AND EXISTS (SELECT 1 FROM REVIEW_DECISION d WHERE d.APPLICATION_ID = a.ID " +
                "            AND d.REVIEWER_ID = ? AND d.VERDICT = 'pending') " +
                "ORDER BY a.ASSIGNED_AT";

        return pool.preparedQuery(sql)
                .execute(Tuple.of(toDb(now), reviewerId))
                .compose(this::loadAll)
                .onFailure(error -> log.error("Failed to query open assignments for {}: {}", reviewerId, error.getMessage()));
    }

    @Override
    public Future<Map<ApplicationStatus, Long>> countByStatus() {
        return pool.query("SELECT STATUS, COUNT(*) AS CNT FROM LOAN_APPLICATION GROUP BY STATUS")
                .execute()
                .map(rows -> {
                    Map<ApplicationStatus, Long> counts = new EnumMap<>(ApplicationStatus.class);
                    rows.forEach(row -> counts.put(
                            ApplicationStatus.fromValue(row.getString("STATUS")), row.getLong("CNT")));
                    return counts;
                })
                .onFailure(error -> log.error("Failed to count applications: {}", error.getMessage()));
    }

    /**
     * Attach decisions and audit trail, one application after another
     */
    private Future<List<LoanApplication>> loadAll(RowSet<Row> rows) {
        List<LoanApplication> applications = new ArrayList<>();
        rows.forEach(row -> applications.add(mapApplication(row)));

        Future<Void> chain = Future.succeededFuture();
        for (LoanApplication application : applications) {
            chain = chain.compose(v -> loadDecisions(application))
                    .compose(v -> loadAuditTrail(application));
        }
        return chain.map(applications);
    }

    private Future<Void> loadDecisions(LoanApplication application) {
        String sql = "SELECT REVIEWER_ID, VERDICT, REVIEW_COMMENT, DECIDED_AT FROM REVIEW_DECISION " +
                "WHERE APPLICATION_ID = ? ORDER BY SLOT_NO";

        return pool.preparedQuery(sql)
                .execute(Tuple.of(application.getId()))
                .map(rows -> {
                    List<ReviewDecision> decisions = new ArrayList<>();
                    rows.forEach(row -> decisions.add(ReviewDecision.builder()
                            .reviewerId(row.getString("REVIEWER_ID"))
                            .verdict(ReviewVerdict.fromValue(row.getString("VERDICT")))
                            .comment(row.getString("REVIEW_COMMENT"))
                            .decidedAt(fromDb(row.getLocalDateTime("DECIDED_AT")))
                            .build()));
                    application.setReviewDecisions(decisions);
                    LinkedHashSet<String> reviewers = new LinkedHashSet<>();
                    decisions.forEach(decision -> reviewers.add(decision.getReviewerId()));
                    application.setAssignedReviewers(reviewers);
                    return (Void) null;
                });
    }

    private Future<Void> loadAuditTrail(LoanApplication application) {
        String sql = "SELECT ACTION, ACTOR_ID, ACTION_AT, RESULTING_STATUS, NOTE FROM APPLICATION_AUDIT " +
                "WHERE APPLICATION_ID = ? ORDER BY SEQ_NO";

        return pool.preparedQuery(sql)
                .execute(Tuple.of(application.getId()))
                .map(rows -> {
                    List<ReviewAuditEntry> trail = new ArrayList<>();
                    rows.forEach(row -> trail.add(new ReviewAuditEntry(
                            AuditAction.fromValue(row.getString("ACTION")),
                            row.getString("ACTOR_ID"),
                            fromDb(row.getLocalDateTime("ACTION_AT")),
                            ApplicationStatus.fromValue(row.getString("RESULTING_STATUS")),
                            row.getString("NOTE"))));
                    application.setAuditTrail(trail);
                    return (Void) null;
                });
    }

    private LoanApplication mapApplication(Row row) {
        return LoanApplication.builder()
                .id(row.getString("ID"))
                .applicationNumber(row.getString("APPLICATION_NUMBER"))
                .applicantId(row.getString("APPLICANT_ID"))
                .status(ApplicationStatus.fromValue(row.getString("STATUS")))
                .approvalThreshold(row.getInteger("APPROVAL_THRESHOLD"))
                .reviewDeadline(fromDb(row.getLocalDateTime("REVIEW_DEADLINE")))
                .assignedAt(fromDb(row.getLocalDateTime("ASSIGNED_AT")))
                .approvedAt(fromDb(row.getLocalDateTime("APPROVED_AT")))
                .approvedBy(row.getString("APPROVED_BY"))
                .rejectedAt(fromDb(row.getLocalDateTime("REJECTED_AT")))
                .rejectedBy(row.getString("REJECTED_BY"))
                .rejectionReason(row.getString("REJECTION_REASON"))
                .createdAt(fromDb(row.getLocalDateTime("CREATED_AT")))
                .updatedAt(fromDb(row.getLocalDateTime("UPDATED_AT")))
                .version(row.getLong("VERSION"))
                .build();
    }
}
