package com.dsaflow.application.service;

import com.dsaflow.application.port.in.RegistrationUseCase;
import com.dsaflow.application.port.out.ApplicationRepository;
import com.dsaflow.application.port.out.ReviewerRepository;
import com.dsaflow.domain.exception.ErrorCode;
import com.dsaflow.domain.exception.WorkflowException;
import com.dsaflow.domain.model.ApplicationStatus;
import com.dsaflow.domain.model.CallerIdentity;
import com.dsaflow.domain.model.LoanApplication;
import com.dsaflow.domain.model.Reviewer;
import com.dsaflow.domain.model.Role;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Entry points for reviewers and applications joining the workflow
 */
@Slf4j
public class RegistrationService implements RegistrationUseCase {

    private static final String APPLICATION_NUMBER_PREFIX = "LA-";

    private final ReviewerRepository reviewerRepository;
    private final ApplicationRepository applicationRepository;
    private final Clock clock;

    public RegistrationService(
            ReviewerRepository reviewerRepository,
            ApplicationRepository applicationRepository,
            Clock clock
    ) {
        this.reviewerRepository = reviewerRepository;
        this.applicationRepository = applicationRepository;
        this.clock = clock;
    }

    @Override
    public Future<Reviewer> registerReviewer(CallerIdentity caller, RegisterReviewerCommand command) {
        return AccessGuard.requireRole(caller, Role.ADMIN)
                .compose(v -> {
                    List<String> errors = validateReviewer(command);
                    if (!errors.isEmpty()) {
                        return Future.failedFuture(new WorkflowException(ErrorCode.INVALID_INPUT,
                                "Reviewer registration is invalid", errors));
                    }

                    Instant now = clock.instant();
                    Reviewer reviewer = Reviewer.builder()
                            .id(UUID.randomUUID().toString())
                            .name(command.name().trim())
                            .email(command.email().trim())
                            .phone(command.phone())
                            .active(true)
                            .verified(true)
                            .verifiedBy(caller.callerId())
                            .verifiedAt(now)
                            .createdAt(now)
                            .build();
                    return reviewerRepository.insert(reviewer).map(reviewer);
                })
                .onSuccess(reviewer -> log.info("Reviewer {} ({}) registered by {}",
                        reviewer.getId(), reviewer.getEmail(), caller.callerId()));
    }

    private List<String> validateReviewer(RegisterReviewerCommand command) {
        List<String> errors = new ArrayList<>();
        if (command == null) {
            errors.add("request body is required");
            return errors;
        }
        if (isBlank(command.name())) {
            errors.add("name is required");
        }
        if (isBlank(command.email())) {
            errors.add("email is required");
        } else if (!command.email().contains("@")) {
            errors.add("email must be a valid address");
        }
        return errors;
    }

    @Override
    public Future<LoanApplication> registerApplication(CallerIdentity caller, String applicantId) {
        return AccessGuard.requireRole(caller, Role.USER, Role.ADMIN)
                .compose(v -> {
                    String owner = caller.hasRole(Role.USER) ? caller.callerId() : applicantId;
                    if (caller.hasRole(Role.USER) && applicantId != null && !applicantId.equals(caller.callerId())) {
                        return Future.failedFuture(WorkflowException.forbidden(
                                "Applicant " + caller.callerId() + " cannot register for " + applicantId));
                    }
                    if (isBlank(owner)) {
                        return Future.failedFuture(new WorkflowException(ErrorCode.INVALID_INPUT, "applicantId is required"));
                    }

                    Instant now = clock.instant();
                    LoanApplication application = LoanApplication.builder()
                            .id(UUID.randomUUID().toString())
                            .applicationNumber(newApplicationNumber())
                            .applicantId(owner)
                            .status(ApplicationStatus.PENDING)
                            .createdAt(now)
                            .updatedAt(now)
                            .build();
                    return applicationRepository.insert(application).map(application);
                })
                .onSuccess(application -> log.info("Application {} ({}) registered for applicant {}",
                        application.getId(), application.getApplicationNumber(), application.getApplicantId()));
    }

    private String newApplicationNumber() {
        return APPLICATION_NUMBER_PREFIX + UUID.randomUUID().toString()
                .replace("-", "")
                .substring(0, 8)
                .toUpperCase(Locale.ROOT);
    }

    private boolean isBlank(String str) {
        return str == null || str.trim().isEmpty();
    }
}
