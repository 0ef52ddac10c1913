package com.dsaflow.domain.model;

import java.util.Objects;

/**
 * Already-authenticated caller of a workflow operation
 */
public record CallerIdentity(String callerId, Role role) {

    private static final CallerIdentity SYSTEM = new CallerIdentity("system", Role.SYSTEM);

    public CallerIdentity {
        Objects.requireNonNull(callerId, "callerId");
        Objects.requireNonNull(role, "role");
    }

    public static CallerIdentity system() {
        return SYSTEM;
    }

    public static CallerIdentity admin(String adminId) {
        return new CallerIdentity(adminId, Role.ADMIN);
    }

    public static CallerIdentity reviewer(String reviewerId) {
        return new CallerIdentity(reviewerId, Role.DSA);
    }

    public static CallerIdentity applicant(String userId) {
        return new CallerIdentity(userId, Role.USER);
    }

    public boolean hasRole(Role... roles) {
        for (Role candidate : roles) {
            if (role == candidate) {
                return true;
            }
        }
        return false;
    }
}
