package com.dsaflow.adapter.in.web;

import com.dsaflow.domain.model.CallerIdentity;
import com.dsaflow.domain.model.Role;
import io.vertx.core.MultiMap;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CallerIdentityResolverTest {

    private static MultiMap headers(String callerId, String role) {
        MultiMap headers = MultiMap.caseInsensitiveMultiMap();
        if (callerId != null) {
            headers.add(CallerIdentityResolver.CALLER_ID_HEADER, callerId);
        }
        if (role != null) {
            headers.add(CallerIdentityResolver.CALLER_ROLE_HEADER, role);
        }
        return headers;
    }

    @Test
    void resolve_readsIdAndRole() {
        Optional<CallerIdentity> caller = CallerIdentityResolver.resolve(headers(" dsa-7 ", "dsa"));

        assertEquals(Optional.of(new CallerIdentity("dsa-7", Role.DSA)), caller);
    }

    @Test
    void resolve_missingOrInvalidHeadersGiveNoCaller() {
        assertTrue(CallerIdentityResolver.resolve(headers(null, "admin")).isEmpty());
        assertTrue(CallerIdentityResolver.resolve(headers("  ", "admin")).isEmpty());
        assertTrue(CallerIdentityResolver.resolve(headers("a1", null)).isEmpty());
        assertTrue(CallerIdentityResolver.resolve(headers("a1", "superuser")).isEmpty());
    }

    @Test
    void resolve_systemRoleIsNeverAccepted() {
        assertTrue(CallerIdentityResolver.resolve(headers("cron", "system")).isEmpty());
    }
}
