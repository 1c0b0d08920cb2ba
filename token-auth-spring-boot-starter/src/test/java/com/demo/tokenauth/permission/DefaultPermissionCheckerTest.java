package com.demo.tokenauth.permission;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

class DefaultPermissionCheckerTest {

    private final PermissionChecker checker = new DefaultPermissionChecker();

    private static final List<String> PERMITS = List.of("user", "admin");

    @ParameterizedTest
    @CsvSource({
            "GET, admin/read, admin/read",
            "HEAD, admin/read, admin/read",
            "POST, admin/write, admin/write",
            "PUT, user/write, user/write",
            "PATCH, user/write, user/write",
            "DELETE, admin/delete, admin/delete"
    })
    void allowsMatchingAction(String method, String scope, String expected) {
        assertThat(checker.authorize(method, PERMITS, List.of(scope))).contains(expected);
    }

    @Test
    void deniesOtherAction() {
        assertThat(checker.authorize("POST", PERMITS, List.of("admin/read"))).isEmpty();
        assertThat(checker.authorize("DELETE", PERMITS, List.of("admin/write"))).isEmpty();
    }

    @Test
    void deniesUnmappedMethods() {
        var scopes = List.of("admin/read", "admin/write", "admin/delete");

        assertThat(checker.authorize("TRACE", PERMITS, scopes)).isEmpty();
        assertThat(checker.authorize("OPTIONS", PERMITS, scopes)).isEmpty();
        assertThat(checker.authorize(null, PERMITS, scopes)).isEmpty();
    }

    @Test
    void methodIsCaseSensitive() {
        assertThat(checker.authorize("get", PERMITS, List.of("admin/read"))).isEmpty();
    }

    @Test
    void deniesResourceNotPermitted() {
        assertThat(checker.authorize("GET", PERMITS, List.of("billing/read"))).isEmpty();
    }

    @Test
    void deniesWithoutPermitsOrScopes() {
        assertThat(checker.authorize("GET", List.of(), List.of("admin/read"))).isEmpty();
        assertThat(checker.authorize("GET", PERMITS, List.of())).isEmpty();
        assertThat(checker.authorize("GET", null, null)).isEmpty();
    }

    @Test
    void returnsFirstMatchingPermit() {
        var scopes = List.of("admin/read", "user/read");

        assertThat(checker.authorize("GET", List.of("user", "admin"), scopes)).contains("user/read");
        assertThat(checker.authorize("GET", List.of("admin", "user"), scopes)).contains("admin/read");
    }

    @Test
    void scopeMatchIsExact() {
        assertThat(checker.authorize("GET", PERMITS, List.of("Admin/read", "admin/READ", "admin/read/x"))).isEmpty();
    }
}
