package io.github.drompincen.bugflow.gateway.controller;

import io.github.drompincen.bugflow.protocol.api.RolePermissions;
import io.github.drompincen.bugflow.protocol.api.UserRole;
import io.github.drompincen.bugflow.runtime.result.ErrorKind;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ErrorResponsesTest {

    @Test
    void everyKindHasHttpStatus() {
        assertThat(ErrorResponses.statusOf(ErrorKind.NOT_FOUND).value()).isEqualTo(404);
        assertThat(ErrorResponses.statusOf(ErrorKind.FORBIDDEN).value()).isEqualTo(403);
        assertThat(ErrorResponses.statusOf(ErrorKind.INVALID_STATE).value()).isEqualTo(400);
        assertThat(ErrorResponses.statusOf(ErrorKind.VALIDATION_FAILED).value()).isEqualTo(400);
        assertThat(ErrorResponses.statusOf(ErrorKind.CONFLICT).value()).isEqualTo(409);
        assertThat(ErrorResponses.statusOf(ErrorKind.INFRASTRUCTURE).value()).isEqualTo(500);
    }

    @Test
    void rolePermissionsEndpointReturnsTableEntry() {
        RolePermissions developer = new RoleController().permissions(UserRole.DEVELOPER);

        assertThat(developer.canAssignBug()).isTrue();
        assertThat(developer.canCloseBug()).isFalse();
        assertThat(developer.canValidateBug()).isFalse();
    }
}
