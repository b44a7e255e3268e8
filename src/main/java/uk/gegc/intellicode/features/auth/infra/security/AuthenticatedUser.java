package uk.gegc.intellicode.features.auth.infra.security;

import uk.gegc.intellicode.features.user.domain.model.UserRole;

import java.security.Principal;
import java.util.UUID;

/**
 * Principal placed in the security context for bearer-authenticated requests.
 */
public record AuthenticatedUser(UUID id, String email, UserRole role) implements Principal {

    @Override
    public String getName() {
        return id.toString();
    }

    public boolean isTeacher() {
        return role == UserRole.TEACHER;
    }
}
