package com.pocketledger.security;

import com.pocketledger.domain.User;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;

/**
 * Pulls the acting user out of the security context installed by
 * {@link JwtAuthenticationFilter}.
 */
public final class CurrentUser {

    private CurrentUser() {
    }

    public static User of(Authentication authentication) {
        if (authentication == null || !(authentication.getPrincipal() instanceof User user)) {
            throw new AuthenticationCredentialsNotFoundException("Not authenticated");
        }
        return user;
    }

    public static Long idOf(Authentication authentication) {
        return of(authentication).getId();
    }
}
