package uk.gegc.reviewscheduler.shared.security;

import org.springframework.security.core.Authentication;
import org.springframework.stereotype.Component;
import uk.gegc.reviewscheduler.shared.exception.UnauthorizedException;

import java.util.UUID;

/**
 * Maps the authenticated principal to the owning user id.
 */
@Component
public class AuthenticatedUserResolver {

    public UUID resolveUserId(Authentication authentication) {
        if (authentication == null || authentication.getName() == null) {
            throw new UnauthorizedException("Authentication is required");
        }
        return JwtTokenService.parseUserId(authentication.getName())
                .orElseThrow(() -> new UnauthorizedException("Unknown principal"));
    }
}
