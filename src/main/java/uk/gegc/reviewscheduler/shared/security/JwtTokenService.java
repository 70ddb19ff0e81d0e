package uk.gegc.reviewscheduler.shared.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Verifies access tokens issued by the auth service. The {@code sub} claim carries the user id.
 */
@Component
@Slf4j
public class JwtTokenService {

    private static final String TOKEN_TYPE_CLAIM = "type";
    private static final String ACCESS_TOKEN_TYPE = "access";

    @Value("${jwt.secret}")
    private String base64secret;

    private SecretKey key;

    @PostConstruct
    public void init() {
        this.key = Keys.hmacShaKeyFor(Decoders.BASE64.decode(base64secret));
    }

    /**
     * Builds the principal for an already validated token: the user id as name and a single {@code ROLE_USER}.
     */
    public Authentication getAuthentication(String token) {
        String userId = claimsOf(token).getSubject();
        return new UsernamePasswordAuthenticationToken(userId, null, List.of(new SimpleGrantedAuthority("ROLE_USER")));
    }

    public boolean validateToken(String token) {
        Claims claims;
        try {
            claims = claimsOf(token);
        } catch (ExpiredJwtException ex) {
            log.debug("Expired access token: {}", ex.getMessage());
            return false;
        } catch (JwtException | IllegalArgumentException ex) {
            log.warn("Unverifiable access token ({}): {}", ex.getClass().getSimpleName(), ex.getMessage());
            return false;
        }

        Optional<String> rejection = rejectionReason(claims);
        rejection.ifPresent(reason -> log.warn("Rejected access token: {}", reason));
        return rejection.isEmpty();
    }

    private Optional<String> rejectionReason(Claims claims) {
        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            return Optional.of("no subject");
        }
        if (parseUserId(subject).isEmpty()) {
            return Optional.of("subject is not a user id");
        }
        String tokenType = claims.get(TOKEN_TYPE_CLAIM, String.class);
        if (tokenType != null && !ACCESS_TOKEN_TYPE.equals(tokenType)) {
            return Optional.of("token type '" + tokenType + "'");
        }
        return Optional.empty();
    }

    static Optional<UUID> parseUserId(String subject) {
        try {
            return Optional.of(UUID.fromString(subject));
        } catch (IllegalArgumentException ex) {
            return Optional.empty();
        }
    }

    private Claims claimsOf(String token) {
        return Jwts.parser().verifyWith(key).build().parseSignedClaims(token).getPayload();
    }
}
