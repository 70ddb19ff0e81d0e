package uk.gegc.reviewscheduler.shared.security;

import io.jsonwebtoken.JwtBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.security.core.Authentication;
import org.springframework.test.util.ReflectionTestUtils;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class JwtTokenServiceTest {

    private static final String SECRET = "cmV2aWV3LXNjaGVkdWxlci10ZXN0LXNlY3JldC0wMTIzNDU2Nzg5YWJjZGVmZ2hpamtsbW4=";
    private static final UUID USER_ID = UUID.fromString("10000000-0000-0000-0000-000000000001");

    private JwtTokenService tokenService;
    private SecretKey key;

    @BeforeEach
    void setUp() {
        tokenService = new JwtTokenService();
        ReflectionTestUtils.setField(tokenService, "base64secret", SECRET);
        tokenService.init();
        key = Keys.hmacShaKeyFor(Decoders.BASE64.decode(SECRET));
    }

    @Test
    @DisplayName("access token with user id subject is valid and authenticates that user")
    void validAccessToken() {
        String token = token(USER_ID.toString(), "access", Instant.now().plus(Duration.ofMinutes(5)), key);

        assertThat(tokenService.validateToken(token)).isTrue();
        Authentication authentication = tokenService.getAuthentication(token);
        assertThat(authentication.getName()).isEqualTo(USER_ID.toString());
        assertThat(authentication.getAuthorities()).extracting(Object::toString).containsExactly("ROLE_USER");
    }

    @Test
    @DisplayName("token without a type claim is accepted")
    void untypedToken() {
        assertThat(tokenService.validateToken(
                token(USER_ID.toString(), null, Instant.now().plus(Duration.ofMinutes(5)), key))).isTrue();
    }

    @Test
    @DisplayName("expired, refresh, foreign-signed and garbage tokens are rejected")
    void rejectedTokens() {
        Instant later = Instant.now().plus(Duration.ofMinutes(5));
        SecretKey foreign = Keys.hmacShaKeyFor("another-secret-another-secret-another-secret".getBytes(StandardCharsets.UTF_8));

        assertThat(tokenService.validateToken(
                token(USER_ID.toString(), "access", Instant.now().minus(Duration.ofMinutes(5)), key))).isFalse();
        assertThat(tokenService.validateToken(token(USER_ID.toString(), "refresh", later, key))).isFalse();
        assertThat(tokenService.validateToken(token(USER_ID.toString(), "access", later, foreign))).isFalse();
        assertThat(tokenService.validateToken("not.a.jwt")).isFalse();
        assertThat(tokenService.validateToken("")).isFalse();
    }

    @Test
    @DisplayName("subject that is not a user id is rejected")
    void nonUuidSubject() {
        assertThat(tokenService.validateToken(
                token("alice", "access", Instant.now().plus(Duration.ofMinutes(5)), key))).isFalse();
        assertThat(JwtTokenService.parseUserId("alice")).isEmpty();
        assertThat(JwtTokenService.parseUserId(USER_ID.toString())).contains(USER_ID);
    }

    private static String token(String subject, String type, Instant expiresAt, SecretKey signingKey) {
        JwtBuilder builder = Jwts.builder()
                .subject(subject)
                .issuedAt(Date.from(expiresAt.minus(Duration.ofMinutes(15))))
                .expiration(Date.from(expiresAt))
                .signWith(signingKey);
        if (type != null) {
            builder.claim("type", type);
        }
        return builder.compact();
    }
}
