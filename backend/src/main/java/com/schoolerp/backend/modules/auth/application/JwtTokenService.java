package com.schoolerp.backend.modules.auth.application;

import java.time.Clock;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.schoolerp.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import org.springframework.stereotype.Service;

/**
 * Verifies HS256 access tokens. Tokens are issued elsewhere; this service only reads
 * the subject, the tenant ({@code schoolId}) and the role claims.
 */
@Service
public class JwtTokenService {

    static final String CLAIM_SCHOOL_ID = "schoolId";
    static final String CLAIM_ROLES = "roles";

    private final JwtTokenProvider tokenProvider;
    private final Clock clock;

    public JwtTokenService(JwtTokenProvider tokenProvider, Clock clock) {
        this.tokenProvider = tokenProvider;
        this.clock = clock;
    }

    public ParsedToken parseAccessToken(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            String subject = claims.getSubject();
            String schoolClaim = claims.get(CLAIM_SCHOOL_ID, String.class);
            if (subject == null || schoolClaim == null) {
                throw new InvalidTokenException("Access token lacks subject or schoolId", null);
            }
            UUID userId = UUID.fromString(subject);
            UUID schoolId = UUID.fromString(schoolClaim);
            List<?> rolesClaim = claims.get(CLAIM_ROLES, List.class);
            List<String> roles = rolesClaim == null ? List.of() : rolesClaim.stream()
                    .filter(Objects::nonNull)
                    .map(Object::toString)
                    .toList();

            return new ParsedToken(userId, schoolId, roles);
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidTokenException("Invalid access token", e);
        }
    }

    public record ParsedToken(UUID userId, UUID schoolId, List<String> roles) {
    }

    public static class InvalidTokenException extends RuntimeException {
        public InvalidTokenException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
