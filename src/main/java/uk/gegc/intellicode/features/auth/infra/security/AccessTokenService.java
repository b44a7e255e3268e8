package uk.gegc.intellicode.features.auth.infra.security;

import io.jsonwebtoken.*;
import io.jsonwebtoken.io.Decoders;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.SignatureException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.stereotype.Component;
import uk.gegc.intellicode.features.user.domain.repository.UserRepository;

import javax.crypto.SecretKey;
import java.time.Clock;
import java.util.Date;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Verifies bearer access tokens minted by the identity provider. The subject
 * is the user id; the role is taken from the local user row, not the token.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AccessTokenService {

    private static final String TYPE_CLAIM = "type";
    private static final String ACCESS_TYPE = "access";

    private final UserRepository userRepository;
    @Qualifier("utcClock")
    private final Clock utcClock;

    @Value("${app.auth.access-token-secret}")
    private String base64secret;

    private SecretKey key;

    @PostConstruct
    public void init() {
        this.key = Keys.hmacShaKeyFor(Decoders.BASE64.decode(base64secret));
    }

    public Optional<Authentication> authenticate(String token) {
        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(key)
                    .clock(() -> Date.from(utcClock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
        } catch (ExpiredJwtException ex) {
            log.debug("Access token is expired: {}", ex.getMessage());
            return Optional.empty();
        } catch (MalformedJwtException ex) {
            log.warn("Malformed access token received: {}", ex.getMessage());
            return Optional.empty();
        } catch (SignatureException ex) {
            log.warn("Invalid access token signature detected: {}", ex.getMessage());
            return Optional.empty();
        } catch (JwtException | IllegalArgumentException ex) {
            log.warn("Access token rejected: {}", ex.getMessage());
            return Optional.empty();
        }

        String type = claims.get(TYPE_CLAIM, String.class);
        if (type != null && !ACCESS_TYPE.equals(type)) {
            log.warn("Token of type '{}' presented as access token", type);
            return Optional.empty();
        }

        if (claims.getSubject() == null) {
            log.warn("Access token missing subject");
            return Optional.empty();
        }
        UUID userId;
        try {
            userId = UUID.fromString(claims.getSubject());
        } catch (IllegalArgumentException ex) {
            log.warn("Access token subject is not a user id");
            return Optional.empty();
        }

        return userRepository.findById(userId)
                .<Authentication>map(user -> {
                    AuthenticatedUser principal = new AuthenticatedUser(user.getId(), user.getEmail(), user.getRole());
                    return new UsernamePasswordAuthenticationToken(principal, null,
                            List.of(new SimpleGrantedAuthority(user.getRole().authority())));
                });
    }

    /**
     * Mints an access token for the user. The identity provider issues tokens
     * in production; this is used by local tooling and tests.
     */
    public String issue(UUID userId, long validityMs) {
        Date now = Date.from(utcClock.instant());
        return Jwts.builder()
                .subject(userId.toString())
                .issuedAt(now)
                .expiration(new Date(now.getTime() + validityMs))
                .claim(TYPE_CLAIM, ACCESS_TYPE)
                .signWith(key)
                .compact();
    }
}
