package com.vendorhub.marketplace.modules.auth;

import com.nimbusds.jose.JOSEException;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.JWSVerifier;
import com.nimbusds.jose.crypto.MACVerifier;
import com.nimbusds.jwt.JWTClaimsSet;
import com.nimbusds.jwt.SignedJWT;
import com.vendorhub.marketplace.modules.auth.exception.InvalidTokenException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.text.ParseException;
import java.time.Clock;
import java.util.UUID;

/**
 * Verifies the HS256 access tokens issued by the auth service.
 * <p>
 * Expected claims: {@code user_id} (UUID), {@code role} ("vendor", "admin",
 * ...) and {@code exp}.
 * </p>
 */
@Slf4j
@Service
public class JwtService {

    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_ROLE = "role";

    private final byte[] secret;
    private final Clock clock;

    public JwtService(@Value("${auth.jwt.secret}") String jwtSecret) {
        this(jwtSecret, Clock.systemUTC());
    }

    JwtService(String jwtSecret, Clock clock) {
        this.secret = jwtSecret.getBytes(StandardCharsets.UTF_8);
        this.clock = clock;
    }

    /**
     * @param token the raw bearer token
     * @return the caller identity
     * @throws InvalidTokenException if the token cannot be trusted
     */
    public AuthenticatedUser verify(String token) {
        try {
            SignedJWT signedJwt = SignedJWT.parse(token);
            if (!JWSAlgorithm.HS256.equals(signedJwt.getHeader().getAlgorithm())) {
                throw new InvalidTokenException("Unsupported token algorithm");
            }

            JWSVerifier verifier = new MACVerifier(secret);
            if (!signedJwt.verify(verifier)) {
                throw new InvalidTokenException("Invalid token signature");
            }

            JWTClaimsSet claims = signedJwt.getJWTClaimsSet();
            if (claims.getExpirationTime() == null
                    || claims.getExpirationTime().toInstant().isBefore(clock.instant())) {
                throw new InvalidTokenException("Token has expired");
            }

            String userId = claims.getStringClaim(CLAIM_USER_ID);
            String role = claims.getStringClaim(CLAIM_ROLE);
            if (userId == null || role == null) {
                throw new InvalidTokenException("Token is missing user_id or role");
            }

            return new AuthenticatedUser(UUID.fromString(userId), role);
        } catch (ParseException | JOSEException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            throw new InvalidTokenException("Invalid token", e);
        }
    }
}
