package com.example.tenantgate.service;

import com.example.tenantgate.domain.entity.Claims;
import com.example.tenantgate.exception.TokenException;
import com.example.tenantgate.exception.TokenException.TokenError;
import com.example.tenantgate.security.ExpiryValidator;
import com.nimbusds.jose.JWSAlgorithm;
import com.nimbusds.jose.jwk.source.ImmutableSecret;
import com.nimbusds.jwt.SignedJWT;
import java.text.ParseException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import javax.crypto.SecretKey;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.oauth2.core.DelegatingOAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2Error;
import org.springframework.security.oauth2.core.OAuth2TokenValidator;
import org.springframework.security.oauth2.core.OAuth2TokenValidatorResult;
import org.springframework.security.oauth2.jose.jws.MacAlgorithm;
import org.springframework.security.oauth2.jwt.BadJwtException;
import org.springframework.security.oauth2.jwt.JwsHeader;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.oauth2.jwt.JwtClaimsSet;
import org.springframework.security.oauth2.jwt.JwtEncoderParameters;
import org.springframework.security.oauth2.jwt.JwtException;
import org.springframework.security.oauth2.jwt.JwtValidationException;
import org.springframework.security.oauth2.jwt.NimbusJwtDecoder;
import org.springframework.security.oauth2.jwt.NimbusJwtEncoder;
import org.springframework.util.StringUtils;

/**
 * Encodes and verifies the HS256 tokens that carry a user's tenant and login session.
 *
 * <p>Payload layout: {@code {"iat", "exp", "user", "login_session", "tenant_id"}}. Decoding
 * distinguishes malformed input, a bad signature and expiry so callers can log the precise cause
 * while answering clients uniformly.
 */
@Slf4j
public class TokenCodec {

  public static final String CLAIM_USER = "user";
  public static final String CLAIM_LOGIN_SESSION = "login_session";
  public static final String CLAIM_TENANT_ID = "tenant_id";

  private static final String MISSING_CLAIMS_ERROR_CODE = "missing_claims";

  private final NimbusJwtEncoder encoder;
  private final NimbusJwtDecoder decoder;
  private final Duration maxAge;
  private final Clock clock;

  public TokenCodec(SecretKey signingKey, Duration maxAge, Clock clock) {
    this.encoder = new NimbusJwtEncoder(new ImmutableSecret<>(signingKey));
    this.decoder = NimbusJwtDecoder.withSecretKey(signingKey)
        .macAlgorithm(MacAlgorithm.HS256)
        .build();
    this.maxAge = maxAge;
    this.clock = clock;

    // Compose multiple validators
    OAuth2TokenValidator<Jwt> requiredClaimsValidator = jwt ->
        (StringUtils.hasText(jwt.getClaimAsString(CLAIM_USER))
            && jwt.getClaimAsString(CLAIM_LOGIN_SESSION) != null
            && StringUtils.hasText(jwt.getClaimAsString(CLAIM_TENANT_ID))
            && jwt.getIssuedAt() != null)
            ? OAuth2TokenValidatorResult.success()
            : OAuth2TokenValidatorResult.failure(
                new OAuth2Error(MISSING_CLAIMS_ERROR_CODE, "Required claims missing", null));

    decoder.setJwtValidator(new DelegatingOAuth2TokenValidator<>(
        requiredClaimsValidator,
        new ExpiryValidator(clock)
    ));
  }

  /**
   * Issues a token for a fresh login, valid for the configured max age.
   */
  public String issue(String user, String loginSession, String tenantId) {
    Instant now = clock.instant();
    return encode(new Claims(user, loginSession, tenantId, now, now.plus(maxAge)));
  }

  /**
   * Signs the given claims. Identical claims produce identical tokens.
   */
  public String encode(Claims claims) {
    JwtClaimsSet claimsSet = JwtClaimsSet.builder()
        .issuedAt(claims.issuedAt())
        .expiresAt(claims.expiresAt())
        .claim(CLAIM_USER, claims.user())
        .claim(CLAIM_LOGIN_SESSION, claims.loginSession())
        .claim(CLAIM_TENANT_ID, claims.tenantId())
        .build();
    JwsHeader header = JwsHeader.with(MacAlgorithm.HS256).build();
    return encoder.encode(JwtEncoderParameters.from(header, claimsSet)).getTokenValue();
  }

  /**
   * Verifies structure, signature and expiry, then maps the payload to {@link Claims}.
   *
   * @throws TokenException carrying the {@link TokenError} that caused the rejection
   */
  public Claims decode(String token) {
    requireWellFormed(token);

    Jwt jwt;
    try {
      jwt = decoder.decode(token);
    } catch (JwtValidationException e) {
      boolean expired = e.getErrors().stream()
          .anyMatch(error -> ExpiryValidator.EXPIRED_ERROR_CODE.equals(error.getErrorCode()));
      if (expired) {
        throw new TokenException(TokenError.EXPIRED, "Token expired", e);
      }
      throw new TokenException(TokenError.MALFORMED, "Token claims invalid: " + e.getMessage(), e);
    } catch (BadJwtException e) {
      throw new TokenException(TokenError.INVALID_SIGNATURE, "Token signature rejected", e);
    } catch (JwtException e) {
      throw new TokenException(TokenError.MALFORMED, "Token could not be decoded", e);
    }

    try {
      return new Claims(
          jwt.getClaimAsString(CLAIM_USER),
          jwt.getClaimAsString(CLAIM_LOGIN_SESSION),
          jwt.getClaimAsString(CLAIM_TENANT_ID),
          jwt.getIssuedAt(),
          jwt.getExpiresAt());
    } catch (IllegalArgumentException e) {
      throw new TokenException(TokenError.MALFORMED, "Token lifetime invalid", e);
    }
  }

  private void requireWellFormed(String token) {
    if (!StringUtils.hasText(token)) {
      throw new TokenException(TokenError.MALFORMED, "Token is empty");
    }
    try {
      SignedJWT parsed = SignedJWT.parse(token);
      if (!JWSAlgorithm.HS256.equals(parsed.getHeader().getAlgorithm())) {
        throw new TokenException(TokenError.MALFORMED,
                                 "Unsupported algorithm: " + parsed.getHeader().getAlgorithm());
      }
      parsed.getJWTClaimsSet();
    } catch (ParseException e) {
      throw new TokenException(TokenError.MALFORMED, "Token is not a signed JWT", e);
    }
  }
}
