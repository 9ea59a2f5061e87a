package com.example.tenantgate.config;

import com.example.tenantgate.properties.ApplicationProperties.TokenProperties;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;
import org.springframework.util.StringUtils;

/**
 * Loads the shared token signing secret: the configured value (APP_TOKEN_SECRET) first, the key
 * file second. HS256 needs at least 256 bits of key material.
 */
@Slf4j
@UtilityClass
public class TokenSecretLoader {

  static final int MIN_SECRET_BYTES = 32;
  private static final String HMAC_ALGORITHM = "HmacSHA256";

  public static SecretKey load(TokenProperties properties) {
    byte[] secret;
    if (StringUtils.hasText(properties.secret())) {
      secret = properties.secret().getBytes(StandardCharsets.UTF_8);
      log.info("Token secret loaded from configuration");
    } else if (StringUtils.hasText(properties.secretFile())) {
      secret = readSecretFile(Path.of(properties.secretFile()));
      log.info("Token secret loaded from key file {}", properties.secretFile());
    } else {
      throw new IllegalStateException(
          "No token secret configured: set APP_TOKEN_SECRET or app.token.secret-file");
    }

    if (secret.length < MIN_SECRET_BYTES) {
      throw new IllegalStateException(
          "Token secret too short: expected at least %d bytes".formatted(MIN_SECRET_BYTES));
    }
    return new SecretKeySpec(secret, HMAC_ALGORITHM);
  }

  private static byte[] readSecretFile(Path path) {
    try {
      return Files.readString(path, StandardCharsets.UTF_8).strip().getBytes(StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read token key file " + path, e);
    }
  }
}
