package com.example.tenantgate.config;

import com.example.tenantgate.properties.ApplicationProperties;
import com.example.tenantgate.service.LoginSessionService;
import com.example.tenantgate.service.TokenCodec;
import java.time.Clock;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

/**
 * Token signing and login session beans.
 */
@Configuration(proxyBeanMethods = false)
public class TokenCodecConfig {

  @Bean
  @ConditionalOnMissingBean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public TokenCodec tokenCodec(ApplicationProperties properties, Clock clock) {
    return new TokenCodec(
        TokenSecretLoader.load(properties.token()),
        properties.token().maxAge(),
        clock);
  }

  // Tenant user tables store bcrypt hashes without an encoding-id prefix
  @Bean
  @ConditionalOnMissingBean
  public PasswordEncoder passwordEncoder() {
    return new BCryptPasswordEncoder();
  }

  @Bean
  public LoginSessionService loginSessionService(TokenCodec tokenCodec,
                                                 PasswordEncoder passwordEncoder,
                                                 ApplicationProperties properties) {
    return new LoginSessionService(tokenCodec, passwordEncoder,
                                   properties.tenantPool().queryTimeout());
  }
}
