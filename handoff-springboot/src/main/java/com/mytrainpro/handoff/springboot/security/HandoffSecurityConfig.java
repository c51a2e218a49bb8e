package com.mytrainpro.handoff.springboot.security;

import com.mytrainpro.handoff.server.auth.AppSessionManager;
import com.mytrainpro.handoff.server.auth.InternalApiKey;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

@Configuration
@EnableWebSecurity
public class HandoffSecurityConfig {

  @Bean
  public SessionTokenAuthenticationFilter sessionTokenAuthenticationFilter(
      AppSessionManager appSessionManager) {
    return new SessionTokenAuthenticationFilter(appSessionManager);
  }

  @Bean
  public InternalApiKeyAuthenticationFilter internalApiKeyAuthenticationFilter(
      InternalApiKey internalApiKey) {
    return new InternalApiKeyAuthenticationFilter(internalApiKey);
  }

  @Bean
  public SecurityFilterChain handoffSecurityFilterChain(HttpSecurity http,
                                                        SessionTokenAuthenticationFilter tokenFilter,
                                                        InternalApiKeyAuthenticationFilter internalFilter)
      throws Exception {
    http
        .csrf(csrf -> csrf.disable())
        .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(auth -> auth
            .requestMatchers("/auth/pending/create")
                .hasRole(InternalApiKeyAuthenticationFilter.INTERNAL_ROLE)
            .requestMatchers("/auth/pending/lookup", "/auth/pending/consume", "/auth/callback/**",
                "/actuator/health", "/actuator/health/**", "/error").permitAll()
            .anyRequest().authenticated())
        .exceptionHandling(ex -> ex
            .authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
        .addFilterBefore(tokenFilter, UsernamePasswordAuthenticationFilter.class)
        .addFilterBefore(internalFilter, UsernamePasswordAuthenticationFilter.class);
    return http.build();
  }
}
