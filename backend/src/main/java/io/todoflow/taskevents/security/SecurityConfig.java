package io.todoflow.taskevents.security;

import io.todoflow.taskevents.realtime.FanOutProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;

/**
 * The only HTTP surface is the WebSocket endpoint, which authenticates its own handshake, and the
 * actuator health endpoints. Everything else is denied.
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

  private final FanOutProperties fanOutProperties;

  public SecurityConfig(FanOutProperties fanOutProperties) {
    this.fanOutProperties = fanOutProperties;
  }

  @Bean
  public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
    http.csrf(csrf -> csrf.disable())
        .httpBasic(basic -> basic.disable())
        .formLogin(form -> form.disable())
        .sessionManagement(
            session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
        .authorizeHttpRequests(
            auth ->
                auth.requestMatchers(fanOutProperties.path())
                    .permitAll()
                    .requestMatchers("/actuator/health", "/actuator/health/**")
                    .permitAll()
                    .anyRequest()
                    .denyAll());
    return http.build();
  }
}
