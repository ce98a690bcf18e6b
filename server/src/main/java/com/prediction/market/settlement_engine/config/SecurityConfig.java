package com.prediction.market.settlement_engine.config;

import java.time.Clock;

import org.springframework.boot.web.servlet.FilterRegistrationBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.HttpStatusEntryPoint;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;

import com.prediction.market.settlement_engine.security.JwtAuthenticationFilter;
import com.prediction.market.settlement_engine.security.JwtUtil;
import com.prediction.market.settlement_engine.security.RequestThrottleFilter;

import io.github.resilience4j.ratelimiter.RateLimiterRegistry;

@Configuration
@EnableWebSecurity
public class SecurityConfig {

    @Bean
    JwtUtil jwtUtil(SettlementProperties properties, Clock clock) {
        return new JwtUtil(properties.security().jwtSecret(), properties.security().tokenTtl(), clock);
    }

    @Bean
    JwtAuthenticationFilter jwtAuthenticationFilter(JwtUtil jwtUtil) {
        return new JwtAuthenticationFilter(jwtUtil);
    }

    @Bean
    RequestThrottleFilter requestThrottleFilter(RateLimiterRegistry requestRateLimiterRegistry) {
        return new RequestThrottleFilter(requestRateLimiterRegistry);
    }

    // Both filters run inside the security chain only, not as plain servlet filters.
    @Bean
    FilterRegistrationBean<JwtAuthenticationFilter> jwtFilterRegistration(JwtAuthenticationFilter filter) {
        FilterRegistrationBean<JwtAuthenticationFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    FilterRegistrationBean<RequestThrottleFilter> throttleFilterRegistration(RequestThrottleFilter filter) {
        FilterRegistrationBean<RequestThrottleFilter> registration = new FilterRegistrationBean<>(filter);
        registration.setEnabled(false);
        return registration;
    }

    @Bean
    public SecurityFilterChain filterChain(HttpSecurity http, JwtAuthenticationFilter jwtFilter,
            RequestThrottleFilter throttleFilter) throws Exception {
        http.csrf(csrf -> csrf.disable())
                .sessionManagement(session -> session.sessionCreationPolicy(SessionCreationPolicy.STATELESS))
                .authorizeHttpRequests(auth -> auth
                        .requestMatchers(HttpMethod.POST, "/markets").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.PATCH, "/markets/*/resolve", "/markets/*/fees").hasRole("ADMIN")
                        .requestMatchers("/admin/**").hasRole("ADMIN")
                        .requestMatchers(HttpMethod.GET, "/markets/**").permitAll()
                        .requestMatchers("/error").permitAll()
                        .anyRequest().authenticated())
                .exceptionHandling(ex -> ex.authenticationEntryPoint(new HttpStatusEntryPoint(HttpStatus.UNAUTHORIZED)))
                // identity first so the throttle can key on the user
                .addFilterBefore(jwtFilter, UsernamePasswordAuthenticationFilter.class)
                .addFilterAfter(throttleFilter, JwtAuthenticationFilter.class);

        return http.build();
    }
}
