package com.vendorhub.marketplace.config;

import com.vendorhub.marketplace.modules.auth.JwtAuthFilter;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.security.config.annotation.web.builders.HttpSecurity;
import org.springframework.security.config.annotation.web.configuration.EnableWebSecurity;
import org.springframework.security.config.annotation.web.configurers.AbstractHttpConfigurer;
import org.springframework.security.config.http.SessionCreationPolicy;
import org.springframework.security.web.SecurityFilterChain;
import org.springframework.security.web.authentication.UsernamePasswordAuthenticationFilter;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.CorsConfigurationSource;
import org.springframework.web.cors.UrlBasedCorsConfigurationSource;

import java.io.IOException;
import java.util.Arrays;
import java.util.List;

/**
 * Stateless bearer-token security.
 * <ul>
 * <li>GET /products/{id}/images, /uploads/**, /actuator/health: permitAll</li>
 * <li>Image writes: ROLE_VENDOR only</li>
 * <li>All other routes: authenticated</li>
 * <li>CSRF disabled (no cookies, bearer tokens only)</li>
 * </ul>
 */
@Configuration
@EnableWebSecurity
public class SecurityConfig {

        @Value("${app.frontend-url:http://localhost:3000}")
        private String frontendUrl;

        private final JwtAuthFilter jwtAuthFilter;

        public SecurityConfig(JwtAuthFilter jwtAuthFilter) {
                this.jwtAuthFilter = jwtAuthFilter;
        }

        @Bean
        public SecurityFilterChain securityFilterChain(HttpSecurity http) throws Exception {
                http
                                .csrf(AbstractHttpConfigurer::disable)
                                .cors(cors -> cors.configurationSource(corsConfigurationSource()))
                                .sessionManagement(session -> session
                                                .sessionCreationPolicy(SessionCreationPolicy.STATELESS))

                                .headers(headers -> headers
                                                .contentTypeOptions(opt -> {
                                                }) // X-Content-Type-Options: nosniff
                                                .frameOptions(frame -> frame.deny()))

                                .authorizeHttpRequests(auth -> auth
                                                .requestMatchers(HttpMethod.GET, "/products/*/images").permitAll()
                                                .requestMatchers(HttpMethod.GET, "/uploads/**").permitAll()
                                                .requestMatchers("/actuator/health").permitAll()
                                                .requestMatchers(HttpMethod.POST, "/products/*/images")
                                                .hasRole("VENDOR")
                                                .requestMatchers("/images/**").hasRole("VENDOR")
                                                .anyRequest().authenticated())
                                .exceptionHandling(ex -> ex
                                                .authenticationEntryPoint((request, response, e) -> writeError(
                                                                response, HttpServletResponse.SC_UNAUTHORIZED,
                                                                "Unauthorized", "authentication required"))
                                                .accessDeniedHandler((request, response, e) -> writeError(
                                                                response, HttpServletResponse.SC_FORBIDDEN,
                                                                "Forbidden",
                                                                "only vendors can manage product images")))
                                .addFilterBefore(jwtAuthFilter, UsernamePasswordAuthenticationFilter.class)
                                .formLogin(AbstractHttpConfigurer::disable)
                                .httpBasic(AbstractHttpConfigurer::disable);

                return http.build();
        }

        @Bean
        public CorsConfigurationSource corsConfigurationSource() {
                CorsConfiguration config = new CorsConfiguration();
                config.setAllowedOrigins(Arrays.asList(
                                "http://localhost:3000",
                                frontendUrl));
                config.setAllowedMethods(List.of("GET", "POST", "PUT", "DELETE", "OPTIONS"));
                config.setAllowedHeaders(List.of("*"));
                config.setMaxAge(3600L);

                UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
                source.registerCorsConfiguration("/**", config);
                return source;
        }

        private static void writeError(HttpServletResponse response, int status, String error, String message)
                        throws IOException {
                response.setStatus(status);
                response.setContentType(MediaType.APPLICATION_JSON_VALUE);
                response.getWriter().write(
                                "{\"status\":" + status + ",\"error\":\"" + error + "\",\"message\":\"" + message
                                                + "\"}");
        }
}
