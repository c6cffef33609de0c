package com.vendorhub.marketplace.modules.auth;

import com.vendorhub.marketplace.modules.auth.exception.InvalidTokenException;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Bearer token authentication filter.
 * <ul>
 * <li>Reads {@code Authorization: Bearer <jwt>}</li>
 * <li>Verifies the token via {@link JwtService}</li>
 * <li>Sets SecurityContext with {@code ROLE_<role>} authority</li>
 * <li>Exposes {@link AuthenticatedUser} as the {@code currentUser} request
 * attribute</li>
 * <li>Returns 401 JSON (no redirect)</li>
 * </ul>
 * Public catalog reads pass through without a token.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JwtAuthFilter extends OncePerRequestFilter {

    public static final String CURRENT_USER_ATTRIBUTE = "currentUser";

    private static final String BEARER_PREFIX = "Bearer ";
    private static final Pattern PUBLIC_IMAGE_LISTING = Pattern.compile("^/products/[^/]+/images/?$");

    private final JwtService jwtService;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path.startsWith("/uploads/") || path.startsWith("/actuator/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request,
            HttpServletResponse response,
            FilterChain filterChain)
            throws ServletException, IOException {

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);

        if (header == null || header.isBlank()) {
            if (isPublicRead(request)) {
                filterChain.doFilter(request, response);
                return;
            }
            sendUnauthorized(response, "missing authorization header");
            return;
        }

        if (!header.startsWith(BEARER_PREFIX) || header.length() == BEARER_PREFIX.length()) {
            sendUnauthorized(response, "invalid authorization header format");
            return;
        }

        AuthenticatedUser user;
        try {
            user = jwtService.verify(header.substring(BEARER_PREFIX.length()).trim());
        } catch (InvalidTokenException e) {
            log.debug("Bearer token rejected for {} {}: {}", request.getMethod(), request.getRequestURI(),
                    e.getMessage());
            sendUnauthorized(response, "invalid or expired token");
            return;
        }

        UsernamePasswordAuthenticationToken auth = new UsernamePasswordAuthenticationToken(
                user.userId().toString(),
                null,
                List.of(new SimpleGrantedAuthority("ROLE_" + user.role().toUpperCase(Locale.ROOT))));
        SecurityContextHolder.getContext().setAuthentication(auth);

        request.setAttribute(CURRENT_USER_ATTRIBUTE, user);

        filterChain.doFilter(request, response);
    }

    private boolean isPublicRead(HttpServletRequest request) {
        return "GET".equals(request.getMethod())
                && PUBLIC_IMAGE_LISTING.matcher(request.getRequestURI()).matches();
    }

    private void sendUnauthorized(HttpServletResponse response, String message) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(
                "{\"status\":401,\"error\":\"Unauthorized\",\"message\":\"" + message + "\"}");
    }
}
