package com.studio45.backend.global.security;

import java.io.IOException;
import java.util.List;

import com.studio45.backend.modules.auth.application.JwtTokenService;
import com.studio45.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.studio45.backend.modules.auth.application.JwtTokenService.VerifiedToken;
import com.studio45.backend.modules.auth.infrastructure.persistence.AppUserRepository;
import com.studio45.backend.modules.rbac.application.AuthorizationResolver;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Verifies the bearer token and loads the caller's current roles from the catalog.
 * A role change therefore applies on the very next request.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtTokenService jwtTokenService;
    private final AuthorizationResolver authorizationResolver;
    private final AppUserRepository appUserRepository;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public JwtAuthenticationFilter(
            JwtTokenService jwtTokenService,
            AuthorizationResolver authorizationResolver,
            AppUserRepository appUserRepository,
            RestAuthenticationEntryPoint authenticationEntryPoint
    ) {
        this.jwtTokenService = jwtTokenService;
        this.authorizationResolver = authorizationResolver;
        this.appUserRepository = appUserRepository;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            VerifiedToken verified;
            try {
                verified = jwtTokenService.verify(token);
            } catch (InvalidTokenException ex) {
                SecurityContextHolder.clearContext();
                authenticationEntryPoint.commence(request, response, new BadCredentialsException("Invalid or expired token", ex));
                return;
            }

            if (!appUserRepository.existsById(verified.userId())) {
                log.info("Rejected token for missing or deleted user {}", verified.userId());
                SecurityContextHolder.clearContext();
                authenticationEntryPoint.commence(request, response, new BadCredentialsException("User no longer exists"));
                return;
            }

            List<String> roles = authorizationResolver.getRoleNames(verified.userId());
            List<SimpleGrantedAuthority> authorities = roles.stream()
                    .map(role -> new SimpleGrantedAuthority("ROLE_" + role))
                    .toList();

            JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(verified.userId(), verified.email(), roles);
            UsernamePasswordAuthenticationToken authentication =
                    new UsernamePasswordAuthenticationToken(principal, token, authorities);
            authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
            SecurityContextHolder.getContext().setAuthentication(authentication);
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return path.startsWith("/api/v1/auth/") || path.startsWith("/health") || path.startsWith("/actuator/health");
    }
}
