package com.campusauth.backend.global.security;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.campusauth.backend.modules.auth.application.JwtTokenService;
import com.campusauth.backend.modules.auth.application.JwtTokenService.AccessTokenClaims;
import com.campusauth.backend.modules.auth.application.JwtTokenService.InvalidTokenException;
import com.campusauth.backend.modules.auth.domain.Permission;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates requests carrying {@code Authorization: Bearer}. An invalid token ends the
 * request with 401; a missing token is left to the authorization rules.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private final JwtTokenService jwtTokenService;
    private final RestAuthenticationEntryPoint authenticationEntryPoint;

    public JwtAuthenticationFilter(JwtTokenService jwtTokenService, RestAuthenticationEntryPoint authenticationEntryPoint) {
        this.jwtTokenService = jwtTokenService;
        this.authenticationEntryPoint = authenticationEntryPoint;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        String token = SecurityUtils.resolveBearerToken(request);
        if (token != null) {
            try {
                AccessTokenClaims claims = jwtTokenService.decode(token);
                List<GrantedAuthority> authorities = new ArrayList<>();
                authorities.add(new SimpleGrantedAuthority("ROLE_" + claims.role().name()));
                for (Permission permission : claims.permissions()) {
                    authorities.add(new SimpleGrantedAuthority(permission.code()));
                }

                JwtAuthenticationPrincipal principal = new JwtAuthenticationPrincipal(
                        claims.userId(),
                        claims.role(),
                        claims.permissions()
                );

                UsernamePasswordAuthenticationToken authentication =
                        new UsernamePasswordAuthenticationToken(principal, null, authorities);
                authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                SecurityContextHolder.getContext().setAuthentication(authentication);
            } catch (InvalidTokenException ex) {
                SecurityContextHolder.clearContext();
                log.info("Access token rejected on {}: reason={}", request.getRequestURI(), ex.getReason());
                authenticationEntryPoint.commence(request, response,
                        new BadCredentialsException("Invalid access token", ex));
                return;
            }
        }

        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return path.equals("/auth/login")
                || path.equals("/auth/refresh")
                || path.startsWith("/health")
                || path.equals("/readyz")
                || path.startsWith("/actuator/health")
                || path.startsWith("/v3/api-docs")
                || path.startsWith("/swagger-ui");
    }
}
