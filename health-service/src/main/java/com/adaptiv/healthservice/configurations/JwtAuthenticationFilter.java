package com.adaptiv.healthservice.configurations;

import com.adaptiv.healthservice.exceptions.Outcome;
import com.adaptiv.healthservice.models.Role;
import com.adaptiv.healthservice.services.TokenService;
import com.adaptiv.healthservice.services.TokenType;
import com.adaptiv.healthservice.services.authorization.AuthenticatedIdentity;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.jwt.Jwt;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.List;

/**
 * Reads the bearer access token and exposes it as an {@link AuthenticatedIdentity} principal.
 * Anything but a valid access-type token leaves the request unauthenticated.
 */
@Slf4j
@RequiredArgsConstructor
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final String BEARER_PREFIX = "Bearer ";

    private final TokenService tokenService;
    private final PublicEndpointsConfig publicEndpoints;

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String requestPath = request.getRequestURI();

        if (publicEndpoints.isPublic(requestPath)) {
            filterChain.doFilter(request, response);
            return;
        }

        String header = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (header != null && header.startsWith(BEARER_PREFIX)) {
            Outcome<Jwt> decoded = tokenService.decode(header.substring(BEARER_PREFIX.length()).trim(), TokenType.ACCESS);

            if (decoded.isSuccess()) {
                Jwt jwt = decoded.getValue();
                AuthenticatedIdentity identity = toIdentity(jwt);
                if (identity != null) {
                    UsernamePasswordAuthenticationToken authentication = new UsernamePasswordAuthenticationToken(
                            identity, null, List.of(new SimpleGrantedAuthority("ROLE_" + identity.getRole().name())));
                    authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
                    SecurityContextHolder.getContext().setAuthentication(authentication);
                    log.debug("Authenticated account {} for {}", identity.getAccountId(), requestPath);
                }
            } else {
                log.debug("Rejected bearer token for {}", requestPath);
                SecurityContextHolder.clearContext();
            }
        }
        filterChain.doFilter(request, response);
    }

    private static AuthenticatedIdentity toIdentity(Jwt jwt) {
        try {
            Role role = Role.valueOf(jwt.getClaimAsString(TokenService.CLAIM_ROLE));
            return new AuthenticatedIdentity(TokenService.parseSubject(jwt), role);
        } catch (IllegalArgumentException | NullPointerException e) {
            log.warn("Access token carries an unknown role claim");
            return null;
        }
    }
}
