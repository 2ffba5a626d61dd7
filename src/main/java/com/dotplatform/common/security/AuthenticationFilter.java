package com.dotplatform.common.security;

import jakarta.servlet.*;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.io.IOException;

/**
 * Resolves the bearer token of every HTTP request and stores the verified identity as the
 * {@value #AUTHENTICATED_USER_ATTRIBUTE} request attribute. Requests without a valid token pass
 * through unauthenticated; endpoints that need a caller reject them via {@link CurrentUser}.
 */
@Component
@RequiredArgsConstructor
public class AuthenticationFilter implements Filter {

    public static final String AUTHENTICATED_USER_ATTRIBUTE = "authenticatedUser";

    private final JwtTokenProvider jwtTokenProvider;

    @Override
    public void doFilter(ServletRequest request, ServletResponse response, FilterChain chain)
            throws IOException, ServletException {
        HttpServletRequest httpRequest = (HttpServletRequest) request;
        String token = resolveToken(httpRequest.getHeader("Authorization"));

        jwtTokenProvider.authenticate(token)
                .ifPresent(user -> httpRequest.setAttribute(AUTHENTICATED_USER_ATTRIBUTE, user));

        chain.doFilter(request, response);
    }

    static String resolveToken(String authorizationHeader) {
        if (authorizationHeader != null && authorizationHeader.startsWith("Bearer ")) {
            return authorizationHeader.substring(7);
        }
        return null;
    }
}
