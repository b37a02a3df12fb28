package com.phillippitts.grillstats.presentation.controller;

import com.phillippitts.grillstats.service.auth.SessionTokenStore;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Issues and revokes stream session tokens.
 *
 * <p>Issuing is unauthenticated: it stands in for the external OAuth exchange, which is not
 * part of this service.
 */
@RestController
@RequestMapping("/api/auth")
class AuthController {

    private static final String BEARER_PREFIX = "Bearer ";

    private final SessionTokenStore tokens;

    AuthController(SessionTokenStore tokens) {
        this.tokens = tokens;
    }

    @PostMapping("/token")
    @ResponseStatus(HttpStatus.CREATED)
    Map<String, String> issue(@Valid @RequestBody TokenRequest request) {
        return Map.of("token", tokens.issue(request.clientId()), "clientId", request.clientId());
    }

    @PostMapping("/logout")
    Map<String, Object> logout(@RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization) {
        return Map.of("revoked", tokens.revoke(bearerToken(authorization)));
    }

    /** Token part of a {@code Bearer} header, or null. */
    static String bearerToken(String authorization) {
        if (authorization == null || !authorization.startsWith(BEARER_PREFIX)) {
            return null;
        }
        String token = authorization.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }

    record TokenRequest(@NotBlank String clientId) {}
}
