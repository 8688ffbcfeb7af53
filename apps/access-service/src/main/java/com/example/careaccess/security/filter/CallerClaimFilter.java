package com.example.careaccess.security.filter;

import com.example.careaccess.common.util.StringSanitizer;
import com.example.careaccess.rbac.Role;
import com.example.careaccess.security.context.CallerContext;
import com.example.careaccess.security.context.CallerContextHolder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.NonNull;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;

/**
 * Reads the verified caller claim forwarded by the authentication layer and places it in the
 * Reactor context for downstream handlers. API requests without a usable claim are rejected with 401.
 */
@Slf4j
@Component
public class CallerClaimFilter implements WebFilter, Ordered {

    public static final String HEADER_USER_ID = "X-User-Id";
    public static final String HEADER_USER_ROLE = "X-User-Role";

    private static final String PROTECTED_PREFIX = "/api/";

    @Override
    public int getOrder() {
        return -100;
    }

    @Override
    @NonNull
    public Mono<Void> filter(@NonNull ServerWebExchange exchange, @NonNull WebFilterChain chain) {
        ServerHttpRequest request = exchange.getRequest();
        if (!request.getPath().value().startsWith(PROTECTED_PREFIX)) {
            return chain.filter(exchange);
        }

        String userId = request.getHeaders().getFirst(HEADER_USER_ID);
        String roleClaim = request.getHeaders().getFirst(HEADER_USER_ROLE);

        if (userId == null || userId.isBlank()) {
            return unauthorizedResponse(exchange, "Missing required header: " + HEADER_USER_ID);
        }
        if (!StringSanitizer.isValidUserId(userId.trim())) {
            return unauthorizedResponse(exchange, "Invalid user id");
        }
        if (roleClaim == null || roleClaim.isBlank()) {
            return unauthorizedResponse(exchange, "Missing required header: " + HEADER_USER_ROLE);
        }

        Role role = Role.fromClaim(roleClaim);
        if (role == null) {
            log.warn("Rejected unrecognized role claim: {}", StringSanitizer.forLog(roleClaim));
            return unauthorizedResponse(exchange, "Unrecognized role");
        }

        CallerContext caller = new CallerContext(userId.trim(), role);
        log.debug("Caller resolved: user={}, role={}", StringSanitizer.forLog(caller.userId()), role);

        return chain.filter(exchange)
                .contextWrite(CallerContextHolder.withContext(caller));
    }

    @NonNull
    private Mono<Void> unauthorizedResponse(@NonNull ServerWebExchange exchange, @NonNull String message) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);

        String body = String.format(
                "{\"error\":\"unauthorized\",\"message\":\"%s\"}",
                StringSanitizer.escapeJson(message));

        return exchange.getResponse()
                .writeWith(Mono.just(exchange.getResponse()
                        .bufferFactory()
                        .wrap(body.getBytes(StandardCharsets.UTF_8))));
    }
}
