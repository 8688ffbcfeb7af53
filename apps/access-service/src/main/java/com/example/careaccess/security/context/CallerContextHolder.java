package com.example.careaccess.security.context;

import com.example.careaccess.security.exception.AuthenticationException;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.function.Function;

public final class CallerContextHolder {

    private static final String CALLER_CONTEXT_KEY = CallerContext.class.getName();

    private CallerContextHolder() {
        // Utility class
    }

    public static Mono<CallerContext> getContext() {
        return Mono.deferContextual(ctx -> {
            if (ctx.hasKey(CALLER_CONTEXT_KEY)) {
                return Mono.just(ctx.get(CALLER_CONTEXT_KEY));
            }
            return Mono.error(new AuthenticationException(
                    "No CallerContext found in reactive context"));
        });
    }

    public static Mono<CallerContext> getContextIfPresent() {
        return Mono.deferContextual(ctx -> {
            if (ctx.hasKey(CALLER_CONTEXT_KEY)) {
                return Mono.just(ctx.get(CALLER_CONTEXT_KEY));
            }
            return Mono.empty();
        });
    }

    public static Function<Context, Context> withContext(CallerContext callerContext) {
        return context -> context.put(CALLER_CONTEXT_KEY, callerContext);
    }
}
