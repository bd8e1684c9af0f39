package com.fintech.expensereconciliation.web;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a controller method whose effect must happen at most once per {@code Idempotency-Key}.
 * <p>
 * The method must return a {@link org.springframework.http.ResponseEntity}. Requests without the
 * header are not guarded.
 *
 * @see IdempotencyGuardAspect
 */
@Documented
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
public @interface IdempotentEndpoint {

    /**
     * Header naming the user the key is scoped to. Keys sent without it are scoped to
     * {@code anonymous}.
     */
    String userHeader() default "X-User-Id";
}
