package com.fintech.expensereconciliation.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fintech.expensereconciliation.dto.IdempotentResponse;
import com.fintech.expensereconciliation.service.IdempotencyService;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

import java.lang.annotation.Annotation;
import java.lang.reflect.Method;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Applies the idempotency guard to {@link IdempotentEndpoint} controller methods.
 * <p>
 * When the request carries an {@code Idempotency-Key} header, the handler runs inside
 * {@link IdempotencyService#execute}: the first request with a given key and body runs and its
 * 2xx response is stored; repeats get the stored status and body back with
 * {@code X-Idempotency-Replay: true}. Non-2xx responses and exceptions release the key so the
 * client can retry.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class IdempotencyGuardAspect {

    public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    public static final String REPLAY_HEADER = "X-Idempotency-Replay";

    static final String ANONYMOUS_USER = "anonymous";

    private final IdempotencyService idempotencyService;
    private final ObjectMapper objectMapper;

    @Around("@annotation(endpoint)")
    public Object guard(ProceedingJoinPoint joinPoint, IdempotentEndpoint endpoint) throws Throwable {
        HttpServletRequest request = currentRequest();
        String idempotencyKey = request != null ? request.getHeader(IDEMPOTENCY_KEY_HEADER) : null;
        if (idempotencyKey == null) {
            return joinPoint.proceed();
        }

        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        if (!ResponseEntity.class.isAssignableFrom(signature.getReturnType())) {
            throw new IllegalStateException("@IdempotentEndpoint method must return ResponseEntity: "
                    + signature.toShortString());
        }

        String userId = request.getHeader(endpoint.userHeader());
        if (userId == null || userId.isBlank()) {
            userId = ANONYMOUS_USER;
        }
        Object body = requestBody(signature.getMethod(), joinPoint.getArgs());

        AtomicReference<ResponseEntity<?>> handled = new AtomicReference<>();
        IdempotentResponse result;
        try {
            result = idempotencyService.execute(idempotencyKey, userId,
                    body != null ? body : Collections.emptyMap(),
                    () -> {
                        ResponseEntity<?> response = proceed(joinPoint);
                        if (!response.getStatusCode().is2xxSuccessful()) {
                            throw new UnstoredResponse(response);
                        }
                        handled.set(response);
                        return toIdempotentResponse(response);
                    });
        } catch (UnstoredResponse e) {
            return e.getResponse();
        } catch (HandlerFailure e) {
            throw e.getCause();
        }

        if (!result.isReplayed()) {
            return handled.get();
        }

        log.info("Replaying stored response: uri={}, key={}, userId={}",
                request.getRequestURI(), idempotencyKey, userId);
        return replay(result.getResponse());
    }

    private IdempotentResponse toIdempotentResponse(ResponseEntity<?> response) {
        JsonNode body = objectMapper.valueToTree(response.getBody());
        ObjectNode stored = objectMapper.createObjectNode();
        stored.put("status", response.getStatusCode().value());
        stored.set("body", body);

        return IdempotentResponse.builder()
                .transactionId(body != null && body.hasNonNull("id") ? body.get("id").asText() : null)
                .response(stored)
                .build();
    }

    private static ResponseEntity<JsonNode> replay(JsonNode stored) {
        int status = stored.path("status").asInt(HttpStatus.OK.value());
        return ResponseEntity.status(status)
                .header(REPLAY_HEADER, "true")
                .body(stored.get("body"));
    }

    private static ResponseEntity<?> proceed(ProceedingJoinPoint joinPoint) {
        try {
            return (ResponseEntity<?>) joinPoint.proceed();
        } catch (RuntimeException | Error e) {
            throw e;
        } catch (Throwable e) {
            throw new HandlerFailure(e);
        }
    }

    private static Object requestBody(Method method, Object[] args) {
        Annotation[][] parameterAnnotations = method.getParameterAnnotations();
        for (int i = 0; i < parameterAnnotations.length; i++) {
            for (Annotation annotation : parameterAnnotations[i]) {
                if (annotation instanceof RequestBody) {
                    return args[i];
                }
            }
        }
        return null;
    }

    private static HttpServletRequest currentRequest() {
        RequestAttributes attributes = RequestContextHolder.getRequestAttributes();
        if (attributes instanceof ServletRequestAttributes) {
            return ((ServletRequestAttributes) attributes).getRequest();
        }
        return null;
    }

    /**
     * Carries a non-2xx response out of the guarded call so the key is released, not stored.
     */
    private static final class UnstoredResponse extends RuntimeException {

        private final transient ResponseEntity<?> response;

        UnstoredResponse(ResponseEntity<?> response) {
            super(null, null, false, false);
            this.response = response;
        }

        ResponseEntity<?> getResponse() {
            return response;
        }
    }

    private static final class HandlerFailure extends RuntimeException {

        HandlerFailure(Throwable cause) {
            super(cause);
        }
    }
}
