package com.al.obstranslator.interceptor;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlates the log lines of one translation request.
 *
 * <p>
 * Pipelines usually pass their own id (an exposure or night label) in the
 * {@value #HEADER_KEY} request header. It is echoed back and logged as is
 * when it is a short token; anything else is replaced by a generated id so
 * it cannot break log lines or response headers.
 */
@Component
@Slf4j
public class MdcInterceptor implements HandlerInterceptor {

    public static final String MDC_KEY = "translationId";
    public static final String HEADER_KEY = "translationId";

    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler) {
        String translationId = resolveId(request.getHeader(HEADER_KEY));
        MDC.put(MDC_KEY, translationId);
        response.setHeader(HEADER_KEY, translationId);
        return true;
    }

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response, Object handler,
            @Nullable Exception ex) {
        MDC.remove(MDC_KEY);
    }

    static String resolveId(@Nullable String supplied) {
        if (supplied != null && VALID_ID.matcher(supplied).matches()) {
            return supplied;
        }
        String generated = UUID.randomUUID().toString();
        if (supplied != null && !supplied.isEmpty()) {
            log.debug("Ignoring malformed {} header, using {}", HEADER_KEY, generated);
        }
        return generated;
    }
}
