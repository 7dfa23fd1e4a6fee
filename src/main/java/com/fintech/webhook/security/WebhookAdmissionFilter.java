package com.fintech.webhook.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.webhook.api.ResponseComposer;
import com.fintech.webhook.api.dto.WebhookResponse;
import com.fintech.webhook.domain.model.PipelineRejection;
import com.fintech.webhook.ratelimit.RateLimitDecision;
import com.fintech.webhook.ratelimit.RateLimiter;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.servlet.Filter;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.ServletRequest;
import jakarta.servlet.ServletResponse;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Runs the admission gates in order: rate limiter, network filter, then signature
 * verification for webhook deliveries. Any gate may end the request with an envelope;
 * an admitted webhook body is replayed unchanged to the controller.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class WebhookAdmissionFilter implements Filter {

    static final String HEADER_LIMIT = "X-RateLimit-Limit";
    static final String HEADER_REMAINING = "X-RateLimit-Remaining";
    static final String HEADER_RESET = "X-RateLimit-Reset";
    static final String HEADER_WINDOW = "X-RateLimit-Window";

    /** Request attribute holding the batch id read by the signature gate. */
    public static final String BATCH_ID_ATTRIBUTE = WebhookAdmissionFilter.class.getName() + ".batchId";

    private static final String WEBHOOK_PATH_PREFIX = "/webhook/";

    private static final String[] BYPASS_PATHS = {
            "/health",
            "/actuator"
    };

    private final ClientIdentityResolver identityResolver;
    private final RateLimiter rateLimiter;
    private final NetworkFilter networkFilter;
    private final SignatureGate signatureGate;
    private final ResponseComposer responseComposer;
    private final ObjectMapper objectMapper;
    private final MeterRegistry meterRegistry;

    @Override
    public void doFilter(ServletRequest req, ServletResponse res, FilterChain chain)
            throws IOException, ServletException {

        HttpServletRequest request = (HttpServletRequest) req;
        HttpServletResponse response = (HttpServletResponse) res;

        String path = pathWithinApplication(request);
        if (isBypassed(path)) {
            chain.doFilter(request, response);
            return;
        }

        HttpServletRequest admitted;
        try {
            admitted = admit(request, response, path);
        } catch (Exception e) {
            log.error("Admission pipeline failed for {} {}", request.getMethod(), path, e);
            countRejection(PipelineRejection.INTERNAL_FAULT);
            if (!response.isCommitted()) {
                writeEnvelope(response, responseComposer.reject(null, PipelineRejection.INTERNAL_FAULT));
            }
            return;
        }

        if (admitted != null) {
            chain.doFilter(admitted, response);
        }
    }

    /**
     * @return the request to pass down the chain, or null when a rejection was written
     */
    private HttpServletRequest admit(HttpServletRequest request, HttpServletResponse response, String path)
            throws IOException {

        String callerId = identityResolver.resolve(request);

        RateLimitDecision decision = rateLimiter.check(callerId);
        writeRateLimitHeaders(response, decision);
        if (!decision.isAllowed()) {
            reject(response, GateResult.reject(PipelineRejection.RATE_LIMITED, null), callerId, path);
            return null;
        }

        if (!networkFilter.admit(callerId)) {
            reject(response, GateResult.reject(PipelineRejection.UNTRUSTED_NETWORK, null), callerId, path);
            return null;
        }

        if (!path.startsWith(WEBHOOK_PATH_PREFIX)) {
            return request;
        }

        GateResult shape = checkRequestShape(request);
        if (!shape.isAdmitted()) {
            reject(response, shape, callerId, path);
            return null;
        }

        byte[] body = request.getInputStream().readAllBytes();
        GateResult verdict = signatureGate.evaluate(body);
        if (!verdict.isAdmitted()) {
            reject(response, verdict, callerId, path);
            return null;
        }
        request.setAttribute(BATCH_ID_ATTRIBUTE, verdict.getBatchId());
        return new CachedBodyHttpServletRequest(request, body);
    }

    /**
     * Webhook deliveries are JSON POSTs. Anything else would be answered by Spring MVC
     * with a bare 405 or 415, so it is rejected here inside the envelope.
     */
    static GateResult checkRequestShape(HttpServletRequest request) {
        if (!HttpMethod.POST.matches(request.getMethod())) {
            return GateResult.reject(PipelineRejection.MALFORMED_BODY, null,
                    "Unsupported method " + request.getMethod());
        }
        String contentType = request.getContentType();
        if (contentType == null) {
            return GateResult.reject(PipelineRejection.MALFORMED_BODY, null, "Missing content type");
        }
        MediaType mediaType;
        try {
            mediaType = MediaType.parseMediaType(contentType);
        } catch (InvalidMediaTypeException e) {
            return GateResult.reject(PipelineRejection.MALFORMED_BODY, null, "Invalid content type");
        }
        if (!MediaType.APPLICATION_JSON.isCompatibleWith(mediaType)) {
            return GateResult.reject(PipelineRejection.MALFORMED_BODY, null,
                    "Unsupported content type " + mediaType.getType() + "/" + mediaType.getSubtype());
        }
        return GateResult.admit(null);
    }

    private void reject(HttpServletResponse response, GateResult verdict, String callerId, String path)
            throws IOException {
        PipelineRejection rejection = verdict.getRejection();
        log.warn("Rejected {} from {}: {} ({})", path, callerId, rejection, verdict.getMessage());
        countRejection(rejection);
        writeEnvelope(response, responseComposer.reject(verdict.getBatchId(), rejection, verdict.getMessage()));
    }

    private void countRejection(PipelineRejection rejection) {
        Counter.builder("webhook.gate.rejected")
                .tag("reason", rejection.name())
                .tag("stage", rejection.getStage().name().toLowerCase())
                .register(meterRegistry)
                .increment();
    }

    private void writeRateLimitHeaders(HttpServletResponse response, RateLimitDecision decision) {
        response.setHeader(HEADER_LIMIT, String.valueOf(decision.getLimit()));
        response.setHeader(HEADER_REMAINING, String.valueOf(decision.getRemaining()));
        response.setHeader(HEADER_RESET, String.valueOf(decision.getResetAt()));
        response.setHeader(HEADER_WINDOW, String.valueOf(decision.getWindowSeconds()));
    }

    private void writeEnvelope(HttpServletResponse response, WebhookResponse envelope) throws IOException {
        response.setStatus(HttpServletResponse.SC_OK);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.setCharacterEncoding(StandardCharsets.UTF_8.name());
        objectMapper.writeValue(response.getOutputStream(), envelope);
    }

    private static String pathWithinApplication(HttpServletRequest request) {
        String uri = request.getRequestURI();
        String contextPath = request.getContextPath();
        if (contextPath != null && !contextPath.isEmpty() && uri.startsWith(contextPath)) {
            return uri.substring(contextPath.length());
        }
        return uri;
    }

    private static boolean isBypassed(String path) {
        for (String prefix : BYPASS_PATHS) {
            if (path.equals(prefix) || path.startsWith(prefix + "/")) {
                return true;
            }
        }
        return false;
    }
}
