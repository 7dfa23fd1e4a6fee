package com.fintech.webhook.api;

import com.fintech.webhook.api.dto.WebhookResponse;
import com.fintech.webhook.domain.model.PipelineRejection;
import com.fintech.webhook.security.WebhookAdmissionFilter;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Keeps webhook failures inside the envelope contract: HTTP 200, code in the body.
 */
@Slf4j
@RestControllerAdvice(assignableTypes = WebhookController.class)
@RequiredArgsConstructor
public class WebhookExceptionHandler {

    private final ResponseComposer responseComposer;

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<WebhookResponse> handleUnreadable(HttpMessageNotReadableException e,
                                                           HttpServletRequest request) {
        log.warn("Webhook body could not be mapped: {}", e.getMostSpecificCause().getMessage());
        return ResponseEntity.ok(responseComposer.reject(knownBatchId(request), PipelineRejection.MALFORMED_BODY));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<WebhookResponse> handleUnexpected(Exception e, HttpServletRequest request) {
        log.error("Unexpected error while handling webhook", e);
        return ResponseEntity.ok(responseComposer.reject(knownBatchId(request), PipelineRejection.INTERNAL_FAULT));
    }

    private static String knownBatchId(HttpServletRequest request) {
        Object batchId = request.getAttribute(WebhookAdmissionFilter.BATCH_ID_ATTRIBUTE);
        return batchId instanceof String value ? value : null;
    }
}
