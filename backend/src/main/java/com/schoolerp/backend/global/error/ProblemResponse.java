package com.schoolerp.backend.global.error;

import java.util.Locale;

import org.springframework.http.HttpStatus;

public record ProblemResponse(String type, String title, int status, String detail, String instance, String code) {

    private static final String TYPE_URN = "urn:problem:schoolerp:";

    public static ProblemResponse of(HttpStatus status, String code, String detail, String instance) {
        String resolvedCode = hasText(code) ? code : status.name();
        return new ProblemResponse(
                TYPE_URN + resolvedCode.toLowerCase(Locale.ROOT).replace('_', '-'),
                status.getReasonPhrase(),
                status.value(),
                hasText(detail) ? detail : status.getReasonPhrase(),
                instance,
                resolvedCode
        );
    }

    public static ProblemResponse of(ProblemException ex, String instance) {
        return of(HttpStatus.valueOf(ex.getStatusCode().value()), ex.getCode(), ex.getDetailMessage(), instance);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
