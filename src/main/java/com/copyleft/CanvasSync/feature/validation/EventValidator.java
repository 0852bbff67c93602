package com.copyleft.CanvasSync.feature.validation;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.Comparator;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * 수신 페이로드를 계약 클래스(Bean Validation 제약이 붙은 DTO)로 변환하고 검증한다.
 * 실패는 예외가 아니라 {@link Rejection} 으로 돌려준다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EventValidator {

    private final ObjectMapper objectMapper;
    private final Validator validator;

    public <T extends EventPayload<T>> ValidationResult<T> validate(Class<T> contract, JsonNode rawPayload) {
        JsonNode source = isAbsent(rawPayload) ? objectMapper.createObjectNode() : rawPayload;
        if (!source.isObject()) {
            return ValidationResult.rejected(new Rejection("payload", "type", "payload must be a JSON object"));
        }

        T candidate;
        try {
            // 정수 필드에 소수가 오면 잘라내지 않고 거부한다
            candidate = objectMapper.readerFor(contract)
                    .without(DeserializationFeature.ACCEPT_FLOAT_AS_INT)
                    .readValue(source);
        } catch (IOException | IllegalArgumentException e) {
            return ValidationResult.rejected(toRejection(e));
        }
        if (candidate == null) {
            return ValidationResult.rejected(new Rejection("payload", "type", "payload must be a JSON object"));
        }

        Set<ConstraintViolation<T>> violations = validator.validate(candidate);
        if (!violations.isEmpty()) {
            ConstraintViolation<T> first = violations.stream()
                    .min(Comparator.comparing((ConstraintViolation<T> v) -> v.getPropertyPath().toString())
                            .thenComparing(ConstraintViolation::getMessage))
                    .orElseThrow();
            log.debug("검증 실패: contract={}, violations={}", contract.getSimpleName(), violations.size());
            return ValidationResult.rejected(new Rejection(
                    first.getPropertyPath().toString(),
                    first.getConstraintDescriptor().getAnnotation().annotationType().getSimpleName(),
                    first.getMessage()));
        }

        return ValidationResult.valid(candidate.sanitized());
    }

    private boolean isAbsent(JsonNode node) {
        return node == null || node.isNull() || node.isMissingNode();
    }

    private Rejection toRejection(Exception e) {
        if (e instanceof JsonMappingException && !((JsonMappingException) e).getPath().isEmpty()) {
            String field = ((JsonMappingException) e).getPath().stream()
                    .map(ref -> ref.getFieldName() != null ? ref.getFieldName() : String.valueOf(ref.getIndex()))
                    .collect(Collectors.joining("."));
            return new Rejection(field, "type", "has an invalid type");
        }
        return new Rejection("payload", "type", "could not be read");
    }
}
