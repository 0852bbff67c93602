package com.copyleft.CanvasSync.feature.element.dto;

import com.copyleft.CanvasSync.domain.type.OperationType;
import com.copyleft.CanvasSync.feature.validation.EventPayload;
import com.copyleft.CanvasSync.feature.validation.ValidationPatterns;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

import java.util.Locale;
import java.util.Map;

@Getter
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class ElementOperationRequest implements EventPayload<ElementOperationRequest> {

    @NotNull(message = "Operation type is required")
    @Pattern(regexp = ValidationPatterns.OPERATION_TYPE, message = "Invalid operation type")
    private final String type;

    @NotNull(message = "Design ID is required")
    @Pattern(regexp = ValidationPatterns.DESIGN_ID, message = "Invalid design ID format")
    private final String designId;

    @NotNull(message = "Element ID is required")
    @Size(min = 1, max = 1000, message = "Element ID must be between 1 and 1000 characters")
    @Pattern(regexp = ValidationPatterns.ELEMENT_ID,
            message = "Element ID can only contain letters, numbers, underscores, and hyphens")
    private final String elementId;

    @Valid
    private final CanvasElementPayload element;

    @Size(max = 50, message = "Too many update fields")
    private final Map<String, Object> updates;

    @Positive(message = "Version must be a positive integer")
    private final Long version;

    @Override
    public ElementOperationRequest sanitized() {
        return toBuilder()
                .type(OperationType.fromCode(type).map(OperationType::getCode).orElse(type))
                .designId(designId.toLowerCase(Locale.ROOT))
                .element(element != null ? element.sanitized() : null)
                .build();
    }
}
