package com.copyleft.CanvasSync.feature.element.dto;

import com.copyleft.CanvasSync.feature.validation.ValidationPatterns;
import com.copyleft.CanvasSync.global.util.SanitizeUtil;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

/**
 * element_operation 에 실려 오는 캔버스 요소. 계약에 없는 속성은 버려진다.
 */
@Getter
@Builder(toBuilder = true)
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class CanvasElementPayload {

    @NotNull(message = "Element ID is required")
    @Size(min = 1, max = 1000, message = "Element ID must be between 1 and 1000 characters")
    @Pattern(regexp = ValidationPatterns.ELEMENT_ID,
            message = "Element ID can only contain letters, numbers, underscores, and hyphens")
    private final String id;

    @NotNull(message = "Element type is required")
    @Pattern(regexp = "^(rect|circle|text|image|line|drawing)$", message = "Invalid element type")
    private final String type;

    @NotNull(message = "X position is required")
    @DecimalMin(value = ValidationPatterns.CANVAS_MIN, message = "X position out of bounds")
    @DecimalMax(value = ValidationPatterns.CANVAS_MAX, message = "X position out of bounds")
    private final Double x;

    @NotNull(message = "Y position is required")
    @DecimalMin(value = ValidationPatterns.CANVAS_MIN, message = "Y position out of bounds")
    @DecimalMax(value = ValidationPatterns.CANVAS_MAX, message = "Y position out of bounds")
    private final Double y;

    @Positive(message = "Width must be positive")
    @DecimalMax(value = ValidationPatterns.CANVAS_MAX, message = "Width exceeds maximum allowed")
    private final Double width;

    @Positive(message = "Height must be positive")
    @DecimalMax(value = ValidationPatterns.CANVAS_MAX, message = "Height exceeds maximum allowed")
    private final Double height;

    @Positive(message = "Radius must be positive")
    @DecimalMax(value = "2000", message = "Radius exceeds maximum allowed")
    private final Double radius;

    @Size(min = 1, max = 500, message = "Text content must be between 1 and 500 characters")
    private final String text;

    @Positive(message = "Font size must be positive")
    @DecimalMax(value = "200", message = "Font size exceeds maximum allowed")
    private final Double fontSize;

    @Size(max = 50, message = "Font family exceeds maximum length")
    @Pattern(regexp = "^[a-zA-Z ,-]+$", message = "Invalid font family")
    private final String fontFamily;

    @Pattern(regexp = "^(normal|bold)$", message = "Invalid font weight")
    private final String fontWeight;

    @Pattern(regexp = "^(transparent|#[0-9A-Fa-f]{6})$",
            message = "Fill color must be a valid hex color or \"transparent\"")
    private final String fill;

    @Pattern(regexp = ValidationPatterns.HEX_COLOR, message = "Stroke color must be a valid hex color")
    private final String stroke;

    @DecimalMin(value = "0", message = "Stroke width must be non-negative")
    @DecimalMax(value = "50", message = "Stroke width exceeds maximum allowed")
    private final Double strokeWidth;

    @DecimalMin(value = "0", message = "Opacity must be between 0 and 1")
    @DecimalMax(value = "1", message = "Opacity must be between 0 and 1")
    private final Double opacity;

    @DecimalMin(value = "-360", message = "Rotation must be between -360 and 360 degrees")
    @DecimalMax(value = "360", message = "Rotation must be between -360 and 360 degrees")
    private final Double rotation;

    @Positive(message = "ScaleX must be positive")
    @DecimalMax(value = "10", message = "ScaleX exceeds maximum allowed")
    private final Double scaleX;

    @Positive(message = "ScaleY must be positive")
    @DecimalMax(value = "10", message = "ScaleY exceeds maximum allowed")
    private final Double scaleY;

    private final Boolean visible;
    private final Boolean locked;

    @Min(value = 0, message = "Z-index must be non-negative")
    @Max(value = 1000, message = "Z-index exceeds maximum allowed")
    @JsonProperty("zIndex")
    private final Integer zIndex;

    @DecimalMin(value = "0", message = "Border radius must be non-negative")
    @DecimalMax(value = "100", message = "Border radius exceeds maximum allowed")
    private final Double borderRadius;

    @Pattern(regexp = "^(cover|contain)$", message = "Invalid fit mode")
    private final String fitMode;

    @Size(max = 1000, message = "Image source exceeds maximum length")
    @Pattern(regexp = "^(https://|data:image/(png|jpeg);base64,).*$",
            message = "Image source must be an https URL or a PNG/JPEG data URL")
    private final String src;

    @Size(max = 10000, message = "Path data exceeds maximum length")
    private final String pathData;

    @Pattern(regexp = "^(pencil|pen)$", message = "Invalid drawing tool")
    private final String tool;

    // getZIndex 의 기본 프로퍼티 이름은 zindex 라서 필드와 같은 이름으로 묶어 준다
    @JsonProperty("zIndex")
    public Integer getZIndex() {
        return zIndex;
    }

    public CanvasElementPayload sanitized() {
        return toBuilder()
                .text(SanitizeUtil.stripTags(text))
                .fontFamily(SanitizeUtil.stripTags(fontFamily))
                .build();
    }
}
