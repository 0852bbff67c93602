package com.copyleft.CanvasSync.feature.session.dto;

import com.copyleft.CanvasSync.feature.validation.EventPayload;
import com.copyleft.CanvasSync.feature.validation.ValidationPatterns;
import com.copyleft.CanvasSync.global.util.SanitizeUtil;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.jackson.Jacksonized;

import java.util.Locale;

@Getter
@Builder(toBuilder = true)
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class JoinDesignRequest implements EventPayload<JoinDesignRequest> {

    @NotNull(message = "Design ID is required")
    @Pattern(regexp = ValidationPatterns.DESIGN_ID, message = "Invalid design ID format")
    private final String designId;

    @Size(min = 1, max = 50, message = "Username must be between 1 and 50 characters")
    @Pattern(regexp = ValidationPatterns.DISPLAY_NAME,
            message = "Username can only contain letters, numbers, underscores, and hyphens")
    private final String userName; // 없으면 기본 이름 사용

    @Override
    public JoinDesignRequest sanitized() {
        return toBuilder()
                .designId(designId.toLowerCase(Locale.ROOT))
                .userName(SanitizeUtil.stripTags(userName))
                .build();
    }
}
