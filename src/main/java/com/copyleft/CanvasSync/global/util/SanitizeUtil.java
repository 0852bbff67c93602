package com.copyleft.CanvasSync.global.util;

import org.springframework.util.StringUtils;

import java.util.regex.Pattern;

public class SanitizeUtil {

    private static final Pattern TAG = Pattern.compile("<[^>]*>");
    private static final Pattern DISPLAY_NAME_DISALLOWED = Pattern.compile("[^a-zA-Z0-9_-]");

    private SanitizeUtil() {
    }

    public static String stripTags(String value) {
        if (value == null) {
            return null;
        }
        return TAG.matcher(value).replaceAll("").trim();
    }

    /**
     * 태그 제거 -> 길이 제한 -> 허용 문자만 남김. 남는 게 없으면 fallback 을 같은 규칙으로 정제해 쓴다.
     */
    public static String sanitizeDisplayName(String raw, String fallback, int maxLength) {
        String cleaned = cleanDisplayName(raw, maxLength);
        return cleaned.isEmpty() ? cleanDisplayName(fallback, maxLength) : cleaned;
    }

    private static String cleanDisplayName(String value, int maxLength) {
        String cleaned = stripTags(value);
        if (!StringUtils.hasText(cleaned)) {
            return "";
        }
        if (cleaned.length() > maxLength) {
            cleaned = cleaned.substring(0, maxLength);
        }
        return DISPLAY_NAME_DISALLOWED.matcher(cleaned).replaceAll("");
    }
}
