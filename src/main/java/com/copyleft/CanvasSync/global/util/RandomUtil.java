package com.copyleft.CanvasSync.global.util;

import java.security.SecureRandom;

public class RandomUtil {

    private static final SecureRandom random = new SecureRandom();
    private static final String BASE36 = "abcdefghijklmnopqrstuvwxyz0123456789";

    /**
     * user_{epochMillis}_{9자리 소문자/숫자} 형식의 멤버 ID
     */
    public static String generateMemberId(long epochMillis) {
        StringBuilder sb = new StringBuilder("user_").append(epochMillis).append('_');
        for (int i = 0; i < 9; i++) {
            sb.append(BASE36.charAt(random.nextInt(BASE36.length())));
        }
        return sb.toString();
    }
}
