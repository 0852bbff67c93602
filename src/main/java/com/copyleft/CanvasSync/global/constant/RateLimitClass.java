package com.copyleft.CanvasSync.global.constant;

public enum RateLimitClass {
    PRESENCE,  // 커서, 드래그, 선택
    MUTATION,  // 요소 변경
    DEFAULT
}
