package com.copyleft.CanvasSync.feature.validation;

/**
 * 검증 계약을 가진 수신 페이로드. 검증을 통과한 값은 sanitized() 를 거쳐 핸들러로 간다.
 */
public interface EventPayload<T extends EventPayload<T>> {

    T sanitized();
}
