package com.copyleft.CanvasSync.feature.presence;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.List;

/**
 * 레지스트리 락 안에서 만든 브로드캐스트 준비물. 전송은 락 밖에서 한다.
 */
@Getter
@RequiredArgsConstructor
public class Relay<T> {
    private final List<String> recipients; // 보낸 사람을 제외한 같은 방 연결들
    private final T payload;
}
