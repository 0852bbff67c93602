package com.copyleft.CanvasSync.domain;

import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
public class RateWindow {

    private final String key;         // connectionId:eventName
    private int count;
    private final long windowResetAt; // epoch millis

    private RateWindow(String key, long windowResetAt) {
        this.key = key;
        this.count = 1;
        this.windowResetAt = windowResetAt;
    }

    public static RateWindow open(String key, long now, long windowMillis) {
        return new RateWindow(key, now + windowMillis);
    }

    public boolean isExpired(long now) {
        return now > windowResetAt;
    }

    public boolean tryIncrement(int ceiling) {
        if (count >= ceiling) {
            return false;
        }
        count++;
        return true;
    }
}
