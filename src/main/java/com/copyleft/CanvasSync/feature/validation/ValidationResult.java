package com.copyleft.CanvasSync.feature.validation;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class ValidationResult<T> {

    private final T value;
    private final Rejection rejection;

    public static <T> ValidationResult<T> valid(T value) {
        return new ValidationResult<>(value, null);
    }

    public static <T> ValidationResult<T> rejected(Rejection rejection) {
        return new ValidationResult<>(null, rejection);
    }

    public boolean isValid() {
        return rejection == null;
    }
}
