package com.copyleft.CanvasSync.domain.type;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum MemberColor {
    CORAL("#FF6B6B"),
    TURQUOISE("#4ECDC4"),
    SKY("#45B7D1"),
    SAGE("#96CEB4"),
    CREAM("#FFEAA7"),
    PLUM("#DDA0DD"),
    MINT("#98D8C8"),
    MUSTARD("#F7DC6F"),
    LAVENDER("#BB8FCE"),
    POWDER("#85C1E9");

    private final String code;
}
