package com.copyleft.CanvasSync.feature.validation;

public final class ValidationPatterns {

    public static final String DESIGN_ID = "^[0-9a-fA-F]{24}$";
    public static final String ELEMENT_ID = "^[a-zA-Z0-9_-]+$";
    public static final String DISPLAY_NAME = "^[a-zA-Z0-9_-]+$";
    public static final String OPERATION_TYPE = "^(element_)?(added|updated|deleted|moved|transformed)$";
    public static final String HEX_COLOR = "^#[0-9A-Fa-f]{6}$";

    // 캔버스 좌표 한계 (+-4000)
    public static final String CANVAS_MIN = "-4000";
    public static final String CANVAS_MAX = "4000";

    private ValidationPatterns() {
    }
}
