package com.aiinpocket.studyquest.model.dto;

import com.aiinpocket.studyquest.model.enums.ValidationMode;

/**
 * 結算選項。expectedDeviceId 為空時只檢查事件之間的裝置是否一致。
 */
public record ProcessOptions(
        ValidationMode mode,
        String expectedDeviceId
) {
    public static ProcessOptions defaults() {
        return new ProcessOptions(ValidationMode.SOFT, null);
    }

    public ProcessOptions {
        if (mode == null) {
            mode = ValidationMode.SOFT;
        }
    }
}
