package com.recbench.evaluation.judge;

import java.util.Locale;

public enum JudgeMode {
    EXACT,
    MODEL;

    public static JudgeMode resolve(String mode, JudgeMode fallback) {
        if (mode == null || mode.isBlank()) {
            return fallback;
        }
        switch (mode.trim().toLowerCase(Locale.ROOT)) {
            case "model":
            case "llm":
                return MODEL;
            case "exact":
                return EXACT;
            default:
                return fallback;
        }
    }
}
