package com.ableclub.monitor.events.model;

import java.util.Locale;

public enum JobOutcome {
    SUCCESS,
    FAILURE;

    public static JobOutcome fromCode(String code) {
        if (code == null) {
            return null;
        }
        return JobOutcome.valueOf(code.trim().toUpperCase(Locale.ROOT));
    }
}
