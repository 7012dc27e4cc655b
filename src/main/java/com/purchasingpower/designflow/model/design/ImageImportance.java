package com.purchasingpower.designflow.model.design;

import java.util.Locale;

public record ImageImportance(Priority priority, String hint) {

    public enum Priority {
        CRITICAL,
        HIGH,
        NORMAL;

        public String label() {
            return name().toLowerCase(Locale.ROOT);
        }
    }
}
