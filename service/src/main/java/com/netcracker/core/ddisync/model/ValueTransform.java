package com.netcracker.core.ddisync.model;

import java.util.Locale;

public enum ValueTransform {
    NONE {
        @Override
        public String apply(String value) {
            return value;
        }
    },
    UPPERCASE {
        @Override
        public String apply(String value) {
            return value.toUpperCase(Locale.ROOT);
        }
    },
    LOWERCASE {
        @Override
        public String apply(String value) {
            return value.toLowerCase(Locale.ROOT);
        }
    },
    CAPITALIZE {
        @Override
        public String apply(String value) {
            if (value.isEmpty()) {
                return value;
            }
            return value.substring(0, 1).toUpperCase(Locale.ROOT) + value.substring(1).toLowerCase(Locale.ROOT);
        }
    };

    public abstract String apply(String value);
}
