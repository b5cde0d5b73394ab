package com.deployguard.harness;

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.regex.Pattern;

/**
 * Common value shapes checked by {@link TestSuites#format}.
 */
public enum FieldFormat {
    IDENTIFIER {
        private final Pattern p = Pattern.compile("^[A-Za-z0-9][A-Za-z0-9._:-]*$");

        @Override
        public boolean accepts(Object v) {
            return (v instanceof Number) || (v instanceof String s && p.matcher(s).matches());
        }
    },
    UUID {
        private final Pattern p = Pattern.compile(
                "^[0-9a-fA-F]{8}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{4}-[0-9a-fA-F]{12}$");

        @Override
        public boolean accepts(Object v) {
            return v instanceof String s && p.matcher(s).matches();
        }
    },
    TIMESTAMP {
        @Override
        public boolean accepts(Object v) {
            return v instanceof String s && (parses(DateTimeFormatter.ISO_DATE_TIME, s)
                    || parses(DateTimeFormatter.ISO_DATE, s));
        }
    },
    EMAIL {
        private final Pattern p = Pattern.compile("^[^\\s@]+@[^\\s@]+\\.[^\\s@]+$");

        @Override
        public boolean accepts(Object v) {
            return v instanceof String s && p.matcher(s).matches();
        }
    },
    NUMERIC {
        @Override
        public boolean accepts(Object v) {
            if (v instanceof Number) return true;
            if (!(v instanceof String s) || s.isBlank()) return false;
            try {
                new BigDecimal(s.trim());
                return true;
            } catch (NumberFormatException e) {
                return false;
            }
        }
    };

    public abstract boolean accepts(Object value);

    private static boolean parses(DateTimeFormatter f, String s) {
        try {
            f.parse(s);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }
}
