package com.identity.resolution.parser;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InputSanitizerTest {

    @Test
    @DisplayName("Should accept ordinary names")
    void acceptsNames() {
        assertDoesNotThrow(() -> InputSanitizer.validateRawName("Zoë O'Brien-Müller"));
    }

    @Test
    @DisplayName("Should reject blank, oversized and control-character names")
    void rejectsInvalid() {
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateRawName(null));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateRawName("  "));
        assertThrows(IllegalArgumentException.class,
                () -> InputSanitizer.validateRawName("a".repeat(InputSanitizer.MAX_RAW_NAME_LENGTH + 1)));
        assertThrows(IllegalArgumentException.class, () -> InputSanitizer.validateRawName("John\u0000Smith"));
    }
}
