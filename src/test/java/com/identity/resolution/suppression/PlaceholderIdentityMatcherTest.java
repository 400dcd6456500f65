package com.identity.resolution.suppression;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlaceholderIdentityMatcherTest {

    private final PlaceholderIdentityMatcher matcher = PlaceholderIdentityMatcher.defaults();

    @ParameterizedTest
    @ValueSource(strings = {"Female (1)", "male", "MALE 2", "Jane Doe", "John Doe (3)", "Victim #4", " minor 12 "})
    @DisplayName("Should recognize placeholder names")
    void placeholders(String rawName) {
        assertTrue(matcher.matches(rawName));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Jeffrey Epstein", "Jane Doerr", "Female Pilot", "Victoria Smith"})
    @DisplayName("Should not match real names")
    void realNames(String rawName) {
        assertFalse(matcher.matches(rawName));
    }

    @Test
    @DisplayName("Custom patterns replace the defaults")
    void customPatterns() {
        PlaceholderIdentityMatcher custom = new PlaceholderIdentityMatcher(List.of("^redacted$"));
        assertTrue(custom.matches("REDACTED"));
        assertFalse(custom.matches("Female (1)"));
        assertFalse(custom.matches(null));
    }
}
