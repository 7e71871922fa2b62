package com.worksuite.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BearerTokenExtractor")
class BearerTokenExtractorTest {

    @Test
    @DisplayName("extracts the token after the scheme")
    void extracts() {
        assertThat(BearerTokenExtractor.extract("Bearer abc.def.ghi")).contains("abc.def.ghi");
    }

    @Test
    @DisplayName("matches the scheme case-insensitively and trims whitespace")
    void lenientScheme() {
        assertThat(BearerTokenExtractor.extract("  bearer    abc  ")).contains("abc");
        assertThat(BearerTokenExtractor.extract("BEARER\tabc")).contains("abc");
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"Bearer", "Bearer   ", "Basic dXNlcjpwYXNz", "Bearerabc", "abc"})
    @DisplayName("returns empty for missing, foreign or token-less headers")
    void rejects(String header) {
        assertThat(BearerTokenExtractor.extract(header)).isEmpty();
    }
}
