package io.atprose.types;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

@DisplayName("LanguageTag")
class LanguageTagTest {

    @ParameterizedTest
    @CsvSource({
        "en, en",
        "EN-us, en-US",
        "pt-BR, pt-BR",
        "zh-hant-tw, zh-Hant-TW",
        "es-419, es-419",
        "de-CH-1901, de-CH-1901",
        "zh-yue-HK, zh-yue-HK",
        "en-a-bbb-x-a-ccc, en-a-bbb-x-a-ccc",
        "x-private, x-private",
        "en-X-Foo, en-x-foo"
    })
    @DisplayName("accepts and canonicalizes valid tags")
    void canonicalizes(String raw, String canonical) {
        assertThat(LanguageTag.parse(raw).toString()).isEqualTo(canonical);
    }

    static Stream<Arguments> invalidTags() {
        return Stream.of(
                Arguments.of("english", FormatError.LANGUAGE_BAD_PRIMARY_SUBTAG),
                Arguments.of("e", FormatError.LANGUAGE_BAD_PRIMARY_SUBTAG),
                Arguments.of("123", FormatError.LANGUAGE_BAD_PRIMARY_SUBTAG),
                Arguments.of("", FormatError.LANGUAGE_MALFORMED),
                Arguments.of("en--US", FormatError.LANGUAGE_MALFORMED),
                Arguments.of("en_US", FormatError.LANGUAGE_MALFORMED),
                Arguments.of("en-a", FormatError.LANGUAGE_MALFORMED),
                Arguments.of("en-x", FormatError.LANGUAGE_MALFORMED),
                Arguments.of("de-1901-1901", FormatError.LANGUAGE_DUPLICATE_SUBTAG),
                Arguments.of("en-a-bbb-a-ccc", FormatError.LANGUAGE_DUPLICATE_SUBTAG));
    }

    @ParameterizedTest
    @MethodSource("invalidTags")
    @DisplayName("rejects invalid tags with the specific rule")
    void rejectsInvalid(String raw, FormatError expected) {
        assertThatThrownBy(() -> LanguageTag.parse(raw))
                .isInstanceOf(InvalidFormatException.class)
                .extracting(e -> ((InvalidFormatException) e).error())
                .isEqualTo(expected);
    }

    @Test
    @DisplayName("exposes language, script and region")
    void exposesSubtags() {
        LanguageTag tag = LanguageTag.parse("zh-Hant-TW");

        assertThat(tag.language()).contains("zh");
        assertThat(tag.script()).contains("Hant");
        assertThat(tag.region()).contains("TW");
        assertThat(LanguageTag.parse("x-private").language()).isEmpty();
    }
}
