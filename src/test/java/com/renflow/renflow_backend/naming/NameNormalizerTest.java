package com.renflow.renflow_backend.naming;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NameNormalizerTest {

    @Test
    void separatorsBecomeUnderscores() {
        assertThat(NameNormalizer.normalize("Jane Doe")).isEqualTo("Jane_Doe");
        assertThat(NameNormalizer.normalize("jane-doe")).isEqualTo("jane_doe");
        assertThat(NameNormalizer.normalize("  a  -  b ")).isEqualTo("a_b");
    }

    @Test
    void punctuationIsDroppedAndUnderscoresCollapsed() {
        assertThat(NameNormalizer.normalize("hello, world!")).isEqualTo("hello_world");
        assertThat(NameNormalizer.normalize("a__b")).isEqualTo("a_b");
        assertThat(NameNormalizer.normalize("_x_")).isEqualTo("x");
    }

    @Test
    void nonAsciiLettersSurvive() {
        assertThat(NameNormalizer.normalize("Zoë Ünal")).isEqualTo("Zoë_Ünal");
    }

    @Test
    void leadingDigitAndEmptyResultArePrefixed() {
        assertThat(NameNormalizer.normalize("1st mate")).isEqualTo("id_1st_mate");
        assertThat(NameNormalizer.normalize("!!!")).isEqualTo("id");
        assertThat(NameNormalizer.normalize("")).isEqualTo("id");
        assertThat(NameNormalizer.normalize(null)).isEqualTo("id");
    }

    @Test
    void normalizingTwiceChangesNothing() {
        List<String> names = List.of("Jane Doe", "1st mate", "!!!", "-1", "bg room", "Zoë", "a - b", "x_", "id_7");

        for (String name : names) {
            String once = NameNormalizer.normalize(name);
            assertThat(NameNormalizer.normalize(once)).as(name).isEqualTo(once);
        }
    }
}
