package com.adrelay.order;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Random;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class ReferenceCodeGeneratorTest {

    @Test
    void next_producesTwoLettersAndFourDigits() {
        ReferenceCodeGenerator generator = new ReferenceCodeGenerator();
        for (int i = 0; i < 500; i++) {
            String code = generator.next();
            assertThat(code).matches("[A-Z]{2}[0-9]{4}");
            assertThat(ReferenceCodeGenerator.isWellFormed(code)).isTrue();
        }
    }

    @Test
    void next_seededRandom_isReproducibleAndVaried() {
        ReferenceCodeGenerator a = new ReferenceCodeGenerator(new Random(42));
        ReferenceCodeGenerator b = new ReferenceCodeGenerator(new Random(42));
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 100; i++) {
            String code = a.next();
            assertThat(b.next()).isEqualTo(code);
            seen.add(code);
        }
        assertThat(seen).hasSizeGreaterThan(90);
    }

    @Test
    void normalize_trimsAndUppercases() {
        assertThat(ReferenceCodeGenerator.normalize("  ab0042 \n")).isEqualTo("AB0042");
        assertThat(ReferenceCodeGenerator.normalize(null)).isNull();
    }

    @Test
    void isWellFormed_rejectsOtherShapes() {
        assertThat(ReferenceCodeGenerator.isWellFormed("A00042")).isFalse();
        assertThat(ReferenceCodeGenerator.isWellFormed("AB042")).isFalse();
        assertThat(ReferenceCodeGenerator.isWellFormed("ab0042")).isFalse();
        assertThat(ReferenceCodeGenerator.isWellFormed("AB0042 thanks")).isFalse();
        assertThat(ReferenceCodeGenerator.isWellFormed(null)).isFalse();
    }
}
