package io.smellscan.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SeverityTest {

    @Test
    void isAtLeast_followsDeclarationOrder() {
        assertThat(Severity.DEFECT.isAtLeast(Severity.ERROR)).isTrue();
        assertThat(Severity.ERROR.isAtLeast(Severity.ERROR)).isTrue();
        assertThat(Severity.WARNING.isAtLeast(Severity.ERROR)).isFalse();
        assertThat(Severity.STYLE.isAtLeast(Severity.WARNING)).isFalse();
    }

    @Test
    void parse_isCaseInsensitive() {
        assertThat(Severity.parse("warning")).isEqualTo(Severity.WARNING);
        assertThat(Severity.parse(" Defect ")).isEqualTo(Severity.DEFECT);
    }

    @Test
    void parse_rejectsUnknownNames() {
        assertThatThrownBy(() -> Severity.parse("fatal"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("fatal");
    }
}
