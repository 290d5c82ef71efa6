package io.smellscan.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DebtTest {

    @Test
    void plus_normalizesIntoHoursAndDays() {
        Debt total = new Debt(0, 23, 55).plus(Debt.TEN_MINS);

        assertThat(total).isEqualTo(new Debt(1, 0, 5));
        assertThat(total.totalMinutes()).isEqualTo(24 * 60 + 5);
    }

    @Test
    void toString_compactForm() {
        assertThat(Debt.ZERO.toString()).isEqualTo("0min");
        assertThat(Debt.TWENTY_MINS.toString()).isEqualTo("20min");
        assertThat(Debt.ofMinutes(60 * 26 + 3).toString()).isEqualTo("1d2h3min");
        assertThat(Debt.ofMinutes(120).toString()).isEqualTo("2h");
    }

    @Test
    void constructor_rejectsUnnormalizedValues() {
        assertThatThrownBy(() -> new Debt(0, 0, 60)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new Debt(-1, 0, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
