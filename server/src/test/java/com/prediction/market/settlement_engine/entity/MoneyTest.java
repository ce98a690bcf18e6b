package com.prediction.market.settlement_engine.entity;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.math.BigDecimal;

import org.junit.jupiter.api.Test;

class MoneyTest {

    @Test
    void holdsCentsAndComparesByValue() {
        assertThat(Money.of("1.5")).isEqualTo(Money.of("1.50"));
        assertThat(Money.of("1.5").toBigDecimal().scale()).isEqualTo(2);
        assertThat(Money.of("0.125").toString()).isEqualTo("0.12");
    }

    @Test
    void detectsSubCentInput() {
        assertThat(Money.isExact(new BigDecimal("10.10"))).isTrue();
        assertThat(Money.isExact(new BigDecimal("10.100"))).isTrue();
        assertThat(Money.isExact(new BigDecimal("10.101"))).isFalse();
    }

    @Test
    void rejectsGarbage() {
        assertThatThrownBy(() -> Money.of("ten")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Money.of((BigDecimal) null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Money.of(1).divide(BigDecimal.ZERO)).isInstanceOf(ArithmeticException.class);
    }

    @Test
    void sideParsingIsCaseInsensitive() {
        assertThat(Side.fromString("yes")).isEqualTo(Side.YES);
        assertThat(Side.fromString(" No ")).isEqualTo(Side.NO);
        assertThat(Side.fromString("")).isNull();
        assertThatThrownBy(() -> Side.fromString("maybe")).isInstanceOf(IllegalArgumentException.class);
    }
}
