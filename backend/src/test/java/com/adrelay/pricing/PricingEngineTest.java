package com.adrelay.pricing;

import com.adrelay.pricing.config.PricingProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PricingEngineTest {

    private PricingEngine engine;

    @BeforeEach
    void setUp() {
        engine = new PricingEngine(new PricingProperties());
    }

    @Test
    @DisplayName("7 days x 2 channels: 3 posts/day, 5.6% discount, 11.49 final, 42 posts")
    void sevenDaysTwoChannels() {
        PricingQuote quote = engine.quote(7, 2);

        assertThat(quote.postsPerDay()).isEqualTo(3);
        assertThat(quote.discountPercent()).isEqualByComparingTo("5.6");
        assertThat(quote.baseCost()).isEqualByComparingTo("12.18");
        assertThat(quote.finalCost()).isEqualByComparingTo("11.49");
        assertThat(quote.finalCost().scale()).isEqualTo(2);
        assertThat(quote.totalPosts()).isEqualTo(42);
        assertThat(quote.scheduleTimes()).containsExactly(LocalTime.of(0, 0), LocalTime.of(8, 0), LocalTime.of(16, 0));
    }

    @Test
    @DisplayName("1 day x 1 channel is floored at the base rate")
    void oneDayHitsFloor() {
        PricingQuote quote = engine.quote(1, 1);

        assertThat(quote.postsPerDay()).isEqualTo(1);
        assertThat(quote.discountPercent()).isEqualByComparingTo("0.8");
        assertThat(quote.finalCost()).isEqualByComparingTo("0.29");
        assertThat(quote.scheduleTimes()).containsExactly(LocalTime.MIDNIGHT);
    }

    @Test
    @DisplayName("30 days: cadence clamped at 12, discount 24%")
    void thirtyDaysClampsCadence() {
        PricingQuote quote = engine.quote(30, 1);

        assertThat(quote.postsPerDay()).isEqualTo(12);
        assertThat(quote.discountPercent()).isEqualByComparingTo("24");
        assertThat(quote.baseCost()).isEqualByComparingTo("104.40");
        assertThat(quote.finalCost()).isEqualByComparingTo("79.34");
    }

    @Test
    @DisplayName("discount is capped at 25%")
    void discountCapped() {
        assertThat(engine.discountPercent(32)).isEqualByComparingTo("25");
        assertThat(engine.discountPercent(365)).isEqualByComparingTo("25");
        assertThat(engine.discountPercent(31)).isEqualByComparingTo("24.8");
    }

    @ParameterizedTest
    @CsvSource({"1,1", "2,1", "3,2", "4,2", "5,3", "7,3", "10,5", "27,11", "28,12", "365,12"})
    void postsPerDay_followsStepFunction(int days, int expected) {
        assertThat(engine.postsPerDay(days)).isEqualTo(expected);
    }

    @Test
    void postsPerDay_neverDecreasesWithDuration() {
        int previous = 0;
        for (int d = 1; d <= 365; d++) {
            int current = engine.postsPerDay(d);
            assertThat(current).isBetween(1, 12).isGreaterThanOrEqualTo(previous);
            previous = current;
        }
    }

    @Test
    void scheduleTimes_truncatedToMinute() {
        assertThat(PricingEngine.scheduleTimes(7)).containsExactly(
                LocalTime.of(0, 0), LocalTime.of(3, 25), LocalTime.of(6, 51), LocalTime.of(10, 17),
                LocalTime.of(13, 42), LocalTime.of(17, 8), LocalTime.of(20, 34));
    }

    @Test
    void quote_isDeterministic() {
        assertThat(engine.quote(12, 3)).isEqualTo(engine.quote(12, 3));
    }

    @ParameterizedTest
    @ValueSource(ints = {0, -1, 366})
    void quote_durationOutOfRange_throwsInvalidDuration(int days) {
        assertThatThrownBy(() -> engine.quote(days, 1))
                .isInstanceOf(PricingException.class)
                .extracting("errorCode").isEqualTo(PricingException.INVALID_DURATION);
    }

    @Test
    void quote_noChannels_throwsInvalidChannelCount() {
        assertThatThrownBy(() -> engine.quote(7, 0))
                .isInstanceOf(PricingException.class)
                .extracting("errorCode").isEqualTo(PricingException.INVALID_CHANNEL_COUNT);
    }

    @Test
    void quote_usesConfiguredBaseRate() {
        PricingProperties properties = new PricingProperties();
        properties.setBaseRatePerPostPerDay(new java.math.BigDecimal("0.50"));
        PricingQuote quote = new PricingEngine(properties).quote(1, 1);
        assertThat(quote.finalCost()).isEqualByComparingTo("0.50");
    }
}
