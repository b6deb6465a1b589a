package com.adrelay.pricing;

import com.adrelay.pricing.config.PricingProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Deterministic pricing: cadence grows by one post every 2.5 days of duration, discount grows linearly
 * with duration up to a ceiling, cost is floored at the base rate. No I/O, no clock.
 */
@Component
@RequiredArgsConstructor
public class PricingEngine {

    private static final int MINUTES_PER_DAY = 24 * 60;
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final PricingProperties properties;

    /**
     * @throws PricingException INVALID_DURATION outside the configured range; INVALID_CHANNEL_COUNT below 1
     */
    public PricingQuote quote(int durationDays, int channelCount) {
        if (durationDays < properties.getMinDurationDays() || durationDays > properties.getMaxDurationDays()) {
            throw new PricingException(PricingException.INVALID_DURATION,
                    "Duration must be between " + properties.getMinDurationDays() + " and "
                            + properties.getMaxDurationDays() + " days, got " + durationDays);
        }
        if (channelCount < 1) {
            throw new PricingException(PricingException.INVALID_CHANNEL_COUNT,
                    "At least one channel required, got " + channelCount);
        }
        int postsPerDay = postsPerDay(durationDays);
        BigDecimal discount = discountPercent(durationDays);
        BigDecimal baseRate = properties.getBaseRatePerPostPerDay();
        BigDecimal baseCost = baseRate.multiply(BigDecimal.valueOf((long) durationDays * postsPerDay * channelCount));
        BigDecimal discounted = baseCost.multiply(BigDecimal.ONE.subtract(discount.divide(HUNDRED)));
        BigDecimal finalCost = discounted.max(baseRate).setScale(properties.getAmountScale(), RoundingMode.DOWN);
        int totalPosts = durationDays * postsPerDay * channelCount;
        return new PricingQuote(durationDays, channelCount, postsPerDay, discount, baseCost, finalCost,
                scheduleTimes(postsPerDay), totalPosts);
    }

    /**
     * floor(d / 2.5) + 1, clamped to [1, maxPostsPerDay].
     */
    public int postsPerDay(int durationDays) {
        int raw = (durationDays * 2) / 5 + 1;
        return Math.max(1, Math.min(properties.getMaxPostsPerDay(), raw));
    }

    public BigDecimal discountPercent(int durationDays) {
        BigDecimal linear = properties.getDiscountRatePerDay().multiply(BigDecimal.valueOf(durationDays));
        return linear.min(properties.getMaxDiscountPercent());
    }

    /**
     * n marks spaced 24h/n apart from 00:00, truncated to the minute.
     */
    public static List<LocalTime> scheduleTimes(int postsPerDay) {
        if (postsPerDay < 1) {
            throw new IllegalArgumentException("postsPerDay must be >= 1");
        }
        List<LocalTime> times = new ArrayList<>(postsPerDay);
        for (int i = 0; i < postsPerDay; i++) {
            times.add(LocalTime.MIDNIGHT.plusMinutes((long) i * MINUTES_PER_DAY / postsPerDay));
        }
        return List.copyOf(times);
    }
}
