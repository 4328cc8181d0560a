package com.kuyan.application.service;

import com.kuyan.domain.model.ConversionPath;
import com.kuyan.domain.model.ConversionResult;
import com.kuyan.domain.model.RateMap;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Optional;

/**
 * Converts amounts between currencies using a single rate map.
 * <p>
 * Resolution order, first match wins:
 * <ol>
 *   <li>same currency - amount returned as is</li>
 *   <li>direct rate (from, to)</li>
 *   <li>inverse rate (to, from), amount divided by it</li>
 *   <li>triangulation through the intermediary currency</li>
 *   <li>miss - amount returned unconverted, flagged on the result</li>
 * </ol>
 * Stateless, safe to share.
 */
@Slf4j
public class ConversionEngine {

    static final MathContext PRECISION = MathContext.DECIMAL128;

    private final String intermediaryCurrency;

    public ConversionEngine(String intermediaryCurrency) {
        if (intermediaryCurrency == null || intermediaryCurrency.isBlank()) {
            throw new IllegalArgumentException("intermediaryCurrency is required");
        }
        this.intermediaryCurrency = intermediaryCurrency;
    }

    public ConversionResult convert(BigDecimal amount, String from, String to, RateMap rates) {
        if (from.equals(to)) {
            return new ConversionResult(amount, from, to, ConversionPath.IDENTITY);
        }

        Optional<BigDecimal> direct = rates.rate(from, to);
        if (direct.isPresent()) {
            return new ConversionResult(amount.multiply(direct.get()), from, to, ConversionPath.DIRECT);
        }

        Optional<BigDecimal> inverse = rates.rate(to, from);
        if (inverse.isPresent()) {
            return new ConversionResult(amount.divide(inverse.get(), PRECISION), from, to, ConversionPath.INVERSE);
        }

        Optional<BigDecimal> toIntermediary = rates.rate(from, intermediaryCurrency);
        Optional<BigDecimal> fromIntermediary = rates.rate(intermediaryCurrency, to);
        if (toIntermediary.isPresent() && fromIntermediary.isPresent()) {
            BigDecimal converted = amount.multiply(toIntermediary.get()).multiply(fromIntermediary.get());
            return new ConversionResult(converted, from, to, ConversionPath.TRIANGULATED);
        }

        log.warn("No conversion rate for {} to {} in rate map as of {}, amount left unconverted",
                from, to, rates.getAsOfDate());
        return new ConversionResult(amount, from, to, ConversionPath.MISS);
    }
}
