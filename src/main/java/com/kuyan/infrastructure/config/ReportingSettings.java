package com.kuyan.infrastructure.config;

import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Reporting configuration: enabled currencies in display order, the default reporting
 * currency and the intermediary used for triangulated conversions
 */
@Value
@Builder
public class ReportingSettings {

    public static final int MAX_CURRENCIES = 9;
    public static final String DEFAULT_INTERMEDIARY = "USD";

    private static final Pattern CURRENCY_CODE = Pattern.compile("^[A-Z]{3}$");

    @Singular
    List<String> currencies;
    String defaultCurrency;
    @Builder.Default
    String intermediaryCurrency = DEFAULT_INTERMEDIARY;

    /**
     * Read the "reporting" section of the application config
     */
    public static ReportingSettings fromConfig(JsonObject config) {
        JsonObject reporting = config.getJsonObject("reporting");
        if (reporting == null) {
            throw new IllegalArgumentException("reporting configuration not found");
        }

        JsonArray codes = reporting.getJsonArray("currencies", new JsonArray());
        List<String> currencies = new ArrayList<>();
        for (int i = 0; i < codes.size(); i++) {
            currencies.add(normalize(codes.getString(i)));
        }

        ReportingSettings settings = ReportingSettings.builder()
                .currencies(currencies)
                .defaultCurrency(normalize(reporting.getString("default-currency")))
                .intermediaryCurrency(normalize(reporting.getString("intermediary-currency", DEFAULT_INTERMEDIARY)))
                .build();
        settings.validate();
        return settings;
    }

    /**
     * @throws IllegalArgumentException listing every problem found
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (currencies.isEmpty()) {
            errors.add("reporting.currencies must list at least one currency");
        }
        if (currencies.size() > MAX_CURRENCIES) {
            errors.add("reporting.currencies supports at most " + MAX_CURRENCIES + " currencies");
        }
        if (new LinkedHashSet<>(currencies).size() != currencies.size()) {
            errors.add("reporting.currencies must not contain duplicates");
        }
        for (String code : currencies) {
            if (!isValidCode(code)) {
                errors.add("reporting.currencies contains invalid code " + code);
            }
        }
        if (defaultCurrency == null) {
            errors.add("reporting.default-currency is required");
        } else if (!currencies.contains(defaultCurrency)) {
            errors.add("reporting.default-currency " + defaultCurrency + " is not an enabled currency");
        }
        if (!isValidCode(intermediaryCurrency)) {
            errors.add("reporting.intermediary-currency must be a 3-letter code");
        }

        if (!errors.isEmpty()) {
            throw new IllegalArgumentException("Invalid reporting configuration: " + String.join("; ", errors));
        }
    }

    public boolean isEnabled(String currency) {
        return currency != null && currencies.contains(currency);
    }

    /**
     * Resolve a requested reporting currency, falling back to the configured default
     */
    public String resolveCurrency(String requested) {
        if (requested == null || requested.isBlank()) {
            return defaultCurrency;
        }
        String code = normalize(requested);
        if (!isEnabled(code)) {
            throw new IllegalArgumentException("Currency " + requested + " is not enabled");
        }
        return code;
    }

    public static boolean isValidCode(String code) {
        return code != null && CURRENCY_CODE.matcher(code).matches();
    }

    private static String normalize(String code) {
        return code == null ? null : code.trim().toUpperCase(Locale.ROOT);
    }
}
