package com.kuyan.adapter.in.web.report;

import com.kuyan.domain.model.AccountValuation;
import com.kuyan.domain.model.Balance;
import com.kuyan.domain.model.CurrencyPair;
import com.kuyan.domain.model.GrowthSeries;
import com.kuyan.domain.model.NetWorthTotal;
import com.kuyan.domain.model.SeriesPoint;
import com.kuyan.domain.model.RateMap;
import com.kuyan.domain.model.Snapshot;
import com.kuyan.domain.model.SnapshotDetail;
import com.kuyan.domain.model.TimeSeries;
import com.kuyan.domain.model.YearOverYear;
import io.vertx.core.json.JsonArray;
import io.vertx.core.json.JsonObject;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Month;
import java.time.Year;
import java.time.YearMonth;
import java.time.format.TextStyle;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.SortedMap;

/**
 * JSON rendering of report results.
 * Amounts are rounded to 2 decimals here, the engine keeps full precision.
 */
public final class ReportJson {

    private ReportJson() {
    }

    public static JsonObject netWorth(Map<String, NetWorthTotal> totals) {
        JsonArray items = new JsonArray();
        totals.values().forEach(total -> items.add(total(total)));
        return new JsonObject().put("netWorth", items);
    }

    public static JsonObject total(NetWorthTotal total) {
        JsonObject json = new JsonObject()
                .put("currency", total.getCurrency())
                .put("amount", money(total.getAmount()));
        if (total.isDegraded()) {
            json.put("unconverted", pairs(total.getMisses()));
        }
        return json;
    }

    public static JsonObject breakdown(String currency, List<AccountValuation> lines) {
        JsonArray accounts = new JsonArray();
        BigDecimal sum = BigDecimal.ZERO;
        for (AccountValuation line : lines) {
            accounts.add(new JsonObject()
                    .put("accountId", line.getAccountId())
                    .put("accountName", line.getAccountName())
                    .put("owner", line.getOwner())
                    .put("accountType", line.getAccountType())
                    .put("nativeCurrency", line.getNativeCurrency())
                    .put("nativeAmount", money(line.getNativeAmount()))
                    .put("convertedAmount", money(line.getConvertedAmount()))
                    .put("conversion", line.getPath().name()));
            sum = sum.add(line.getConvertedAmount());
        }
        return new JsonObject()
                .put("currency", currency)
                .put("accounts", accounts)
                .put("total", money(sum));
    }

    public static JsonObject history(String currency, TimeSeries<BigDecimal> series) {
        JsonArray points = new JsonArray();
        for (SeriesPoint<BigDecimal> point : series.points()) {
            points.add(new JsonObject()
                    .put("date", point.date().toString())
                    .put("label", point.periodLabel())
                    .put("netWorth", money(point.value())));
        }
        return new JsonObject()
                .put("currency", currency)
                .put("points", points);
    }

    public static JsonObject growth(GrowthSeries growth) {
        JsonArray points = new JsonArray();
        for (SeriesPoint<Map<String, BigDecimal>> point : growth.getPercentages().points()) {
            JsonObject values = new JsonObject();
            point.value().forEach((currency, pct) -> values.put(currency, pct.setScale(2, RoundingMode.HALF_UP)));
            points.add(new JsonObject()
                    .put("date", point.date().toString())
                    .put("label", point.periodLabel())
                    .put("growth", values));
        }
        return new JsonObject()
                .put("baseline", growth.getBaselineDate() != null ? growth.getBaselineDate().toString() : null)
                .put("points", points)
                .put("zeroBaseline", new JsonArray(List.copyOf(growth.getZeroBaselineCurrencies())));
    }

    public static JsonObject yearOverYear(YearOverYear yoy) {
        JsonObject years = new JsonObject();
        for (Map.Entry<Year, SortedMap<Month, BigDecimal>> year : yoy.asMap().entrySet()) {
            JsonObject months = new JsonObject();
            year.getValue().forEach((month, amount) ->
                    months.put(month.getDisplayName(TextStyle.SHORT, Locale.ENGLISH).toUpperCase(Locale.ENGLISH), money(amount)));
            years.put(year.getKey().toString(), months);
        }
        return new JsonObject()
                .put("currency", yoy.getCurrency())
                .put("years", years);
    }

    public static JsonObject snapshot(Snapshot snapshot) {
        JsonArray balances = new JsonArray();
        for (Balance balance : snapshot.getBalances()) {
            balances.add(new JsonObject()
                    .put("accountId", balance.getAccountId())
                    .put("currency", balance.getCurrency())
                    .put("amount", money(balance.getAmount())));
        }
        return new JsonObject()
                .put("status", "success")
                .put("snapshotDate", snapshot.getSnapshotDate().toString())
                .put("balances", balances)
                .put("rates", pairRates(snapshot.getRates()));
    }

    public static JsonObject months(List<YearMonth> months) {
        JsonArray items = new JsonArray();
        months.forEach(month -> items.add(new JsonObject()
                .put("month", month.toString())
                .put("label", SeriesPoint.labelOf(month.atDay(1)))));
        return new JsonObject().put("months", items);
    }

    public static JsonObject snapshotDetail(SnapshotDetail detail) {
        JsonObject json = breakdown(detail.getTotal().getCurrency(), detail.getAccounts())
                .put("snapshotDate", detail.getSnapshotDate().toString())
                .put("rates", pairRates(detail.getRates()));
        if (detail.getTotal().isDegraded()) {
            json.put("unconverted", pairs(detail.getTotal().getMisses()));
        }
        return json;
    }

    /**
     * Cross-rate table; self pairs are left out
     */
    public static JsonObject rateTable(RateMap rates, List<String> currencies) {
        JsonObject table = new JsonObject();
        rates.asMap().forEach((pair, rate) -> {
            if (!pair.from().equals(pair.to())) {
                table.put(pair.toString(), rate);
            }
        });
        return new JsonObject()
                .put("date", rates.getAsOfDate() != null ? rates.getAsOfDate().toString() : "latest")
                .put("currencies", new JsonArray(List.copyOf(currencies)))
                .put("rates", table);
    }

    private static JsonObject pairRates(RateMap rates) {
        JsonObject json = new JsonObject();
        rates.asMap().forEach((pair, rate) -> json.put(pair.toString(), rate));
        return json;
    }

    private static JsonArray pairs(List<CurrencyPair> pairs) {
        JsonArray array = new JsonArray();
        pairs.forEach(pair -> array.add(pair.toString()));
        return array;
    }

    private static BigDecimal money(BigDecimal amount) {
        return amount.setScale(2, RoundingMode.HALF_UP);
    }
}
