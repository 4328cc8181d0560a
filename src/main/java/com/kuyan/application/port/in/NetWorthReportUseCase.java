package com.kuyan.application.port.in;

import com.kuyan.domain.model.AccountValuation;
import com.kuyan.domain.model.GrowthSeries;
import com.kuyan.domain.model.NetWorthTotal;
import com.kuyan.domain.model.TimeSeries;
import com.kuyan.domain.model.YearOverYear;
import io.vertx.core.Future;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.Map;

/**
 * Input port for net worth reporting
 * A null or blank currency means the configured default currency
 */
public interface NetWorthReportUseCase {

    /**
     * Net worth of the latest snapshot in every configured currency, in display order
     */
    Future<Map<String, NetWorthTotal>> currentNetWorth();

    /**
     * Per-account values of the latest snapshot
     */
    Future<List<AccountValuation>> breakdown(String currency);

    /**
     * Total net worth per snapshot date
     */
    Future<TimeSeries<BigDecimal>> history(String currency);

    /**
     * Native holdings per currency relative to the baseline month
     * @param baselineMonth Month assigned 100%, null for the oldest snapshot
     */
    Future<GrowthSeries> growth(YearMonth baselineMonth);

    Future<YearOverYear> yearOverYear(String currency);
}
