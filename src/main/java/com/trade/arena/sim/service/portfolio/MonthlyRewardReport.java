package com.trade.arena.sim.service.portfolio;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;

/**
 * Monthly reward run. {@code executed=false} when the month was already paid out.
 */
public record MonthlyRewardReport(YearMonth month,
                                  boolean executed,
                                  int rewarded,
                                  int skipped,
                                  BigDecimal totalPaid,
                                  List<String> failures) {
}
