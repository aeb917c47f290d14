package com.trade.arena.sim.common.constants;

/**
 * Korea Investment &amp; Securities open API endpoints and transaction ids.
 */
public interface KisConstants {

    String TOKEN_PATH = "/oauth2/tokenP";

    String INQUIRE_PRICE_PATH = "/uapi/domestic-stock/v1/quotations/inquire-price";

    String INQUIRE_DAILY_CHART_PATH = "/uapi/domestic-stock/v1/quotations/inquire-daily-itemchartprice";

    String TR_INQUIRE_PRICE = "FHKST01010100";

    String TR_INQUIRE_DAILY_CHART = "FHKST03010100";

    // stock market division code (J = KRX equities)
    String MARKET_DIV_STOCK = "J";

    String PERIOD_DAILY = "D";

    // 0 = adjusted prices
    String ADJUSTED_PRICE = "0";

    // P = individual customer
    String CUSTOMER_TYPE = "P";

    String RT_CD_OK = "0";

    String TOKEN_STATE_KEY = "kis:access-token";
}
