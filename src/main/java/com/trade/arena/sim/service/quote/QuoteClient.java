package com.trade.arena.sim.service.quote;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.trade.arena.sim.common.constants.KisConstants;
import com.trade.arena.sim.common.exception.ConfigurationException;
import com.trade.arena.sim.common.exception.ExternalProviderException;
import com.trade.arena.sim.core.FastStateStore;
import com.trade.arena.sim.model.kis.KisApiResponse;
import com.trade.arena.sim.model.kis.KisDailyBar;
import com.trade.arena.sim.model.kis.KisPriceOutput;
import com.trade.arena.sim.model.kis.KisTokenResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.math.BigDecimal;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Market-data client for the KIS open API.
 * <p>
 * Owns the access credential and its expiry; refreshes it once the refresh margin is reached.
 * Every quotation request passes the shared {@link RequestThrottle} first. Failures surface as
 * {@link ExternalProviderException}; nothing is retried here.
 */
@Slf4j
@Service
public class QuoteClient {

    private static final DateTimeFormatter KIS_DATE = DateTimeFormatter.BASIC_ISO_DATE;
    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    private final HttpClient http = HttpClient.newBuilder().connectTimeout(DEFAULT_TIMEOUT).build();

    private final String baseUrl;
    private final String appKey;
    private final String appSecret;
    private final Duration refreshMargin;
    private final ObjectMapper mapper;
    private final RequestThrottle throttle;
    private final FastStateStore stateStore;
    private final Clock clock;

    // guarded by this
    private String accessToken;
    private Instant tokenExpiresAt;

    public QuoteClient(@Value("${arena.kis.base-url:}") String baseUrl,
                       @Value("${arena.kis.app-key:}") String appKey,
                       @Value("${arena.kis.app-secret:}") String appSecret,
                       @Value("${arena.quote.token-refresh-margin:PT1H}") Duration refreshMargin,
                       ObjectMapper mapper,
                       RequestThrottle throttle,
                       FastStateStore stateStore,
                       Clock clock) {
        List<String> missing = new ArrayList<>();
        if (isBlank(baseUrl)) missing.add("KIS_API_URL");
        if (isBlank(appKey)) missing.add("KIS_APP_KEY");
        if (isBlank(appSecret)) missing.add("KIS_APP_SECRET");
        if (!missing.isEmpty()) {
            throw new ConfigurationException("Quote provider credentials missing: " + String.join(", ", missing));
        }
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.appKey = appKey;
        this.appSecret = appSecret;
        this.refreshMargin = refreshMargin;
        this.mapper = mapper;
        this.throttle = throttle;
        this.stateStore = stateStore;
        this.clock = clock;
    }

    // -------------------- Quotations --------------------

    public QuoteSnapshot getQuote(String code) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("FID_COND_MRKT_DIV_CODE", KisConstants.MARKET_DIV_STOCK);
        params.put("FID_INPUT_ISCD", code);

        KisApiResponse api = call(KisConstants.INQUIRE_PRICE_PATH, KisConstants.TR_INQUIRE_PRICE, params);
        if (api.getOutput() == null || api.getOutput().isNull()) {
            throw new ExternalProviderException(200, api.getMsgCd(), "Empty quote output for " + code);
        }
        KisPriceOutput out = convert(api.getOutput(), KisPriceOutput.class);
        return new QuoteSnapshot(code,
                number(out.getCurrentPrice()),
                number(out.getOpenPrice()),
                number(out.getHighPrice()),
                number(out.getLowPrice()),
                volume(out.getAccumulatedVolume()));
    }

    /**
     * Daily bars in {@code [from, to]}, oldest first.
     */
    public List<DailyBar> getHistoricalSeries(String code, LocalDate from, LocalDate to) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("FID_COND_MRKT_DIV_CODE", KisConstants.MARKET_DIV_STOCK);
        params.put("FID_INPUT_ISCD", code);
        params.put("FID_INPUT_DATE_1", from.format(KIS_DATE));
        params.put("FID_INPUT_DATE_2", to.format(KIS_DATE));
        params.put("FID_PERIOD_DIV_CODE", KisConstants.PERIOD_DAILY);
        params.put("FID_ORG_ADJ_PRC", KisConstants.ADJUSTED_PRICE);

        KisApiResponse api = call(KisConstants.INQUIRE_DAILY_CHART_PATH, KisConstants.TR_INQUIRE_DAILY_CHART, params);
        JsonNode rows = api.getOutput2();
        if (rows == null || !rows.isArray()) return List.of();

        List<DailyBar> bars = new ArrayList<>(rows.size());
        for (JsonNode row : rows) {
            KisDailyBar raw = convert(row, KisDailyBar.class);
            // KIS pads the array with empty objects on non-trading days
            if (isBlank(raw.getBusinessDate())) continue;
            bars.add(new DailyBar(LocalDate.parse(raw.getBusinessDate(), KIS_DATE),
                    number(raw.getOpenPrice()),
                    number(raw.getHighPrice()),
                    number(raw.getLowPrice()),
                    number(raw.getClosePrice()),
                    volume(raw.getAccumulatedVolume())));
        }
        bars.sort(Comparator.comparing(DailyBar::date));
        return bars;
    }

    // -------------------- Access credential --------------------

    /**
     * Cached token, refreshed once {@code now >= expiresAt - margin}.
     */
    synchronized String accessToken() {
        Instant now = clock.instant();
        if (accessToken == null) {
            restoreToken();
        }
        if (accessToken != null && now.isBefore(tokenExpiresAt.minus(refreshMargin))) {
            return accessToken;
        }
        fetchToken(now);
        return accessToken;
    }

    private void restoreToken() {
        Optional<String> stored = stateStore.get(KisConstants.TOKEN_STATE_KEY);
        if (stored.isEmpty()) return;
        try {
            StoredToken t = mapper.readValue(stored.get(), StoredToken.class);
            this.accessToken = t.token();
            this.tokenExpiresAt = Instant.ofEpochSecond(t.expiresAtEpochSecond());
            log.info("Restored quote provider token (expires {})", tokenExpiresAt);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable stored token: {}", e.getOriginalMessage());
            stateStore.delete(KisConstants.TOKEN_STATE_KEY);
        }
    }

    private void fetchToken(Instant now) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("grant_type", "client_credentials");
        body.put("appkey", appKey);
        body.put("appsecret", appSecret);

        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder(URI.create(baseUrl + KisConstants.TOKEN_PATH))
                    .timeout(DEFAULT_TIMEOUT)
                    .header("content-type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body)))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ExternalProviderException("Token request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalProviderException("Token request interrupted", e);
        }
        if (isNot2xx(resp.statusCode())) throw httpFail("token", resp);

        KisTokenResponse token = read(resp.body(), KisTokenResponse.class);
        if (isBlank(token.getAccessToken())) {
            throw new ExternalProviderException(resp.statusCode(), null, "Token response missing access_token");
        }

        this.accessToken = token.getAccessToken();
        this.tokenExpiresAt = now.plusSeconds(token.getExpiresIn());
        log.info("Obtained quote provider token (expires {})", tokenExpiresAt);

        Duration ttl = Duration.between(now, tokenExpiresAt.minus(refreshMargin));
        if (!ttl.isNegative() && !ttl.isZero()) {
            try {
                String json = mapper.writeValueAsString(new StoredToken(accessToken, tokenExpiresAt.getEpochSecond()));
                stateStore.put(KisConstants.TOKEN_STATE_KEY, json, ttl);
            } catch (JsonProcessingException e) {
                log.warn("Token not persisted: {}", e.getOriginalMessage());
            }
        }
    }

    // -------------------- Helpers --------------------

    private KisApiResponse call(String path, String trId, Map<String, String> params) {
        throttle.acquire();
        String token = accessToken();

        String query = params.entrySet().stream()
                .map(e -> urlEncode(e.getKey()) + "=" + urlEncode(e.getValue()))
                .collect(Collectors.joining("&"));
        HttpRequest req = HttpRequest.newBuilder(URI.create(baseUrl + path + "?" + query))
                .timeout(DEFAULT_TIMEOUT)
                .header("content-type", "application/json")
                .header("authorization", "Bearer " + token)
                .header("appkey", appKey)
                .header("appsecret", appSecret)
                .header("tr_id", trId)
                .header("custtype", KisConstants.CUSTOMER_TYPE)
                .GET()
                .build();

        HttpResponse<String> resp;
        try {
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ExternalProviderException(trId + " request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalProviderException(trId + " request interrupted", e);
        }
        if (isNot2xx(resp.statusCode())) throw httpFail(trId, resp);

        KisApiResponse api = read(resp.body(), KisApiResponse.class);
        if (!api.isOk()) {
            throw new ExternalProviderException(resp.statusCode(), api.getMsgCd(),
                    "[" + api.getMsgCd() + "] " + api.getMsg());
        }
        return api;
    }

    private <T> T read(String body, Class<T> type) {
        try {
            return mapper.readValue(body, type);
        } catch (JsonProcessingException e) {
            throw new ExternalProviderException("Unreadable provider response: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T convert(JsonNode node, Class<T> type) {
        try {
            return mapper.treeToValue(node, type);
        } catch (JsonProcessingException e) {
            throw new ExternalProviderException("Unreadable provider payload: " + e.getOriginalMessage(), e);
        }
    }

    private static ExternalProviderException httpFail(String op, HttpResponse<String> resp) {
        String body = resp.body() == null ? "" : resp.body();
        return new ExternalProviderException(resp.statusCode(), null, "HTTP " + resp.statusCode() + " on " + op + ": " + body);
    }

    private static boolean isNot2xx(int sc) {
        return sc < 200 || sc >= 300;
    }

    private static String urlEncode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static BigDecimal number(String s) {
        return isBlank(s) ? BigDecimal.ZERO : new BigDecimal(s.trim());
    }

    private static long volume(String s) {
        return isBlank(s) ? 0L : Long.parseLong(s.trim());
    }

    record StoredToken(String token, long expiresAtEpochSecond) {
    }
}
