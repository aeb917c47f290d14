package com.trade.arena.sim.test.web;

import com.trade.arena.sim.common.Result;
import com.trade.arena.sim.common.constants.ErrorCodes;
import com.trade.arena.sim.common.exception.GlobalExceptionHandler;
import com.trade.arena.sim.enums.TransactionType;
import com.trade.arena.sim.service.trade.TradeReceipt;
import com.trade.arena.sim.service.trade.TradingLedger;
import com.trade.arena.sim.web.TradingController;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.math.BigDecimal;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class TradingControllerTest {

    private TradingLedger ledger;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        ledger = mock(TradingLedger.class);
        mvc = MockMvcBuilders.standaloneSetup(new TradingController(ledger))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    void buyReturnsReceipt() throws Exception {
        when(ledger.executeBuy("u1", "005930", 10, null)).thenReturn(Result.ok(new TradeReceipt("t1", TransactionType.BUY,
                "005930", "Samsung", 10, new BigDecimal("70000"), new BigDecimal("700000"), null,
                new BigDecimal("300000"), 10)));

        mvc.perform(post("/api/trading/buy")
                        .header("X-User-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stockCode\":\"005930\",\"quantity\":10}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.cashAfter").value(300000));
    }

    @Test
    void insufficientFundsIs422() throws Exception {
        when(ledger.executeBuy(anyString(), anyString(), anyLong(), any()))
                .thenReturn(Result.fail(ErrorCodes.INSUFFICIENT_FUNDS, "Insufficient cash"));

        mvc.perform(post("/api/trading/buy")
                        .header("X-User-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stockCode\":\"005930\",\"quantity\":100}"))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.errorCode").value(ErrorCodes.INSUFFICIENT_FUNDS));
    }

    @Test
    void notOwnedIs404() throws Exception {
        when(ledger.executeSell(anyString(), anyString(), anyLong(), any()))
                .thenReturn(Result.fail(ErrorCodes.STOCK_NOT_OWNED, "No holding"));

        mvc.perform(post("/api/trading/sell")
                        .header("X-User-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stockCode\":\"005930\",\"quantity\":1}"))
                .andExpect(status().isNotFound());
    }

    @Test
    void nonPositiveQuantityNeverReachesLedger() throws Exception {
        mvc.perform(post("/api/trading/buy")
                        .header("X-User-Id", "u1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"stockCode\":\"005930\",\"quantity\":0}"))
                .andExpect(status().isBadRequest());

        verify(ledger, never()).executeBuy(anyString(), anyString(), anyLong(), any());
    }
}
