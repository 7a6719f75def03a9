package com.kotsin.ledger.service;

import com.kotsin.ledger.model.LedgerCurrency;
import com.kotsin.ledger.model.WriteResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ReplyFormatterTest {

    private static WriteResult result(String title, LedgerCurrency currency) {
        return WriteResult.builder()
                .spreadsheetTitle(title)
                .currency(currency)
                .avgPrice(1234.5)
                .currentPrice(1300)
                .zoneATarget(1234.5)
                .zoneBTarget(1357.95)
                .sellTarget(1358)
                .sellQtyCurrentRound(17)
                .build();
    }

    @Test
    @DisplayName("Fill reply formats money in the ledger currency")
    void testFillReply() {
        String usd = ReplyFormatter.fillReply(result("TQQQ 무한매수", LedgerCurrency.USD));

        assertTrue(usd.startsWith("구글스프레드시트(TQQQ 무한매수) 기입 완료\n"));
        assertTrue(usd.contains("현재 평단가 : $1,234.50"));
        assertTrue(usd.contains("LOC 큰수 : $1,357.95"));
        assertTrue(usd.contains("매도 지정가 : $1,358.00"));
        assertTrue(usd.endsWith("매도 수량 : 17.0"));

        String krw = ReplyFormatter.fillReply(result("BTC 무한매수", LedgerCurrency.KRW));
        assertTrue(krw.contains("현재 주가 : ₩1,300.00"));
    }

    @Test
    @DisplayName("Small quantities are printed as plain decimals")
    void testSmallQuantity() {
        WriteResult btc = WriteResult.builder()
                .spreadsheetTitle("BTC 무한매수")
                .currency(LedgerCurrency.KRW)
                .sellQtyCurrentRound(0.000714)
                .build();

        assertTrue(ReplyFormatter.fillReply(btc).endsWith("매도 수량 : 0.000714"));
        assertEquals("0.00000012", ReplyFormatter.quantity(1.2e-7));
        assertEquals("0.0", ReplyFormatter.quantity(0));
        assertEquals("2.5", ReplyFormatter.quantity(2.50));
    }

    @Test
    @DisplayName("Currency falls back to the spreadsheet title")
    void testCurrencyFromTitle() {
        assertTrue(ReplyFormatter.fillReply(result("비트코인 장부", null)).contains("₩1,234.50"));
        assertTrue(ReplyFormatter.fillReply(result("SOXL", null)).contains("$1,234.50"));
    }

    @Test
    @DisplayName("Sync reply carries counts and the last summary when something was written")
    void testSyncReply() {
        String none = ReplyFormatter.syncReply(new SyncOutcome(3, 0, null));
        assertEquals("업비트 기록 수행 완료\n- 처리 체결 수: 3\n- 시트 기입 수: 0", none);

        String some = ReplyFormatter.syncReply(new SyncOutcome(3, 1, result("BTC 무한매수", LedgerCurrency.KRW)));
        assertTrue(some.startsWith("업비트 기록 수행 완료\n- 처리 체결 수: 3\n- 시트 기입 수: 1\n\n구글스프레드시트(BTC 무한매수)"));
    }

    @Test
    @DisplayName("Currency is chosen by symbol")
    void testCurrencyBySymbol() {
        assertEquals(LedgerCurrency.KRW, LedgerCurrency.fromSymbol("btc"));
        assertEquals(LedgerCurrency.USD, LedgerCurrency.fromSymbol("TQQQ"));
        assertEquals(LedgerCurrency.USD, LedgerCurrency.fromSpreadsheetTitle("TQQQ BTC 비교"));
    }
}
