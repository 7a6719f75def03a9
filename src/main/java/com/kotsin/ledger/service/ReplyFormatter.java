package com.kotsin.ledger.service;

import com.kotsin.ledger.model.LedgerCurrency;
import com.kotsin.ledger.model.WriteResult;

import java.math.BigDecimal;

/**
 * Reply texts sent back to the notification channel.
 */
public final class ReplyFormatter {

    private ReplyFormatter() {
    }

    public static String fillReply(WriteResult result) {
        LedgerCurrency ccy = result.getCurrency() != null
                ? result.getCurrency()
                : LedgerCurrency.fromSpreadsheetTitle(result.getSpreadsheetTitle());
        return "구글스프레드시트(" + result.getSpreadsheetTitle() + ") 기입 완료\n"
                + "현재 평단가 : " + ccy.format(result.getAvgPrice()) + "\n"
                + "현재 주가 : " + ccy.format(result.getCurrentPrice()) + "\n\n"
                + "오늘 매수 시도액\n"
                + "LOC 평단 : " + ccy.format(result.getZoneATarget()) + "\n"
                + "LOC 큰수 : " + ccy.format(result.getZoneBTarget()) + "\n\n"
                + "오늘 매도 시도액\n"
                + "매도 지정가 : " + ccy.format(result.getSellTarget()) + "\n"
                + "매도 수량 : " + quantity(result.getSellQtyCurrentRound());
    }

    public static String syncReply(SyncOutcome outcome) {
        String head = "업비트 기록 수행 완료\n"
                + "- 처리 체결 수: " + outcome.processed() + "\n"
                + "- 시트 기입 수: " + outcome.written();
        if (outcome.written() == 0 || outcome.lastResult() == null) {
            return head;
        }
        return head + "\n\n" + fillReply(outcome.lastResult());
    }

    /** Plain decimal, never scientific; whole numbers keep one fractional digit. */
    static String quantity(double qty) {
        String plain = BigDecimal.valueOf(qty).stripTrailingZeros().toPlainString();
        return plain.indexOf('.') >= 0 ? plain : plain + ".0";
    }
}
