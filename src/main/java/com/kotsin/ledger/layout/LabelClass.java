package com.kotsin.ledger.layout;

import java.util.List;

/**
 * Header label classes recognised in a ledger. Each class accepts a small set of
 * alternatives; an alternative matches when every one of its fragments occurs in
 * the normalised cell text.
 */
public enum LabelClass {

    DATE(List.of(
            List.of("날짜"),
            List.of("체결일자"))),

    /** LOC buy at the average price */
    ZONE_A(List.of(
            List.of("loc평단"),
            List.of("loc", "평단"))),

    /** LOC buy at the high price */
    ZONE_B(List.of(
            List.of("loc고가"),
            List.of("loc", "고가"))),

    TOTAL_QTY(List.of(
            List.of("총수량")));

    private final List<List<String>> alternatives;

    LabelClass(List<List<String>> alternatives) {
        this.alternatives = alternatives;
    }

    boolean accepts(String normalized) {
        for (List<String> fragments : alternatives) {
            if (fragments.stream().allMatch(normalized::contains)) {
                return true;
            }
        }
        return false;
    }
}
