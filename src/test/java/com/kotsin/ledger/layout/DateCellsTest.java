package com.kotsin.ledger.layout;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class DateCellsTest {

    @ParameterizedTest
    @ValueSource(strings = {"2024-03-05", "2024-3-5", "2024/03/05", "2024.3.5", " 2024-03-05 ", "2024-03-05 14:02:09"})
    @DisplayName("Accepted date formats parse to the same day")
    void testParse(String text) {
        assertEquals(Optional.of(LocalDate.of(2024, 3, 5)), DateCells.parse(text));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "날짜", "03/05", "2024-02-30", "5.3.2024", "61.23"})
    @DisplayName("Anything else is not a date")
    void testNotADate(String text) {
        assertTrue(DateCells.parse(text).isEmpty());
    }

    @Test
    @DisplayName("Dates are written as ISO yyyy-MM-dd")
    void testFormat() {
        assertEquals("2024-03-05", DateCells.format(LocalDate.of(2024, 3, 5)));
        assertTrue(DateCells.parse(null).isEmpty());
    }
}
