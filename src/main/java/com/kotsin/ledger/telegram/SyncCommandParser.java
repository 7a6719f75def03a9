package com.kotsin.ledger.telegram;

import com.kotsin.ledger.error.FillParseException;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recognises the exchange sync command: the configured command text, optionally
 * followed by ": YYYY-MM-DD" or ": YY-MM-DD".
 */
@Component
public class SyncCommandParser {

    private final Clock clock;

    public SyncCommandParser(Clock clock) {
        this.clock = clock;
    }

    public Optional<SyncCommand> parse(String text, String commandText) {
        if (text == null || commandText == null || commandText.isBlank()) {
            return Optional.empty();
        }
        Pattern p = Pattern.compile("^\\s*" + Pattern.quote(commandText.strip())
                + "(?:\\s*:\\s*(\\d{2,4}-\\d{2}-\\d{2}))?\\s*$");
        Matcher m = p.matcher(text.strip());
        if (!m.matches()) {
            return Optional.empty();
        }
        String d = m.group(1);
        if (d == null) {
            return Optional.of(new SyncCommand(LocalDate.now(clock), false));
        }
        if (d.indexOf('-') == 2) {
            d = "20" + d;
        }
        try {
            return Optional.of(new SyncCommand(LocalDate.parse(d), true));
        } catch (DateTimeParseException e) {
            throw new FillParseException("invalid sync date: " + m.group(1), e);
        }
    }
}
