package com.microtrader.performance;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.microtrader.config.TradingSettings;
import com.microtrader.domain.model.ClosedTrade;
import com.microtrader.domain.model.PerformanceSnapshot;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Writes the journal as JSON Lines: one {@link JournalEntry} per line, appended in call order.
 *
 * <p>Writes are synchronized so concurrent trade and snapshot appends never interleave within a
 * line. The parent directory is created on first write.
 */
@Component
public class JsonLinesTradeJournal implements TradeJournal {

    private static final Logger log = LoggerFactory.getLogger(JsonLinesTradeJournal.class);

    private final Path journalPath;
    private final ObjectMapper objectMapper;

    public JsonLinesTradeJournal(TradingSettings tradingSettings) {
        this.journalPath = tradingSettings.getJournalPath();
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @Override
    public void appendTrade(ClosedTrade trade) {
        append(JournalEntry.of(trade));
    }

    @Override
    public void appendSnapshot(PerformanceSnapshot snapshot) {
        append(JournalEntry.of(snapshot));
    }

    public Path getJournalPath() {
        return journalPath;
    }

    private synchronized void append(JournalEntry entry) {
        try {
            Path parent = journalPath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String line = objectMapper.writeValueAsString(entry);
            try (BufferedWriter writer = Files.newBufferedWriter(
                    journalPath,
                    StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE,
                    StandardOpenOption.APPEND)) {
                writer.write(line);
                writer.newLine();
            }
        } catch (IOException e) {
            log.error("Failed to append {} to journal {}: {}", entry.getType(), journalPath, e.getMessage());
        }
    }
}
