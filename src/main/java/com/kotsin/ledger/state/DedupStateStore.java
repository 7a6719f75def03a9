package com.kotsin.ledger.state;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.kotsin.ledger.config.LedgerProps;
import com.kotsin.ledger.error.TransportException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.function.Consumer;

/**
 * Loads {@link DedupState} once at start-up and writes it back as pretty-printed JSON.
 * A missing or unreadable file yields an empty state.
 * <p>
 * The scheduler and request threads share one state; every change goes through
 * {@link #update(Consumer)}, which holds the same monitor as {@link #save()}.
 */
@Component
@Slf4j
public class DedupStateStore {

    private final Path path;
    private final ObjectMapper mapper;
    private final boolean existedAtStartup;
    private final DedupState state;

    @Autowired
    public DedupStateStore(LedgerProps props, ObjectMapper mapper) {
        this(Path.of(props.stateFile()), mapper);
    }

    public DedupStateStore(Path path, ObjectMapper mapper) {
        this.path = path;
        this.mapper = mapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.existedAtStartup = Files.exists(path);
        this.state = load();
        log.info("state_loaded path={} existed={} last_update_id={} seen={}",
                path, existedAtStartup, state.getLastUpdateId(), state.getProcessedUpbitFillIds().size());
    }

    public DedupState current() {
        return state;
    }

    public boolean existedAtStartup() {
        return existedAtStartup;
    }

    public synchronized void update(Consumer<DedupState> change) {
        change.accept(state);
    }

    public synchronized void save() {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = path.resolveSibling(path.getFileName() + ".tmp");
            Files.writeString(tmp, mapper.writeValueAsString(state));
            Files.move(tmp, path, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new TransportException("cannot write state file " + path, e);
        }
    }

    private DedupState load() {
        if (!existedAtStartup) {
            return new DedupState();
        }
        try {
            DedupState loaded = mapper.readValue(Files.readString(path), DedupState.class);
            if (loaded == null) {
                return new DedupState();
            }
            if (loaded.getProcessedUpbitFillIds() == null) {
                loaded.setProcessedUpbitFillIds(new ArrayList<>());
            }
            return loaded;
        } catch (IOException e) {
            log.warn("state_reset path={} reason={}", path, e.toString());
            return new DedupState();
        }
    }
}
