package com.di.plumeflux.ledger;

import com.di.plumeflux.exception.TransientIoException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Append-only JSON-lines ledger. Every entry is one line; the file is replayed into an in-memory
 * index when opened. A torn last line (crash mid-write) is skipped with a warning.
 */
@Slf4j
public class JsonLinesUnitLedger implements UnitLedger {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final Path file;
    private final boolean fsync;
    private final Map<String, List<LedgerEntry>> byKey = new ConcurrentSkipListMap<>();
    private final Set<String> consumedFiles = ConcurrentHashMap.newKeySet();
    private FileChannel channel;

    public JsonLinesUnitLedger(Path file, boolean fsync) {
        this.file = file.toAbsolutePath().normalize();
        this.fsync = fsync;
        replay();
        open();
    }

    @Override
    public synchronized void append(LedgerEntry entry) {
        if (channel == null) {
            throw new IllegalStateException("Ledger " + file + " is closed");
        }
        try {
            byte[] line = (MAPPER.writeValueAsString(entry) + "\n").getBytes(StandardCharsets.UTF_8);
            ByteBuffer buffer = ByteBuffer.wrap(line);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            if (fsync) {
                channel.force(false);
            }
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize ledger entry for " + entry.getUnitKey(), e);
        } catch (IOException e) {
            throw new TransientIoException("Ledger write failed for " + entry.getUnitKey(), e);
        }
        index(entry);
        log.debug("[LEDGER] {} -> {}", entry.getUnitKey(), entry.getOutcome());
    }

    @Override
    public Optional<LedgerEntry> latest(String unitKey) {
        List<LedgerEntry> entries = byKey.get(unitKey);
        if (entries == null) {
            return Optional.empty();
        }
        synchronized (entries) {
            return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
        }
    }

    @Override
    public List<LedgerEntry> history(String unitKey) {
        List<LedgerEntry> entries = byKey.get(unitKey);
        if (entries == null) {
            return List.of();
        }
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    @Override
    public Collection<LedgerEntry> latestEntries() {
        List<LedgerEntry> result = new ArrayList<>();
        byKey.keySet().forEach(key -> latest(key).ifPresent(result::add));
        return result;
    }

    @Override
    public boolean isFileConsumed(Path path) {
        return consumedFiles.contains(normalize(path));
    }

    @Override
    public synchronized void close() {
        if (channel == null) {
            return;
        }
        try {
            channel.force(false);
            channel.close();
            log.info("[LEDGER] closed {} ({} units)", file, byKey.size());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot close ledger " + file, e);
        } finally {
            channel = null;
        }
    }

    public Path getFile() {
        return file;
    }

    private void replay() {
        if (!Files.exists(file)) {
            log.info("[LEDGER] starting new ledger at {}", file);
            return;
        }
        List<String> lines;
        try {
            lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read ledger " + file, e);
        }
        int loaded = 0;
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i).trim();
            if (line.isEmpty()) {
                continue;
            }
            try {
                index(MAPPER.readValue(line, LedgerEntry.class));
                loaded++;
            } catch (JsonProcessingException e) {
                log.warn("[LEDGER] skipping unreadable line {} of {}: {}", i + 1, file, e.getOriginalMessage());
            }
        }
        log.info("[LEDGER] replayed {} entries for {} units from {}", loaded, byKey.size(), file);
    }

    private void open() {
        try {
            Path parent = file.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            channel = FileChannel.open(file, StandardOpenOption.CREATE, StandardOpenOption.WRITE,
                    StandardOpenOption.APPEND);
            terminateTornLine();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot open ledger " + file, e);
        }
    }

    /** A crash mid-append can leave a line without its newline; later entries must start on a fresh line. */
    private void terminateTornLine() throws IOException {
        long size = channel.size();
        if (size == 0) {
            return;
        }
        try (FileChannel reader = FileChannel.open(file, StandardOpenOption.READ)) {
            ByteBuffer last = ByteBuffer.allocate(1);
            reader.read(last, size - 1);
            if (last.get(0) != '\n') {
                channel.write(ByteBuffer.wrap(new byte[]{'\n'}));
            }
        }
    }

    private void index(LedgerEntry entry) {
        List<LedgerEntry> entries = byKey.computeIfAbsent(entry.getUnitKey(), k -> new ArrayList<>());
        synchronized (entries) {
            entries.add(entry);
        }
        if (entry.getOutcome() != null && entry.getOutcome().isTerminal() && entry.getFiles() != null) {
            entry.getFiles().forEach(f -> consumedFiles.add(normalize(Path.of(f))));
        }
    }

    private static String normalize(Path path) {
        return path.toAbsolutePath().normalize().toString();
    }
}
