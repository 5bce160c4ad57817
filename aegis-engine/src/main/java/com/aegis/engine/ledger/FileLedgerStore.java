package com.aegis.engine.ledger;

import com.aegis.core.domain.LedgerRecord;
import com.aegis.core.json.CanonicalJson;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable store: one JSON-lines file per project, appended and forced to disk
 * on every record, plus a {@code keys/} directory of PEM public keys.
 * <p>
 * Files are read once when the store opens. A file that cannot be parsed, or
 * that holds records of another project, is reported through
 * {@link #unreadableProjects()} and none of its records are served.
 * <p>
 * The store remembers how long each project file was after its own last read
 * or write. When the file on disk has a different length, another writer has
 * touched it: {@link #last(String)} then reports the record actually on disk
 * and {@link #append(LedgerRecord)} refuses to write.
 */
public class FileLedgerStore implements LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(FileLedgerStore.class);

    private static final String RECORD_SUFFIX = ".jsonl";
    private static final String KEY_SUFFIX = ".pem";
    private static final String KEYS_DIRECTORY = "keys";

    private final Path directory;
    private final Path keysDirectory;
    private final ObjectMapper mapper;
    private final InMemoryLedgerStore cache = new InMemoryLedgerStore();
    private final Map<String, String> unreadable = Collections.synchronizedMap(new LinkedHashMap<>());
    private final Map<String, Long> lengths = new ConcurrentHashMap<>();

    public FileLedgerStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "Directory cannot be null");
        this.keysDirectory = directory.resolve(KEYS_DIRECTORY);
        this.mapper = CanonicalJson.mapper();
        try {
            Files.createDirectories(keysDirectory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create ledger directory " + directory, e);
        }
        loadKeys();
        loadRecords();
    }

    public Path getDirectory() {
        return directory;
    }

    /**
     * @throws LedgerIntegrityException if the project file is unreadable or its
     *                                  length changed since this store last read or wrote it
     */
    @Override
    public void append(LedgerRecord record) {
        Objects.requireNonNull(record, "Record cannot be null");
        String projectId = record.projectId();
        if (unreadable.containsKey(projectId)) {
            throw new LedgerIntegrityException(projectId, "stored chain is unreadable");
        }
        byte[] line;
        try {
            line = (mapper.writeValueAsString(record) + "\n").getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Record " + record.id() + " is not serializable", e);
        }
        Path file = projectFile(projectId);
        long expected = lengths.getOrDefault(projectId, 0L);
        try (FileChannel channel = FileChannel.open(file,
                StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
             FileLock ignored = channel.lock()) {
            long actual = channel.size();
            if (actual != expected) {
                throw new LedgerIntegrityException(projectId, "ledger file " + file
                        + " changed on disk by another writer (" + actual + " bytes, expected " + expected + ")");
            }
            ByteBuffer buffer = ByteBuffer.wrap(line);
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
            channel.force(true);
            lengths.put(projectId, expected + line.length);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to append record " + record.id() + " to " + file, e);
        }
        cache.append(record);
    }

    @Override
    public List<LedgerRecord> records(String projectId) {
        return cache.records(projectId);
    }

    /**
     * The last record this store read or wrote, unless the project file has
     * since been changed by another writer. In that case the last record on
     * disk is returned instead, so the caller's head check sees the divergence.
     *
     * @throws LedgerIntegrityException if the changed file ends in a line that
     *                                  is not a record of this project
     */
    @Override
    public LedgerRecord last(String projectId) {
        Path file = projectFile(projectId);
        long expected = lengths.getOrDefault(projectId, 0L);
        long actual;
        try {
            actual = Files.exists(file) ? Files.size(file) : 0L;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to stat " + file, e);
        }
        if (actual == expected) {
            return cache.last(projectId);
        }
        log.warn("Ledger file {} is {} bytes, expected {}; reading its last record", file, actual, expected);
        return lastOnDisk(projectId, file);
    }

    @Override
    public List<String> projectIds() {
        return cache.projectIds();
    }

    @Override
    public void storePublicKey(String keyId, String pem) {
        Path file = keysDirectory.resolve(keyId + KEY_SUFFIX);
        if (!Files.exists(file)) {
            try {
                Files.writeString(file, pem, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to persist public key " + keyId, e);
            }
        }
        cache.storePublicKey(keyId, pem);
    }

    @Override
    public Map<String, String> publicKeys() {
        return cache.publicKeys();
    }

    @Override
    public Map<String, String> unreadableProjects() {
        synchronized (unreadable) {
            return Map.copyOf(unreadable);
        }
    }

    private Path projectFile(String projectId) {
        return directory.resolve(URLEncoder.encode(projectId, StandardCharsets.UTF_8) + RECORD_SUFFIX);
    }

    private void loadKeys() {
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(keysDirectory, "*" + KEY_SUFFIX)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                String keyId = name.substring(0, name.length() - KEY_SUFFIX.length());
                cache.storePublicKey(keyId, Files.readString(file, StandardCharsets.UTF_8));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read public keys from " + keysDirectory, e);
        }
    }

    private void loadRecords() {
        List<List<LedgerRecord>> chains = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + RECORD_SUFFIX)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                String projectId = URLDecoder.decode(
                        name.substring(0, name.length() - RECORD_SUFFIX.length()), StandardCharsets.UTF_8);
                List<LedgerRecord> chain = readChain(projectId, file);
                if (chain != null && !chain.isEmpty()) {
                    chains.add(chain);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list ledger files in " + directory, e);
        }
        // Restore the order in which projects were first appended.
        chains.sort(Comparator.comparing((List<LedgerRecord> chain) -> chain.get(0).signedAt())
                .thenComparing(chain -> chain.get(0).projectId()));
        for (List<LedgerRecord> chain : chains) {
            chain.forEach(cache::append);
        }
        log.info("Opened ledger store {} with {} project(s), {} unreadable",
                directory, chains.size(), unreadable.size());
    }

    private LedgerRecord lastOnDisk(String projectId, Path file) {
        List<String> lines;
        try {
            lines = Files.exists(file) ? Files.readAllLines(file, StandardCharsets.UTF_8) : List.of();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
        for (int i = lines.size() - 1; i >= 0; i--) {
            String line = lines.get(i);
            if (line.isBlank()) {
                continue;
            }
            LedgerRecord record;
            try {
                record = mapper.readValue(line, LedgerRecord.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new LedgerIntegrityException(projectId,
                        "line " + (i + 1) + " of " + file + " is not a ledger record: " + e.getMessage());
            }
            if (!projectId.equals(record.projectId())) {
                throw new LedgerIntegrityException(projectId,
                        "line " + (i + 1) + " of " + file + " belongs to project " + record.projectId());
            }
            return record;
        }
        return null;
    }

    private List<LedgerRecord> readChain(String projectId, Path file) {
        List<LedgerRecord> chain = new ArrayList<>();
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + file, e);
        }
        lengths.put(projectId, (long) bytes.length);
        List<String> lines = new String(bytes, StandardCharsets.UTF_8).lines().toList();
        int lineNumber = 0;
        for (String line : lines) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            LedgerRecord record;
            try {
                record = mapper.readValue(line, LedgerRecord.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                markUnreadable(projectId, "line " + lineNumber + " is not a ledger record: " + e.getMessage());
                return null;
            }
            if (!projectId.equals(record.projectId())) {
                markUnreadable(projectId, "line " + lineNumber + " belongs to project " + record.projectId());
                return null;
            }
            chain.add(record);
        }
        return chain;
    }

    private void markUnreadable(String projectId, String reason) {
        log.error("Ledger file for project {} is unreadable: {}", projectId, reason);
        unreadable.put(projectId, reason);
    }
}
