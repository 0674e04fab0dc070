package com.phillippitts.transcriptionagent.service.transcript;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.phillippitts.transcriptionagent.config.properties.AgentProperties;
import com.phillippitts.transcriptionagent.domain.TranscriptRecord;
import com.phillippitts.transcriptionagent.exception.TranscriptPersistenceException;
import com.phillippitts.transcriptionagent.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Transcript store keeping one pretty-printed JSON array per room and day:
 * {@code <transcript-dir>/<room>_<yyyy-MM-dd>.json}.
 *
 * <p>Each append reads the whole array, adds the record and writes the array back. The
 * read-modify-write runs under a per-file {@link ReentrantLock}, so concurrent sessions of the
 * same room never lose each other's records while appends to different files proceed in parallel.
 * A lock lives only while some append holds or waits for it.
 *
 * <p>Entries are written as {@code {"timestamp", "participant", "text", "room"}} in that key
 * order, two-space indented, with non-ASCII text left unescaped.
 *
 * <p>A file that cannot be parsed is treated as an empty array and is overwritten by the next
 * append; its previous content is not recoverable.
 */
@Service
public class JsonFileTranscriptStore implements TranscriptStore {

    private static final Logger LOG = LogManager.getLogger(JsonFileTranscriptStore.class);

    private static final DateTimeFormatter FILE_DATE_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE;
    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ISO_LOCAL_DATE_TIME;

    private final Path directory;
    private final Clock clock;
    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ObjectWriter fileWriter = objectMapper.writer(new TranscriptFilePrinter());

    private final ConcurrentMap<Path, FileLock> fileLocks = new ConcurrentHashMap<>();

    @Autowired
    public JsonFileTranscriptStore(AgentProperties props, Clock clock) {
        this(Paths.get(props.getTranscriptDir()), clock);
    }

    // Package-private for tests
    JsonFileTranscriptStore(Path directory, Clock clock) {
        this.directory = Objects.requireNonNull(directory, "directory").toAbsolutePath().normalize();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void append(TranscriptRecord record) {
        Objects.requireNonNull(record, "record");
        Path file = resolveFile(record.room(), LocalDate.now(clock));

        FileLock fileLock = fileLocks.compute(file, (k, existing) -> {
            FileLock l = existing == null ? new FileLock() : existing;
            l.users++;
            return l;
        });
        fileLock.lock.lock();
        try {
            ArrayNode transcripts = readArray(file);
            transcripts.add(toNode(record));
            write(file, transcripts);
        } finally {
            fileLock.lock.unlock();
            fileLocks.compute(file, (k, existing) -> --existing.users == 0 ? null : existing);
        }
        LOG.info("Saved transcript to {} [{}]: {}", file.getFileName(), record.participant(),
                LogSanitizer.preview(record.text()));
    }

    @Override
    public List<TranscriptRecord> read(String roomName, LocalDate date) {
        Path file = resolveFile(roomName, date);
        ArrayNode transcripts = readArray(file);
        List<TranscriptRecord> records = new ArrayList<>(transcripts.size());
        for (int i = 0; i < transcripts.size(); i++) {
            JsonNode entry = transcripts.get(i);
            if (!entry.isObject()) {
                LOG.warn("Skipping non-object entry {} in {}", i, file.getFileName());
                continue;
            }
            try {
                records.add(toRecord(entry));
            } catch (IllegalArgumentException | DateTimeParseException e) {
                LOG.warn("Skipping malformed entry {} in {}: {}", i, file.getFileName(), e.getMessage());
            }
        }
        return records;
    }

    /** Visible for tests */
    Path resolveFile(String roomName, LocalDate date) {
        String safeRoom = roomName.replaceAll("[\\\\/:]", "_");
        return directory.resolve(safeRoom + "_" + FILE_DATE_FORMAT.format(date) + ".json");
    }

    /** Visible for tests */
    int lockCount() {
        return fileLocks.size();
    }

    private ArrayNode readArray(Path file) {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return objectMapper.createArrayNode();
        } catch (IOException e) {
            LOG.warn("Could not read transcript file {}; starting a new list: {}", file, e.getMessage());
            return objectMapper.createArrayNode();
        }
        if (content.isBlank()) {
            return objectMapper.createArrayNode();
        }
        try {
            JsonNode root = objectMapper.readTree(content);
            if (root instanceof ArrayNode array) {
                return array;
            }
            LOG.warn("Transcript file {} is not a JSON array; starting a new list", file);
        } catch (JsonProcessingException e) {
            LOG.warn("Transcript file {} is not valid JSON; starting a new list: {}", file, e.getOriginalMessage());
        }
        return objectMapper.createArrayNode();
    }

    private void write(Path file, ArrayNode transcripts) {
        try {
            Files.createDirectories(file.getParent());
            Files.writeString(file, fileWriter.writeValueAsString(transcripts), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TranscriptPersistenceException(file, e);
        }
    }

    private ObjectNode toNode(TranscriptRecord record) {
        ObjectNode entry = objectMapper.createObjectNode();
        entry.put("timestamp", TIMESTAMP_FORMAT.format(record.timestamp()));
        entry.put("participant", record.participant());
        entry.put("text", record.text());
        entry.put("room", record.room());
        return entry;
    }

    private static TranscriptRecord toRecord(JsonNode entry) {
        return new TranscriptRecord(
                LocalDateTime.parse(requireText(entry, "timestamp"), TIMESTAMP_FORMAT),
                requireText(entry, "participant"),
                requireText(entry, "text"),
                requireText(entry, "room"));
    }

    private static String requireText(JsonNode entry, String field) {
        JsonNode value = entry.get(field);
        if (value == null || !value.isTextual()) {
            throw new IllegalArgumentException("missing or non-text field '" + field + "'");
        }
        return value.asText();
    }

    private static final class FileLock {
        private final ReentrantLock lock = new ReentrantLock();
        // Guarded by the map's per-key compute
        private int users;
    }

    /**
     * Two-space indentation with one element per line and {@code "key": value} separators.
     */
    private static final class TranscriptFilePrinter extends DefaultPrettyPrinter {

        private static final DefaultIndenter INDENTER = new DefaultIndenter("  ", "\n");

        TranscriptFilePrinter() {
            indentArraysWith(INDENTER);
            indentObjectsWith(INDENTER);
        }

        @Override
        public DefaultPrettyPrinter createInstance() {
            return new TranscriptFilePrinter();
        }

        @Override
        public void writeObjectFieldValueSeparator(JsonGenerator g) throws IOException {
            g.writeRaw(": ");
        }
    }
}
