package ai.letitride.simulation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits {@link HandRecord}s as JSON lines on the {@code ai.letitride.hands} logger.
 *
 * <p>Each line is prefixed with {@code "HAND "} so downstream tools can pick the records out of mixed
 * logs; {@code logback-spring.xml} also routes this logger to its own file. Besides the per-run
 * setting, {@code -Dlog.hands=true} switches the records on for every run.
 */
public final class HandRecordLogger {
    public static final String LOGGER_NAME = "ai.letitride.hands";
    public static final String PREFIX = "HAND ";

    private static final Logger hands = LoggerFactory.getLogger(LOGGER_NAME);
    private static final Logger log = LoggerFactory.getLogger(HandRecordLogger.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final boolean FORCED = Boolean.getBoolean("log.hands");

    private HandRecordLogger() {
    }

    /**
     * True if hand records were requested with {@code -Dlog.hands=true}.
     */
    public static boolean isForced() {
        return FORCED;
    }

    /**
     * Serializes a record to a single JSON line (without the prefix).
     *
     * @throws IllegalStateException if Jackson cannot serialize the record
     */
    public static String toJson(HandRecord record) {
        try {
            return OBJECT_MAPPER.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize hand record " + record, e);
        }
    }

    /**
     * Reads back a line written by {@link #toJson(HandRecord)}, with or without the prefix.
     *
     * @throws IllegalArgumentException if the line is not a hand record
     */
    public static HandRecord fromJson(String line) {
        String json = line.startsWith(PREFIX) ? line.substring(PREFIX.length()) : line;
        try {
            return OBJECT_MAPPER.readValue(json, HandRecord.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a hand record: " + line, e);
        }
    }

    public static void log(HandRecord record) {
        if (!hands.isInfoEnabled()) {
            return;
        }
        try {
            hands.info(PREFIX + OBJECT_MAPPER.writeValueAsString(record));
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize hand record {}", record, e);
        }
    }
}
