package org.tripweave.catalog;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.tripweave.planning.core.PlanningException;
import org.tripweave.planning.model.Spot;
import org.tripweave.planning.model.SpotDefaults;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads a JSON array of spots and applies category defaults.
 *
 * <p>Entries that fail validation are skipped and logged; the rest of the catalogue
 * still loads. This is the only I/O in the project; the planning core receives the
 * resulting immutable spot list.</p>
 */
@Slf4j
public final class SpotCatalogLoader {
    public static final String REASON_UNREADABLE = "CATALOG_UNREADABLE";
    public static final String REASON_MALFORMED = "CATALOG_MALFORMED";

    private static final TypeReference<List<SpotRecord>> RECORD_LIST = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public SpotCatalogLoader() {
        this(new ObjectMapper());
    }

    public SpotCatalogLoader(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    /**
     * Loads a catalogue file.
     */
    public List<Spot> load(Path path) {
        Objects.requireNonNull(path, "path");
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        } catch (IOException ex) {
            throw new PlanningException(REASON_UNREADABLE, "cannot read spot catalogue " + path, ex);
        }
    }

    /**
     * Loads a catalogue from a stream; the stream is not closed.
     *
     * @param source label used in log and error messages.
     */
    public List<Spot> load(InputStream in, String source) {
        Objects.requireNonNull(in, "in");
        List<SpotRecord> records;
        try {
            records = objectMapper.readValue(in, RECORD_LIST);
        } catch (JsonProcessingException ex) {
            throw new PlanningException(REASON_MALFORMED, "malformed spot catalogue " + source, ex);
        } catch (IOException ex) {
            throw new PlanningException(REASON_UNREADABLE, "cannot read spot catalogue " + source, ex);
        }
        if (records == null) {
            throw new PlanningException(REASON_MALFORMED, "spot catalogue " + source + " is null");
        }

        List<Spot> spots = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) {
            SpotRecord record = records.get(i);
            if (record == null) {
                log.warn("skipping null catalogue entry #{} in {}", i, source);
                continue;
            }
            try {
                spots.add(SpotDefaults.withDefaults(record.toSpot()));
            } catch (IllegalArgumentException | NullPointerException ex) {
                log.warn("skipping invalid catalogue entry #{} ({}) in {}: {}", i, record.getName(), source, ex.getMessage());
            }
        }
        log.info("loaded {} of {} spots from {}", spots.size(), records.size(), source);
        return spots;
    }
}
