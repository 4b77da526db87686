package io.github.yok.leaguerow.core;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.github.yok.leaguerow.model.RowParseResult;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads row files and writes parse results as JSON.
 *
 * <p>
 * A row file holds one JSON object whose keys are column letters and whose values are the cell
 * texts, for example {@code {"A": "Dodgeball", "B": "MONDAY\nOpen", ...}}. Non-string values are
 * read as their text form and {@code null} values are kept as {@code null}.
 * </p>
 *
 * <p>
 * Results are written with instants as ISO-8601 strings ({@code 2025-10-15T04:00:00Z}).
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class RowJsonMapper {

    private final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    /**
     * Loads the cells of a row file.
     *
     * @param file row file
     * @return cells keyed by column letter, in file order
     * @throws IOException if the file cannot be read or is not a JSON object
     */
    public Map<String, String> readCells(Path file) throws IOException {
        JsonNode root;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            root = mapper.readTree(reader);
        }
        if (root == null || !root.isObject()) {
            throw new IOException("Row file must contain a JSON object: " + file);
        }
        Map<String, String> cells = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode val = field.getValue();
            cells.put(field.getKey(), (val != null && !val.isNull()) ? val.asText() : null);
        }
        return cells;
    }

    /**
     * Serializes a parse result as {@code {"payload": ..., "unresolvedFields": [...]}}.
     *
     * @param result parse result
     * @param prettyPrint whether to indent the output
     * @return JSON text
     * @throws JsonProcessingException if serialization fails
     */
    public String write(RowParseResult result, boolean prettyPrint)
            throws JsonProcessingException {
        Map<String, Object> document = new LinkedHashMap<>();
        document.put("payload", result.getPayload());
        document.put("unresolvedFields", result.getUnresolvedFields());
        return prettyPrint ? mapper.writerWithDefaultPrettyPrinter().writeValueAsString(document)
                : mapper.writeValueAsString(document);
    }
}
