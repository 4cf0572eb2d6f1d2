package com.mediaanalytics.etl.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.mediaanalytics.etl.model.ExtractionWarning;
import com.mediaanalytics.etl.model.RecordSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads every {@code *.json} file directly inside a directory into one {@link RecordSet}.
 *
 * Two encodings are accepted per file, chosen by the first non-whitespace character:
 * a single JSON array of objects ({@code [}), or newline-delimited JSON with one object
 * per non-blank line. A file is all or nothing: if any part of it fails to parse, none of
 * its records are kept and a warning is recorded, and extraction continues with the next file.
 */
public class JsonFileExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileExtractor.class);
    private static final TypeReference<LinkedHashMap<String, Object>> RECORD_TYPE =
        new TypeReference<LinkedHashMap<String, Object>>() {};
    private static final String JSON_GLOB = "*.json";
    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final ObjectMapper mapper;

    public JsonFileExtractor() {
        this(JsonMapper.builder()
            .enable(JsonReadFeature.ALLOW_NON_NUMERIC_NUMBERS)
            .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
            .build());
    }

    public JsonFileExtractor(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public RecordSet extract(Path directory) {
        LOGGER.info("Starting data extraction from {}", directory);
        List<Path> jsonFiles = discoverFiles(directory);

        if (jsonFiles.isEmpty()) {
            LOGGER.warn("No JSON files found in {}", directory);
            return RecordSet.empty();
        }

        List<Map<String, Object>> allRecords = new ArrayList<>();
        List<ExtractionWarning> warnings = new ArrayList<>();

        for (Path file : jsonFiles) {
            try {
                LOGGER.info("Processing file: {}", file);
                List<Map<String, Object>> fileRecords = readFile(file);
                allRecords.addAll(fileRecords);
                LOGGER.info("Successfully processed {} records from {}", fileRecords.size(), file);
            } catch (IOException | IllegalArgumentException e) {
                LOGGER.error("Error processing file {}: {}", file, e.getMessage());
                warnings.add(new ExtractionWarning(file, e.getMessage()));
            }
        }

        if (allRecords.isEmpty()) {
            LOGGER.warn("No data was extracted from any files");
        } else {
            LOGGER.info("Extracted {} total records from {} files ({} skipped)",
                       allRecords.size(), jsonFiles.size(), warnings.size());
        }
        return new RecordSet(allRecords, warnings);
    }

    /**
     * Regular files ending in .json, non-recursive, sorted by file name.
     */
    List<Path> discoverFiles(Path directory) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(directory)) {
            LOGGER.warn("Input directory {} does not exist or is not a directory", directory);
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, JSON_GLOB)) {
            for (Path path : stream) {
                if (Files.isRegularFile(path)) {
                    files.add(path);
                }
            }
        } catch (NoSuchFileException e) {
            LOGGER.warn("Input directory {} disappeared during listing", directory);
            return files;
        } catch (IOException e) {
            LOGGER.error("Failed to list input directory {}: {}", directory, e.getMessage(), e);
            throw new ExtractionException(directory, e);
        }
        files.sort((a, b) -> a.getFileName().toString().compareTo(b.getFileName().toString()));
        return files;
    }

    List<Map<String, Object>> readFile(Path file) throws IOException {
        String content = Files.readString(file, StandardCharsets.UTF_8);
        if (!content.isEmpty() && content.charAt(0) == BYTE_ORDER_MARK) {
            content = content.substring(1);
        }
        String trimmed = content.strip();
        if (trimmed.startsWith("[")) {
            return parseArray(trimmed);
        }
        return parseLines(trimmed);
    }

    private List<Map<String, Object>> parseArray(String content) throws JsonProcessingException {
        JsonNode root = mapper.readTree(content);
        List<Map<String, Object>> records = new ArrayList<>(root.size());
        int index = 0;
        for (JsonNode element : root) {
            if (!element.isObject()) {
                throw new IllegalArgumentException(String.format(
                    "array element %d is %s, expected an object", index, element.getNodeType()));
            }
            records.add(mapper.convertValue(element, RECORD_TYPE));
            index++;
        }
        return records;
    }

    private List<Map<String, Object>> parseLines(String content) {
        List<Map<String, Object>> records = new ArrayList<>();
        String[] lines = content.split("\\r?\\n");
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].strip();
            if (line.isEmpty()) {
                continue;
            }
            JsonNode node;
            try {
                node = mapper.readTree(line);
            } catch (JsonProcessingException e) {
                throw new IllegalArgumentException(String.format(
                    "line %d is not valid JSON: %s", i + 1, e.getOriginalMessage()), e);
            }
            if (node == null || !node.isObject()) {
                throw new IllegalArgumentException(String.format(
                    "line %d is not a JSON object", i + 1));
            }
            records.add(mapper.convertValue(node, RECORD_TYPE));
        }
        return records;
    }
}
