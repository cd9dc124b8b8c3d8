package com.questrail.lockcodec.charset;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonPrimitive;
import com.questrail.lockcodec.error.InvalidCharsetException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * CharsetLoader
 * -----------------------------------------------------------------------------
 * Reads charset JSON documents and turns them into a validated
 * {@link CharsetTable}.
 *
 * <p>Document shape:</p>
 * <pre>
 *   { "author": "...", "timestamp": 1700000000, "mapping": { "a": 0, "b": 1 } }
 * </pre>
 *
 * <p>Every mapping value is shifted by the loader's base offset (100 unless
 * configured otherwise) so that codes share one digit width. When several
 * documents are combined, later documents override earlier ones for the same
 * character.</p>
 *
 * <p>This class sits outside the codec core: codecs only ever see the finished
 * table.</p>
 */
public final class CharsetLoader
{
    private static final Logger log = LoggerFactory.getLogger(CharsetLoader.class);

    public static final int DEFAULT_BASE_OFFSET = 100;

    /** Classpath location of the bundled charset. */
    public static final String DEFAULT_CHARSET_RESOURCE = "/charsets/default.json";

    private final Gson gson = new Gson();
    private final int baseOffset;

    public CharsetLoader() {
        this(DEFAULT_BASE_OFFSET);
    }

    public CharsetLoader(int baseOffset) {
        if (baseOffset < 0) {
            throw new IllegalArgumentException("baseOffset must be non-negative");
        }
        this.baseOffset = baseOffset;
    }

    public int baseOffset() {
        return baseOffset;
    }

    /**
     * Loads the charset bundled with this library.
     */
    public CharsetTable loadDefault() {
        InputStream in = CharsetLoader.class.getResourceAsStream(DEFAULT_CHARSET_RESOURCE);
        if (in == null) {
            throw new InvalidCharsetException("Bundled charset " + DEFAULT_CHARSET_RESOURCE + " is missing");
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            return toTable(List.of(parse(reader, DEFAULT_CHARSET_RESOURCE)));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read bundled charset " + DEFAULT_CHARSET_RESOURCE, e);
        }
    }

    /**
     * Loads a single charset file.
     */
    public CharsetTable load(Path file) {
        return toTable(List.of(read(file)));
    }

    /**
     * Loads every {@code *.json} file in a directory (not recursive), in
     * file-name order.
     *
     * @throws InvalidCharsetException if the directory holds no charset files
     */
    public CharsetTable loadDirectory(Path directory) {
        List<Path> files;
        try (Stream<Path> listing = Files.list(directory)) {
            files = listing
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".json"))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list charset directory " + directory, e);
        }

        if (files.isEmpty()) {
            log.error("No charset files found in {}", directory);
            throw new InvalidCharsetException("No charset files found in " + directory);
        }

        List<CharsetDocument> documents = new ArrayList<>(files.size());
        for (Path file : files) {
            documents.add(read(file));
        }
        return toTable(documents);
    }

    /**
     * Reads and parses one charset file without building a table.
     */
    public CharsetDocument read(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return parse(reader, file.getFileName().toString());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read charset file " + file, e);
        }
    }

    /**
     * Parses one charset document.
     *
     * @param source name used in error messages
     */
    public CharsetDocument parse(Reader reader, String source) {
        final JsonObject json;
        try {
            json = gson.fromJson(new BufferedReader(reader), JsonObject.class);
        } catch (JsonParseException e) {
            throw new InvalidCharsetException("Invalid charset JSON in " + source + ": " + e.getMessage(), e);
        }
        if (json == null) {
            throw new InvalidCharsetException("Charset file " + source + " is empty");
        }

        JsonElement mappingElement = json.get("mapping");
        if (mappingElement == null || !mappingElement.isJsonObject() || mappingElement.getAsJsonObject().size() == 0) {
            throw new InvalidCharsetException("Charset file " + source + " has no mapping");
        }

        Map<String, Integer> mapping = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : mappingElement.getAsJsonObject().entrySet()) {
            mapping.put(entry.getKey(), integerValue(source, entry.getKey(), entry.getValue()));
        }

        String author = null;
        JsonElement authorElement = json.get("author");
        if (authorElement != null && authorElement.isJsonPrimitive()) {
            author = authorElement.getAsString();
        }

        Instant timestamp = null;
        JsonElement timestampElement = json.get("timestamp");
        if (timestampElement != null && timestampElement.isJsonPrimitive()
                && timestampElement.getAsJsonPrimitive().isNumber()) {
            double seconds = timestampElement.getAsDouble();
            timestamp = Instant.ofEpochMilli(Math.round(seconds * 1000.0));
        }

        return new CharsetDocument(source, author, timestamp, mapping);
    }

    /**
     * Combines documents into a table, applying the base offset.
     */
    public CharsetTable toTable(List<CharsetDocument> documents) {
        CharsetTable.Builder builder = CharsetTable.builder();
        for (CharsetDocument document : documents) {
            for (Map.Entry<String, Integer> entry : document.mapping().entrySet()) {
                if (entry.getValue() > Integer.MAX_VALUE - baseOffset) {
                    throw new InvalidCharsetException(document.source() + ": value " + entry.getValue()
                            + " for '" + entry.getKey() + "' is too large for base offset " + baseOffset);
                }
                try {
                    builder.put(entry.getKey(), entry.getValue() + baseOffset);
                } catch (InvalidCharsetException e) {
                    throw new InvalidCharsetException(document.source() + ": " + e.getMessage(), e);
                }
            }
            log.info("Loaded charset {} ({} characters, author={})",
                    document.source(), document.mapping().size(), document.authorIfPresent().orElse("unknown"));
        }
        return builder.build();
    }

    private static int integerValue(String source, String key, JsonElement value) {
        if (value == null || !value.isJsonPrimitive() || !((JsonPrimitive) value).isNumber()) {
            throw new InvalidCharsetException("Charset file " + source + ": value for '" + key + "' is not a number");
        }
        BigDecimal number = value.getAsBigDecimal();
        final int intValue;
        try {
            intValue = number.intValueExact();
        } catch (ArithmeticException e) {
            throw new InvalidCharsetException("Charset file " + source + ": value for '" + key
                    + "' is not an integer: " + number, e);
        }
        if (intValue < 0) {
            throw new InvalidCharsetException("Charset file " + source + ": value for '" + key + "' is negative");
        }
        return intValue;
    }
}
