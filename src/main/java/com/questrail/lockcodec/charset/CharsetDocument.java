package com.questrail.lockcodec.charset;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One parsed charset file.
 *
 * <p>{@code mapping} holds the raw values from the file, before the loader's
 * base offset is applied. {@code author} and {@code timestamp} are informational
 * and may be {@code null} when the file omits them.</p>
 */
public record CharsetDocument(
    String source,
    String author,
    Instant timestamp,
    Map<String, Integer> mapping
) {
    public CharsetDocument {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(mapping, "mapping");
        mapping = Collections.unmodifiableMap(new LinkedHashMap<>(mapping));
    }

    public Optional<String> authorIfPresent() {
        return Optional.ofNullable(author);
    }

    public Optional<Instant> timestampIfPresent() {
        return Optional.ofNullable(timestamp);
    }
}
