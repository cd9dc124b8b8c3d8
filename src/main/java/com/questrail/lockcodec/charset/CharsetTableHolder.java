package com.questrail.lockcodec.charset;

import com.questrail.lockcodec.error.TableNotInitializedException;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * CharsetTableHolder
 * -----------------------------------------------------------------------------
 * Holds the charset table a codec reads from.
 *
 * <p>The holder starts empty or pre-loaded. A loader installs a table once at
 * startup and may later replace it; replacement is a single atomic reference
 * swap. Codec operations call {@link #snapshot()} exactly once per call and use
 * that table throughout, so an in-flight call never observes a mix of old and
 * new mappings.</p>
 */
public final class CharsetTableHolder
{
    private final AtomicReference<CharsetTable> current;

    private CharsetTableHolder(CharsetTable initial) {
        this.current = new AtomicReference<>(initial);
    }

    /**
     * @return a holder with no table; codec calls fail until {@link #install} is called
     */
    public static CharsetTableHolder empty() {
        return new CharsetTableHolder(null);
    }

    public static CharsetTableHolder of(CharsetTable table) {
        return new CharsetTableHolder(Objects.requireNonNull(table, "table"));
    }

    /**
     * Installs or replaces the table.
     *
     * @return the previously installed table, if any
     */
    public Optional<CharsetTable> install(CharsetTable table) {
        return Optional.ofNullable(current.getAndSet(Objects.requireNonNull(table, "table")));
    }

    /**
     * Returns the table to use for one whole codec call.
     *
     * @throws TableNotInitializedException if no table has been installed
     */
    public CharsetTable snapshot() {
        CharsetTable table = current.get();
        if (table == null) {
            throw new TableNotInitializedException();
        }
        return table;
    }

    public boolean isInitialized() {
        return current.get() != null;
    }
}
