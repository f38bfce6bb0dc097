package io.github.ratelimitedchannel;


import org.jetbrains.annotations.NotNull;

import java.util.UUID;

/**
 * Generates the identifiers of rate limiter workers.
 */
public class UuidProvider {

    /**
     * Generates a new random worker id.
     *
     * @return a new {@link UUID}
     */
    public static @NotNull UUID generateUuid() {
        return UUID.randomUUID();
    }

    /**
     * Short form of a worker id, used in thread names.
     *
     * @param id the worker id
     * @return the first group of the UUID string
     */
    public static @NotNull String shortId(@NotNull UUID id) {
        String s = id.toString();
        return s.substring(0, s.indexOf('-'));
    }
}
