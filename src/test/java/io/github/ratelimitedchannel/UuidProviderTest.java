package io.github.ratelimitedchannel;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class UuidProviderTest {

    @Test
    void generatedIdsDiffer() {
        assertNotEquals(UuidProvider.generateUuid(), UuidProvider.generateUuid());
    }

    @Test
    void shortId_isFirstGroup() {
        UUID id = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");
        assertEquals("123e4567", UuidProvider.shortId(id));
    }
}
