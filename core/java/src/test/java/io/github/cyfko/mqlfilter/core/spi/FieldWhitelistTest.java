package io.github.cyfko.mqlfilter.core.spi;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FieldWhitelistTest {

    @Test
    void allowAllShouldAdmitEveryPath() {
        assertTrue(FieldWhitelist.allowAll().isAllowed("title"));
        assertTrue(FieldWhitelist.allowAll().isAllowed("tracks.playlists.name"));
    }

    @Test
    void listedPathsShouldBeMatchedExactly() {
        FieldWhitelist whitelist = FieldWhitelist.of(List.of("title", "tracks.name"));

        assertTrue(whitelist.isAllowed("tracks.name"));
        assertFalse(whitelist.isAllowed("tracks"));
        assertFalse(whitelist.isAllowed("tracks.name.length"));
        assertFalse(whitelist.isAllowed("Title"));
    }

    @Test
    void listedPathsShouldLoseIndexSegments() {
        FieldWhitelist whitelist = FieldWhitelist.of(List.of("tracks.0.playlists.name"));

        assertTrue(whitelist.isAllowed("tracks.playlists.name"));
    }
}
