package io.github.cyfko.mqlfilter.core;

import io.github.cyfko.mqlfilter.core.model.SimpleSchema;
import io.github.cyfko.mqlfilter.core.spi.Cardinality;
import io.github.cyfko.mqlfilter.core.spi.SchemaModel;
import io.github.cyfko.mqlfilter.core.spi.ValueType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Music store schema shared by the core tests, with document-building helpers.
 */
public final class ChinookSchema {

    public static final SimpleSchema SCHEMA = SimpleSchema.builder()
            .model("Album", m -> m
                    .scalar("album_id", ValueType.INT)
                    .scalar("title", ValueType.TEXT)
                    .relation("artist", "Artist", Cardinality.ONE)
                    .relation("tracks", "Track", Cardinality.MANY))
            .model("Artist", m -> m
                    .scalar("artist_id", ValueType.INT)
                    .scalar("name", ValueType.TEXT)
                    .relation("albums", "Album", Cardinality.MANY))
            .model("Track", m -> m
                    .scalar("track_id", ValueType.INT)
                    .scalar("name", ValueType.TEXT)
                    .scalar("composer", ValueType.TEXT)
                    .scalar("milliseconds", ValueType.INT)
                    .scalar("unit_price", ValueType.FLOAT)
                    .relation("album", "Album", Cardinality.ONE)
                    .relation("playlists", "Playlist", Cardinality.MANY))
            .model("Playlist", m -> m
                    .scalar("playlist_id", ValueType.INT)
                    .scalar("name", ValueType.TEXT)
                    .relation("tracks", "Track", Cardinality.MANY))
            .model("Employee", m -> m
                    .scalar("employee_id", ValueType.INT)
                    .scalar("first_name", ValueType.TEXT)
                    .scalar("last_name", ValueType.TEXT)
                    .scalar("active", ValueType.BOOL)
                    .scalar("birth_date", ValueType.DATETIME)
                    .scalar("hire_date", ValueType.DATE)
                    .scalar("shift_start", ValueType.TIME)
                    .relation("parent", "Employee", Cardinality.ONE))
            .build();

    private ChinookSchema() {
    }

    public static SchemaModel album() {
        return SCHEMA.model("Album");
    }

    public static SchemaModel track() {
        return SCHEMA.model("Track");
    }

    public static SchemaModel playlist() {
        return SCHEMA.model("Playlist");
    }

    public static SchemaModel employee() {
        return SCHEMA.model("Employee");
    }

    /**
     * Ordered document from alternating keys and values; values may be {@code null}.
     */
    public static Map<String, Object> doc(Object... keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected key/value pairs");
        }
        Map<String, Object> document = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            document.put((String) keyValues[i], keyValues[i + 1]);
        }
        return document;
    }

    /**
     * Mutable list allowing {@code null} elements.
     */
    public static List<Object> list(Object... values) {
        return new ArrayList<>(Arrays.asList(values));
    }
}
