package io.github.cyfko.mqlfilter.core.config;

import io.github.cyfko.mqlfilter.core.spi.FieldWhitelist;
import io.github.cyfko.mqlfilter.core.spi.KeyNameTranslator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("CompileOptions Tests")
class CompileOptionsTest {

    @Test
    @DisplayName("Should default to permissive collaborators")
    void shouldDefaultToPermissiveCollaborators() {
        CompileOptions options = CompileOptions.defaults();

        assertTrue(options.getWhitelist().isAllowed("anything.at.all"));
        assertTrue(options.getNestedConditions().conditionsFor("tracks").isEmpty());
        assertEquals("tracks.unitPrice", options.getKeyTranslator().translate("tracks.unitPrice"));
        assertEquals("plain", options.getMessageFormatter().format("plain"));
        assertEquals(CompilePolicy.defaults(), options.getPolicy());
        assertSame(options, CompileOptions.defaults());
    }

    @Test
    @DisplayName("Should keep configured collaborators")
    void shouldKeepConfiguredCollaborators() {
        FieldWhitelist whitelist = FieldWhitelist.of(List.of("title"));
        KeyNameTranslator translator = key -> key.toLowerCase();

        CompileOptions options = CompileOptions.builder()
                .whitelist(whitelist)
                .keyTranslator(translator)
                .policy(CompilePolicy.strict())
                .build();

        assertSame(whitelist, options.getWhitelist());
        assertSame(translator, options.getKeyTranslator());
        assertEquals(CompilePolicy.strict(), options.getPolicy());
    }

    @Test
    @DisplayName("Should reject null collaborators")
    void shouldRejectNullCollaborators() {
        CompileOptions.Builder builder = CompileOptions.builder();

        assertThrows(NullPointerException.class, () -> builder.whitelist(null));
        assertThrows(NullPointerException.class, () -> builder.nestedConditions(null));
        assertThrows(NullPointerException.class, () -> builder.keyTranslator(null));
        assertThrows(NullPointerException.class, () -> builder.messageFormatter(null));
        assertThrows(NullPointerException.class, () -> builder.policy(null));
    }
}
