package io.github.cyfko.mqlfilter.core.config;

import io.github.cyfko.mqlfilter.core.spi.FieldWhitelist;
import io.github.cyfko.mqlfilter.core.spi.KeyNameTranslator;
import io.github.cyfko.mqlfilter.core.spi.MessageFormatter;
import io.github.cyfko.mqlfilter.core.spi.NestedConditionSupplier;

import java.util.Objects;

/**
 * Per-call options of a {@link io.github.cyfko.mqlfilter.core.api.FilterCompiler}.
 * <p>
 * Aggregates the caller-authored collaborators (whitelist, nested conditions, key
 * translation, message formatting) and the {@link CompilePolicy}. Every knob has a
 * permissive default, so {@code CompileOptions.defaults()} compiles any resolvable
 * document without restriction.
 * </p>
 *
 * <pre>{@code
 * CompileOptions options = CompileOptions.builder()
 *     .whitelist(FieldWhitelist.of(List.of("name", "tracks.name")))
 *     .nestedConditions(path -> "tracks".equals(path) ? List.of(notHidden) : List.of())
 *     .keyTranslator(CamelCase::toSnakeCase)
 *     .policy(CompilePolicy.strict())
 *     .build();
 * }</pre>
 */
public final class CompileOptions {

    private static final CompileOptions DEFAULTS = builder().build();

    private final FieldWhitelist whitelist;
    private final NestedConditionSupplier nestedConditions;
    private final KeyNameTranslator keyTranslator;
    private final MessageFormatter messageFormatter;
    private final CompilePolicy policy;

    private CompileOptions(Builder builder) {
        this.whitelist = builder.whitelist;
        this.nestedConditions = builder.nestedConditions;
        this.keyTranslator = builder.keyTranslator;
        this.messageFormatter = builder.messageFormatter;
        this.policy = builder.policy;
    }

    public static Builder builder() { return new Builder(); }

    public static CompileOptions defaults() { return DEFAULTS; }

    public FieldWhitelist getWhitelist() { return whitelist; }
    public NestedConditionSupplier getNestedConditions() { return nestedConditions; }
    public KeyNameTranslator getKeyTranslator() { return keyTranslator; }
    public MessageFormatter getMessageFormatter() { return messageFormatter; }
    public CompilePolicy getPolicy() { return policy; }

    /**
     * Builder for {@link CompileOptions}.
     */
    public static final class Builder {
        private FieldWhitelist whitelist = FieldWhitelist.allowAll();
        private NestedConditionSupplier nestedConditions = NestedConditionSupplier.none();
        private KeyNameTranslator keyTranslator = KeyNameTranslator.identity();
        private MessageFormatter messageFormatter = MessageFormatter.defaults();
        private CompilePolicy policy = CompilePolicy.defaults();

        public Builder whitelist(FieldWhitelist whitelist) {
            this.whitelist = Objects.requireNonNull(whitelist, "whitelist");
            return this;
        }

        public Builder nestedConditions(NestedConditionSupplier nestedConditions) {
            this.nestedConditions = Objects.requireNonNull(nestedConditions, "nestedConditions");
            return this;
        }

        public Builder keyTranslator(KeyNameTranslator keyTranslator) {
            this.keyTranslator = Objects.requireNonNull(keyTranslator, "keyTranslator");
            return this;
        }

        public Builder messageFormatter(MessageFormatter messageFormatter) {
            this.messageFormatter = Objects.requireNonNull(messageFormatter, "messageFormatter");
            return this;
        }

        public Builder policy(CompilePolicy policy) {
            this.policy = Objects.requireNonNull(policy, "policy");
            return this;
        }

        public CompileOptions build() { return new CompileOptions(this); }
    }
}
