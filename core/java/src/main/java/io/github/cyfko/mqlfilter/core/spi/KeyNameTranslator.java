package io.github.cyfko.mqlfilter.core.spi;

/**
 * Converts user-facing dotted key names into schema field names.
 * <p>
 * Called with the full external path from the root model (e.g.
 * {@code "tracks.unitPrice"}) and expected to return the internal path in the
 * same dotted format (e.g. {@code "tracks.unit_price"}). Returning {@code null}
 * signals an unknown key and makes the compiler fail with
 * {@code unknown_field}.
 * </p>
 *
 * <pre>{@code
 * KeyNameTranslator lower = key -> key.toLowerCase(Locale.ROOT);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface KeyNameTranslator {

    /**
     * @param externalPath dotted path as written in the filter document
     * @return the internal dotted path, or {@code null} if the key is unknown
     */
    String translate(String externalPath);

    /**
     * @return the translator returning every path unchanged
     */
    static KeyNameTranslator identity() {
        return path -> path;
    }
}
