package io.github.cyfko.mqlfilter.core.spi;

/**
 * Formats (and optionally localizes) the messages carried by compile exceptions.
 * <p>
 * Every message template produced by the compiler goes through the configured
 * formatter before it is attached to an exception, so applications can plug in
 * their own resource bundles. Templates use {@link String#format} placeholders.
 * </p>
 *
 * <pre>{@code
 * ResourceBundle bundle = ResourceBundle.getBundle("mql-messages", Locale.FRENCH);
 * MessageFormatter french = (template, args) ->
 *     String.format(bundle.containsKey(template) ? bundle.getString(template) : template, args);
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@FunctionalInterface
public interface MessageFormatter {

    /**
     * @param template message template
     * @param args     template arguments, possibly empty
     * @return the formatted message
     */
    String format(String template, Object... args);

    /**
     * @return the formatter returning templates unchanged, applying {@link String#format} only when arguments are given
     */
    static MessageFormatter defaults() {
        return (template, args) -> args == null || args.length == 0 ? template : String.format(template, args);
    }
}
