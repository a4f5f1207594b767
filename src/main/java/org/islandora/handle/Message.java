package org.islandora.handle;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Message is a record that packages a report emitted by a reconciliation operation. The text
 * carries `{name}` placeholders that are filled from the substitutions map when rendered, so the
 * caller decides how and where to display or log it.
 */
public record Message(
    String text, Map<String, String> substitutions, MessageChannel channel, Severity severity) {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([A-Za-z0-9_]+)\\}");

    public Message {
        substitutions = Collections.unmodifiableMap(new LinkedHashMap<>(substitutions));
    }

    public static Message notice(String text, Map<String, String> substitutions) {
        return new Message(text, substitutions, MessageChannel.USER_NOTICE, Severity.INFO);
    }

    public static Message logWarning(String text, Map<String, String> substitutions) {
        return new Message(text, substitutions, MessageChannel.OPERATIONAL_LOG, Severity.WARNING);
    }

    public static Message logError(String text, Map<String, String> substitutions) {
        return new Message(text, substitutions, MessageChannel.OPERATIONAL_LOG, Severity.ERROR);
    }

    /**
     * Replace each `{name}` placeholder in the text with its substitution, in a single pass over
     * the text. Substituted values are not scanned again, and placeholders without a substitution
     * are left untouched.
     *
     * @return Rendered message text
     */
    public String render() {
        Matcher matcher = PLACEHOLDER.matcher(text);
        StringBuilder rendered = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = matcher.group();
            if (substitutions.containsKey(name)) {
                String value = substitutions.get(name);
                replacement = value == null ? "" : value;
            }
            matcher.appendReplacement(rendered, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(rendered);
        return rendered.toString();
    }

    @Override
    public String toString() {
        return "[" + channel.getName() + "/" + severity + "] " + render();
    }
}
