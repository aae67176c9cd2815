package com.chaineditor.chain;

import com.chaineditor.model.ParameterValue;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Wire format of a back-reference token.
 *
 * Syntax:
 *   ={{ $('Fetch').output}}          -> node "Fetch", suffix ".output"
 *   ={{ $("Fetch").items[0].url}}    -> node "Fetch", suffix ".items[0].url"
 *   ={{ $('It\'s').output}}          -> node "It's"
 *
 * Rules:
 *   - The whole string must be exactly one token. Text around it, or a second token, means literal.
 *   - Inside the quotes a backslash escapes the quote character or a backslash; any other
 *     backslash is part of the name, so $('a\b') names "a\b".
 *   - The suffix may not contain "{{", "}}" or "$(".
 */
public final class ReferenceToken {

    static final String OPEN = "={{ $(";
    static final String CLOSE = "}}";

    private static final String SUFFIX = "((?:(?!\\{\\{|\\}\\}|\\$\\().)*)";
    private static final Pattern TOKEN_PATTERN = Pattern.compile(
        "^=\\{\\{ \\$\\((?:'((?:[^'\\\\]|\\\\.)*)'|\"((?:[^\"\\\\]|\\\\.)*)\")\\)" + SUFFIX + "\\}\\}$",
        Pattern.DOTALL);

    private ReferenceToken() {
    }

    /**
     * Parse a string that is exactly one token, or return null for anything else.
     */
    public static ParameterValue.Reference parse(String raw) {
        if (raw == null || !raw.startsWith(OPEN) || !raw.endsWith(CLOSE)) {
            return null;
        }
        Matcher m = TOKEN_PATTERN.matcher(raw);
        if (!m.matches()) {
            return null;
        }
        if (m.group(1) != null) {
            return new ParameterValue.Reference(unescape(m.group(1), '\''), m.group(3), '\'');
        }
        return new ParameterValue.Reference(unescape(m.group(2), '"'), m.group(3), '"');
    }

    public static String format(ParameterValue.Reference reference) {
        char quote = reference.getQuote();
        return OPEN + quote + escape(reference.getNodeName(), quote) + quote + ")" + reference.getPathSuffix() + CLOSE;
    }

    /**
     * Escapes the quote, and a backslash only where it would otherwise read as an escape:
     * before the quote, before another backslash, or at the end of the name.
     */
    private static String escape(String name, char quote) {
        StringBuilder sb = new StringBuilder(name.length() + 2);
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (c == quote) {
                sb.append('\\');
            } else if (c == '\\') {
                char next = i + 1 < name.length() ? name.charAt(i + 1) : quote;
                if (next == '\\' || next == quote) {
                    sb.append('\\');
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }

    /**
     * Only a doubled backslash and a backslash before the quote are escapes; any other backslash is kept.
     */
    private static String unescape(String quoted, char quote) {
        if (quoted.indexOf('\\') < 0) {
            return quoted;
        }
        StringBuilder sb = new StringBuilder(quoted.length());
        for (int i = 0; i < quoted.length(); i++) {
            char c = quoted.charAt(i);
            if (c == '\\' && i + 1 < quoted.length()) {
                char next = quoted.charAt(i + 1);
                if (next == '\\' || next == quote) {
                    c = next;
                    i++;
                }
            }
            sb.append(c);
        }
        return sb.toString();
    }
}
