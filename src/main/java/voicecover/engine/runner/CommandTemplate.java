package voicecover.engine.runner;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable command line with {placeholder} tokens.
 * Rendering substitutes each placeholder inside every argument; no shell is
 * involved, so values are never re-split or interpreted.
 */
public final class CommandTemplate {

    private static final Pattern PLACEHOLDER = Pattern.compile("\\{([a-z_][a-z0-9_]*)}");

    private final List<String> tokens;

    private CommandTemplate(List<String> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    public static CommandTemplate of(String... tokens) {
        return new CommandTemplate(List.of(tokens));
    }

    public static CommandTemplate of(List<String> tokens) {
        return new CommandTemplate(tokens);
    }

    /**
     * Parse a command line string. Whitespace separates arguments; single or
     * double quotes group an argument, backslash escapes the next character
     * outside single quotes.
     */
    public static CommandTemplate parse(String line) {
        if (line == null) {
            return new CommandTemplate(List.of());
        }
        List<String> out = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean inToken = false;
        char quote = 0;

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quote != 0) {
                if (c == quote) {
                    quote = 0;
                } else if (c == '\\' && quote == '"' && i + 1 < line.length()) {
                    current.append(line.charAt(++i));
                } else {
                    current.append(c);
                }
            } else if (c == '\'' || c == '"') {
                quote = c;
                inToken = true;
            } else if (c == '\\' && i + 1 < line.length()) {
                current.append(line.charAt(++i));
                inToken = true;
            } else if (Character.isWhitespace(c)) {
                if (inToken) {
                    out.add(current.toString());
                    current.setLength(0);
                    inToken = false;
                }
            } else {
                current.append(c);
                inToken = true;
            }
        }
        if (quote != 0) {
            throw new IllegalArgumentException("Unterminated quote in command template: " + line);
        }
        if (inToken) {
            out.add(current.toString());
        }
        return new CommandTemplate(out);
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    public List<String> tokens() {
        return tokens;
    }

    /** Executable name, used in diagnostics */
    public String toolName() {
        if (tokens.isEmpty()) {
            return "<none>";
        }
        String exe = tokens.get(0);
        int slash = Math.max(exe.lastIndexOf('/'), exe.lastIndexOf('\\'));
        return slash >= 0 ? exe.substring(slash + 1) : exe;
    }

    /**
     * Substitute placeholders.
     *
     * @throws IllegalArgumentException if the template is empty or references
     *                                  a placeholder with no value
     */
    public List<String> render(Map<String, String> values) {
        if (tokens.isEmpty()) {
            throw new IllegalArgumentException("command template is empty");
        }
        List<String> rendered = new ArrayList<>(tokens.size());
        for (String token : tokens) {
            Matcher m = PLACEHOLDER.matcher(token);
            StringBuilder sb = new StringBuilder();
            while (m.find()) {
                String value = values.get(m.group(1));
                if (value == null) {
                    throw new IllegalArgumentException("unknown placeholder {" + m.group(1) + "}");
                }
                m.appendReplacement(sb, Matcher.quoteReplacement(value));
            }
            m.appendTail(sb);
            rendered.add(sb.toString());
        }
        return rendered;
    }

    @Override
    public String toString() {
        return String.join(" ", tokens);
    }
}
