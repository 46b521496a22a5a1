package com.podscope.filter.support;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.jboss.logging.Logger;

/**
 * Regex and identifier matching used by the id and name filters.
 */
public final class Regexes {

    private static final Logger LOGGER = Logger.getLogger("FILTER.Regexes");

    private static final Pattern NOT_HEX = Pattern.compile("[^0-9a-fA-F]");

    private Regexes() {
    }

    /**
     * True when the value holds hex digits only, which makes it an identifier prefix. The empty
     * string counts as a prefix of every identifier.
     */
    public static boolean isHexPrefix(String value) {
        return !NOT_HEX.matcher(value).find();
    }

    public static Optional<Pattern> compile(String expression) {
        try {
            return Optional.of(Pattern.compile(expression));
        } catch (PatternSyntaxException e) {
            LOGGER.debugv("[REGEX-INVALID] expression={0} reason={1}", expression, e.getDescription());
            return Optional.empty();
        }
    }

    /**
     * Compiles every expression, dropping the ones that are not valid regular expressions.
     */
    public static List<Pattern> compileAll(Collection<String> expressions) {
        List<Pattern> patterns = new ArrayList<>(expressions.size());
        for (String expression : expressions) {
            compile(expression).ifPresent(patterns::add);
        }
        return List.copyOf(patterns);
    }

    /**
     * Unanchored search of each pattern in the candidate.
     */
    public static boolean matchesAny(String candidate, List<Pattern> patterns) {
        if (candidate == null) {
            return false;
        }
        for (Pattern pattern : patterns) {
            if (pattern.matcher(candidate).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Matcher for one identifier query: a lowercase prefix test for hex values, a regex search
     * otherwise. An invalid regex yields a matcher that never matches.
     */
    public static Predicate<String> identifierMatcher(String want) {
        if (isHexPrefix(want)) {
            String prefix = want.toLowerCase(Locale.ROOT);
            return id -> id != null && id.startsWith(prefix);
        }
        return compile(want)
                .<Predicate<String>>map(pattern -> id -> id != null && pattern.matcher(id).find())
                .orElse(id -> false);
    }
}
