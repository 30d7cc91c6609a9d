package com.codesentinel.core.scoring;

import com.codesentinel.core.model.LineContext;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Halstead volume proxy over lexical tokens.
 *
 * <p>Every token of the code text (identifiers, keywords, numbers, string literals and
 * operator symbols) counts; {@code V = N * log2(n)} with {@code N} total and {@code n}
 * distinct tokens. Operators and operands are not separated.
 *
 * @since 1.0.0
 */
public final class HalsteadEstimator {

    private static final Pattern TOKEN = Pattern.compile(
        "[A-Za-z_]\\w*"
            + "|\\d+(?:\\.\\d+)?"
            + "|\"[^\"]*\"|'[^']*'"
            + "|\\*\\*=?|//=?|<<=?|>>=?|->|[-+*/%@&|^<>!=]=|[-+*/%@&|^~<>=.,:;()\\[\\]{}]"
    );

    private HalsteadEstimator() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Estimates the Halstead volume of a unit.
     *
     * @param lines line facts
     * @return volume, 0 for a unit without tokens
     */
    public static double volume(List<LineContext> lines) {
        long total = 0;
        Set<String> distinct = new HashSet<>();
        for (LineContext line : lines) {
            Matcher matcher = TOKEN.matcher(line.codeText());
            while (matcher.find()) {
                total++;
                distinct.add(matcher.group());
            }
        }
        if (total == 0) {
            return 0.0;
        }
        int vocabulary = Math.max(2, distinct.size());
        return total * (Math.log(vocabulary) / Math.log(2));
    }
}
