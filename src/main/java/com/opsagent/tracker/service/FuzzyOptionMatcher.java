package com.opsagent.tracker.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.UnaryOperator;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Best-effort option label matching once an exact lookup has failed.
 *
 * Strategies run in a fixed order and the first one that produces a result wins. The last strategy
 * (unique substring) refuses to guess: several candidates yield an ambiguous match, never a pick.
 */
@Component
public class FuzzyOptionMatcher {

    private static final Logger logger = LoggerFactory.getLogger(FuzzyOptionMatcher.class);

    private static final Pattern ALL_WHITESPACE =
            Pattern.compile("[\\s\\u00A0\\u2000-\\u200B\\u202F\\u205F\\u3000]+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern NON_WORD =
            Pattern.compile("[^\\w\\u4e00-\\u9fa5]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final String UNIT_SUFFIXES = "gmktp";

    @FunctionalInterface
    interface MatchStrategy {
        OptionMatch apply(String input, Map<String, String> options);
    }

    private final List<MatchStrategy> strategies = List.of(
            byEquality("normalized", FuzzyOptionMatcher::normalize),
            byEquality("symbol normalized", FuzzyOptionMatcher::normalizeSymbols),
            byEquality("extreme cleaned", FuzzyOptionMatcher::cleanAll),
            FuzzyOptionMatcher::unitCompletion,
            FuzzyOptionMatcher::uniqueSubstring
    );

    public OptionMatch match(String input, Map<String, String> options) {
        if (input == null || input.isBlank() || options == null || options.isEmpty()) {
            return OptionMatch.none();
        }
        for (MatchStrategy strategy : strategies) {
            OptionMatch result = strategy.apply(input, options);
            if (result.matched() || result.isAmbiguous()) {
                return result;
            }
        }
        return OptionMatch.none();
    }

    static String normalize(String value) {
        return value.toLowerCase(Locale.ROOT).strip().replace(" ", "");
    }

    static String normalizeSymbols(String value) {
        String result = ALL_WHITESPACE.matcher(value.toLowerCase(Locale.ROOT)).replaceAll("");
        return result.replace("（", "(")
                .replace("）", ")")
                .replace("，", ",")
                .replace("；", ";")
                .replace("：", ":")
                .replace("°", "")
                .replace("deg", "");
    }

    static String cleanAll(String value) {
        return NON_WORD.matcher(value).replaceAll("").toLowerCase(Locale.ROOT);
    }

    private static MatchStrategy byEquality(String strategyName, UnaryOperator<String> normalizer) {
        return (input, options) -> {
            String target = normalizer.apply(input.toLowerCase(Locale.ROOT).strip());
            if (target.isEmpty()) {
                return OptionMatch.none();
            }
            for (Map.Entry<String, String> option : options.entrySet()) {
                if (target.equals(normalizer.apply(option.getKey()))) {
                    logger.info("Fuzzy match ({}): '{}' -> '{}'", strategyName, input, option.getKey());
                    return OptionMatch.of(option.getKey(), option.getValue());
                }
            }
            return OptionMatch.none();
        };
    }

    // "32g" -> "32gb"
    private static OptionMatch unitCompletion(String input, Map<String, String> options) {
        String target = normalize(input);
        if (target.isEmpty() || UNIT_SUFFIXES.indexOf(target.charAt(target.length() - 1)) < 0) {
            return OptionMatch.none();
        }
        String completed = target + "b";
        for (Map.Entry<String, String> option : options.entrySet()) {
            if (completed.equals(normalize(option.getKey()))) {
                logger.info("Fuzzy match (unit fix): '{}' -> '{}'", input, option.getKey());
                return OptionMatch.of(option.getKey(), option.getValue());
            }
        }
        return OptionMatch.none();
    }

    private static OptionMatch uniqueSubstring(String input, Map<String, String> options) {
        String target = normalize(input);
        if (target.isEmpty()) {
            return OptionMatch.none();
        }
        List<Map.Entry<String, String>> candidates = new ArrayList<>();
        for (Map.Entry<String, String> option : options.entrySet()) {
            String label = normalize(option.getKey());
            if (!label.isEmpty() && (label.contains(target) || target.contains(label))) {
                candidates.add(option);
            }
        }
        if (candidates.size() == 1) {
            Map.Entry<String, String> only = candidates.get(0);
            logger.info("Fuzzy match (unique substring): '{}' -> '{}'", input, only.getKey());
            return OptionMatch.of(only.getKey(), only.getValue());
        }
        if (candidates.size() > 1) {
            List<String> labels = candidates.stream().map(Map.Entry::getKey).collect(Collectors.toList());
            logger.warn("Ambiguous fuzzy match for '{}': {}", input, labels);
            return OptionMatch.ambiguous(labels);
        }
        return OptionMatch.none();
    }
}
