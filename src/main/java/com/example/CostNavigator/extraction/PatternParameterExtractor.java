package com.example.CostNavigator.extraction;

import com.example.CostNavigator.geo.GeoMath;
import com.example.CostNavigator.model.RankingIntent;
import com.example.CostNavigator.util.RequestBudget;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Deterministic extraction over a fixed grammar. Never performs I/O.
 *
 * <ul>
 *   <li>code: {@code drg|ms-drg|code|procedure [#] ddd}, or a bare 3-digit number that is
 *       not a distance or a dollar amount and does not follow "top" or "within"</li>
 *   <li>ZIP: {@code ddddd} with an optional {@code -dddd} suffix, preferring one after
 *       near/of/in/around/zip/from/at/by, else the last one; amounts and distances never count</li>
 *   <li>radius: number followed by km / kilometers / mi / miles (miles converted to km)</li>
 *   <li>intent, first match wins: price words, then rating words, then "average",
 *       then "top N" / "nearest" / "closest"</li>
 *   <li>limit: "top N" or "N cheapest|best|closest|nearest|lowest"</li>
 *   <li>procedure text (only when no code): the phrase after for/of/on/about, or after a
 *       superlative, up to a location word or punctuation, with filler words removed</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
public class PatternParameterExtractor implements ParameterExtractor {

    private static final Logger log = LoggerFactory.getLogger(PatternParameterExtractor.class);

    private static final String UNIT = "(km|kms|kilometers?|kilometres?|mi|miles?)";

    private static final String CURRENCY = "(?:dollars?|usd|bucks)";

    private static final Pattern ZIP = Pattern.compile("(?<![\\d.$,])(\\d{5})(?:-\\d{4})?(?!\\d|[.,]\\d)");

    private static final Pattern ZIP_ANCHOR = Pattern.compile(
            "\\b(?:near|of|in|around|zip|code|from|at|by)\\s*[:#]?\\s*$");

    private static final Pattern QUANTITY_AFTER = Pattern.compile("^\\s*(?:" + UNIT + "|" + CURRENCY + ")\\b");

    private static final Pattern CURRENCY_BEFORE = Pattern.compile("\\b" + CURRENCY + "\\s*$");

    private static final Pattern RADIUS = Pattern.compile(
            "(?<![\\d.])(\\d+(?:\\.\\d+)?)\\s*" + UNIT + "\\b");

    private static final Pattern PREFIXED_CODE = Pattern.compile(
            "\\b(?:ms-drg|drg|code|procedure)\\s*(?:code\\s*)?#?\\s*(\\d{3})(?!\\d)");

    private static final Pattern BARE_CODE = Pattern.compile(
            "(?<!top\\s)(?<!within\\s)(?<![\\d.$,])(\\d{3})(?!\\d|[.,]\\d)(?!\\s*" + UNIT + "\\b)(?!\\s*" + CURRENCY + "\\b)");

    private static final Pattern TOP_N = Pattern.compile(
            "\\btop\\s+(\\d{1,2})\\b|\\b(\\d{1,2})\\s+(?:cheapest|best|closest|nearest|lowest)\\b");

    private static final Pattern CHEAPEST_WORDS = Pattern.compile(
            "\\b(cheap|cheapest|cheaper|lowest|least expensive|affordable|inexpensive|low[\\s-]cost)\\b");

    private static final Pattern BEST_RATED_WORDS = Pattern.compile(
            "\\b(best[\\s-]rated|highest[\\s-]rated|top[\\s-]rated|best|highest rating|ratings?|rated|quality)\\b");

    private static final Pattern AVERAGE_WORDS = Pattern.compile("\\b(average|avg|typical cost)\\b");

    private static final Pattern NEAREST_WORDS = Pattern.compile("\\b(top\\s+\\d{1,2}|nearest|closest)\\b");

    private static final String PHRASE_END =
            "(?=\\s+(?:within|near|around|in|close\\s+to|by|at|from|under)\\b|[,?.!;]|$)";

    private static final Pattern TEXT_AFTER_PREPOSITION = Pattern.compile(
            "\\b(?:for|of|on|about|needing)\\s+(?:an?\\s+|the\\s+|my\\s+)?(.+?)" + PHRASE_END);

    private static final Pattern TEXT_AFTER_SUPERLATIVE = Pattern.compile(
            "\\b(?:cheapest|cheap|best[\\s-]rated|top[\\s-]rated|best|affordable|nearest|closest)\\s+(.+?)" + PHRASE_END);

    private static final Set<String> FILLER_WORDS = Set.of(
            "a", "an", "the", "for", "of", "to", "me", "my", "is", "are", "which", "who", "what", "where",
            "hospital", "hospitals", "provider", "providers", "procedure", "procedures", "place", "places",
            "cheap", "cheapest", "lowest", "best", "rated", "top", "highest", "rating", "ratings", "quality",
            "price", "prices", "cost", "costs", "charge", "charges", "average", "nearest", "closest",
            "drg", "ms", "ms-drg", "code", "zip", "km", "miles", "mile", "mi", "kilometers", "options", "option",
            "surgery", "treatment", "near", "find", "show", "get", "need", "want", "i"
    );

    private final DraftValidator validator;

    @Override
    public ExtractionResult extract(String question, RequestBudget budget) {
        return new ExtractionResult(parse(question), ExtractionOrigin.PATTERN);
    }

    /**
     * Parse and validate without a budget; the grammar never blocks.
     */
    public QuerySpecDraft parse(String question) {
        if (question == null || question.isBlank()) {
            return QuerySpecDraft.empty();
        }
        String q = question.toLowerCase(Locale.ROOT).strip();

        String zip = parseZip(q);
        Double radiusKm = parseRadius(q);
        String code = firstGroup(PREFIXED_CODE, q);
        if (code == null) {
            code = firstGroup(BARE_CODE, stripZipCodes(q));
        }
        String text = code == null ? parseProcedureText(q) : null;
        RankingIntent intent = parseIntent(q);
        Integer limit = parseLimit(q);

        QuerySpecDraft raw = new QuerySpecDraft(code, text, zip, radiusKm, intent, limit);
        var validation = validator.validate(raw);
        if (!validation.valid()) {
            log.debug("Pattern extraction dropped fields: {}", validation.violations());
        }
        return validation.draft();
    }

    static String parseZip(String q) {
        Matcher m = ZIP.matcher(q);
        String last = null;
        while (m.find()) {
            String before = q.substring(0, m.start());
            if (QUANTITY_AFTER.matcher(q.substring(m.end())).find() || CURRENCY_BEFORE.matcher(before).find()) {
                continue;
            }
            if (ZIP_ANCHOR.matcher(before).find()) {
                return m.group(1);
            }
            last = m.group(1);
        }
        return last;
    }

    private static Double parseRadius(String q) {
        Matcher m = RADIUS.matcher(q);
        if (!m.find()) {
            return null;
        }
        double value = Double.parseDouble(m.group(1));
        return m.group(2).startsWith("mi") ? GeoMath.milesToKm(value) : value;
    }

    private static RankingIntent parseIntent(String q) {
        if (CHEAPEST_WORDS.matcher(q).find()) {
            return RankingIntent.CHEAPEST;
        }
        if (BEST_RATED_WORDS.matcher(q).find()) {
            return RankingIntent.BEST_RATED;
        }
        if (AVERAGE_WORDS.matcher(q).find()) {
            return RankingIntent.AVERAGE_COST;
        }
        if (NEAREST_WORDS.matcher(q).find()) {
            return RankingIntent.TOP_N;
        }
        return null;
    }

    private static Integer parseLimit(String q) {
        Matcher m = TOP_N.matcher(q);
        if (!m.find()) {
            return null;
        }
        String n = m.group(1) != null ? m.group(1) : m.group(2);
        return Integer.valueOf(n);
    }

    private static String parseProcedureText(String q) {
        String text = firstCleanPhrase(TEXT_AFTER_PREPOSITION, q);
        return text != null ? text : firstCleanPhrase(TEXT_AFTER_SUPERLATIVE, q);
    }

    private static String firstCleanPhrase(Pattern pattern, String q) {
        Matcher m = pattern.matcher(q);
        while (m.find()) {
            String cleaned = dropFillers(m.group(1));
            if (!cleaned.isEmpty()) {
                return cleaned;
            }
        }
        return null;
    }

    private static String dropFillers(String phrase) {
        return Arrays.stream(phrase.split("[^a-z0-9-]+"))
                .filter(token -> !token.isBlank())
                .filter(token -> !FILLER_WORDS.contains(token))
                .filter(token -> !token.chars().allMatch(Character::isDigit))
                .collect(Collectors.joining(" "));
    }

    private static String stripZipCodes(String q) {
        return ZIP.matcher(q).replaceAll(" ");
    }

    private static String firstGroup(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        return m.find() ? m.group(1) : null;
    }
}
