package com.example.CostNavigator.extraction;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * The one validation pass every draft goes through, whichever strategy produced it.
 * Each field is checked on its own; a field that fails is removed from the draft and
 * reported as a {@link Violation}. Callers decide whether violations are fatal.
 */
@Component
public class DraftValidator {

    private static final Pattern DRG_CODE = Pattern.compile("\\d{3}");
    private static final Pattern ZIP5 = Pattern.compile("\\d{5}");
    private static final Pattern ZIP_PLUS4 = Pattern.compile("(\\d{5})-\\d{4}");
    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");
    private static final Pattern LETTER = Pattern.compile("[a-z]");

    static final int MAX_TEXT_LENGTH = 80;
    private static final int MIN_TEXT_LETTERS = 3;

    public Validation validate(QuerySpecDraft raw) {
        if (raw == null) {
            return new Validation(QuerySpecDraft.empty(), List.of());
        }
        List<Violation> violations = new ArrayList<>();

        String code = null;
        if (raw.procedureCode() != null) {
            String trimmed = raw.procedureCode().trim();
            if (DRG_CODE.matcher(trimmed).matches()) {
                code = trimmed;
            } else {
                violations.add(new Violation("drg", "DRG code must be exactly 3 digits"));
            }
        }

        String text = null;
        if (raw.procedureText() != null && code == null) {
            text = normalizeText(raw.procedureText());
            if (text == null) {
                violations.add(new Violation("drg", "Procedure text must contain at least "
                        + MIN_TEXT_LETTERS + " letters"));
            }
        }

        String zip = null;
        if (raw.postalCode() != null) {
            zip = normalizeZip(raw.postalCode());
            if (zip == null) {
                violations.add(new Violation("zip", "ZIP code must be 5 digits"));
            }
        }

        Double radius = raw.radiusKm();
        if (radius != null && (radius.isNaN() || radius.isInfinite())) {
            violations.add(new Violation("radius_km", "Radius must be a finite number"));
            radius = null;
        }

        QuerySpecDraft cleaned = new QuerySpecDraft(code, text, zip, radius, raw.rankingIntent(), raw.limit());
        return new Validation(cleaned, List.copyOf(violations));
    }

    /**
     * Lower-case letters, digits and single spaces, cut at a word boundary.
     * Returns null when fewer than three letters survive.
     */
    static String normalizeText(String text) {
        String normalized = NON_ALNUM.matcher(text.toLowerCase(Locale.ROOT)).replaceAll(" ").trim();
        if (normalized.length() > MAX_TEXT_LENGTH) {
            int cut = normalized.lastIndexOf(' ', MAX_TEXT_LENGTH);
            normalized = (cut > 0 ? normalized.substring(0, cut) : normalized.substring(0, MAX_TEXT_LENGTH)).trim();
        }
        long letters = LETTER.matcher(normalized).results().count();
        return letters < MIN_TEXT_LETTERS ? null : normalized;
    }

    static String normalizeZip(String zip) {
        String trimmed = zip.trim();
        if (ZIP5.matcher(trimmed).matches()) {
            return trimmed;
        }
        var plus4 = ZIP_PLUS4.matcher(trimmed);
        return plus4.matches() ? plus4.group(1) : null;
    }

    public record Violation(String field, String reason) {
    }

    public record Validation(QuerySpecDraft draft, List<Violation> violations) {

        public boolean valid() {
            return violations.isEmpty();
        }
    }
}
