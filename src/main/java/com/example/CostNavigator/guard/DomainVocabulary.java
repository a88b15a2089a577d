package com.example.CostNavigator.guard;

import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

/**
 * Keyword check for whether a question is about hospitals, procedures, prices or ratings.
 *
 * Location words ("near", "zip") and bare superlatives ("cheapest", "best") are not
 * signals on their own; "cheapest gas near 10001" is not a hospital question.
 */
final class DomainVocabulary {

    private static final Set<String> WORDS = Set.of(
            "drg", "ms-drg", "hospital", "hospitals", "provider", "providers", "clinic", "clinics",
            "doctor", "doctors", "physician", "physicians", "patient", "patients", "health", "healthcare",
            "procedure", "procedures", "treatment", "treatments", "operation", "operations", "care",
            "cost", "costs", "price", "prices", "pricing", "priced", "charge", "charges", "charged",
            "payment", "payments", "fee", "fees", "bill", "billing", "insurance", "covered",
            "rating", "ratings", "rated", "quality",
            "knee", "knees", "hip", "hips", "joint", "heart", "chest", "stroke", "spine", "spinal",
            "kidney", "liver", "lung", "lungs", "colon", "bowel", "hernia", "asthma", "copd", "sepsis",
            "cancer", "tumor", "birth", "childbirth", "c-section", "mri", "icu", "stent", "wound",
            "shoulder", "elbow", "wrist", "ankle", "blood", "thyroid"
    );

    private static final String[] STEMS = {
            "hospit", "medic", "surg", "diagnos", "therap", "cardi", "coronar", "arrhythm", "pacemak",
            "defibrillat", "cerebr", "neuro", "seizure", "fractur", "orthop", "renal", "dialys", "urinar",
            "hepat", "pancrea", "gallbladder", "cholecyst", "appendic", "intestin", "gastro", "esophag",
            "pulmon", "pneumon", "respirat", "ventilat", "bronch", "septic", "infect", "diabet", "oncolog",
            "chemo", "pregnan", "cesarean", "obstet", "matern", "newborn", "transplant", "amputat",
            "psych", "detox", "rehab", "syncope", "dehydrat", "trauma", "cellulit", "transfus", "anemi",
            "vascular", "aneurysm", "angioplast", "catheter", "implant", "mastectom", "hysterectom",
            "prostat", "colonoscop", "endoscop"
    };

    private DomainVocabulary() {
    }

    static boolean mentionsDomain(String question) {
        if (question == null || question.isBlank()) {
            return false;
        }
        return Arrays.stream(question.toLowerCase(Locale.ROOT).split("[^a-z0-9-]+"))
                .filter(token -> !token.isBlank())
                .anyMatch(DomainVocabulary::isSignal);
    }

    private static boolean isSignal(String token) {
        if (WORDS.contains(token)) {
            return true;
        }
        for (String stem : STEMS) {
            if (token.startsWith(stem)) {
                return true;
            }
        }
        return false;
    }
}
