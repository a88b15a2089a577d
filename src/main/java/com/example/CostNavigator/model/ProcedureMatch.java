package com.example.CostNavigator.model;

/**
 * Either an exact 3-digit MS-DRG code or a normalized fuzzy text fragment, never both.
 */
public record ProcedureMatch(String code, String text) {

    public ProcedureMatch {
        if ((code == null) == (text == null)) {
            throw new IllegalArgumentException("exactly one of code or text is required");
        }
    }

    public static ProcedureMatch exactCode(String code) {
        return new ProcedureMatch(code, null);
    }

    public static ProcedureMatch fuzzyText(String text) {
        return new ProcedureMatch(null, text);
    }

    public boolean isExactCode() {
        return code != null;
    }

    @Override
    public String toString() {
        return isExactCode() ? "code:" + code : "text:" + text;
    }
}
