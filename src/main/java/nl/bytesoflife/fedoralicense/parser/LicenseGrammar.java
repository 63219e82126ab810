package nl.bytesoflife.fedoralicense.parser;

import nl.bytesoflife.fedoralicense.model.LicenseFormat;

/**
 * Token rules of the two license string grammars. Both share the rule set
 * <pre>
 *   start      : expression END
 *   expression : and_expr (OR expression)?
 *   and_expr   : atom (AND and_expr)?
 *   atom       : '(' expression ')' | identifier
 * </pre>
 * and differ only in their keywords and in what an identifier may contain.
 */
public enum LicenseGrammar {

    /**
     * Lowercase {@code and}/{@code or}; identifiers may contain spaces, e.g. {@code Artistic 2.0}.
     */
    LEGACY(LicenseFormat.LEGACY, "and", "or") {
        @Override
        public int identifierEnd(String input, int start) {
            int end = start;
            int i = start;
            while (i < input.length()) {
                char c = input.charAt(i);
                if (Character.isWhitespace(c)) {
                    i++;
                    continue;
                }
                if (!isWordChar(c) && c != '.' && c != '+') {
                    break;
                }
                if (matchKeyword(input, i, andKeyword()) >= 0 || matchKeyword(input, i, orKeyword()) >= 0) {
                    break;
                }
                i++;
                end = i;
            }
            return end;
        }

        @Override
        protected boolean isKeywordBoundary(char c) {
            return c == ' ' || c == '\t' || c == '(' || c == ')';
        }
    },

    /**
     * Uppercase {@code AND}/{@code OR}; identifiers are SPDX ids such as {@code GPL-2.0-or-later}.
     */
    SPDX(LicenseFormat.SPDX, "AND", "OR") {
        @Override
        public int identifierEnd(String input, int start) {
            int end = start;
            while (end < input.length()) {
                char c = input.charAt(end);
                if (!isWordChar(c) && c != '-' && c != '.') {
                    break;
                }
                end++;
            }
            String token = input.substring(start, end);
            if (token.equals(andKeyword()) || token.equals(orKeyword())) {
                return start;
            }
            return end;
        }
    };

    private final LicenseFormat format;
    private final String andKeyword;
    private final String orKeyword;

    LicenseGrammar(LicenseFormat format, String andKeyword, String orKeyword) {
        this.format = format;
        this.andKeyword = andKeyword;
        this.orKeyword = orKeyword;
    }

    public LicenseFormat format() {
        return format;
    }

    public String andKeyword() {
        return andKeyword;
    }

    public String orKeyword() {
        return orKeyword;
    }

    /**
     * Returns the end offset of the identifier starting at {@code start}, or
     * {@code start} itself when no identifier starts there. The returned end never
     * includes trailing whitespace.
     */
    public abstract int identifierEnd(String input, int start);

    /**
     * Matches {@code keyword} as a whole word at {@code pos}: it must be preceded
     * and followed by a {@linkplain #isKeywordBoundary boundary} or the string boundary.
     *
     * @return the offset just past the keyword, or -1 if it does not match
     */
    public int matchKeyword(String input, int pos, String keyword) {
        if (!input.startsWith(keyword, pos)) {
            return -1;
        }
        if (pos > 0 && !isKeywordBoundary(input.charAt(pos - 1))) {
            return -1;
        }
        int end = pos + keyword.length();
        if (end < input.length() && !isKeywordBoundary(input.charAt(end))) {
            return -1;
        }
        return end;
    }

    public static LicenseGrammar forFormat(LicenseFormat format) {
        return switch (format) {
            case LEGACY -> LEGACY;
            case SPDX -> SPDX;
        };
    }

    static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

    /**
     * Characters that may sit next to a keyword. Legacy keywords only accept
     * horizontal whitespace.
     */
    protected boolean isKeywordBoundary(char c) {
        return Character.isWhitespace(c) || c == '(' || c == ')';
    }
}
