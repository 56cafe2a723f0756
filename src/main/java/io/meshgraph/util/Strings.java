package io.meshgraph.util;

public final class Strings {
    private Strings() {
    }

    /**
     * Drops non-ASCII characters, trims, and collapses whitespace runs. Returns null for
     * null or for input that is empty after cleaning.
     */
    public static String sanitize(String input) {
        if (input == null) {
            return null;
        }
        StringBuilder sb = new StringBuilder(input.length());
        boolean space = false;
        for (int i = 0; i < input.length(); i++) {
            char ch = input.charAt(i);
            if (ch > 0x7F || (Character.isISOControl(ch) && !Character.isWhitespace(ch))) {
                continue;
            }
            if (Character.isWhitespace(ch)) {
                space = sb.length() > 0;
                continue;
            }
            if (space) {
                sb.append(' ');
                space = false;
            }
            sb.append(ch);
        }
        return sb.length() == 0 ? null : sb.toString();
    }
}
