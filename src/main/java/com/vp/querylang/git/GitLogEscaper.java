package com.vp.querylang.git;

/**
 * Escapes query values for use inside a double-quoted {@code git log} pattern argument.
 *
 * <p>The output passes through the shell's double-quote handling and then git's basic regular
 * expressions, so:
 * <ul>
 *   <li>{@code \} and {@code $} become {@code \\\} followed by the character</li>
 *   <li>{@code .} and {@code [} are prefixed with {@code \}</li>
 *   <li>{@code *} becomes {@code .*}, keeping the query language's wildcard meaning</li>
 * </ul>
 * Other characters, including {@code "}, pass unchanged.
 */
final class GitLogEscaper {

    private GitLogEscaper() {
    }

    static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\':
                case '$':
                    sb.append("\\\\\\").append(c);
                    break;
                case '.':
                case '[':
                    sb.append('\\').append(c);
                    break;
                case '*':
                    sb.append(".*");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.toString();
    }
}
