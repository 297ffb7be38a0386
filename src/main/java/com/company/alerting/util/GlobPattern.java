package com.company.alerting.util;

import java.util.regex.Pattern;

/**
 * Shell-style wildcard matching for service patterns: {@code *}, {@code ?},
 * {@code [seq]} and {@code [!seq]}. Unlike path globs, {@code *} also crosses
 * {@code /} and {@code .}.
 */
public final class GlobPattern {

    private GlobPattern() {
    }

    public static boolean matches(String pattern, String value) {
        if (pattern == null) {
            return false;
        }
        return toRegex(pattern).matcher(value == null ? "" : value).matches();
    }

    public static Pattern toRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        int i = 0;
        int n = glob.length();
        while (i < n) {
            char c = glob.charAt(i++);
            switch (c) {
                case '*' -> regex.append(".*");
                case '?' -> regex.append('.');
                case '[' -> {
                    int j = i;
                    if (j < n && glob.charAt(j) == '!') j++;
                    if (j < n && glob.charAt(j) == ']') j++;
                    while (j < n && glob.charAt(j) != ']') j++;
                    if (j >= n) {
                        // Unterminated class is a literal bracket
                        regex.append("\\[");
                    } else {
                        String body = glob.substring(i, j).replace("\\", "\\\\");
                        i = j + 1;
                        if (body.startsWith("!")) {
                            body = "^" + body.substring(1);
                        } else if (body.startsWith("^")) {
                            body = "\\" + body;
                        }
                        regex.append('[').append(body).append(']');
                    }
                }
                default -> regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
