package com.company.dashboards.util;

import java.util.regex.Pattern;

/**
 * Redis-style glob ({@code *}, {@code ?}, {@code [abc]}) compiled to a regex, so the local
 * cache matches keys exactly like a server-side SCAN MATCH would.
 */
public final class GlobPattern {

    private GlobPattern() {
    }

    public static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        boolean inClass = false;
        for (int i = 0; i < glob.length(); i++) {
            char c = glob.charAt(i);
            if (c == '\\' && i + 1 < glob.length()) {
                regex.append(Pattern.quote(String.valueOf(glob.charAt(++i))));
            } else if (inClass) {
                if (c == ']') {
                    inClass = false;
                    regex.append(']');
                } else if (c == '^' && glob.charAt(i - 1) == '[') {
                    regex.append('^');
                } else {
                    regex.append(c == '-' ? "-" : Pattern.quote(String.valueOf(c)));
                }
            } else if (c == '*') {
                regex.append(".*");
            } else if (c == '?') {
                regex.append('.');
            } else if (c == '[' && glob.indexOf(']', i + 1) > i + 1) {
                inClass = true;
                regex.append('[');
            } else {
                regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.DOTALL);
    }
}
