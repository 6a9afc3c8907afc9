package io.github.jsummarise.selector;

import io.github.jsummarise.exception.InvalidArgumentException;

import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import static java.lang.String.format;

/**
 * Shell style wildcards: * any run of characters, ? one character, [abc] / [a-c] / [!abc] character classes.
 * Inside a class every character but the range dash is literal, and a ] right after [ or [! belongs to the class.
 */
final class Globs {
    private Globs() {
    }

    static boolean isGlob(String name) {
        return name.indexOf('*') >= 0 || name.indexOf('?') >= 0 || name.indexOf('[') >= 0;
    }

    /**
     * @throws InvalidArgumentException if a character class holds a reversed range such as [z-a]
     */
    static Pattern toPattern(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        int i = 0;
        while (i < glob.length()) {
            char c = glob.charAt(i++);
            switch (c) {
                case '*':
                    regex.append(".*");
                    break;
                case '?':
                    regex.append('.');
                    break;
                case '[': {
                    boolean negated = i < glob.length() && glob.charAt(i) == '!';
                    int bodyStart = negated ? i + 1 : i;
                    int end = glob.indexOf(']', bodyStart + 1);
                    if (bodyStart >= glob.length() || end < 0) {
                        regex.append("\\[");
                        break;
                    }
                    regex.append(negated ? "[^" : "[");
                    appendClassBody(regex, glob.substring(bodyStart, end));
                    regex.append(']');
                    i = end + 1;
                    break;
                }
                default:
                    regex.append(Pattern.quote(String.valueOf(c)));
            }
        }
        try {
            return Pattern.compile(regex.toString());
        } catch (PatternSyntaxException e) {
            throw new InvalidArgumentException(format("invalid glob '%s': %s", glob, e.getDescription()));
        }
    }

    private static void appendClassBody(StringBuilder regex, String body) {
        for (int j = 0; j < body.length(); j++) {
            char c = body.charAt(j);
            if (Character.isLetterOrDigit(c) || c == '-') {
                regex.append(c);
            } else {
                regex.append('\\').append(c);
            }
        }
    }
}
