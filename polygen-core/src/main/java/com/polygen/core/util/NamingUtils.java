package com.polygen.core.util;

import java.util.Locale;

/**
 * Name transformations used for synthesized type names and relation names.
 */
public final class NamingUtils {

    private NamingUtils() {
        // Utility class
    }

    /**
     * Converts a snake_case or camelCase name to PascalCase.
     *
     * <p>{@code drop_items} becomes {@code DropItems}; {@code dropItems} becomes
     * {@code DropItems}.
     *
     * @param name source name
     * @return PascalCase name
     */
    public static String toPascalCase(String name) {
        StringBuilder sb = new StringBuilder(name.length());
        boolean upperNext = true;
        for (char c : name.toCharArray()) {
            if (c == '_' || c == '-' || c == ' ') {
                upperNext = true;
            } else if (upperNext) {
                sb.append(Character.toUpperCase(c));
                upperNext = false;
            } else {
                sb.append(c);
            }
        }
        return sb.toString();
    }

    /**
     * Converts a name to lowerCamelCase.
     *
     * @param name source name
     * @return lowerCamelCase name
     */
    public static String toLowerCamel(String name) {
        String pascal = toPascalCase(name);
        if (pascal.isEmpty()) {
            return pascal;
        }
        return Character.toLowerCase(pascal.charAt(0)) + pascal.substring(1);
    }

    /**
     * English plural of a word using the regular suffix rules.
     *
     * <p>{@code Category} becomes {@code Categories}, {@code Box} becomes {@code Boxes},
     * {@code PlayerSkill} becomes {@code PlayerSkills}.
     *
     * @param word singular word
     * @return plural form
     */
    public static String pluralize(String word) {
        if (word.isEmpty()) {
            return word;
        }
        String lower = word.toLowerCase(Locale.ROOT);
        if (lower.endsWith("y") && lower.length() > 1 && !isVowel(lower.charAt(lower.length() - 2))) {
            return word.substring(0, word.length() - 1) + "ies";
        }
        if (lower.endsWith("s") || lower.endsWith("x") || lower.endsWith("z")
            || lower.endsWith("ch") || lower.endsWith("sh")) {
            return word + "es";
        }
        return word + "s";
    }

    /**
     * Last segment of a dotted path.
     *
     * @param path dotted path
     * @return simple name
     */
    public static String simpleName(String path) {
        int dot = path.lastIndexOf('.');
        return dot < 0 ? path : path.substring(dot + 1);
    }

    /**
     * Joins a parent FQN and a child name; the root namespace has an empty FQN.
     *
     * @param parent parent FQN, possibly empty
     * @param child child name
     * @return qualified name
     */
    public static String qualify(String parent, String child) {
        if (parent == null || parent.isEmpty()) {
            return child;
        }
        return parent + "." + child;
    }

    /**
     * Everything before the last dot of a path, or the empty string.
     *
     * @param path dotted path
     * @return parent path
     */
    public static String parentOf(String path) {
        int dot = path.lastIndexOf('.');
        return dot < 0 ? "" : path.substring(0, dot);
    }

    private static boolean isVowel(char c) {
        return "aeiou".indexOf(c) >= 0;
    }
}
