package com.filedrop.server.naming;

/**
 * Reduces a sender-supplied filename to a safe basename.
 *
 * <ul>
 * <li>directory components are dropped ({@code /} and {@code \} both count)</li>
 * <li>only letters, digits, {@code .}, {@code -} and {@code _} are kept</li>
 * <li>an empty or dots-only result becomes {@value #PLACEHOLDER}</li>
 * <li>names longer than {@value #MAX_LENGTH} characters lose the end of their stem,
 * never their extension</li>
 * </ul>
 * Sanitizing is idempotent.
 */
public final class FilenameSanitizer {

    public static final String PLACEHOLDER = "unnamed_file";
    public static final int MAX_LENGTH = 255;

    private FilenameSanitizer() {
    }

    public static String sanitize(String filename) {
        String name = basename(filename != null ? filename : "");

        StringBuilder safe = new StringBuilder(name.length());
        name.codePoints()
                .filter(FilenameSanitizer::isAllowed)
                .forEach(safe::appendCodePoint);

        String result = safe.toString();
        if (result.isEmpty() || result.chars().allMatch(c -> c == '.')) {
            return PLACEHOLDER;
        }
        return truncate(result);
    }

    /**
     * Check that a name only contains allowed characters.
     */
    public static boolean isSafe(String name) {
        return name != null && !name.isEmpty() && name.codePoints().allMatch(FilenameSanitizer::isAllowed);
    }

    /**
     * Index of the extension dot, or -1 when the name has no extension.
     * A leading dot ({@code .profile}) and a trailing dot ({@code name.}) do not start one.
     */
    public static int extensionIndex(String name) {
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return -1;
        }
        // ".tar" inside "..tar" is still a leading-dots name
        for (int i = 0; i < dot; i++) {
            if (name.charAt(i) != '.') {
                return dot;
            }
        }
        return -1;
    }

    private static boolean isAllowed(int codePoint) {
        return Character.isLetterOrDigit(codePoint) || codePoint == '.' || codePoint == '-' || codePoint == '_';
    }

    private static String basename(String path) {
        int cut = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return cut >= 0 ? path.substring(cut + 1) : path;
    }

    private static String truncate(String name) {
        int length = name.codePointCount(0, name.length());
        if (length <= MAX_LENGTH) {
            return name;
        }

        int dot = extensionIndex(name);
        String extension = dot >= 0 ? name.substring(dot) : "";
        int extensionLength = extension.codePointCount(0, extension.length());
        if (extensionLength >= MAX_LENGTH) {
            return prefix(name, MAX_LENGTH);
        }

        String stem = dot >= 0 ? name.substring(0, dot) : name;
        return prefix(stem, MAX_LENGTH - extensionLength) + extension;
    }

    private static String prefix(String s, int codePoints) {
        return s.substring(0, s.offsetByCodePoints(0, codePoints));
    }
}
