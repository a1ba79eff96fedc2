package io.hearthwarrio.pagelens.core.download;

/**
 * File name rules for downloads. Unlike session names, dots and spaces are kept so extensions survive.
 */
final class FileNames {

    static final int MAX_LENGTH = 180;

    private FileNames() {
    }

    /**
     * Replaces path separators, reserved characters and control characters with {@code _}, collapses whitespace and
     * caps the length.
     *
     * @return a name safe to resolve against a directory, {@code fallback} when nothing usable remains
     */
    static String sanitize(String name, String fallback) {
        if (name == null) {
            return fallback;
        }
        StringBuilder sb = new StringBuilder();
        boolean space = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isWhitespace(c)) {
                space = sb.length() > 0;
                continue;
            }
            if (space) {
                sb.append(' ');
                space = false;
            }
            sb.append(c < 0x20 || "<>:\"/\\|?*".indexOf(c) >= 0 ? '_' : c);
        }
        String clean = sb.length() > MAX_LENGTH ? sb.substring(0, MAX_LENGTH) : sb.toString();
        if (clean.isEmpty() || ".".equals(clean) || "..".equals(clean)) {
            return fallback;
        }
        return clean;
    }
}
