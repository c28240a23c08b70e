package org.kingstonaccess.service.service;

/**
 * Turns arbitrary error text into something safe to put in a one-line note.
 */
public final class ErrorText {

    public static final int DEFAULT_MAX_LENGTH = 240;

    private ErrorText() {
    }

    public static String shorten(String text) {
        return shorten(text, DEFAULT_MAX_LENGTH);
    }

    /**
     * Folds line breaks and runs of whitespace into single spaces and caps the length,
     * marking a cut with an ellipsis.
     */
    public static String shorten(String text, int maxLength) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String oneLine = text.replace('\r', ' ').replace('\n', ' ').trim().replaceAll("\\s+", " ");
        if (oneLine.length() <= maxLength) {
            return oneLine;
        }
        return oneLine.substring(0, maxLength) + "…";
    }
}
