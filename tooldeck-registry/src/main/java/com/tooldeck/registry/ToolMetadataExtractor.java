package com.tooldeck.registry;

import com.tooldeck.annotations.DeckTool;

import java.util.Objects;

/**
 * Reads {@link DeckTool} off a tool's entry class and fills in defaults for whatever is not declared.
 * <ul>
 *   <li>display name: declared name if non-blank, else the file name without suffix, underscores
 *       replaced by spaces, title-cased ({@code code_app_5.jar} → {@code Code App 5})</li>
 *   <li>description: declared or empty</li>
 *   <li>priority: declared or {@value DeckTool#DEFAULT_ORDER}</li>
 *   <li>numeric id: first run of digits after the prefix ({@code code10.jar} → 10), else
 *       {@value ToolDescriptor#NO_NUMERIC_ID}</li>
 * </ul>
 */
public final class ToolMetadataExtractor {

    private final String prefix;
    private final String suffix;

    public ToolMetadataExtractor(String prefix, String suffix) {
        this.prefix = Objects.requireNonNull(prefix, "prefix");
        this.suffix = Objects.requireNonNull(suffix, "suffix");
    }

    public ToolDescriptor extract(Class<?> entryClass, String fileName) {
        Objects.requireNonNull(fileName, "fileName");
        DeckTool declared = entryClass != null ? entryClass.getAnnotation(DeckTool.class) : null;
        String displayName = declared != null && !declared.name().isBlank()
                ? declared.name().trim()
                : displayNameFromFileName(fileName);
        String description = declared != null ? declared.description() : "";
        int priority = declared != null ? declared.order() : DeckTool.DEFAULT_ORDER;
        return new ToolDescriptor(displayName, description, priority, numericIdFromFileName(fileName));
    }

    /** {@code code_app_5.jar} → {@code Code App 5}. */
    String displayNameFromFileName(String fileName) {
        return titleCase(stripSuffix(fileName).replace('_', ' '));
    }

    /** {@code code10.jar} → 10, {@code code_app_5.jar} → 5, {@code code_app.jar} → {@value ToolDescriptor#NO_NUMERIC_ID}. */
    int numericIdFromFileName(String fileName) {
        String stem = stripSuffix(fileName);
        String rest = stem.startsWith(prefix) ? stem.substring(prefix.length()) : stem;
        int start = -1;
        for (int i = 0; i < rest.length(); i++) {
            if (Character.isDigit(rest.charAt(i))) {
                start = i;
                break;
            }
        }
        if (start < 0) {
            return ToolDescriptor.NO_NUMERIC_ID;
        }
        int end = start;
        while (end < rest.length() && Character.isDigit(rest.charAt(end))) {
            end++;
        }
        try {
            return Integer.parseInt(rest.substring(start, end));
        } catch (NumberFormatException e) {
            return ToolDescriptor.NO_NUMERIC_ID;
        }
    }

    /**
     * Upper-cases the first letter of every run of letters and lower-cases the rest, so a letter
     * following a digit or space starts a new word ({@code code10x} → {@code Code10X}).
     */
    static String titleCase(String value) {
        StringBuilder sb = new StringBuilder(value.length());
        boolean previousLetter = false;
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (Character.isLetter(c)) {
                sb.append(previousLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousLetter = true;
            } else {
                sb.append(c);
                previousLetter = false;
            }
        }
        return sb.toString();
    }

    private String stripSuffix(String fileName) {
        return fileName.endsWith(suffix) ? fileName.substring(0, fileName.length() - suffix.length()) : fileName;
    }
}
