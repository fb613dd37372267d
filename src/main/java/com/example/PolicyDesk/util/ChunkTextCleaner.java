package com.example.PolicyDesk.util;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public final class ChunkTextCleaner {

    private ChunkTextCleaner() {
    }

    /**
     * Remove repeated header/footer strings, trim every line and drop blank lines.
     * Patterns are removed in the given order, so list longer variants first.
     */
    public static String clean(String text, List<String> boilerplate) {
        if (text == null) {
            return "";
        }
        String cleaned = text;
        if (boilerplate != null) {
            for (String pattern : boilerplate) {
                if (pattern != null && !pattern.isEmpty()) {
                    cleaned = cleaned.replace(pattern, "");
                }
            }
        }
        return Arrays.stream(cleaned.split("\\R"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .collect(Collectors.joining("\n"));
    }
}
