package com.geico.poc.faunasql.sql;

import com.geico.poc.faunasql.errors.TranslationRejectedException;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Functions that can wrap a selected column.
 */
public enum SqlFunction {
    COUNT;

    private static final Set<String> RECOGNIZED_BUT_UNSUPPORTED =
        new HashSet<>(Arrays.asList("SUM", "AVG", "MIN", "MAX"));

    public static SqlFunction fromName(String name) {
        String upper = name.toUpperCase();
        if ("COUNT".equals(upper)) {
            return COUNT;
        }
        if (RECOGNIZED_BUT_UNSUPPORTED.contains(upper)) {
            throw new TranslationRejectedException("SQL function " + upper + " is not supported yet");
        }
        throw new TranslationRejectedException("Unknown SQL function: " + name);
    }
}
