package com.sommerph.skillbackend.util;

import java.util.Locale;

public class SkillTypes {

    private SkillTypes() {
    }

    /**
     * Canonical form used for every skill type comparison: trimmed, inner whitespace collapsed,
     * lower case. Returns {@code null} for {@code null} input.
     */
    public static String normalize(String skillType) {
        if (skillType == null) {
            return null;
        }
        return skillType.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

}
