package net.neoforged.rewrite.api.tree;

import org.jetbrains.annotations.Nullable;

/**
 * Modifier flags of definitions. Flags without a keyword are never written in source.
 */
public enum Flag {
    PRIVATE("private"),
    PROTECTED("protected"),
    OVERRIDE("override"),
    IMPLICIT("implicit"),
    ABSTRACT("abstract"),
    FINAL("final"),
    SEALED("sealed"),
    LAZY("lazy"),
    CASE("case"),
    PARAM(null),
    PARAMACCESSOR(null),
    CASEACCESSOR(null),
    SYNTHETIC(null),
    MUTABLE(null);

    @Nullable
    private final String keyword;

    Flag(@Nullable String keyword) {
        this.keyword = keyword;
    }

    public @Nullable String keyword() {
        return keyword;
    }

    public boolean isPrintable() {
        return keyword != null;
    }

    public static @Nullable Flag fromKeyword(String keyword) {
        for (var flag : values()) {
            if (keyword.equals(flag.keyword)) {
                return flag;
            }
        }
        return null;
    }
}
