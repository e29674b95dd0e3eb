package net.neoforged.rewrite.regeneration;

/**
 * The part of a tree a {@link Site} stands for.
 */
public enum Role {
    MODS,
    ITSELF,
    NAME,
    TPT,
    RHS,
    PARAM_LIST,
    ARGS_SEPARATOR,
    STMTS_SEPARATOR,
    CLASS_PARAMS,
    PARENTS,
    WITH_SEPARATOR,
    CLASS_BODY,
    BLOCK_BODY,
    COND,
    THEN,
    ELSE,
    CASES,
    PATTERN,
    CASE_BODY
}
