package net.neoforged.rewrite.api;

public enum ProblemSeverity {
    INFO,
    WARNING,
    ERROR
}
