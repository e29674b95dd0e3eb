package net.neoforged.rewrite.api.tree;

/**
 * Conventions for names of operators.
 */
public final class Names {
    public static final String UNARY_PREFIX = "unary_";

    private Names() {
    }

    public static boolean isOperator(String name) {
        if (name.isEmpty()) {
            return false;
        }
        for (int i = 0; i < name.length(); i++) {
            if (!isOperatorChar(name.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    public static boolean isOperatorChar(char c) {
        return "+-*/%<>=!&|^~:".indexOf(c) >= 0;
    }

    /**
     * @return the operator as written in source, {@code !} for {@code unary_!}
     */
    public static String decode(String name) {
        return name.startsWith(UNARY_PREFIX) ? name.substring(UNARY_PREFIX.length()) : name;
    }

    /**
     * Scala-style precedence of an infix operator, derived from its first character. Higher binds tighter.
     */
    public static int precedence(String operator) {
        return switch (operator.charAt(0)) {
            case '|' -> 1;
            case '^' -> 2;
            case '&' -> 3;
            case '=', '!' -> 4;
            case '<', '>' -> 5;
            case ':' -> 6;
            case '+', '-' -> 7;
            case '*', '/', '%' -> 8;
            default -> Character.isLetter(operator.charAt(0)) ? 0 : 9;
        };
    }
}
