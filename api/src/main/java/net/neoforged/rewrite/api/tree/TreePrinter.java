package net.neoforged.rewrite.api.tree;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Prints trees as source text.
 * <p>
 * {@link #token(Tree)} is the text of the leaf a tree contributes to the layout of its source, and
 * {@link #syntheticText(Tree)} what is printed for a tree that has no source text. {@link #print(Tree)}
 * renders a whole tree without any original layout.
 */
public final class TreePrinter {
    private static final String INDENT = "  ";

    private TreePrinter() {
    }

    public static String token(Tree tree) {
        if (tree instanceof DefTree def) {
            return def.name();
        } else if (tree instanceof RefTree ref) {
            return Names.decode(ref.name());
        } else if (tree instanceof Literal literal) {
            return literal(literal.value());
        } else if (tree instanceof New) {
            return "new";
        } else if (tree instanceof Super) {
            return "super";
        } else if (tree instanceof TypeTree typeTree) {
            return typeTree.name();
        }
        return print(tree);
    }

    public static String syntheticText(Tree tree) {
        if (tree instanceof DefDef defDef) {
            return "def " + defDef.name();
        } else if (tree instanceof ValDef valDef) {
            if (valDef.isParameter()) {
                return valDef.name();
            }
            return (valDef.mods().hasFlag(Flag.MUTABLE) ? "var " : "val ") + valDef.name();
        } else if (tree instanceof ClassDef classDef) {
            return "class " + classDef.name();
        } else if (tree instanceof ModuleDef moduleDef) {
            return "object " + moduleDef.name();
        } else if (tree instanceof TypeDef typeDef) {
            return "type " + typeDef.name();
        }
        return token(tree);
    }

    public static String literal(Object value) {
        if (value == null) {
            return "null";
        } else if (value instanceof String string) {
            return quote(string, '"');
        } else if (value instanceof Character character) {
            return quote(String.valueOf(character), '\'');
        } else if (value instanceof Long longValue) {
            return longValue + "L";
        }
        return String.valueOf(value);
    }

    private static String quote(String text, char quote) {
        var result = new StringBuilder(text.length() + 2).append(quote);
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '\n' -> result.append("\\n");
                case '\t' -> result.append("\\t");
                case '\r' -> result.append("\\r");
                case '\\' -> result.append("\\\\");
                default -> {
                    if (c == quote) {
                        result.append('\\');
                    }
                    result.append(c);
                }
            }
        }
        return result.append(quote).toString();
    }

    public static String print(Tree tree) {
        if (tree instanceof CompilationUnit unit) {
            return unit.stats().stream().map(TreePrinter::print).collect(Collectors.joining("\n"));
        } else if (tree instanceof ClassDef classDef) {
            var params = classDef.impl().body().stream()
                    .filter(member -> member instanceof ValDef valDef && valDef.isParameter())
                    .toList();
            var result = new StringBuilder(modifiers(classDef.mods())).append("class ").append(classDef.name());
            if (!params.isEmpty()) {
                result.append(params(params));
            }
            return result.append(template(classDef.impl(), params)).toString();
        } else if (tree instanceof ModuleDef moduleDef) {
            return modifiers(moduleDef.mods()) + "object " + moduleDef.name() + template(moduleDef.impl(), List.of());
        } else if (tree instanceof DefDef defDef) {
            var result = new StringBuilder(modifiers(defDef.mods())).append("def ").append(defDef.name());
            for (var vparams : defDef.vparamss()) {
                result.append(params(vparams));
            }
            return result.append(typeAnnotation(defDef.tpt())).append(rhs(defDef.rhs())).toString();
        } else if (tree instanceof ValDef valDef) {
            if (valDef.isParameter()) {
                return valDef.name() + typeAnnotation(valDef.tpt());
            }
            return modifiers(valDef.mods()) + syntheticText(valDef) + typeAnnotation(valDef.tpt()) + rhs(valDef.rhs());
        } else if (tree instanceof TypeDef typeDef) {
            return modifiers(typeDef.mods()) + "type " + typeDef.name() + rhs(typeDef.rhs());
        } else if (tree instanceof Block block) {
            if (block.stats().isEmpty() && block.expr().isEmpty()) {
                return "{}";
            }
            var lines = new StringBuilder("{\n");
            for (var stat : Trees.concat(block.stats(), block.expr())) {
                if (!stat.isEmpty()) {
                    lines.append(indent(print(stat))).append('\n');
                }
            }
            return lines.append('}').toString();
        } else if (tree instanceof If ifTree) {
            var result = "if (" + print(ifTree.cond()) + ") " + print(ifTree.thenp());
            return ifTree.elsep().isEmpty() ? result : result + " else " + print(ifTree.elsep());
        } else if (tree instanceof Match match) {
            var result = new StringBuilder(print(match.selector())).append(" match {\n");
            for (var caseDef : match.cases()) {
                result.append(indent(print(caseDef))).append('\n');
            }
            return result.append('}').toString();
        } else if (tree instanceof CaseDef caseDef) {
            return "case " + print(caseDef.pat()) + " => " + print(caseDef.body());
        } else if (tree instanceof Apply apply) {
            if (apply.isInfix()) {
                var select = (Select) apply.fun();
                return print(select.qualifier()) + " " + select.name() + " " + print(apply.args().get(0));
            }
            return print(apply.fun()) + "(" + join(apply.args()) + ")";
        } else if (tree instanceof TypeApply typeApply) {
            return print(typeApply.fun()) + "[" + join(typeApply.args()) + "]";
        } else if (tree instanceof Select select) {
            if (select.isPrefixOperator()) {
                return Names.decode(select.name()) + print(select.qualifier());
            }
            return print(select.qualifier()) + "." + select.name();
        } else if (tree instanceof New newTree) {
            return "new " + print(newTree.tpt());
        } else if (tree instanceof EmptyTree) {
            return "";
        }
        return token(tree);
    }

    private static String template(Template impl, List<Tree> params) {
        var result = new StringBuilder();
        if (!impl.parents().isEmpty()) {
            result.append(" extends ").append(impl.parents().stream().map(TreePrinter::print).collect(Collectors.joining(" with ")));
        }
        var members = impl.body().stream().filter(member -> !params.contains(member)).toList();
        if (!members.isEmpty()) {
            result.append(" {\n");
            for (var member : members) {
                result.append(indent(print(member))).append('\n');
            }
            result.append('}');
        }
        return result.toString();
    }

    private static String modifiers(Modifiers mods) {
        var result = new StringBuilder();
        for (var annotation : mods.annotations()) {
            result.append('@').append(print(annotation)).append(' ');
        }
        for (var flag : mods.flags()) {
            if (flag.isPrintable()) {
                result.append(flag.keyword()).append(' ');
            }
        }
        return result.toString();
    }

    private static String params(List<? extends Tree> params) {
        return "(" + join(params) + ")";
    }

    private static String typeAnnotation(Tree tpt) {
        if (tpt.isEmpty() || tpt.position().isTransparent()) {
            return "";
        }
        return ": " + print(tpt);
    }

    private static String rhs(Tree rhs) {
        return rhs.isEmpty() ? "" : " = " + print(rhs);
    }

    private static String join(List<? extends Tree> trees) {
        return trees.stream().map(TreePrinter::print).collect(Collectors.joining(", "));
    }

    private static String indent(String text) {
        return INDENT + text.replace("\n", "\n" + INDENT);
    }
}
