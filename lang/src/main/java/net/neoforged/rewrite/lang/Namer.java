package net.neoforged.rewrite.lang;

import net.neoforged.rewrite.api.tree.Block;
import net.neoforged.rewrite.api.tree.ClassDef;
import net.neoforged.rewrite.api.tree.CompilationUnit;
import net.neoforged.rewrite.api.tree.DefDef;
import net.neoforged.rewrite.api.tree.DefTree;
import net.neoforged.rewrite.api.tree.Ident;
import net.neoforged.rewrite.api.tree.ModuleDef;
import net.neoforged.rewrite.api.tree.Names;
import net.neoforged.rewrite.api.tree.RefTree;
import net.neoforged.rewrite.api.tree.Select;
import net.neoforged.rewrite.api.tree.Symbol;
import net.neoforged.rewrite.api.tree.Template;
import net.neoforged.rewrite.api.tree.Tree;
import net.neoforged.rewrite.api.tree.Trees;
import org.jetbrains.annotations.Nullable;

import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Binds identifiers and member selections to the symbols of their definitions.
 * <p>
 * Resolution is lexical: a class body, object body, block or compilation unit makes all of its
 * definitions visible to each of its statements, regardless of order. Selections resolve against the
 * members of a class or object named by their qualifier. Every name that cannot be resolved is bound
 * to one external symbol shared by all its occurrences.
 */
public final class Namer {
    private final Map<String, Symbol> externals = new HashMap<>();
    private final Map<Symbol, Map<String, Symbol>> members = new IdentityHashMap<>();

    public CompilationUnit name(CompilationUnit unit) {
        Trees.preorder(unit).forEach(tree -> {
            if (tree instanceof ClassDef classDef && classDef.symbol() != null) {
                members.put(classDef.symbol(), definitions(classDef.impl().body()));
            } else if (tree instanceof ModuleDef moduleDef && moduleDef.symbol() != null) {
                members.put(moduleDef.symbol(), definitions(moduleDef.impl().body()));
            }
        });
        return (CompilationUnit) resolve(unit, LexicalScope.EMPTY);
    }

    private Tree resolve(Tree tree, LexicalScope scope) {
        if (tree instanceof Ident ident) {
            return new Ident(ident.position(), ident.name(), scope.lookup(ident.name(), this::external));
        } else if (tree instanceof Select select) {
            Tree qualifier = resolve(select.qualifier(), scope);
            return new Select(select.position(), qualifier, select.name(), member(qualifier, select.name()));
        } else if (tree instanceof CompilationUnit unit) {
            var inner = scope.enter(definitions(unit.stats()));
            return unit.withChildren(child -> resolve(child, inner));
        } else if (tree instanceof Template template) {
            var inner = scope.enter(definitions(template.body()));
            return template.withChildren(child -> resolve(child, inner));
        } else if (tree instanceof Block block) {
            var inner = scope.enter(definitions(block.stats()));
            return block.withChildren(child -> resolve(child, inner));
        } else if (tree instanceof DefDef defDef) {
            var params = new HashMap<String, Symbol>();
            defDef.vparamss().forEach(vparams -> params.putAll(definitions(vparams)));
            var inner = scope.enter(params);
            return defDef.withChildren(child -> resolve(child, inner));
        }
        return tree.withChildren(child -> resolve(child, scope));
    }

    private Symbol member(Tree qualifier, String name) {
        if (!Names.isOperator(Names.decode(name)) && qualifier instanceof RefTree ref && ref.symbol() != null) {
            var owned = members.get(ref.symbol());
            if (owned != null && owned.containsKey(name)) {
                return owned.get(name);
            }
        }
        return external(name);
    }

    private Symbol external(String name) {
        return externals.computeIfAbsent(name, Symbol::external);
    }

    private static Map<String, Symbol> definitions(List<? extends Tree> stats) {
        var result = new HashMap<String, Symbol>();
        for (var stat : stats) {
            if (stat instanceof DefTree def && def.symbol() != null) {
                result.putIfAbsent(def.name(), def.symbol());
            }
        }
        return result;
    }

    private record LexicalScope(Map<String, Symbol> entries, @Nullable LexicalScope parent) {
        static final LexicalScope EMPTY = new LexicalScope(Map.of(), null);

        LexicalScope enter(Map<String, Symbol> definitions) {
            return new LexicalScope(definitions, this);
        }

        Symbol lookup(String name, Function<String, Symbol> fallback) {
            for (var scope = this; scope != null; scope = scope.parent) {
                var symbol = scope.entries.get(name);
                if (symbol != null) {
                    return symbol;
                }
            }
            return fallback.apply(name);
        }
    }
}
