package net.neoforged.rewrite.lang;

import net.neoforged.rewrite.api.Position;
import net.neoforged.rewrite.api.SourceFile;
import net.neoforged.rewrite.api.tree.Apply;
import net.neoforged.rewrite.api.tree.Block;
import net.neoforged.rewrite.api.tree.CaseDef;
import net.neoforged.rewrite.api.tree.ClassDef;
import net.neoforged.rewrite.api.tree.CompilationUnit;
import net.neoforged.rewrite.api.tree.DefDef;
import net.neoforged.rewrite.api.tree.DefTree;
import net.neoforged.rewrite.api.tree.EmptyTree;
import net.neoforged.rewrite.api.tree.Flag;
import net.neoforged.rewrite.api.tree.Ident;
import net.neoforged.rewrite.api.tree.If;
import net.neoforged.rewrite.api.tree.Literal;
import net.neoforged.rewrite.api.tree.Match;
import net.neoforged.rewrite.api.tree.Modifiers;
import net.neoforged.rewrite.api.tree.ModuleDef;
import net.neoforged.rewrite.api.tree.Names;
import net.neoforged.rewrite.api.tree.New;
import net.neoforged.rewrite.api.tree.Select;
import net.neoforged.rewrite.api.tree.Super;
import net.neoforged.rewrite.api.tree.Symbol;
import net.neoforged.rewrite.api.tree.Template;
import net.neoforged.rewrite.api.tree.Tree;
import net.neoforged.rewrite.api.tree.TypeApply;
import net.neoforged.rewrite.api.tree.TypeDef;
import net.neoforged.rewrite.api.tree.TypeTree;
import net.neoforged.rewrite.api.tree.ValDef;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses source text into a tree with range positions.
 * <p>
 * Statements are separated by line breaks. Line breaks inside parentheses and brackets are ignored.
 * Definitions get their symbols while parsing; references are left unresolved and are bound by the
 * {@link Namer}.
 */
public final class SourceReader {
    private static final int MAX_PARSE_DEPTH = 64;
    private static final Set<String> KEYWORDS = Set.of(
            "class", "object", "def", "val", "var", "type", "extends", "with", "new", "super",
            "if", "else", "match", "case", "true", "false", "null",
            "private", "protected", "override", "implicit", "abstract", "final", "sealed", "lazy"
    );

    private final SourceFile source;
    private final String content;
    private int offset;
    private int lastTokenEnd;
    @Nullable
    private Token nextToken;
    private int parenDepth;
    private final Deque<Symbol> owners = new ArrayDeque<>();

    public SourceReader(SourceFile source) {
        this.source = source;
        this.content = source.content();
    }

    /**
     * Parses {@code source} and resolves all references in it.
     */
    public static CompilationUnit parse(SourceFile source) throws SourceParseException {
        return new Namer().name(new SourceReader(source).read());
    }

    /**
     * Parses the whole source without resolving references.
     */
    public CompilationUnit read() throws SourceParseException {
        var stats = parseStats(0);
        Token token = peekToken();
        if (token.type != TokenType.EOF) {
            throw expectedTokenError("statement", token);
        }
        return new CompilationUnit(Position.range(source, 0, content.length()), source, stats);
    }

    private List<Tree> parseStats(int parseDepth) throws SourceParseException {
        if (parseDepth > MAX_PARSE_DEPTH) {
            throw parseError("max parse depth reached", peekToken().start);
        }
        List<Tree> stats = new ArrayList<>();
        while (true) {
            Token token = peekToken();
            if (token.type == TokenType.EOF || token.is("}")) {
                return stats;
            }
            if (!stats.isEmpty() && !token.newlineBefore) {
                throw expectedTokenError("line break", token);
            }
            stats.add(parseStat(parseDepth));
        }
    }

    private Tree parseStat(int parseDepth) throws SourceParseException {
        ParsedModifiers parsed = parseModifiers();
        Token keyword = peekToken();
        int start = parsed.start >= 0 ? parsed.start : keyword.start;

        if (keyword.type == TokenType.IDENTIFIER) {
            switch (keyword.text) {
                case "class":
                    return parseClassDef(parsed.mods, parseDepth);
                case "object":
                    return parseModuleDef(parsed.mods, parseDepth);
                case "def":
                    return parseDefDef(parsed.mods, start, parseDepth);
                case "val":
                case "var":
                    return parseValDef(parsed.mods, start, parseDepth);
                case "type":
                    return parseTypeDef(parsed.mods, start, parseDepth);
                default:
                    break;
            }
        }
        if (!parsed.mods.isEmpty()) {
            throw expectedTokenError("definition", keyword);
        }
        return parseExpr(parseDepth);
    }

    private ParsedModifiers parseModifiers() throws SourceParseException {
        Set<Flag> flags = EnumSet.noneOf(Flag.class);
        Map<Flag, Position> positions = new EnumMap<>(Flag.class);
        List<Tree> annotations = new ArrayList<>();
        int start = -1;

        while (true) {
            Token token = peekToken();
            Flag flag = token.type == TokenType.IDENTIFIER ? Flag.fromKeyword(token.text) : null;
            if (token.is("@")) {
                nextToken();
                Token name = parseName("annotation");
                annotations.add(new Ident(range(name.start, name.end), name.text, null));
            } else if (flag != null) {
                nextToken();
                if (!flags.add(flag)) {
                    throw parseError("Repeated modifier " + token.text, token.start);
                }
                positions.put(flag, range(token.start, token.end));
            } else {
                return new ParsedModifiers(new Modifiers(flags, positions, annotations), start);
            }
            if (start < 0) {
                start = token.start;
            }
        }
    }

    private ClassDef parseClassDef(Modifiers mods, int parseDepth) throws SourceParseException {
        Token keyword = nextToken();
        Token name = parseName("class name");
        var symbol = new Symbol(name.text, Symbol.Kind.CLASS, owners.peek(), mods.flags(), range(name.start, name.end));

        owners.push(symbol);
        try {
            List<Tree> params = new ArrayList<>();
            int templateStart = -1;
            if (peekToken().is("(") && continuesLine(peekToken())) {
                var paramMods = mods.hasFlag(Flag.CASE)
                        ? Modifiers.of(Flag.PARAMACCESSOR, Flag.CASEACCESSOR)
                        : Modifiers.of(Flag.PARAMACCESSOR);
                params.addAll(parseParams(paramMods, Symbol.Kind.VALUE, parseDepth));
                if (!params.isEmpty()) {
                    templateStart = params.get(0).position().start();
                }
            }
            Template impl = parseTemplate(params, templateStart, name.end, parseDepth);
            return new ClassDef(Position.range(source, keyword.start, name.start, lastTokenEnd), mods, name.text, symbol, impl);
        } finally {
            owners.pop();
        }
    }

    private ModuleDef parseModuleDef(Modifiers mods, int parseDepth) throws SourceParseException {
        Token keyword = nextToken();
        Token name = parseName("object name");
        var symbol = new Symbol(name.text, Symbol.Kind.MODULE, owners.peek(), mods.flags(), range(name.start, name.end));

        owners.push(symbol);
        try {
            Template impl = parseTemplate(List.of(), -1, name.end, parseDepth);
            return new ModuleDef(Position.range(source, keyword.start, name.start, lastTokenEnd), mods, name.text, symbol, impl);
        } finally {
            owners.pop();
        }
    }

    private Template parseTemplate(List<Tree> params, int start, int nameEnd, int parseDepth) throws SourceParseException {
        List<Tree> parents = new ArrayList<>();
        List<Tree> body = new ArrayList<>(params);

        Token token = peekToken();
        if (token.is("extends")) {
            nextToken();
            if (start < 0) {
                start = token.start;
            }
            if (peekToken().is("{")) {
                // early definitions
                body.addAll(parseBody(parseDepth));
                expectToken("with");
            }
            parents.add(parseParent(parseDepth));
            while (acceptToken("with")) {
                parents.add(parseParent(parseDepth));
            }
        }

        token = peekToken();
        if (token.is("{")) {
            if (start < 0) {
                start = token.start;
            }
            body.addAll(parseBody(parseDepth));
        }

        if (start < 0) {
            start = nameEnd;
        }
        return new Template(range(start, Math.max(start, lastTokenEnd)), parents, body);
    }

    private List<Tree> parseBody(int parseDepth) throws SourceParseException {
        expectToken("{");
        int savedParenDepth = parenDepth;
        parenDepth = 0;
        var stats = parseStats(parseDepth + 1);
        expectToken("}");
        parenDepth = savedParenDepth;
        return stats;
    }

    private Tree parseParent(int parseDepth) throws SourceParseException {
        Tree parent = parseType(parseDepth + 1);
        if (peekToken().is("(") && continuesLine(peekToken())) {
            var args = parseArgs(parseDepth);
            parent = new Apply(range(parent.position().start(), lastTokenEnd), parent, args);
        }
        return parent;
    }

    private DefDef parseDefDef(Modifiers mods, int start, int parseDepth) throws SourceParseException {
        nextToken();
        Token name = peekToken().type == TokenType.OPERATOR ? nextToken() : parseName("method name");
        var symbol = new Symbol(name.text, Symbol.Kind.METHOD, owners.peek(), mods.flags(), range(name.start, name.end));

        owners.push(symbol);
        try {
            List<List<ValDef>> vparamss = new ArrayList<>();
            while (peekToken().is("(") && continuesLine(peekToken())) {
                vparamss.add(parseParams(Modifiers.of(Flag.PARAM), Symbol.Kind.PARAMETER, parseDepth));
            }
            Tree tpt = acceptToken(":") ? parseType(parseDepth + 1) : inferredType();
            Tree rhs = acceptToken("=") ? parseExpr(parseDepth + 1) : EmptyTree.INSTANCE;
            return new DefDef(Position.range(source, start, name.start, lastTokenEnd), mods, name.text, vparamss, tpt, rhs, symbol);
        } finally {
            owners.pop();
        }
    }

    private List<ValDef> parseParams(Modifiers paramMods, Symbol.Kind kind, int parseDepth) throws SourceParseException {
        expectToken("(");
        parenDepth++;
        List<ValDef> params = new ArrayList<>();
        if (!peekToken().is(")")) {
            do {
                Token name = parseName("parameter name");
                expectToken(":");
                Tree tpt = parseType(parseDepth + 1);
                var symbol = new Symbol(name.text, kind, owners.peek(), paramMods.flags(), range(name.start, name.end));
                var position = Position.range(source, name.start, name.start, tpt.position().end());
                params.add(new ValDef(position, paramMods, name.text, tpt, EmptyTree.INSTANCE, symbol));
            } while (acceptToken(","));
        }
        expectToken(")");
        parenDepth--;
        return params;
    }

    private ValDef parseValDef(Modifiers mods, int start, int parseDepth) throws SourceParseException {
        Token keyword = nextToken();
        Modifiers valMods = keyword.is("var") ? mods.withFlag(Flag.MUTABLE) : mods;
        Token name = parseName("value name");
        var symbol = new Symbol(name.text, Symbol.Kind.VALUE, owners.peek(), valMods.flags(), range(name.start, name.end));

        Tree tpt = acceptToken(":") ? parseType(parseDepth + 1) : inferredType();
        Tree rhs = acceptToken("=") ? parseExpr(parseDepth + 1) : EmptyTree.INSTANCE;
        return new ValDef(Position.range(source, start, name.start, lastTokenEnd), valMods, name.text, tpt, rhs, symbol);
    }

    private TypeDef parseTypeDef(Modifiers mods, int start, int parseDepth) throws SourceParseException {
        nextToken();
        Token name = parseName("type name");
        var symbol = new Symbol(name.text, Symbol.Kind.TYPE, owners.peek(), mods.flags(), range(name.start, name.end));
        expectToken("=");
        Tree rhs = parseType(parseDepth + 1);
        return new TypeDef(Position.range(source, start, name.start, lastTokenEnd), mods, name.text, rhs, symbol);
    }

    private TypeTree inferredType() {
        return new TypeTree(Position.transparent(source, lastTokenEnd, lastTokenEnd, lastTokenEnd), "");
    }

    private Tree parseType(int parseDepth) throws SourceParseException {
        if (parseDepth > MAX_PARSE_DEPTH) {
            throw parseError("max parse depth reached", peekToken().start);
        }
        Token name = parseName("type");
        Tree type = new Ident(range(name.start, name.end), name.text, null);
        if (peekToken().is("[") && continuesLine(peekToken())) {
            var args = parseTypeArgs(parseDepth);
            type = new TypeApply(range(name.start, lastTokenEnd), type, args);
        }
        return type;
    }

    private List<Tree> parseTypeArgs(int parseDepth) throws SourceParseException {
        expectToken("[");
        parenDepth++;
        List<Tree> args = new ArrayList<>();
        do {
            args.add(parseType(parseDepth + 1));
        } while (acceptToken(","));
        expectToken("]");
        parenDepth--;
        return args;
    }

    private Tree parseExpr(int parseDepth) throws SourceParseException {
        if (parseDepth > MAX_PARSE_DEPTH) {
            throw parseError("max parse depth reached", peekToken().start);
        }
        if (peekToken().is("if")) {
            return parseIf(parseDepth);
        }
        Tree tree = parseInfix(0, parseDepth);
        while (peekToken().is("match") && continuesLine(peekToken())) {
            tree = parseMatch(tree, parseDepth);
        }
        return tree;
    }

    private If parseIf(int parseDepth) throws SourceParseException {
        Token keyword = nextToken();
        expectToken("(");
        parenDepth++;
        Tree cond = parseExpr(parseDepth + 1);
        expectToken(")");
        parenDepth--;
        Tree thenp = parseExpr(parseDepth + 1);
        Tree elsep = acceptToken("else") ? parseExpr(parseDepth + 1) : EmptyTree.INSTANCE;
        return new If(range(keyword.start, lastTokenEnd), cond, thenp, elsep);
    }

    private Match parseMatch(Tree selector, int parseDepth) throws SourceParseException {
        nextToken();
        expectToken("{");
        int savedParenDepth = parenDepth;
        parenDepth = 0;
        List<CaseDef> cases = new ArrayList<>();
        while (peekToken().is("case")) {
            Token keyword = nextToken();
            Tree pat = parseSimple(parseDepth + 1);
            expectToken("=>");
            Tree body = parseExpr(parseDepth + 1);
            cases.add(new CaseDef(range(keyword.start, lastTokenEnd), pat, body));
        }
        if (cases.isEmpty()) {
            throw expectedTokenError("'case'", peekToken());
        }
        expectToken("}");
        parenDepth = savedParenDepth;
        return new Match(range(selector.position().start(), lastTokenEnd), selector, cases);
    }

    private Tree parseInfix(int minPrecedence, int parseDepth) throws SourceParseException {
        Tree left = parsePrefix(parseDepth);
        while (true) {
            Token operator = peekToken();
            if (!isInfixOperator(operator) || Names.precedence(operator.text) < minPrecedence) {
                return left;
            }
            nextToken();
            Tree right = parseInfix(Names.precedence(operator.text) + 1, parseDepth + 1);
            int start = left.position().start();
            var fun = new Select(Position.range(source, start, operator.start, operator.end), left, operator.text, null);
            left = new Apply(range(start, right.position().end()), fun, List.of(right));
        }
    }

    private boolean isInfixOperator(Token token) {
        return token.type == TokenType.OPERATOR && !token.is("=") && !token.is("=>") && !token.is(":")
                && continuesLine(token);
    }

    private Tree parsePrefix(int parseDepth) throws SourceParseException {
        Token token = peekToken();
        if (token.type == TokenType.OPERATOR && (token.is("!") || token.is("-") || token.is("~"))) {
            nextToken();
            Tree operand = parseSimple(parseDepth + 1);
            var position = Position.range(source, token.start, token.start, operand.position().end());
            return new Select(position, operand, Names.UNARY_PREFIX + token.text, null);
        }
        return parseSimple(parseDepth);
    }

    private Tree parseSimple(int parseDepth) throws SourceParseException {
        if (parseDepth > MAX_PARSE_DEPTH) {
            throw parseError("max parse depth reached", peekToken().start);
        }
        Token token = nextToken();
        Tree tree;
        switch (token.type) {
            case INTEGER:
                tree = new Literal(range(token.start, token.end), parseInt(token));
                break;
            case LONG:
                tree = new Literal(range(token.start, token.end), parseLong(token));
                break;
            case DOUBLE:
                tree = new Literal(range(token.start, token.end), parseDouble(token));
                break;
            case STRING:
                tree = new Literal(range(token.start, token.end), unquote(token));
                break;
            case CHAR:
                tree = new Literal(range(token.start, token.end), unquote(token).charAt(0));
                break;
            case IDENTIFIER:
                tree = parseIdentifierExpr(token, parseDepth);
                break;
            case PUNCTUATION:
                if (token.is("(")) {
                    parenDepth++;
                    tree = parseExpr(parseDepth + 1);
                    expectToken(")");
                    parenDepth--;
                } else if (token.is("{")) {
                    tree = parseBlock(token, parseDepth);
                } else {
                    throw expectedTokenError("expression", token);
                }
                break;
            default:
                throw expectedTokenError("expression", token);
        }

        while (true) {
            Token next = peekToken();
            int start = tree.position().start();
            if (next.is(".")) {
                nextToken();
                Token name = peekToken().type == TokenType.OPERATOR ? nextToken() : parseName("member name");
                tree = new Select(Position.range(source, start, name.start, name.end), tree, name.text, null);
            } else if (next.is("(") && continuesLine(next)) {
                var args = parseArgs(parseDepth);
                tree = new Apply(range(start, lastTokenEnd), tree, args);
            } else if (next.is("[") && continuesLine(next)) {
                var args = parseTypeArgs(parseDepth);
                tree = new TypeApply(range(start, lastTokenEnd), tree, args);
            } else {
                return tree;
            }
        }
    }

    private Tree parseIdentifierExpr(Token token, int parseDepth) throws SourceParseException {
        switch (token.text) {
            case "true":
            case "false":
                return new Literal(range(token.start, token.end), Boolean.parseBoolean(token.text));
            case "null":
                return new Literal(range(token.start, token.end), null);
            case "super":
                return new Super(range(token.start, token.end));
            case "new":
                Tree tpt = parseType(parseDepth + 1);
                return new New(range(token.start, tpt.position().end()), tpt);
            default:
                if (KEYWORDS.contains(token.text)) {
                    throw expectedTokenError("expression", token);
                }
                return new Ident(range(token.start, token.end), token.text, null);
        }
    }

    private Block parseBlock(Token open, int parseDepth) throws SourceParseException {
        int savedParenDepth = parenDepth;
        parenDepth = 0;
        var stats = parseStats(parseDepth + 1);
        expectToken("}");
        parenDepth = savedParenDepth;

        Tree expr = EmptyTree.INSTANCE;
        if (!stats.isEmpty() && !(stats.get(stats.size() - 1) instanceof DefTree)) {
            expr = stats.remove(stats.size() - 1);
        }
        return new Block(range(open.start, lastTokenEnd), stats, expr);
    }

    private List<Tree> parseArgs(int parseDepth) throws SourceParseException {
        expectToken("(");
        parenDepth++;
        List<Tree> args = new ArrayList<>();
        if (!peekToken().is(")")) {
            do {
                args.add(parseExpr(parseDepth + 1));
            } while (acceptToken(","));
        }
        expectToken(")");
        parenDepth--;
        return args;
    }

    private Token parseName(String expected) throws SourceParseException {
        Token token = nextToken(expected, TokenType.IDENTIFIER);
        if (KEYWORDS.contains(token.text)) {
            throw expectedTokenError(expected, token);
        }
        return token;
    }

    private int parseInt(Token token) throws SourceParseException {
        try {
            return Integer.parseInt(token.text);
        } catch (NumberFormatException e) {
            throw parseError("Integer out of bounds", token.start);
        }
    }

    private long parseLong(Token token) throws SourceParseException {
        try {
            return Long.parseLong(token.text.substring(0, token.text.length() - 1));
        } catch (NumberFormatException e) {
            throw parseError("Long out of bounds", token.start);
        }
    }

    private double parseDouble(Token token) throws SourceParseException {
        try {
            return Double.parseDouble(token.text);
        } catch (NumberFormatException e) {
            throw parseError("Invalid double", token.start);
        }
    }

    private String unquote(Token token) throws SourceParseException {
        String text = token.text;
        var result = new StringBuilder(text.length());
        for (int i = 1; i < text.length() - 1; i++) {
            char c = text.charAt(i);
            if (c != '\\') {
                result.append(c);
                continue;
            }
            c = text.charAt(++i);
            switch (c) {
                case 'n':
                    result.append('\n');
                    break;
                case 't':
                    result.append('\t');
                    break;
                case 'r':
                    result.append('\r');
                    break;
                case '\\':
                case '"':
                case '\'':
                    result.append(c);
                    break;
                default:
                    throw parseError("Illegal escape sequence \\" + c, token.start + i - 1);
            }
        }
        if (token.type == TokenType.CHAR && result.length() != 1) {
            throw parseError(result.length() == 0 ? "No character in char literal" : "Multiple characters in char literal", token.start);
        }
        return result.toString();
    }

    private boolean continuesLine(Token token) {
        return parenDepth > 0 || !token.newlineBefore;
    }

    private Token peekToken() throws SourceParseException {
        if (nextToken == null) {
            nextToken = scanToken();
        }
        return nextToken;
    }

    private boolean acceptToken(String expected) throws SourceParseException {
        if (peekToken().is(expected)) {
            nextToken();
            return true;
        }
        return false;
    }

    private void expectToken(String expected) throws SourceParseException {
        Token token = nextToken();
        if (!token.is(expected)) {
            throw expectedTokenError("'" + expected + "'", token);
        }
    }

    private Token nextToken() throws SourceParseException {
        Token token = peekToken();
        nextToken = null;
        lastTokenEnd = token.end;
        return token;
    }

    private Token nextToken(String expected, TokenType type) throws SourceParseException {
        Token token = nextToken();
        if (token.type != type) {
            throw expectedTokenError(expected, token);
        }
        return token;
    }

    private Token scanToken() throws SourceParseException {
        boolean newline = false;
        while (offset < content.length()) {
            char c = content.charAt(offset);
            if (c == '\n') {
                newline = true;
                offset++;
            } else if (Character.isWhitespace(c)) {
                offset++;
            } else if (content.startsWith("//", offset)) {
                while (offset < content.length() && content.charAt(offset) != '\n') {
                    offset++;
                }
            } else if (content.startsWith("/*", offset)) {
                int end = content.indexOf("*/", offset + 2);
                if (end < 0) {
                    throw parseError("Unexpected end of comment", offset);
                }
                newline |= content.substring(offset, end).indexOf('\n') >= 0;
                offset = end + 2;
            } else {
                break;
            }
        }

        int start = offset;
        if (offset == content.length()) {
            return new Token(TokenType.EOF, "", start, start, true);
        }

        char c = content.charAt(offset);
        TokenType type;
        if (Character.isJavaIdentifierStart(c)) {
            do {
                offset++;
            } while (offset < content.length() && Character.isJavaIdentifierPart(content.charAt(offset)));
            type = TokenType.IDENTIFIER;
        } else if (c >= '0' && c <= '9') {
            type = skipNumber();
        } else if (c == '"' || c == '\'') {
            skipString(c);
            type = c == '"' ? TokenType.STRING : TokenType.CHAR;
        } else if ("(){}[],.@".indexOf(c) >= 0) {
            offset++;
            type = TokenType.PUNCTUATION;
        } else if (Names.isOperatorChar(c)) {
            do {
                offset++;
            } while (offset < content.length() && Names.isOperatorChar(content.charAt(offset)));
            type = TokenType.OPERATOR;
        } else {
            throw parseError("Unexpected character: " + c, offset);
        }
        return new Token(type, content.substring(start, offset), start, offset, newline);
    }

    private TokenType skipNumber() throws SourceParseException {
        TokenType type = TokenType.INTEGER;
        skipDigits();
        if (offset + 1 < content.length() && content.charAt(offset) == '.' && Character.isDigit(content.charAt(offset + 1))) {
            offset++;
            skipDigits();
            type = TokenType.DOUBLE;
        } else if (offset < content.length() && (content.charAt(offset) == 'L' || content.charAt(offset) == 'l')) {
            offset++;
            type = TokenType.LONG;
        }
        if (offset < content.length() && Character.isJavaIdentifierPart(content.charAt(offset))) {
            throw parseError("Unexpected character in number: " + content.charAt(offset), offset);
        }
        return type;
    }

    private void skipDigits() {
        while (offset < content.length() && Character.isDigit(content.charAt(offset))) {
            offset++;
        }
    }

    private void skipString(char quoteChar) throws SourceParseException {
        int start = offset;
        offset++;
        while (true) {
            if (offset >= content.length() || content.charAt(offset) == '\n') {
                throw parseError("Unexpected end of string", start);
            }
            char c = content.charAt(offset++);
            if (c == '\\') {
                if (offset >= content.length()) {
                    throw parseError("Unexpected end of string", start);
                }
                offset++;
            } else if (c == quoteChar) {
                return;
            }
        }
    }

    private Position range(int start, int end) {
        return Position.range(source, start, end);
    }

    private SourceParseException expectedTokenError(String expected, Token token) {
        if (token.type == TokenType.EOF) {
            return parseError("Expected " + expected + " before end of file", token.start);
        } else {
            return parseError("Expected " + expected + " before '" + token.text + "' token", token.start);
        }
    }

    private SourceParseException parseError(String message, int offset) {
        return new SourceParseException(message, source.lineNumber(offset), source.columnNumber(offset));
    }

    private record ParsedModifiers(Modifiers mods, int start) {
    }

    private record Token(TokenType type, String text, int start, int end, boolean newlineBefore) {
        boolean is(String expected) {
            return type != TokenType.STRING && type != TokenType.CHAR && text.equals(expected);
        }
    }

    private enum TokenType {
        IDENTIFIER,
        OPERATOR,
        PUNCTUATION,
        INTEGER,
        LONG,
        DOUBLE,
        CHAR,
        STRING,
        EOF,
    }
}
