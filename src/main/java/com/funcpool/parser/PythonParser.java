package com.funcpool.parser;

import com.funcpool.exception.PythonSyntaxException;
import com.funcpool.model.syntax.Arg;
import com.funcpool.model.syntax.Arguments;
import com.funcpool.model.syntax.BinaryOperator;
import com.funcpool.model.syntax.BoolOperator;
import com.funcpool.model.syntax.CompareOperator;
import com.funcpool.model.syntax.ComprehensionClause;
import com.funcpool.model.syntax.ConstantKind;
import com.funcpool.model.syntax.ExceptHandler;
import com.funcpool.model.syntax.Expr;
import com.funcpool.model.syntax.ImportName;
import com.funcpool.model.syntax.Keyword;
import com.funcpool.model.syntax.Module;
import com.funcpool.model.syntax.Stmt;
import com.funcpool.model.syntax.UnaryOperator;
import com.funcpool.model.syntax.WithItem;
import com.funcpool.parser.PythonToken.TokenType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser for the supported Python subset.
 *
 * Builds a {@link Module} whose shape matches Python's own {@code ast} module for the same
 * source, so that unparsing follows the same conventions.
 */
public class PythonParser {
    private static final Logger log = LoggerFactory.getLogger(PythonParser.class);

    private static final Set<String> KEYWORDS = Set.of(
        "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class",
        "continue", "def", "del", "elif", "else", "except", "finally", "for", "from", "global",
        "if", "import", "in", "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return",
        "try", "while", "with", "yield"
    );

    private static final Map<String, BinaryOperator> AUG_ASSIGN_OPS = Map.ofEntries(
        Map.entry("+=", BinaryOperator.ADD),
        Map.entry("-=", BinaryOperator.SUB),
        Map.entry("*=", BinaryOperator.MULT),
        Map.entry("@=", BinaryOperator.MAT_MULT),
        Map.entry("/=", BinaryOperator.DIV),
        Map.entry("%=", BinaryOperator.MOD),
        Map.entry("//=", BinaryOperator.FLOOR_DIV),
        Map.entry("**=", BinaryOperator.POW),
        Map.entry("<<=", BinaryOperator.LSHIFT),
        Map.entry(">>=", BinaryOperator.RSHIFT),
        Map.entry("|=", BinaryOperator.BIT_OR),
        Map.entry("^=", BinaryOperator.BIT_XOR),
        Map.entry("&=", BinaryOperator.BIT_AND)
    );

    private static final Map<String, CompareOperator> COMPARISON_OPS = Map.of(
        "==", CompareOperator.EQ,
        "!=", CompareOperator.NOT_EQ,
        "<", CompareOperator.LT,
        "<=", CompareOperator.LT_E,
        ">", CompareOperator.GT,
        ">=", CompareOperator.GT_E
    );

    private final List<PythonToken> tokens;
    private final String fileName;
    private int pos = 0;

    public PythonParser(List<PythonToken> tokens, String fileName) {
        this.tokens = tokens;
        this.fileName = fileName;
    }

    /**
     * Tokenize and parse a whole source file.
     */
    public static Module parse(String source, String fileName) {
        List<PythonToken> tokens = new PythonTokenizer(source, fileName).tokenize();
        Module module = new PythonParser(tokens, fileName).parseModule();
        log.debug("Parsed {}: {} top-level statements", fileName, module.getBody().size());
        return module;
    }

    public Module parseModule() {
        List<Stmt> body = new ArrayList<>();
        while (!check(TokenType.ENDMARKER)) {
            if (match(TokenType.NEWLINE)) {
                continue;
            }
            body.addAll(parseStatement());
        }
        return new Module(body);
    }

    /**
     * Parses a single expression filling the whole token stream (the inside of an f-string
     * replacement field).
     */
    Expr parseStandaloneExpression() {
        Expr expr = checkName("yield") ? parseYieldExpression() : parseStarExpressions();
        match(TokenType.NEWLINE);
        if (!check(TokenType.ENDMARKER)) {
            throw error(peek(), "f-string: expecting '}'");
        }
        return expr;
    }

    // ---------------------------------------------------------------- statements

    private List<Stmt> parseStatement() {
        PythonToken token = peek();
        if (token.isOp("@")) {
            return List.of(parseDecorated());
        }
        if (token.getType() == TokenType.NAME) {
            switch (token.getValue()) {
                case "def":
                    return List.of(parseFunctionDef(new ArrayList<>(), false, token.getLine()));
                case "class":
                    return List.of(parseClassDef(new ArrayList<>(), token.getLine()));
                case "if":
                    return List.of(parseIf());
                case "while":
                    return List.of(parseWhile());
                case "for":
                    return List.of(parseFor(false, token.getLine()));
                case "try":
                    return List.of(parseTry());
                case "with":
                    return List.of(parseWith(false, token.getLine()));
                case "async":
                    return List.of(parseAsyncStatement());
                default:
                    break;
            }
        }
        return parseSimpleStatements();
    }

    private Stmt parseAsyncStatement() {
        PythonToken asyncToken = advance();
        PythonToken next = peek();
        if (next.isName("def")) {
            return parseFunctionDef(new ArrayList<>(), true, asyncToken.getLine());
        }
        if (next.isName("for")) {
            return parseFor(true, asyncToken.getLine());
        }
        if (next.isName("with")) {
            return parseWith(true, asyncToken.getLine());
        }
        throw error(next, "invalid syntax");
    }

    private Stmt parseDecorated() {
        List<Expr> decorators = new ArrayList<>();
        int line = peek().getLine();
        while (matchOp("@")) {
            decorators.add(parseNamedExpression());
            expect(TokenType.NEWLINE, "invalid syntax");
        }
        PythonToken token = peek();
        if (token.isName("def")) {
            return parseFunctionDef(decorators, false, line);
        }
        if (token.isName("async") && peekAt(1).isName("def")) {
            advance();
            return parseFunctionDef(decorators, true, line);
        }
        if (token.isName("class")) {
            return parseClassDef(decorators, line);
        }
        throw error(token, "invalid syntax");
    }

    private Stmt parseFunctionDef(List<Expr> decorators, boolean async, int line) {
        expectName("def");
        String name = expectIdentifier();
        if (checkOp("[")) {
            throw error(peek(), "type parameter lists are not supported");
        }
        expectOp("(");
        Arguments args = parseParameters(")", true);
        expectOp(")");
        Expr returns = matchOp("->") ? parseExpression() : null;
        List<Stmt> body = parseBlock();
        Stmt.FunctionDef def = new Stmt.FunctionDef(name, args, body, decorators, returns, async);
        def.setSourceLine(line);
        return def;
    }

    private Stmt parseClassDef(List<Expr> decorators, int line) {
        expectName("class");
        String name = expectIdentifier();
        if (checkOp("[")) {
            throw error(peek(), "type parameter lists are not supported");
        }
        List<Expr> bases = new ArrayList<>();
        List<Keyword> keywords = new ArrayList<>();
        if (matchOp("(")) {
            parseArguments(bases, keywords);
        }
        List<Stmt> body = parseBlock();
        Stmt.ClassDef def = new Stmt.ClassDef(name, bases, keywords, body, decorators);
        def.setSourceLine(line);
        return def;
    }

    private Stmt parseIf() {
        PythonToken start = advance();
        Expr test = parseNamedExpression();
        List<Stmt> body = parseBlock();
        List<Stmt> orelse = new ArrayList<>();
        if (checkName("elif")) {
            orelse.add(parseIf());
        } else if (matchName("else")) {
            orelse = parseBlock();
        }
        Stmt.If stmt = new Stmt.If(test, body, orelse);
        stmt.setSourceLine(start.getLine());
        return stmt;
    }

    private Stmt parseWhile() {
        PythonToken start = advance();
        Expr test = parseNamedExpression();
        List<Stmt> body = parseBlock();
        List<Stmt> orelse = matchName("else") ? parseBlock() : new ArrayList<>();
        Stmt.While stmt = new Stmt.While(test, body, orelse);
        stmt.setSourceLine(start.getLine());
        return stmt;
    }

    private Stmt parseFor(boolean async, int line) {
        PythonToken start = expectName("for");
        Expr target = parseTargetList();
        checkAssignable(target, start);
        expectName("in");
        Expr iter = parseStarExpressions();
        List<Stmt> body = parseBlock();
        List<Stmt> orelse = matchName("else") ? parseBlock() : new ArrayList<>();
        Stmt.For stmt = new Stmt.For(target, iter, body, orelse, async);
        stmt.setSourceLine(line);
        return stmt;
    }

    private Stmt parseTry() {
        PythonToken start = advance();
        List<Stmt> body = parseBlock();
        List<ExceptHandler> handlers = new ArrayList<>();
        while (checkName("except")) {
            PythonToken exceptToken = advance();
            if (checkOp("*")) {
                throw error(peek(), "except* is not supported");
            }
            Expr type = null;
            String name = null;
            if (!checkOp(":")) {
                type = parseExpression();
                if (matchName("as")) {
                    name = expectIdentifier();
                }
            } else if (!handlers.isEmpty() && handlers.get(handlers.size() - 1).getType() == null) {
                throw error(exceptToken, "default 'except:' must be last");
            }
            handlers.add(new ExceptHandler(type, name, parseBlock()));
        }
        List<Stmt> orelse = new ArrayList<>();
        if (matchName("else")) {
            if (handlers.isEmpty()) {
                throw error(previous(), "invalid syntax");
            }
            orelse = parseBlock();
        }
        List<Stmt> finalbody = matchName("finally") ? parseBlock() : new ArrayList<>();
        if (handlers.isEmpty() && finalbody.isEmpty()) {
            throw error(peek(), "expected 'except' or 'finally' block");
        }
        Stmt.Try stmt = new Stmt.Try(body, handlers, orelse, finalbody);
        stmt.setSourceLine(start.getLine());
        return stmt;
    }

    private Stmt parseWith(boolean async, int line) {
        expectName("with");
        List<WithItem> items = new ArrayList<>();
        if (checkOp("(") && parenthesizedWithItems()) {
            advance();
            while (!checkOp(")")) {
                items.add(parseWithItem());
                if (!matchOp(",")) {
                    break;
                }
            }
            expectOp(")");
        } else {
            items.add(parseWithItem());
            while (matchOp(",")) {
                items.add(parseWithItem());
            }
        }
        List<Stmt> body = parseBlock();
        Stmt.With stmt = new Stmt.With(items, body, async);
        stmt.setSourceLine(line);
        return stmt;
    }

    /**
     * Looks ahead from an opening parenthesis after {@code with} to decide whether it encloses a
     * list of with-items (containing a top-level {@code as}) rather than an expression.
     */
    private boolean parenthesizedWithItems() {
        int depth = 0;
        boolean sawAs = false;
        for (int i = pos; i < tokens.size(); i++) {
            PythonToken token = tokens.get(i);
            if (token.isOp("(") || token.isOp("[") || token.isOp("{")) {
                depth++;
            } else if (token.isOp(")") || token.isOp("]") || token.isOp("}")) {
                depth--;
                if (depth == 0) {
                    return sawAs && i + 1 < tokens.size() && tokens.get(i + 1).isOp(":");
                }
            } else if (depth == 1 && token.isName("as")) {
                sawAs = true;
            } else if (token.getType() == TokenType.NEWLINE) {
                return false;
            }
        }
        return false;
    }

    private WithItem parseWithItem() {
        Expr context = parseExpression();
        Expr vars = null;
        if (matchName("as")) {
            PythonToken at = peek();
            vars = parseStarTarget();
            checkAssignable(vars, at);
        }
        return new WithItem(context, vars);
    }

    private List<Stmt> parseBlock() {
        expectOp(":");
        if (match(TokenType.NEWLINE)) {
            expect(TokenType.INDENT, "expected an indented block");
            List<Stmt> body = new ArrayList<>();
            while (!check(TokenType.DEDENT) && !check(TokenType.ENDMARKER)) {
                if (match(TokenType.NEWLINE)) {
                    continue;
                }
                body.addAll(parseStatement());
            }
            expect(TokenType.DEDENT, "invalid syntax");
            return body;
        }
        return parseSimpleStatements();
    }

    private List<Stmt> parseSimpleStatements() {
        List<Stmt> statements = new ArrayList<>();
        statements.add(parseSimpleStatement());
        while (matchOp(";")) {
            if (check(TokenType.NEWLINE)) {
                break;
            }
            statements.add(parseSimpleStatement());
        }
        expect(TokenType.NEWLINE, "invalid syntax");
        return statements;
    }

    private Stmt parseSimpleStatement() {
        PythonToken token = peek();
        Stmt stmt;
        if (token.getType() != TokenType.NAME) {
            stmt = parseExpressionStatement();
        } else {
            switch (token.getValue()) {
                case "pass" -> {
                    advance();
                    stmt = new Stmt.Pass();
                }
                case "break" -> {
                    advance();
                    stmt = new Stmt.Break();
                }
                case "continue" -> {
                    advance();
                    stmt = new Stmt.Continue();
                }
                case "return" -> {
                    advance();
                    stmt = new Stmt.Return(startsExpression() ? parseStarExpressions() : null);
                }
                case "raise" -> stmt = parseRaise();
                case "global" -> {
                    advance();
                    stmt = new Stmt.Global(parseNameList());
                }
                case "nonlocal" -> {
                    advance();
                    stmt = new Stmt.Nonlocal(parseNameList());
                }
                case "del" -> stmt = parseDelete();
                case "assert" -> {
                    advance();
                    Expr test = parseExpression();
                    Expr msg = matchOp(",") ? parseExpression() : null;
                    stmt = new Stmt.Assert(test, msg);
                }
                case "import" -> stmt = parseImport();
                case "from" -> stmt = parseImportFrom();
                default -> stmt = parseExpressionStatement();
            }
        }
        stmt.setSourceLine(token.getLine());
        return stmt;
    }

    private Stmt parseRaise() {
        advance();
        if (!startsExpression()) {
            return new Stmt.Raise(null, null);
        }
        Expr exc = parseExpression();
        Expr cause = matchName("from") ? parseExpression() : null;
        return new Stmt.Raise(exc, cause);
    }

    private Stmt parseDelete() {
        PythonToken start = advance();
        List<Expr> targets = new ArrayList<>();
        targets.add(parseStarTarget());
        while (matchOp(",")) {
            if (!startsExpression()) {
                break;
            }
            targets.add(parseStarTarget());
        }
        for (Expr target : targets) {
            if (target instanceof Expr.Starred) {
                throw error(start, "cannot delete starred");
            }
            checkAssignable(target, start);
        }
        return new Stmt.Delete(targets);
    }

    private List<String> parseNameList() {
        List<String> names = new ArrayList<>();
        names.add(expectIdentifier());
        while (matchOp(",")) {
            names.add(expectIdentifier());
        }
        return names;
    }

    private Stmt parseImport() {
        advance();
        List<ImportName> names = new ArrayList<>();
        do {
            String module = parseDottedName();
            String asname = matchName("as") ? expectIdentifier() : null;
            names.add(new ImportName(module, asname));
        } while (matchOp(","));
        return new Stmt.Import(names);
    }

    private Stmt parseImportFrom() {
        advance();
        int level = 0;
        while (checkOp(".") || checkOp("...")) {
            level += advance().getValue().length();
        }
        String module = null;
        if (!checkName("import")) {
            module = parseDottedName();
        } else if (level == 0) {
            throw error(peek(), "invalid syntax");
        }
        expectName("import");

        List<ImportName> names = new ArrayList<>();
        if (matchOp("*")) {
            names.add(new ImportName("*", null));
            return new Stmt.ImportFrom(module, names, level);
        }
        boolean parenthesized = matchOp("(");
        do {
            if (parenthesized && checkOp(")")) {
                break;
            }
            String name = expectIdentifier();
            String asname = matchName("as") ? expectIdentifier() : null;
            names.add(new ImportName(name, asname));
        } while (matchOp(","));
        if (parenthesized) {
            expectOp(")");
        } else if (previous().isOp(",")) {
            throw error(previous(), "trailing comma not allowed without surrounding parentheses");
        }
        return new Stmt.ImportFrom(module, names, level);
    }

    private String parseDottedName() {
        StringBuilder name = new StringBuilder(expectIdentifier());
        while (matchOp(".")) {
            name.append('.').append(expectIdentifier());
        }
        return name.toString();
    }

    private Stmt parseExpressionStatement() {
        PythonToken start = peek();
        Expr first = checkName("yield") ? parseYieldExpression() : parseStarExpressions();

        if (matchOp(":")) {
            if (!(first instanceof Expr.Name || first instanceof Expr.Attribute || first instanceof Expr.Subscript)) {
                throw error(start, "only single target (not " + describe(first) + ") can be annotated");
            }
            boolean simple = first instanceof Expr.Name && !start.isOp("(");
            Expr annotation = parseExpression();
            Expr value = null;
            if (matchOp("=")) {
                value = checkName("yield") ? parseYieldExpression() : parseStarExpressions();
            }
            return new Stmt.AnnAssign(first, annotation, value, simple);
        }

        PythonToken next = peek();
        if (next.getType() == TokenType.OP && AUG_ASSIGN_OPS.containsKey(next.getValue())) {
            advance();
            if (!(first instanceof Expr.Name || first instanceof Expr.Attribute || first instanceof Expr.Subscript)) {
                throw error(start, "'" + describe(first) + "' is an illegal expression for augmented assignment");
            }
            Expr value = checkName("yield") ? parseYieldExpression() : parseStarExpressions();
            return new Stmt.AugAssign(first, AUG_ASSIGN_OPS.get(next.getValue()), value);
        }

        if (checkOp("=")) {
            List<Expr> chain = new ArrayList<>();
            chain.add(first);
            while (matchOp("=")) {
                chain.add(checkName("yield") ? parseYieldExpression() : parseStarExpressions());
            }
            Expr value = chain.remove(chain.size() - 1);
            for (Expr target : chain) {
                checkAssignable(target, start);
            }
            return new Stmt.Assign(chain, value);
        }
        return new Stmt.ExprStmt(first);
    }

    // ---------------------------------------------------------------- parameters and arguments

    /**
     * Parses a parameter list up to (not including) {@code closing}: {@code ")"} for functions,
     * {@code ":"} for lambdas.
     */
    private Arguments parseParameters(String closing, boolean allowAnnotations) {
        Arguments arguments = new Arguments();
        List<Arg> positional = new ArrayList<>();
        boolean seenStar = false;
        boolean seenSlash = false;

        while (!checkOp(closing)) {
            PythonToken token = peek();
            if (arguments.getKwarg() != null) {
                throw error(token, "arguments cannot follow var-keyword argument");
            }
            if (matchOp("/")) {
                if (seenSlash || seenStar || positional.isEmpty()) {
                    throw error(token, "invalid syntax");
                }
                seenSlash = true;
                arguments.getPosonlyargs().addAll(positional);
                positional.clear();
            } else if (matchOp("*")) {
                if (seenStar) {
                    throw error(token, "* argument may appear only once");
                }
                seenStar = true;
                if (check(TokenType.NAME)) {
                    arguments.setVararg(parseParameter(allowAnnotations));
                }
            } else if (matchOp("**")) {
                arguments.setKwarg(parseParameter(allowAnnotations));
            } else {
                Arg arg = parseParameter(allowAnnotations);
                Expr defaultValue = matchOp("=") ? parseExpression() : null;
                if (seenStar) {
                    arguments.getKwonlyargs().add(arg);
                    arguments.getKwDefaults().add(defaultValue);
                } else {
                    positional.add(arg);
                    if (defaultValue != null) {
                        arguments.getDefaults().add(defaultValue);
                    } else if (!arguments.getDefaults().isEmpty()) {
                        throw error(token, "parameter without a default follows parameter with a default");
                    }
                }
            }
            if (!matchOp(",")) {
                break;
            }
        }
        if (seenStar && arguments.getVararg() == null && arguments.getKwonlyargs().isEmpty()) {
            throw error(peek(), "named arguments must follow bare *");
        }
        arguments.getArgs().addAll(positional);
        return arguments;
    }

    private Arg parseParameter(boolean allowAnnotations) {
        String name = expectIdentifier();
        Expr annotation = null;
        if (allowAnnotations && matchOp(":")) {
            annotation = parseExpression();
        }
        return new Arg(name, annotation);
    }

    /**
     * Parses call arguments after the opening parenthesis, consuming the closing one.
     */
    private void parseArguments(List<Expr> args, List<Keyword> keywords) {
        while (!checkOp(")")) {
            PythonToken token = peek();
            if (matchOp("*")) {
                args.add(new Expr.Starred(parseExpression()));
            } else if (matchOp("**")) {
                keywords.add(new Keyword(null, parseExpression()));
            } else if (token.getType() == TokenType.NAME && peekAt(1).isOp("=")) {
                advance();
                advance();
                keywords.add(new Keyword(token.getValue(), parseExpression()));
            } else {
                Expr value = parseNamedExpression();
                if (startsComprehension()) {
                    value = new Expr.Comprehension(Expr.Comprehension.Kind.GENERATOR, value,
                            parseComprehensionClauses());
                }
                if (!keywords.isEmpty()) {
                    boolean unpacking = keywords.stream().anyMatch(k -> k.getArg() == null);
                    throw error(token, unpacking
                            ? "positional argument follows keyword argument unpacking"
                            : "positional argument follows keyword argument");
                }
                args.add(value);
            }
            if (!matchOp(",")) {
                break;
            }
        }
        expectOp(")");
    }

    // ---------------------------------------------------------------- expressions

    private Expr parseStarExpressions() {
        Expr first = parseStarExpression();
        if (!checkOp(",")) {
            return first;
        }
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (matchOp(",")) {
            if (!startsExpression()) {
                break;
            }
            elts.add(parseStarExpression());
        }
        return new Expr.TupleExpr(elts);
    }

    private Expr parseStarExpression() {
        if (matchOp("*")) {
            return new Expr.Starred(parseBitwiseOr());
        }
        return parseExpression();
    }

    private Expr parseStarNamedExpression() {
        if (matchOp("*")) {
            return new Expr.Starred(parseBitwiseOr());
        }
        return parseNamedExpression();
    }

    private Expr parseNamedExpression() {
        PythonToken token = peek();
        if (token.getType() == TokenType.NAME && peekAt(1).isOp(":=")) {
            if (KEYWORDS.contains(token.getValue())) {
                throw error(token, "cannot use assignment expressions with " + token.getValue());
            }
            advance();
            advance();
            return new Expr.NamedExpr(new Expr.Name(token.getValue()), parseExpression());
        }
        return parseExpression();
    }

    private Expr parseExpression() {
        if (checkName("lambda")) {
            return parseLambda();
        }
        Expr body = parseDisjunction();
        if (matchName("if")) {
            Expr test = parseDisjunction();
            expectName("else");
            Expr orelse = parseExpression();
            return new Expr.IfExp(test, body, orelse);
        }
        return body;
    }

    private Expr parseLambda() {
        expectName("lambda");
        Arguments args = parseParameters(":", false);
        expectOp(":");
        return new Expr.Lambda(args, parseExpression());
    }

    private Expr parseYieldExpression() {
        expectName("yield");
        if (matchName("from")) {
            return new Expr.YieldFrom(parseExpression());
        }
        return new Expr.Yield(startsExpression() ? parseStarExpressions() : null);
    }

    private Expr parseDisjunction() {
        Expr first = parseConjunction();
        if (!checkName("or")) {
            return first;
        }
        List<Expr> values = new ArrayList<>();
        values.add(first);
        while (matchName("or")) {
            values.add(parseConjunction());
        }
        return new Expr.BoolOp(BoolOperator.OR, values);
    }

    private Expr parseConjunction() {
        Expr first = parseInversion();
        if (!checkName("and")) {
            return first;
        }
        List<Expr> values = new ArrayList<>();
        values.add(first);
        while (matchName("and")) {
            values.add(parseInversion());
        }
        return new Expr.BoolOp(BoolOperator.AND, values);
    }

    private Expr parseInversion() {
        if (matchName("not")) {
            return new Expr.UnaryOp(UnaryOperator.NOT, parseInversion());
        }
        return parseComparison();
    }

    private Expr parseComparison() {
        Expr left = parseBitwiseOr();
        List<CompareOperator> ops = new ArrayList<>();
        List<Expr> comparators = new ArrayList<>();
        while (true) {
            CompareOperator op = matchComparisonOperator();
            if (op == null) {
                break;
            }
            ops.add(op);
            comparators.add(parseBitwiseOr());
        }
        return ops.isEmpty() ? left : new Expr.Compare(left, ops, comparators);
    }

    private CompareOperator matchComparisonOperator() {
        PythonToken token = peek();
        if (token.getType() == TokenType.OP && COMPARISON_OPS.containsKey(token.getValue())) {
            advance();
            return COMPARISON_OPS.get(token.getValue());
        }
        if (token.isName("in")) {
            advance();
            return CompareOperator.IN;
        }
        if (token.isName("not") && peekAt(1).isName("in")) {
            advance();
            advance();
            return CompareOperator.NOT_IN;
        }
        if (token.isName("is")) {
            advance();
            return matchName("not") ? CompareOperator.IS_NOT : CompareOperator.IS;
        }
        return null;
    }

    private Expr parseBitwiseOr() {
        Expr left = parseBitwiseXor();
        while (matchOp("|")) {
            left = new Expr.BinOp(left, BinaryOperator.BIT_OR, parseBitwiseXor());
        }
        return left;
    }

    private Expr parseBitwiseXor() {
        Expr left = parseBitwiseAnd();
        while (matchOp("^")) {
            left = new Expr.BinOp(left, BinaryOperator.BIT_XOR, parseBitwiseAnd());
        }
        return left;
    }

    private Expr parseBitwiseAnd() {
        Expr left = parseShift();
        while (matchOp("&")) {
            left = new Expr.BinOp(left, BinaryOperator.BIT_AND, parseShift());
        }
        return left;
    }

    private Expr parseShift() {
        Expr left = parseSum();
        while (checkOp("<<") || checkOp(">>")) {
            BinaryOperator op = BinaryOperator.fromSymbol(advance().getValue());
            left = new Expr.BinOp(left, op, parseSum());
        }
        return left;
    }

    private Expr parseSum() {
        Expr left = parseTerm();
        while (checkOp("+") || checkOp("-")) {
            BinaryOperator op = BinaryOperator.fromSymbol(advance().getValue());
            left = new Expr.BinOp(left, op, parseTerm());
        }
        return left;
    }

    private Expr parseTerm() {
        Expr left = parseFactor();
        while (checkOp("*") || checkOp("/") || checkOp("//") || checkOp("%") || checkOp("@")) {
            BinaryOperator op = BinaryOperator.fromSymbol(advance().getValue());
            left = new Expr.BinOp(left, op, parseFactor());
        }
        return left;
    }

    private Expr parseFactor() {
        if (matchOp("+")) {
            return new Expr.UnaryOp(UnaryOperator.PLUS, parseFactor());
        }
        if (matchOp("-")) {
            return new Expr.UnaryOp(UnaryOperator.MINUS, parseFactor());
        }
        if (matchOp("~")) {
            return new Expr.UnaryOp(UnaryOperator.INVERT, parseFactor());
        }
        return parsePower();
    }

    private Expr parsePower() {
        Expr base = parseAwaitPrimary();
        if (matchOp("**")) {
            return new Expr.BinOp(base, BinaryOperator.POW, parseFactor());
        }
        return base;
    }

    private Expr parseAwaitPrimary() {
        if (matchName("await")) {
            return new Expr.Await(parsePrimary());
        }
        return parsePrimary();
    }

    private Expr parsePrimary() {
        Expr expr = parseAtom();
        while (true) {
            if (matchOp(".")) {
                expr = new Expr.Attribute(expr, expectIdentifier());
            } else if (matchOp("(")) {
                List<Expr> args = new ArrayList<>();
                List<Keyword> keywords = new ArrayList<>();
                parseArguments(args, keywords);
                expr = new Expr.Call(expr, args, keywords);
            } else if (matchOp("[")) {
                Expr slice = parseSlices();
                expectOp("]");
                expr = new Expr.Subscript(expr, slice);
            } else {
                return expr;
            }
        }
    }

    private Expr parseSlices() {
        Expr first = parseSlice();
        if (!checkOp(",")) {
            return first;
        }
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (matchOp(",")) {
            if (checkOp("]")) {
                break;
            }
            elts.add(parseSlice());
        }
        return new Expr.TupleExpr(elts);
    }

    private Expr parseSlice() {
        if (matchOp("*")) {
            return new Expr.Starred(parseBitwiseOr());
        }
        Expr lower = null;
        if (!checkOp(":")) {
            lower = parseNamedExpression();
            if (!checkOp(":")) {
                return lower;
            }
        }
        expectOp(":");
        Expr upper = sliceBoundary() ? null : parseExpression();
        Expr step = null;
        if (matchOp(":")) {
            step = sliceBoundary() ? null : parseExpression();
        }
        return new Expr.Slice(lower, upper, step);
    }

    private boolean sliceBoundary() {
        return checkOp(":") || checkOp(",") || checkOp("]");
    }

    private Expr parseAtom() {
        PythonToken token = peek();
        switch (token.getType()) {
            case NAME:
                return parseNameAtom(token);
            case NUMBER:
                advance();
                return numberConstant(token);
            case STRING:
                return parseStrings();
            case OP:
                break;
            default:
                throw error(token, "invalid syntax");
        }
        if (matchOp("...")) {
            return new Expr.Constant(ConstantKind.ELLIPSIS, "...");
        }
        if (matchOp("(")) {
            return parseParenthesized();
        }
        if (matchOp("[")) {
            return parseListDisplay();
        }
        if (matchOp("{")) {
            return parseBraceDisplay();
        }
        throw error(token, "invalid syntax");
    }

    private Expr parseNameAtom(PythonToken token) {
        switch (token.getValue()) {
            case "True":
                advance();
                return new Expr.Constant(ConstantKind.TRUE, "True");
            case "False":
                advance();
                return new Expr.Constant(ConstantKind.FALSE, "False");
            case "None":
                advance();
                return new Expr.Constant(ConstantKind.NONE, "None");
            default:
                break;
        }
        if (KEYWORDS.contains(token.getValue())) {
            throw error(token, "invalid syntax");
        }
        advance();
        return new Expr.Name(token.getValue());
    }

    private Expr numberConstant(PythonToken token) {
        String text = token.getValue();
        try {
            if (text.endsWith("j") || text.endsWith("J")) {
                return new Expr.Constant(ConstantKind.COMPLEX,
                        PythonLiterals.floatValue(text.substring(0, text.length() - 1)));
            }
            if (PythonLiterals.isIntegerLiteral(text)) {
                return new Expr.Constant(ConstantKind.INTEGER, PythonLiterals.integerValue(text));
            }
            return new Expr.Constant(ConstantKind.FLOAT, PythonLiterals.floatValue(text));
        } catch (NumberFormatException e) {
            throw error(token, "invalid number literal '" + text + "'");
        } catch (IllegalArgumentException e) {
            throw error(token, e.getMessage());
        }
    }

    private Expr parseParenthesized() {
        if (matchOp(")")) {
            return new Expr.TupleExpr(new ArrayList<>());
        }
        if (checkName("yield")) {
            Expr yield = parseYieldExpression();
            expectOp(")");
            return yield;
        }
        Expr first = parseStarNamedExpression();
        if (startsComprehension()) {
            Expr generator = new Expr.Comprehension(Expr.Comprehension.Kind.GENERATOR, first,
                    parseComprehensionClauses());
            expectOp(")");
            return generator;
        }
        if (!checkOp(",")) {
            expectOp(")");
            return first;
        }
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (matchOp(",")) {
            if (checkOp(")")) {
                break;
            }
            elts.add(parseStarNamedExpression());
        }
        expectOp(")");
        return new Expr.TupleExpr(elts);
    }

    private Expr parseListDisplay() {
        if (matchOp("]")) {
            return new Expr.ListExpr(new ArrayList<>());
        }
        Expr first = parseStarNamedExpression();
        if (startsComprehension()) {
            Expr comp = new Expr.Comprehension(Expr.Comprehension.Kind.LIST, first, parseComprehensionClauses());
            expectOp("]");
            return comp;
        }
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (matchOp(",")) {
            if (checkOp("]")) {
                break;
            }
            elts.add(parseStarNamedExpression());
        }
        expectOp("]");
        return new Expr.ListExpr(elts);
    }

    private Expr parseBraceDisplay() {
        if (matchOp("}")) {
            return new Expr.DictExpr(new ArrayList<>(), new ArrayList<>());
        }
        if (checkOp("**")) {
            return parseDictDisplay(null, null);
        }
        Expr first = parseStarNamedExpression();
        if (matchOp(":")) {
            Expr value = parseExpression();
            if (startsComprehension()) {
                Expr comp = new Expr.DictComp(first, value, parseComprehensionClauses());
                expectOp("}");
                return comp;
            }
            return parseDictDisplay(first, value);
        }
        if (startsComprehension()) {
            Expr comp = new Expr.Comprehension(Expr.Comprehension.Kind.SET, first, parseComprehensionClauses());
            expectOp("}");
            return comp;
        }
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (matchOp(",")) {
            if (checkOp("}")) {
                break;
            }
            elts.add(parseStarNamedExpression());
        }
        expectOp("}");
        return new Expr.SetExpr(elts);
    }

    /**
     * Parses the rest of a dict display. When {@code firstKey} is null the display starts at a
     * {@code **} entry that has not been consumed yet.
     */
    private Expr parseDictDisplay(Expr firstKey, Expr firstValue) {
        List<Expr> keys = new ArrayList<>();
        List<Expr> values = new ArrayList<>();
        boolean pending = firstKey == null;
        if (!pending) {
            keys.add(firstKey);
            values.add(firstValue);
        }
        while (pending || matchOp(",")) {
            pending = false;
            if (checkOp("}")) {
                break;
            }
            if (matchOp("**")) {
                keys.add(null);
                values.add(parseBitwiseOr());
            } else {
                keys.add(parseExpression());
                expectOp(":");
                values.add(parseExpression());
            }
        }
        expectOp("}");
        return new Expr.DictExpr(keys, values);
    }

    private boolean startsComprehension() {
        return checkName("for") || (checkName("async") && peekAt(1).isName("for"));
    }

    private List<ComprehensionClause> parseComprehensionClauses() {
        List<ComprehensionClause> clauses = new ArrayList<>();
        while (startsComprehension()) {
            boolean async = matchName("async");
            PythonToken forToken = expectName("for");
            Expr target = parseTargetList();
            checkAssignable(target, forToken);
            expectName("in");
            Expr iter = parseDisjunction();
            List<Expr> ifs = new ArrayList<>();
            while (matchName("if")) {
                ifs.add(parseDisjunction());
            }
            clauses.add(new ComprehensionClause(target, iter, ifs, async));
        }
        return clauses;
    }

    private Expr parseTargetList() {
        Expr first = parseStarTarget();
        if (!checkOp(",")) {
            return first;
        }
        List<Expr> elts = new ArrayList<>();
        elts.add(first);
        while (matchOp(",")) {
            if (checkName("in") || checkOp("=") || checkOp(":")) {
                break;
            }
            elts.add(parseStarTarget());
        }
        return new Expr.TupleExpr(elts);
    }

    private Expr parseStarTarget() {
        if (matchOp("*")) {
            return new Expr.Starred(parseBitwiseOr());
        }
        return parseBitwiseOr();
    }

    private Expr parseStrings() {
        List<PythonToken> parts = new ArrayList<>();
        while (check(TokenType.STRING)) {
            parts.add(advance());
        }
        return new StringLiteralParser(fileName).combine(parts);
    }

    private void checkAssignable(Expr target, PythonToken at) {
        if (target instanceof Expr.Name || target instanceof Expr.Attribute || target instanceof Expr.Subscript) {
            return;
        }
        if (target instanceof Expr.Starred starred) {
            checkAssignable(starred.getValue(), at);
            return;
        }
        if (target instanceof Expr.TupleExpr tuple) {
            tuple.getElts().forEach(e -> checkAssignable(e, at));
            return;
        }
        if (target instanceof Expr.ListExpr list) {
            list.getElts().forEach(e -> checkAssignable(e, at));
            return;
        }
        throw error(at, "cannot assign to " + describe(target));
    }

    private static String describe(Expr expr) {
        if (expr instanceof Expr.Call) {
            return "function call";
        }
        if (expr instanceof Expr.Constant) {
            return "literal";
        }
        if (expr instanceof Expr.Compare) {
            return "comparison";
        }
        if (expr instanceof Expr.TupleExpr) {
            return "tuple";
        }
        if (expr instanceof Expr.Lambda) {
            return "lambda";
        }
        return "expression";
    }

    private boolean startsExpression() {
        PythonToken token = peek();
        switch (token.getType()) {
            case NAME:
                return !KEYWORDS.contains(token.getValue())
                        || Set.of("True", "False", "None", "not", "lambda", "await", "yield").contains(token.getValue());
            case NUMBER:
            case STRING:
                return true;
            case OP:
                return Set.of("(", "[", "{", "-", "+", "~", "*", "...").contains(token.getValue());
            default:
                return false;
        }
    }

    // ---------------------------------------------------------------- token helpers

    private PythonToken peek() {
        return tokens.get(pos);
    }

    private PythonToken peekAt(int offset) {
        int index = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private PythonToken previous() {
        return tokens.get(pos - 1);
    }

    private PythonToken advance() {
        PythonToken token = tokens.get(pos);
        if (token.getType() != TokenType.ENDMARKER) {
            pos++;
        }
        return token;
    }

    private boolean check(TokenType type) {
        return peek().getType() == type;
    }

    private boolean checkOp(String op) {
        return peek().isOp(op);
    }

    private boolean checkName(String name) {
        return peek().isName(name);
    }

    private boolean match(TokenType type) {
        if (check(type)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchOp(String op) {
        if (checkOp(op)) {
            advance();
            return true;
        }
        return false;
    }

    private boolean matchName(String name) {
        if (checkName(name)) {
            advance();
            return true;
        }
        return false;
    }

    private PythonToken expect(TokenType type, String message) {
        if (check(type)) {
            return advance();
        }
        throw error(peek(), message);
    }

    private PythonToken expectOp(String op) {
        if (checkOp(op)) {
            return advance();
        }
        throw error(peek(), "expected '" + op + "'");
    }

    private PythonToken expectName(String name) {
        if (checkName(name)) {
            return advance();
        }
        throw error(peek(), "expected '" + name + "'");
    }

    private String expectIdentifier() {
        PythonToken token = peek();
        if (token.getType() != TokenType.NAME || KEYWORDS.contains(token.getValue())) {
            throw error(token, "invalid syntax");
        }
        advance();
        return token.getValue();
    }

    private PythonSyntaxException error(PythonToken token, String message) {
        return new PythonSyntaxException(message, fileName, token.getLine(), token.getColumn());
    }
}
