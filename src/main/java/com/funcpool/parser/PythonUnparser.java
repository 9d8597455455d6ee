package com.funcpool.parser;

import com.funcpool.model.syntax.Arg;
import com.funcpool.model.syntax.Arguments;
import com.funcpool.model.syntax.BinaryOperator;
import com.funcpool.model.syntax.BoolOperator;
import com.funcpool.model.syntax.ComprehensionClause;
import com.funcpool.model.syntax.ConstantKind;
import com.funcpool.model.syntax.ExceptHandler;
import com.funcpool.model.syntax.Expr;
import com.funcpool.model.syntax.ImportName;
import com.funcpool.model.syntax.Keyword;
import com.funcpool.model.syntax.Module;
import com.funcpool.model.syntax.Node;
import com.funcpool.model.syntax.NodeVisitor;
import com.funcpool.model.syntax.Stmt;
import com.funcpool.model.syntax.SyntaxTrees;
import com.funcpool.model.syntax.UnaryOperator;
import com.funcpool.model.syntax.WithItem;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Renders a syntax tree back to Python source in one canonical layout: four-space indentation,
 * a blank line before every def and class, parentheses only where precedence needs them, and one
 * fixed spelling per literal value.
 */
public class PythonUnparser implements NodeVisitor<Void> {

    private static final String INFINITY = "1e309";

    // Operator precedence, lowest binding first.
    private static final int NAMED_EXPR = 1;
    private static final int TUPLE = 2;
    private static final int YIELD = 3;
    private static final int TEST = 4;
    private static final int OR = 5;
    private static final int AND = 6;
    private static final int NOT = 7;
    private static final int CMP = 8;
    private static final int EXPR = 9;
    private static final int BOR = 9;
    private static final int BXOR = 10;
    private static final int BAND = 11;
    private static final int SHIFT = 12;
    private static final int ARITH = 13;
    private static final int TERM = 14;
    private static final int FACTOR = 15;
    private static final int POWER = 16;
    private static final int AWAIT = 17;
    private static final int ATOM = 18;

    private static final Map<BinaryOperator, Integer> BINARY_PRECEDENCE = Map.ofEntries(
        Map.entry(BinaryOperator.ADD, ARITH),
        Map.entry(BinaryOperator.SUB, ARITH),
        Map.entry(BinaryOperator.MULT, TERM),
        Map.entry(BinaryOperator.MAT_MULT, TERM),
        Map.entry(BinaryOperator.DIV, TERM),
        Map.entry(BinaryOperator.MOD, TERM),
        Map.entry(BinaryOperator.FLOOR_DIV, TERM),
        Map.entry(BinaryOperator.LSHIFT, SHIFT),
        Map.entry(BinaryOperator.RSHIFT, SHIFT),
        Map.entry(BinaryOperator.BIT_OR, BOR),
        Map.entry(BinaryOperator.BIT_XOR, BXOR),
        Map.entry(BinaryOperator.BIT_AND, BAND),
        Map.entry(BinaryOperator.POW, POWER)
    );

    private final StringBuilder out = new StringBuilder();
    private final Map<Node, Integer> precedences = new IdentityHashMap<>();
    private int indent = 0;

    /**
     * Renders a tree; the result has no leading or trailing newline.
     */
    public static String unparse(Node node) {
        PythonUnparser unparser = new PythonUnparser();
        unparser.traverse(node);
        return unparser.out.toString();
    }

    private static String unparseInner(Expr node, int precedence) {
        PythonUnparser unparser = new PythonUnparser();
        unparser.precedences.put(node, precedence);
        unparser.traverse(node);
        return unparser.out.toString();
    }

    // ---------------------------------------------------------------- layout helpers

    private void traverse(Node node) {
        node.accept(this);
    }

    private void traverseAll(List<? extends Node> nodes) {
        for (Node node : nodes) {
            traverse(node);
        }
    }

    private void write(String text) {
        out.append(text);
    }

    private void fill(String text) {
        if (out.length() > 0) {
            out.append('\n');
        }
        out.append("    ".repeat(indent)).append(text);
    }

    private void maybeNewline() {
        if (out.length() > 0) {
            out.append('\n');
        }
    }

    private void block(Runnable body) {
        write(":");
        indent++;
        body.run();
        indent--;
    }

    private <T> void interleave(List<T> items, Consumer<T> action) {
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                write(", ");
            }
            action.accept(items.get(i));
        }
    }

    private void itemsView(List<Expr> items) {
        if (items.size() == 1) {
            traverse(items.get(0));
            write(",");
        } else {
            interleave(items, this::traverse);
        }
    }

    private int precedenceOf(Node node) {
        return precedences.getOrDefault(node, TEST);
    }

    private void setPrecedence(int precedence, Node... nodes) {
        for (Node node : nodes) {
            if (node != null) {
                precedences.put(node, precedence);
            }
        }
    }

    private void delimitIf(boolean condition, String open, String close, Runnable body) {
        if (condition) {
            write(open);
        }
        body.run();
        if (condition) {
            write(close);
        }
    }

    private void requireParens(int precedence, Node node, Runnable body) {
        delimitIf(precedenceOf(node) > precedence, "(", ")", body);
    }

    private void writeDocstringAndBody(List<Stmt> body) {
        Expr.Constant docstring = SyntaxTrees.docstringOf(body);
        if (docstring != null) {
            fill("");
            PythonLiterals.QuotedText quoted = PythonLiterals.quoteAvoidingBackslashes(
                    docstring.getValue(), PythonLiterals.MULTI_QUOTES, false);
            String quote = quoted.getQuoteTypes().get(0);
            write(quote + quoted.getText() + quote);
            traverseAll(body.subList(1, body.size()));
        } else {
            traverseAll(body);
        }
    }

    // ---------------------------------------------------------------- auxiliary nodes

    @Override
    public Void visitModule(Module node) {
        writeDocstringAndBody(node.getBody());
        return null;
    }

    @Override
    public Void visitArguments(Arguments node) {
        boolean first = true;
        List<Arg> allArgs = new ArrayList<>(node.getPosonlyargs());
        allArgs.addAll(node.getArgs());
        int missingDefaults = allArgs.size() - node.getDefaults().size();
        for (int i = 0; i < allArgs.size(); i++) {
            if (first) {
                first = false;
            } else {
                write(", ");
            }
            traverse(allArgs.get(i));
            if (i >= missingDefaults) {
                write("=");
                traverse(node.getDefaults().get(i - missingDefaults));
            }
            if (i + 1 == node.getPosonlyargs().size()) {
                write(", /");
            }
        }
        if (node.getVararg() != null || !node.getKwonlyargs().isEmpty()) {
            if (first) {
                first = false;
            } else {
                write(", ");
            }
            write("*");
            if (node.getVararg() != null) {
                write(node.getVararg().getName());
                if (node.getVararg().getAnnotation() != null) {
                    write(": ");
                    traverse(node.getVararg().getAnnotation());
                }
            }
        }
        for (int i = 0; i < node.getKwonlyargs().size(); i++) {
            write(", ");
            traverse(node.getKwonlyargs().get(i));
            Expr defaultValue = node.getKwDefaults().get(i);
            if (defaultValue != null) {
                write("=");
                traverse(defaultValue);
            }
        }
        if (node.getKwarg() != null) {
            if (!first) {
                write(", ");
            }
            write("**" + node.getKwarg().getName());
            if (node.getKwarg().getAnnotation() != null) {
                write(": ");
                traverse(node.getKwarg().getAnnotation());
            }
        }
        return null;
    }

    @Override
    public Void visitArg(Arg node) {
        write(node.getName());
        if (node.getAnnotation() != null) {
            write(": ");
            traverse(node.getAnnotation());
        }
        return null;
    }

    @Override
    public Void visitKeyword(Keyword node) {
        if (node.getArg() == null) {
            write("**");
        } else {
            write(node.getArg());
            write("=");
        }
        traverse(node.getValue());
        return null;
    }

    @Override
    public Void visitComprehensionClause(ComprehensionClause node) {
        write(node.isAsync() ? " async for " : " for ");
        setPrecedence(TUPLE, node.getTarget());
        traverse(node.getTarget());
        write(" in ");
        setPrecedence(TEST + 1, node.getIter());
        node.getIfs().forEach(condition -> setPrecedence(TEST + 1, condition));
        traverse(node.getIter());
        for (Expr condition : node.getIfs()) {
            write(" if ");
            traverse(condition);
        }
        return null;
    }

    @Override
    public Void visitExceptHandler(ExceptHandler node) {
        fill("except");
        if (node.getType() != null) {
            write(" ");
            traverse(node.getType());
        }
        if (node.getName() != null) {
            write(" as ");
            write(node.getName());
        }
        block(() -> traverseAll(node.getBody()));
        return null;
    }

    @Override
    public Void visitWithItem(WithItem node) {
        traverse(node.getContextExpr());
        if (node.getOptionalVars() != null) {
            write(" as ");
            traverse(node.getOptionalVars());
        }
        return null;
    }

    @Override
    public Void visitImportName(ImportName node) {
        write(node.getName());
        if (node.getAsname() != null) {
            write(" as " + node.getAsname());
        }
        return null;
    }

    // ---------------------------------------------------------------- statements

    @Override
    public Void visitFunctionDef(Stmt.FunctionDef node) {
        maybeNewline();
        for (Expr decorator : node.getDecorators()) {
            fill("@");
            traverse(decorator);
        }
        fill((node.isAsync() ? "async def " : "def ") + node.getName());
        write("(");
        traverse(node.getArgs());
        write(")");
        if (node.getReturns() != null) {
            write(" -> ");
            traverse(node.getReturns());
        }
        block(() -> writeDocstringAndBody(node.getBody()));
        return null;
    }

    @Override
    public Void visitClassDef(Stmt.ClassDef node) {
        maybeNewline();
        for (Expr decorator : node.getDecorators()) {
            fill("@");
            traverse(decorator);
        }
        fill("class " + node.getName());
        boolean hasArguments = !node.getBases().isEmpty() || !node.getKeywords().isEmpty();
        delimitIf(hasArguments, "(", ")", () -> {
            List<Node> arguments = new ArrayList<>(node.getBases());
            arguments.addAll(node.getKeywords());
            interleave(arguments, this::traverse);
        });
        block(() -> writeDocstringAndBody(node.getBody()));
        return null;
    }

    @Override
    public Void visitReturn(Stmt.Return node) {
        fill("return");
        if (node.getValue() != null) {
            write(" ");
            traverse(node.getValue());
        }
        return null;
    }

    @Override
    public Void visitDelete(Stmt.Delete node) {
        fill("del ");
        interleave(node.getTargets(), this::traverse);
        return null;
    }

    @Override
    public Void visitAssign(Stmt.Assign node) {
        fill("");
        for (Expr target : node.getTargets()) {
            setPrecedence(TUPLE, target);
            traverse(target);
            write(" = ");
        }
        traverse(node.getValue());
        return null;
    }

    @Override
    public Void visitAugAssign(Stmt.AugAssign node) {
        fill("");
        traverse(node.getTarget());
        write(" " + node.getOp().getSymbol() + "= ");
        traverse(node.getValue());
        return null;
    }

    @Override
    public Void visitAnnAssign(Stmt.AnnAssign node) {
        fill("");
        delimitIf(!node.isSimple() && node.getTarget() instanceof Expr.Name, "(", ")",
                () -> traverse(node.getTarget()));
        write(": ");
        traverse(node.getAnnotation());
        if (node.getValue() != null) {
            write(" = ");
            traverse(node.getValue());
        }
        return null;
    }

    @Override
    public Void visitFor(Stmt.For node) {
        fill(node.isAsync() ? "async for " : "for ");
        setPrecedence(TUPLE, node.getTarget());
        traverse(node.getTarget());
        write(" in ");
        traverse(node.getIter());
        block(() -> traverseAll(node.getBody()));
        if (!node.getOrelse().isEmpty()) {
            fill("else");
            block(() -> traverseAll(node.getOrelse()));
        }
        return null;
    }

    @Override
    public Void visitWhile(Stmt.While node) {
        fill("while ");
        traverse(node.getTest());
        block(() -> traverseAll(node.getBody()));
        if (!node.getOrelse().isEmpty()) {
            fill("else");
            block(() -> traverseAll(node.getOrelse()));
        }
        return null;
    }

    @Override
    public Void visitIf(Stmt.If node) {
        fill("if ");
        traverse(node.getTest());
        block(() -> traverseAll(node.getBody()));
        Stmt.If current = node;
        // collapse nested ifs into equivalent elifs
        while (current.getOrelse().size() == 1 && current.getOrelse().get(0) instanceof Stmt.If elif) {
            current = elif;
            fill("elif ");
            traverse(elif.getTest());
            block(() -> traverseAll(elif.getBody()));
        }
        if (!current.getOrelse().isEmpty()) {
            List<Stmt> orelse = current.getOrelse();
            fill("else");
            block(() -> traverseAll(orelse));
        }
        return null;
    }

    @Override
    public Void visitWith(Stmt.With node) {
        fill(node.isAsync() ? "async with " : "with ");
        interleave(node.getItems(), this::traverse);
        block(() -> traverseAll(node.getBody()));
        return null;
    }

    @Override
    public Void visitRaise(Stmt.Raise node) {
        fill("raise");
        if (node.getExc() == null) {
            return null;
        }
        write(" ");
        traverse(node.getExc());
        if (node.getCause() != null) {
            write(" from ");
            traverse(node.getCause());
        }
        return null;
    }

    @Override
    public Void visitTry(Stmt.Try node) {
        fill("try");
        block(() -> traverseAll(node.getBody()));
        traverseAll(node.getHandlers());
        if (!node.getOrelse().isEmpty()) {
            fill("else");
            block(() -> traverseAll(node.getOrelse()));
        }
        if (!node.getFinalbody().isEmpty()) {
            fill("finally");
            block(() -> traverseAll(node.getFinalbody()));
        }
        return null;
    }

    @Override
    public Void visitAssert(Stmt.Assert node) {
        fill("assert ");
        traverse(node.getTest());
        if (node.getMsg() != null) {
            write(", ");
            traverse(node.getMsg());
        }
        return null;
    }

    @Override
    public Void visitImport(Stmt.Import node) {
        fill("import ");
        interleave(node.getNames(), this::traverse);
        return null;
    }

    @Override
    public Void visitImportFrom(Stmt.ImportFrom node) {
        fill("from ");
        write(".".repeat(node.getLevel()));
        if (node.getModule() != null) {
            write(node.getModule());
        }
        write(" import ");
        interleave(node.getNames(), this::traverse);
        return null;
    }

    @Override
    public Void visitGlobal(Stmt.Global node) {
        fill("global ");
        write(String.join(", ", node.getNames()));
        return null;
    }

    @Override
    public Void visitNonlocal(Stmt.Nonlocal node) {
        fill("nonlocal ");
        write(String.join(", ", node.getNames()));
        return null;
    }

    @Override
    public Void visitExprStmt(Stmt.ExprStmt node) {
        fill("");
        setPrecedence(YIELD, node.getValue());
        traverse(node.getValue());
        return null;
    }

    @Override
    public Void visitPass(Stmt.Pass node) {
        fill("pass");
        return null;
    }

    @Override
    public Void visitBreak(Stmt.Break node) {
        fill("break");
        return null;
    }

    @Override
    public Void visitContinue(Stmt.Continue node) {
        fill("continue");
        return null;
    }

    // ---------------------------------------------------------------- expressions

    @Override
    public Void visitName(Expr.Name node) {
        write(node.getId());
        return null;
    }

    @Override
    public Void visitConstant(Expr.Constant node) {
        switch (node.getKind()) {
            case STRING -> write(PythonLiterals.reprString(node.getValue()));
            case BYTES -> write(PythonLiterals.reprBytes(node.getValue()));
            case FLOAT -> write(floatText(node.getValue()));
            case COMPLEX -> {
                String imaginary = node.getValue();
                if (imaginary.endsWith(".0")) {
                    imaginary = imaginary.substring(0, imaginary.length() - 2);
                }
                write(floatText(imaginary) + "j");
            }
            default -> write(node.getValue());
        }
        return null;
    }

    private static String floatText(String repr) {
        return repr.replace("inf", INFINITY).replace("nan", "(" + INFINITY + "-" + INFINITY + ")");
    }

    @Override
    public Void visitJoinedStr(Expr.JoinedStr node) {
        write("f");
        List<String> rendered = new ArrayList<>();
        List<Boolean> constant = new ArrayList<>();
        for (Expr value : node.getValues()) {
            StringBuilder buffer = new StringBuilder();
            writeFStringInner(value, false, buffer);
            rendered.add(buffer.toString());
            constant.add(value instanceof Expr.Constant);
        }

        List<String> quoteTypes = new ArrayList<>(PythonLiterals.ALL_QUOTES);
        List<String> parts = new ArrayList<>();
        boolean fallbackToRepr = false;
        for (int i = 0; i < rendered.size(); i++) {
            String value = rendered.get(i);
            if (constant.get(i)) {
                PythonLiterals.QuotedText quoted = PythonLiterals.quoteAvoidingBackslashes(value, quoteTypes, true);
                if (quoted.getQuoteTypes().stream().noneMatch(quoteTypes::contains)) {
                    fallbackToRepr = true;
                    break;
                }
                value = quoted.getText();
                quoteTypes = new ArrayList<>(quoted.getQuoteTypes());
            } else {
                if (value.contains("\n")) {
                    quoteTypes.removeIf(q -> !PythonLiterals.MULTI_QUOTES.contains(q));
                }
                // keep the result valid for interpreters that forbid reusing the outer quote
                String expression = value;
                List<String> unused = new ArrayList<>(quoteTypes);
                unused.removeIf(q -> expression.indexOf(q.charAt(0)) >= 0);
                if (!unused.isEmpty()) {
                    quoteTypes = unused;
                }
            }
            parts.add(value);
        }
        if (fallbackToRepr) {
            quoteTypes = List.of("'''");
            parts.clear();
            for (int i = 0; i < rendered.size(); i++) {
                String value = rendered.get(i);
                if (constant.get(i)) {
                    String repr = PythonLiterals.reprString("\"" + value);
                    value = repr.substring(2, repr.length() - 1);
                }
                parts.add(value);
            }
        }
        String quote = quoteTypes.get(0);
        write(quote + String.join("", parts) + quote);
        return null;
    }

    private void writeFStringInner(Expr node, boolean formatSpec, StringBuilder buffer) {
        if (node instanceof Expr.JoinedStr joined) {
            for (Expr value : joined.getValues()) {
                writeFStringInner(value, formatSpec, buffer);
            }
        } else if (node instanceof Expr.Constant constant && constant.isString()) {
            String value = constant.getValue().replace("{", "{{").replace("}", "}}");
            if (formatSpec) {
                value = value.replace("\\", "\\\\")
                        .replace("'", "\\'")
                        .replace("\"", "\\\"")
                        .replace("\n", "\\n");
            }
            buffer.append(value);
        } else if (node instanceof Expr.FormattedValue formatted) {
            buffer.append('{');
            String expression = unparseInner(formatted.getValue(), TEST + 1);
            if (expression.startsWith("{")) {
                buffer.append(' ');
            }
            buffer.append(expression);
            if (formatted.getConversion() != -1) {
                buffer.append('!').append((char) formatted.getConversion());
            }
            if (formatted.getFormatSpec() != null) {
                buffer.append(':');
                writeFStringInner(formatted.getFormatSpec(), true, buffer);
            }
            buffer.append('}');
        }
    }

    @Override
    public Void visitFormattedValue(Expr.FormattedValue node) {
        StringBuilder buffer = new StringBuilder();
        writeFStringInner(node, false, buffer);
        write(buffer.toString());
        return null;
    }

    @Override
    public Void visitAttribute(Expr.Attribute node) {
        setPrecedence(ATOM, node.getValue());
        traverse(node.getValue());
        // 1.real would lex as a float; 1 .real is an attribute access
        if (node.getValue() instanceof Expr.Constant constant
                && constant.getKind() == ConstantKind.INTEGER) {
            write(" ");
        }
        write(".");
        write(node.getAttr());
        return null;
    }

    @Override
    public Void visitSubscript(Expr.Subscript node) {
        setPrecedence(ATOM, node.getValue());
        traverse(node.getValue());
        write("[");
        if (node.getSlice() instanceof Expr.TupleExpr tuple && !tuple.getElts().isEmpty()) {
            itemsView(tuple.getElts());
        } else {
            traverse(node.getSlice());
        }
        write("]");
        return null;
    }

    @Override
    public Void visitSlice(Expr.Slice node) {
        if (node.getLower() != null) {
            traverse(node.getLower());
        }
        write(":");
        if (node.getUpper() != null) {
            traverse(node.getUpper());
        }
        if (node.getStep() != null) {
            write(":");
            traverse(node.getStep());
        }
        return null;
    }

    @Override
    public Void visitStarred(Expr.Starred node) {
        write("*");
        setPrecedence(EXPR, node.getValue());
        traverse(node.getValue());
        return null;
    }

    @Override
    public Void visitCall(Expr.Call node) {
        setPrecedence(ATOM, node.getFunc());
        traverse(node.getFunc());
        write("(");
        List<Node> arguments = new ArrayList<>(node.getArgs());
        arguments.addAll(node.getKeywords());
        interleave(arguments, this::traverse);
        write(")");
        return null;
    }

    @Override
    public Void visitBinOp(Expr.BinOp node) {
        int precedence = BINARY_PRECEDENCE.get(node.getOp());
        requireParens(precedence, node, () -> {
            int leftPrecedence;
            int rightPrecedence;
            if (node.getOp() == BinaryOperator.POW) {
                leftPrecedence = precedence + 1;
                rightPrecedence = precedence;
            } else {
                leftPrecedence = precedence;
                rightPrecedence = precedence + 1;
            }
            setPrecedence(leftPrecedence, node.getLeft());
            traverse(node.getLeft());
            write(" " + node.getOp().getSymbol() + " ");
            setPrecedence(rightPrecedence, node.getRight());
            traverse(node.getRight());
        });
        return null;
    }

    @Override
    public Void visitUnaryOp(Expr.UnaryOp node) {
        int precedence = node.getOp() == UnaryOperator.NOT ? NOT : FACTOR;
        requireParens(precedence, node, () -> {
            write(node.getOp().getSymbol());
            if (precedence != FACTOR) {
                write(" ");
            }
            setPrecedence(precedence, node.getOperand());
            traverse(node.getOperand());
        });
        return null;
    }

    @Override
    public Void visitBoolOp(Expr.BoolOp node) {
        int base = node.getOp() == BoolOperator.AND ? AND : OR;
        requireParens(base, node, () -> {
            int level = base;
            List<Expr> values = node.getValues();
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) {
                    write(" " + node.getOp().getSymbol() + " ");
                }
                level++;
                setPrecedence(level, values.get(i));
                traverse(values.get(i));
            }
        });
        return null;
    }

    @Override
    public Void visitCompare(Expr.Compare node) {
        requireParens(CMP, node, () -> {
            setPrecedence(CMP + 1, node.getLeft());
            node.getComparators().forEach(comparator -> setPrecedence(CMP + 1, comparator));
            traverse(node.getLeft());
            for (int i = 0; i < node.getOps().size(); i++) {
                write(" " + node.getOps().get(i).getSymbol() + " ");
                traverse(node.getComparators().get(i));
            }
        });
        return null;
    }

    @Override
    public Void visitIfExp(Expr.IfExp node) {
        requireParens(TEST, node, () -> {
            setPrecedence(TEST + 1, node.getBody(), node.getTest());
            traverse(node.getBody());
            write(" if ");
            traverse(node.getTest());
            write(" else ");
            setPrecedence(TEST, node.getOrelse());
            traverse(node.getOrelse());
        });
        return null;
    }

    @Override
    public Void visitLambda(Expr.Lambda node) {
        requireParens(TEST, node, () -> {
            write("lambda");
            String parameters = unparse(node.getArgs());
            if (!parameters.isEmpty()) {
                write(" " + parameters);
            }
            write(": ");
            setPrecedence(TEST, node.getBody());
            traverse(node.getBody());
        });
        return null;
    }

    @Override
    public Void visitNamedExpr(Expr.NamedExpr node) {
        requireParens(NAMED_EXPR, node, () -> {
            setPrecedence(ATOM, node.getTarget(), node.getValue());
            traverse(node.getTarget());
            write(" := ");
            traverse(node.getValue());
        });
        return null;
    }

    @Override
    public Void visitAwait(Expr.Await node) {
        requireParens(AWAIT, node, () -> {
            write("await");
            if (node.getValue() != null) {
                write(" ");
                setPrecedence(ATOM, node.getValue());
                traverse(node.getValue());
            }
        });
        return null;
    }

    @Override
    public Void visitYield(Expr.Yield node) {
        requireParens(YIELD, node, () -> {
            write("yield");
            if (node.getValue() != null) {
                write(" ");
                setPrecedence(ATOM, node.getValue());
                traverse(node.getValue());
            }
        });
        return null;
    }

    @Override
    public Void visitYieldFrom(Expr.YieldFrom node) {
        requireParens(YIELD, node, () -> {
            write("yield from ");
            setPrecedence(ATOM, node.getValue());
            traverse(node.getValue());
        });
        return null;
    }

    @Override
    public Void visitListExpr(Expr.ListExpr node) {
        write("[");
        interleave(node.getElts(), this::traverse);
        write("]");
        return null;
    }

    @Override
    public Void visitTupleExpr(Expr.TupleExpr node) {
        delimitIf(node.getElts().isEmpty() || precedenceOf(node) > TUPLE, "(", ")",
                () -> itemsView(node.getElts()));
        return null;
    }

    @Override
    public Void visitSetExpr(Expr.SetExpr node) {
        if (node.getElts().isEmpty()) {
            write("{*()}");
            return null;
        }
        write("{");
        interleave(node.getElts(), this::traverse);
        write("}");
        return null;
    }

    @Override
    public Void visitDictExpr(Expr.DictExpr node) {
        write("{");
        List<Integer> indexes = new ArrayList<>();
        for (int i = 0; i < node.getKeys().size(); i++) {
            indexes.add(i);
        }
        interleave(indexes, i -> {
            Expr key = node.getKeys().get(i);
            Expr value = node.getValues().get(i);
            if (key == null) {
                write("**");
                setPrecedence(EXPR, value);
                traverse(value);
            } else {
                traverse(key);
                write(": ");
                traverse(value);
            }
        });
        write("}");
        return null;
    }

    @Override
    public Void visitComprehension(Expr.Comprehension node) {
        String open;
        String close;
        switch (node.getKind()) {
            case LIST -> {
                open = "[";
                close = "]";
            }
            case SET -> {
                open = "{";
                close = "}";
            }
            default -> {
                open = "(";
                close = ")";
            }
        }
        write(open);
        traverse(node.getElt());
        traverseAll(node.getGenerators());
        write(close);
        return null;
    }

    @Override
    public Void visitDictComp(Expr.DictComp node) {
        write("{");
        traverse(node.getKey());
        write(": ");
        traverse(node.getValue());
        traverseAll(node.getGenerators());
        write("}");
        return null;
    }
}
