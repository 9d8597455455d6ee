package com.funcpool.model.syntax;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for Python statements.
 */
public abstract class Stmt extends Node {

    @Getter
    @Setter
    protected int sourceLine;

    /**
     * {@code def} / {@code async def}.
     */
    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FunctionDef extends Stmt {
        private String name;
        private Arguments args;
        private List<Stmt> body = new ArrayList<>();
        private List<Expr> decorators = new ArrayList<>();
        private Expr returns;
        private boolean async;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitFunctionDef(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(args, body, decorators, returns);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ClassDef extends Stmt {
        private String name;
        private List<Expr> bases = new ArrayList<>();
        private List<Keyword> keywords = new ArrayList<>();
        private List<Stmt> body = new ArrayList<>();
        private List<Expr> decorators = new ArrayList<>();

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitClassDef(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(bases, keywords, body, decorators);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Return extends Stmt {
        private Expr value;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitReturn(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(value);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Delete extends Stmt {
        private List<Expr> targets = new ArrayList<>();

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitDelete(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(targets);
        }
    }

    /**
     * Plain assignment; chained assignments carry several targets.
     */
    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Assign extends Stmt {
        private List<Expr> targets = new ArrayList<>();
        private Expr value;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAssign(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(targets, value);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AugAssign extends Stmt {
        private Expr target;
        private BinaryOperator op;
        private Expr value;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAugAssign(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(target, value);
        }
    }

    /**
     * Annotated assignment. {@code simple} is false when a bare name target was parenthesized.
     */
    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class AnnAssign extends Stmt {
        private Expr target;
        private Expr annotation;
        private Expr value;
        private boolean simple;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAnnAssign(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(target, annotation, value);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class For extends Stmt {
        private Expr target;
        private Expr iter;
        private List<Stmt> body = new ArrayList<>();
        private List<Stmt> orelse = new ArrayList<>();
        private boolean async;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitFor(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(target, iter, body, orelse);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class While extends Stmt {
        private Expr test;
        private List<Stmt> body = new ArrayList<>();
        private List<Stmt> orelse = new ArrayList<>();

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitWhile(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(test, body, orelse);
        }
    }

    /**
     * {@code if}; an {@code elif} chain is a nested If as the single statement of {@code orelse}.
     */
    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class If extends Stmt {
        private Expr test;
        private List<Stmt> body = new ArrayList<>();
        private List<Stmt> orelse = new ArrayList<>();

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitIf(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(test, body, orelse);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class With extends Stmt {
        private List<WithItem> items = new ArrayList<>();
        private List<Stmt> body = new ArrayList<>();
        private boolean async;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitWith(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(items, body);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Raise extends Stmt {
        private Expr exc;
        private Expr cause;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitRaise(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(exc, cause);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Try extends Stmt {
        private List<Stmt> body = new ArrayList<>();
        private List<ExceptHandler> handlers = new ArrayList<>();
        private List<Stmt> orelse = new ArrayList<>();
        private List<Stmt> finalbody = new ArrayList<>();

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitTry(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(body, handlers, orelse, finalbody);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Assert extends Stmt {
        private Expr test;
        private Expr msg;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAssert(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(test, msg);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Import extends Stmt {
        private List<ImportName> names = new ArrayList<>();

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitImport(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(names);
        }
    }

    /**
     * {@code from module import names}; {@code module} is null for {@code from . import x}.
     */
    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImportFrom extends Stmt {
        private String module;
        private List<ImportName> names = new ArrayList<>();
        private int level;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitImportFrom(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(names);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Global extends Stmt {
        private List<String> names = new ArrayList<>();

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitGlobal(this);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Nonlocal extends Stmt {
        private List<String> names = new ArrayList<>();

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitNonlocal(this);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * An expression evaluated for its effect (a call, a docstring, a bare yield).
     */
    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ExprStmt extends Stmt {
        private Expr value;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitExprStmt(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(value);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    public static class Pass extends Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitPass(this);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    public static class Break extends Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitBreak(this);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    public static class Continue extends Stmt {
        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitContinue(this);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }
}
