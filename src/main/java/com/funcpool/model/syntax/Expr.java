package com.funcpool.model.syntax;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Base class for Python expressions.
 */
public abstract class Expr extends Node {

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Name extends Expr {
        private String id;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitName(this);
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
    public static class Constant extends Expr {
        private ConstantKind kind;
        private String value;

        public static Constant string(String value) {
            return new Constant(ConstantKind.STRING, value);
        }

        public boolean isString() {
            return kind == ConstantKind.STRING;
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitConstant(this);
        }

        @Override
        public List<Node> children() {
            return List.of();
        }
    }

    /**
     * An f-string: a sequence of string constants and formatted values.
     */
    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class JoinedStr extends Expr {
        private List<Expr> values = new ArrayList<>();

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitJoinedStr(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(values);
        }
    }

    /**
     * A replacement field of an f-string. {@code conversion} is -1 or one of 's', 'r', 'a'.
     */
    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class FormattedValue extends Expr {
        private Expr value;
        private int conversion = -1;
        private JoinedStr formatSpec;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitFormattedValue(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(value, formatSpec);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Attribute extends Expr {
        private Expr value;
        private String attr;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAttribute(this);
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
    public static class Subscript extends Expr {
        private Expr value;
        private Expr slice;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitSubscript(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(value, slice);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Slice extends Expr {
        private Expr lower;
        private Expr upper;
        private Expr step;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitSlice(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(lower, upper, step);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Starred extends Expr {
        private Expr value;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitStarred(this);
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
    public static class Call extends Expr {
        private Expr func;
        private List<Expr> args = new ArrayList<>();
        private List<Keyword> keywords = new ArrayList<>();

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitCall(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(func, args, keywords);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BinOp extends Expr {
        private Expr left;
        private BinaryOperator op;
        private Expr right;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitBinOp(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(left, right);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class UnaryOp extends Expr {
        private UnaryOperator op;
        private Expr operand;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitUnaryOp(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(operand);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class BoolOp extends Expr {
        private BoolOperator op;
        private List<Expr> values = new ArrayList<>();

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitBoolOp(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(values);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Compare extends Expr {
        private Expr left;
        private List<CompareOperator> ops = new ArrayList<>();
        private List<Expr> comparators = new ArrayList<>();

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitCompare(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(left, comparators);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class IfExp extends Expr {
        private Expr test;
        private Expr body;
        private Expr orelse;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitIfExp(this);
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
    public static class Lambda extends Expr {
        private Arguments args;
        private Expr body;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitLambda(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(args, body);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class NamedExpr extends Expr {
        private Expr target;
        private Expr value;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitNamedExpr(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(target, value);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Await extends Expr {
        private Expr value;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitAwait(this);
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
    public static class Yield extends Expr {
        private Expr value;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitYield(this);
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
    public static class YieldFrom extends Expr {
        private Expr value;

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitYieldFrom(this);
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
    public static class ListExpr extends Expr {
        private List<Expr> elts = new ArrayList<>();

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitListExpr(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(elts);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TupleExpr extends Expr {
        private List<Expr> elts = new ArrayList<>();

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitTupleExpr(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(elts);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class SetExpr extends Expr {
        private List<Expr> elts = new ArrayList<>();

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitSetExpr(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(elts);
        }
    }

    /**
     * Dict display. A null key marks a {@code **mapping} unpacking of the matching value.
     */
    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DictExpr extends Expr {
        private List<Expr> keys = new ArrayList<>();
        private List<Expr> values = new ArrayList<>();

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitDictExpr(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(keys, values);
        }
    }

    /**
     * List, set and generator comprehensions.
     */
    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Comprehension extends Expr {
        private Kind kind;
        private Expr elt;
        private List<ComprehensionClause> generators = new ArrayList<>();

        public enum Kind {
            LIST,
            SET,
            GENERATOR
        }

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitComprehension(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(elt, generators);
        }
    }

    @Data
    @EqualsAndHashCode(callSuper = false)
    @NoArgsConstructor
    @AllArgsConstructor
    public static class DictComp extends Expr {
        private Expr key;
        private Expr value;
        private List<ComprehensionClause> generators = new ArrayList<>();

        @Override
        public <R> R accept(NodeVisitor<R> visitor) {
            return visitor.visitDictComp(this);
        }

        @Override
        public List<Node> children() {
            return childrenOf(key, value, generators);
        }
    }
}
