package com.funcpool.model.syntax;

import java.util.List;

/**
 * Visitor that walks the whole tree and lets subclasses replace expressions or rename
 * identifiers. Children are rewritten in place; every visit returns the (possibly new) node.
 */
public abstract class NodeRewriter implements NodeVisitor<Node> {

    protected Expr rewrite(Expr node) {
        return node == null ? null : (Expr) node.accept(this);
    }

    protected void rewriteExprs(List<Expr> nodes) {
        nodes.replaceAll(this::rewrite);
    }

    protected void rewriteStmts(List<Stmt> nodes) {
        nodes.replaceAll(stmt -> (Stmt) stmt.accept(this));
    }

    protected void rewriteAll(List<? extends Node> nodes) {
        for (Node node : nodes) {
            node.accept(this);
        }
    }

    @Override
    public Node visitModule(Module node) {
        rewriteStmts(node.getBody());
        return node;
    }

    @Override
    public Node visitArguments(Arguments node) {
        rewriteAll(node.getPosonlyargs());
        rewriteAll(node.getArgs());
        if (node.getVararg() != null) {
            node.getVararg().accept(this);
        }
        rewriteAll(node.getKwonlyargs());
        rewriteExprs(node.getKwDefaults());
        if (node.getKwarg() != null) {
            node.getKwarg().accept(this);
        }
        rewriteExprs(node.getDefaults());
        return node;
    }

    @Override
    public Node visitArg(Arg node) {
        node.setAnnotation(rewrite(node.getAnnotation()));
        return node;
    }

    @Override
    public Node visitKeyword(Keyword node) {
        node.setValue(rewrite(node.getValue()));
        return node;
    }

    @Override
    public Node visitComprehensionClause(ComprehensionClause node) {
        node.setTarget(rewrite(node.getTarget()));
        node.setIter(rewrite(node.getIter()));
        rewriteExprs(node.getIfs());
        return node;
    }

    @Override
    public Node visitExceptHandler(ExceptHandler node) {
        node.setType(rewrite(node.getType()));
        rewriteStmts(node.getBody());
        return node;
    }

    @Override
    public Node visitWithItem(WithItem node) {
        node.setContextExpr(rewrite(node.getContextExpr()));
        node.setOptionalVars(rewrite(node.getOptionalVars()));
        return node;
    }

    @Override
    public Node visitImportName(ImportName node) {
        return node;
    }

    @Override
    public Node visitFunctionDef(Stmt.FunctionDef node) {
        node.getArgs().accept(this);
        rewriteStmts(node.getBody());
        rewriteExprs(node.getDecorators());
        node.setReturns(rewrite(node.getReturns()));
        return node;
    }

    @Override
    public Node visitClassDef(Stmt.ClassDef node) {
        rewriteExprs(node.getBases());
        rewriteAll(node.getKeywords());
        rewriteStmts(node.getBody());
        rewriteExprs(node.getDecorators());
        return node;
    }

    @Override
    public Node visitReturn(Stmt.Return node) {
        node.setValue(rewrite(node.getValue()));
        return node;
    }

    @Override
    public Node visitDelete(Stmt.Delete node) {
        rewriteExprs(node.getTargets());
        return node;
    }

    @Override
    public Node visitAssign(Stmt.Assign node) {
        rewriteExprs(node.getTargets());
        node.setValue(rewrite(node.getValue()));
        return node;
    }

    @Override
    public Node visitAugAssign(Stmt.AugAssign node) {
        node.setTarget(rewrite(node.getTarget()));
        node.setValue(rewrite(node.getValue()));
        return node;
    }

    @Override
    public Node visitAnnAssign(Stmt.AnnAssign node) {
        node.setTarget(rewrite(node.getTarget()));
        node.setAnnotation(rewrite(node.getAnnotation()));
        node.setValue(rewrite(node.getValue()));
        return node;
    }

    @Override
    public Node visitFor(Stmt.For node) {
        node.setTarget(rewrite(node.getTarget()));
        node.setIter(rewrite(node.getIter()));
        rewriteStmts(node.getBody());
        rewriteStmts(node.getOrelse());
        return node;
    }

    @Override
    public Node visitWhile(Stmt.While node) {
        node.setTest(rewrite(node.getTest()));
        rewriteStmts(node.getBody());
        rewriteStmts(node.getOrelse());
        return node;
    }

    @Override
    public Node visitIf(Stmt.If node) {
        node.setTest(rewrite(node.getTest()));
        rewriteStmts(node.getBody());
        rewriteStmts(node.getOrelse());
        return node;
    }

    @Override
    public Node visitWith(Stmt.With node) {
        rewriteAll(node.getItems());
        rewriteStmts(node.getBody());
        return node;
    }

    @Override
    public Node visitRaise(Stmt.Raise node) {
        node.setExc(rewrite(node.getExc()));
        node.setCause(rewrite(node.getCause()));
        return node;
    }

    @Override
    public Node visitTry(Stmt.Try node) {
        rewriteStmts(node.getBody());
        rewriteAll(node.getHandlers());
        rewriteStmts(node.getOrelse());
        rewriteStmts(node.getFinalbody());
        return node;
    }

    @Override
    public Node visitAssert(Stmt.Assert node) {
        node.setTest(rewrite(node.getTest()));
        node.setMsg(rewrite(node.getMsg()));
        return node;
    }

    @Override
    public Node visitImport(Stmt.Import node) {
        rewriteAll(node.getNames());
        return node;
    }

    @Override
    public Node visitImportFrom(Stmt.ImportFrom node) {
        rewriteAll(node.getNames());
        return node;
    }

    @Override
    public Node visitGlobal(Stmt.Global node) {
        return node;
    }

    @Override
    public Node visitNonlocal(Stmt.Nonlocal node) {
        return node;
    }

    @Override
    public Node visitExprStmt(Stmt.ExprStmt node) {
        node.setValue(rewrite(node.getValue()));
        return node;
    }

    @Override
    public Node visitPass(Stmt.Pass node) {
        return node;
    }

    @Override
    public Node visitBreak(Stmt.Break node) {
        return node;
    }

    @Override
    public Node visitContinue(Stmt.Continue node) {
        return node;
    }

    @Override
    public Node visitName(Expr.Name node) {
        return node;
    }

    @Override
    public Node visitConstant(Expr.Constant node) {
        return node;
    }

    @Override
    public Node visitJoinedStr(Expr.JoinedStr node) {
        rewriteExprs(node.getValues());
        return node;
    }

    @Override
    public Node visitFormattedValue(Expr.FormattedValue node) {
        node.setValue(rewrite(node.getValue()));
        if (node.getFormatSpec() != null) {
            node.getFormatSpec().accept(this);
        }
        return node;
    }

    @Override
    public Node visitAttribute(Expr.Attribute node) {
        node.setValue(rewrite(node.getValue()));
        return node;
    }

    @Override
    public Node visitSubscript(Expr.Subscript node) {
        node.setValue(rewrite(node.getValue()));
        node.setSlice(rewrite(node.getSlice()));
        return node;
    }

    @Override
    public Node visitSlice(Expr.Slice node) {
        node.setLower(rewrite(node.getLower()));
        node.setUpper(rewrite(node.getUpper()));
        node.setStep(rewrite(node.getStep()));
        return node;
    }

    @Override
    public Node visitStarred(Expr.Starred node) {
        node.setValue(rewrite(node.getValue()));
        return node;
    }

    @Override
    public Node visitCall(Expr.Call node) {
        node.setFunc(rewrite(node.getFunc()));
        rewriteExprs(node.getArgs());
        rewriteAll(node.getKeywords());
        return node;
    }

    @Override
    public Node visitBinOp(Expr.BinOp node) {
        node.setLeft(rewrite(node.getLeft()));
        node.setRight(rewrite(node.getRight()));
        return node;
    }

    @Override
    public Node visitUnaryOp(Expr.UnaryOp node) {
        node.setOperand(rewrite(node.getOperand()));
        return node;
    }

    @Override
    public Node visitBoolOp(Expr.BoolOp node) {
        rewriteExprs(node.getValues());
        return node;
    }

    @Override
    public Node visitCompare(Expr.Compare node) {
        node.setLeft(rewrite(node.getLeft()));
        rewriteExprs(node.getComparators());
        return node;
    }

    @Override
    public Node visitIfExp(Expr.IfExp node) {
        node.setTest(rewrite(node.getTest()));
        node.setBody(rewrite(node.getBody()));
        node.setOrelse(rewrite(node.getOrelse()));
        return node;
    }

    @Override
    public Node visitLambda(Expr.Lambda node) {
        node.getArgs().accept(this);
        node.setBody(rewrite(node.getBody()));
        return node;
    }

    @Override
    public Node visitNamedExpr(Expr.NamedExpr node) {
        node.setTarget(rewrite(node.getTarget()));
        node.setValue(rewrite(node.getValue()));
        return node;
    }

    @Override
    public Node visitAwait(Expr.Await node) {
        node.setValue(rewrite(node.getValue()));
        return node;
    }

    @Override
    public Node visitYield(Expr.Yield node) {
        node.setValue(rewrite(node.getValue()));
        return node;
    }

    @Override
    public Node visitYieldFrom(Expr.YieldFrom node) {
        node.setValue(rewrite(node.getValue()));
        return node;
    }

    @Override
    public Node visitListExpr(Expr.ListExpr node) {
        rewriteExprs(node.getElts());
        return node;
    }

    @Override
    public Node visitTupleExpr(Expr.TupleExpr node) {
        rewriteExprs(node.getElts());
        return node;
    }

    @Override
    public Node visitSetExpr(Expr.SetExpr node) {
        rewriteExprs(node.getElts());
        return node;
    }

    @Override
    public Node visitDictExpr(Expr.DictExpr node) {
        rewriteExprs(node.getKeys());
        rewriteExprs(node.getValues());
        return node;
    }

    @Override
    public Node visitComprehension(Expr.Comprehension node) {
        node.setElt(rewrite(node.getElt()));
        rewriteAll(node.getGenerators());
        return node;
    }

    @Override
    public Node visitDictComp(Expr.DictComp node) {
        node.setKey(rewrite(node.getKey()));
        node.setValue(rewrite(node.getValue()));
        rewriteAll(node.getGenerators());
        return node;
    }
}
