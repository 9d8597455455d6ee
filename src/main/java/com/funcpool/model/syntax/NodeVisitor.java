package com.funcpool.model.syntax;

/**
 * Visitor over the Python syntax tree.
 */
public interface NodeVisitor<R> {
    R visitModule(Module node);
    R visitArguments(Arguments node);
    R visitArg(Arg node);
    R visitKeyword(Keyword node);
    R visitComprehensionClause(ComprehensionClause node);
    R visitExceptHandler(ExceptHandler node);
    R visitWithItem(WithItem node);
    R visitImportName(ImportName node);

    R visitFunctionDef(Stmt.FunctionDef node);
    R visitClassDef(Stmt.ClassDef node);
    R visitReturn(Stmt.Return node);
    R visitDelete(Stmt.Delete node);
    R visitAssign(Stmt.Assign node);
    R visitAugAssign(Stmt.AugAssign node);
    R visitAnnAssign(Stmt.AnnAssign node);
    R visitFor(Stmt.For node);
    R visitWhile(Stmt.While node);
    R visitIf(Stmt.If node);
    R visitWith(Stmt.With node);
    R visitRaise(Stmt.Raise node);
    R visitTry(Stmt.Try node);
    R visitAssert(Stmt.Assert node);
    R visitImport(Stmt.Import node);
    R visitImportFrom(Stmt.ImportFrom node);
    R visitGlobal(Stmt.Global node);
    R visitNonlocal(Stmt.Nonlocal node);
    R visitExprStmt(Stmt.ExprStmt node);
    R visitPass(Stmt.Pass node);
    R visitBreak(Stmt.Break node);
    R visitContinue(Stmt.Continue node);

    R visitName(Expr.Name node);
    R visitConstant(Expr.Constant node);
    R visitJoinedStr(Expr.JoinedStr node);
    R visitFormattedValue(Expr.FormattedValue node);
    R visitAttribute(Expr.Attribute node);
    R visitSubscript(Expr.Subscript node);
    R visitSlice(Expr.Slice node);
    R visitStarred(Expr.Starred node);
    R visitCall(Expr.Call node);
    R visitBinOp(Expr.BinOp node);
    R visitUnaryOp(Expr.UnaryOp node);
    R visitBoolOp(Expr.BoolOp node);
    R visitCompare(Expr.Compare node);
    R visitIfExp(Expr.IfExp node);
    R visitLambda(Expr.Lambda node);
    R visitNamedExpr(Expr.NamedExpr node);
    R visitAwait(Expr.Await node);
    R visitYield(Expr.Yield node);
    R visitYieldFrom(Expr.YieldFrom node);
    R visitListExpr(Expr.ListExpr node);
    R visitTupleExpr(Expr.TupleExpr node);
    R visitSetExpr(Expr.SetExpr node);
    R visitDictExpr(Expr.DictExpr node);
    R visitComprehension(Expr.Comprehension node);
    R visitDictComp(Expr.DictComp node);
}
