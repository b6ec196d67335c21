package me.x150.clabel.ast.stmt;

/**
 * One method per statement kind. Every labeling pass implements this directly, so a new statement
 * kind does not compile until each pass decides what to do with it.
 *
 * @param <X> checked exception the visitor may abort with
 */
public interface StatementVisitor<X extends Exception> {
	void visitReturn(ReturnStmt stmt) throws X;

	void visitExpression(ExpressionStmt stmt) throws X;

	void visitIf(IfStmt stmt) throws X;

	void visitGoto(GotoStmt stmt) throws X;

	void visitLabeled(LabeledStmt stmt) throws X;

	void visitCompound(CompoundStmt stmt) throws X;

	void visitBreak(BreakStmt stmt) throws X;

	void visitContinue(ContinueStmt stmt) throws X;

	void visitWhile(WhileStmt stmt) throws X;

	void visitDoWhile(DoWhileStmt stmt) throws X;

	void visitFor(ForStmt stmt) throws X;

	void visitSwitch(SwitchStmt stmt) throws X;

	void visitCase(CaseStmt stmt) throws X;

	void visitDefault(DefaultStmt stmt) throws X;

	void visitNull(NullStmt stmt) throws X;
}
