package me.x150.clabel.ast.expr;

/**
 * One method per expression kind. Adding a kind means adding a method here, which every visitor must implement.
 *
 * @param <X> checked exception the visitor may abort with
 */
public interface ExpressionVisitor<X extends Exception> {
	void visitIntLiteral(IntLiteralExpr expr) throws X;

	void visitFloatLiteral(FloatLiteralExpr expr) throws X;

	void visitStringLiteral(StringLiteralExpr expr) throws X;

	void visitVar(VarExpr expr) throws X;

	void visitUnary(UnaryExpr expr) throws X;

	void visitBinary(BinaryExpr expr) throws X;

	void visitAssign(AssignExpr expr) throws X;

	void visitPostAssign(PostAssignExpr expr) throws X;

	void visitConditional(ConditionalExpr expr) throws X;

	void visitCast(CastExpr expr) throws X;

	void visitCall(CallExpr expr) throws X;

	void visitAddressOf(AddressOfExpr expr) throws X;

	void visitDereference(DereferenceExpr expr) throws X;

	void visitSubscript(SubscriptExpr expr) throws X;

	void visitSizeOf(SizeOfExpr expr) throws X;

	void visitSizeOfType(SizeOfTypeExpr expr) throws X;

	void visitMember(MemberExpr expr) throws X;

	void visitStatementExpr(StatementExpr expr) throws X;
}
