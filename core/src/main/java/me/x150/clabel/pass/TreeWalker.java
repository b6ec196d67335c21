package me.x150.clabel.pass;

import me.x150.clabel.ast.*;
import me.x150.clabel.ast.expr.*;
import me.x150.clabel.ast.init.CompoundInitializer;
import me.x150.clabel.ast.init.Initializer;
import me.x150.clabel.ast.init.SingleInitializer;
import me.x150.clabel.ast.stmt.ForInit;
import me.x150.clabel.ast.stmt.Statement;
import me.x150.clabel.ast.stmt.StatementVisitor;
import me.x150.clabel.exc.LabelingFailure;
import org.jetbrains.annotations.Nullable;

/**
 * Recursive descent over one function body. Subclasses decide what each statement kind does;
 * this class walks declarations, initializers and expressions, which only matter because a
 * statement expression can hide statements anywhere an expression may appear.
 */
public abstract class TreeWalker implements StatementVisitor<LabelingFailure>, ExpressionVisitor<LabelingFailure> {
	protected final FunctionScope scope;

	protected TreeWalker(FunctionScope scope) {
		this.scope = scope;
	}

	protected static LabelingFailure fail(LabelingFailure.Kind kind, String diagnostic, Statement at) {
		return new LabelingFailure(kind, diagnostic, at.getLocation());
	}

	public void walkBody() throws LabelingFailure {
		walkBlock(scope.body());
	}

	protected void walkBlock(Block block) throws LabelingFailure {
		for (BlockItem item : block.items()) {
			if (item instanceof Statement stmt) {
				stmt.accept(this);
			} else if (item instanceof Declaration decl) {
				walkDeclaration(decl);
			} else {
				throw LabelingFailure.malformed("block item", item);
			}
		}
	}

	protected void walk(@Nullable Statement stmt) throws LabelingFailure {
		if (stmt != null) stmt.accept(this);
	}

	protected void walkDeclaration(Declaration decl) throws LabelingFailure {
		if (decl instanceof VariableDeclaration var) {
			walkInitializer(var.getInitializer());
		} else if (!(decl instanceof FunctionDeclaration)) {
			throw LabelingFailure.malformed("declaration", decl);
		}
		// local function declarations are prototypes, nothing to label
	}

	protected void walkInitializer(@Nullable Initializer init) throws LabelingFailure {
		if (init == null) return;
		if (init instanceof SingleInitializer single) {
			walkExpression(single.expression());
		} else if (init instanceof CompoundInitializer compound) {
			for (Initializer element : compound.elements()) {
				walkInitializer(element);
			}
		} else {
			throw LabelingFailure.malformed("initializer", init);
		}
	}

	protected void walkForInit(ForInit init) throws LabelingFailure {
		if (init instanceof ForInit.Declared declared) {
			walkDeclaration(declared.declaration());
		} else if (init instanceof ForInit.Expr expr) {
			walkExpression(expr.expression());
		} else {
			throw LabelingFailure.malformed("for-init", init);
		}
	}

	protected void walkExpression(@Nullable Expression expr) throws LabelingFailure {
		if (expr != null) expr.accept(this);
	}

	@Override
	public void visitIntLiteral(IntLiteralExpr expr) {
	}

	@Override
	public void visitFloatLiteral(FloatLiteralExpr expr) {
	}

	@Override
	public void visitStringLiteral(StringLiteralExpr expr) {
	}

	@Override
	public void visitVar(VarExpr expr) {
	}

	@Override
	public void visitUnary(UnaryExpr expr) throws LabelingFailure {
		walkExpression(expr.operand());
	}

	@Override
	public void visitBinary(BinaryExpr expr) throws LabelingFailure {
		walkExpression(expr.left());
		walkExpression(expr.right());
	}

	@Override
	public void visitAssign(AssignExpr expr) throws LabelingFailure {
		walkExpression(expr.target());
		walkExpression(expr.value());
	}

	@Override
	public void visitPostAssign(PostAssignExpr expr) throws LabelingFailure {
		walkExpression(expr.target());
	}

	@Override
	public void visitConditional(ConditionalExpr expr) throws LabelingFailure {
		walkExpression(expr.condition());
		walkExpression(expr.ifTrue());
		walkExpression(expr.ifFalse());
	}

	@Override
	public void visitCast(CastExpr expr) throws LabelingFailure {
		walkExpression(expr.operand());
	}

	@Override
	public void visitCall(CallExpr expr) throws LabelingFailure {
		for (Expression argument : expr.arguments()) {
			walkExpression(argument);
		}
	}

	@Override
	public void visitAddressOf(AddressOfExpr expr) throws LabelingFailure {
		walkExpression(expr.operand());
	}

	@Override
	public void visitDereference(DereferenceExpr expr) throws LabelingFailure {
		walkExpression(expr.operand());
	}

	@Override
	public void visitSubscript(SubscriptExpr expr) throws LabelingFailure {
		walkExpression(expr.array());
		walkExpression(expr.index());
	}

	@Override
	public void visitSizeOf(SizeOfExpr expr) throws LabelingFailure {
		walkExpression(expr.operand());
	}

	@Override
	public void visitSizeOfType(SizeOfTypeExpr expr) {
	}

	@Override
	public void visitMember(MemberExpr expr) throws LabelingFailure {
		walkExpression(expr.operand());
	}

	@Override
	public void visitStatementExpr(StatementExpr expr) throws LabelingFailure {
		walkBlock(expr.block());
	}
}
