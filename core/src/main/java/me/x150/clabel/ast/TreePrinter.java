package me.x150.clabel.ast;

import me.x150.clabel.ast.expr.*;
import me.x150.clabel.ast.init.CompoundInitializer;
import me.x150.clabel.ast.init.Initializer;
import me.x150.clabel.ast.init.SingleInitializer;
import me.x150.clabel.ast.stmt.*;
import me.x150.clabel.label.Label;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a tree one statement per line, indented by nesting depth, with the labels and case lists
 * the labeling passes attached. Labels that were never assigned show as {@code ?}.
 * <pre>
 * Function main()
 *   While[main.while.0](i &lt; 10)
 *     Break[main.while.0]
 * </pre>
 */
public class TreePrinter implements StatementVisitor<RuntimeException>, ExpressionVisitor<RuntimeException> {
	private static final String INDENT = "  ";

	private final StringBuilder out = new StringBuilder();
	private int depth;

	private TreePrinter() {
	}

	public static String print(Program program) {
		TreePrinter p = new TreePrinter();
		for (Declaration decl : program.declarations()) {
			p.declaration(decl);
		}
		return p.out.toString();
	}

	public static String print(FunctionDeclaration function) {
		TreePrinter p = new TreePrinter();
		p.declaration(function);
		return p.out.toString();
	}

	public static String print(Expression expression) {
		TreePrinter p = new TreePrinter();
		expression.accept(p);
		return p.out.toString();
	}

	private static String label(@Nullable Label label) {
		return label == null ? "?" : label.toString();
	}

	private void line(String text) {
		out.append(INDENT.repeat(depth)).append(text);
	}

	private void lineWith(String head, @Nullable Expression expr, String tail) {
		line(head);
		if (expr != null) {
			out.append('(');
			expr.accept(this);
			out.append(')');
		}
		out.append(tail).append('\n');
	}

	private void child(@Nullable Statement stmt) {
		if (stmt == null) return;
		depth++;
		stmt.accept(this);
		depth--;
	}

	private void block(Block block) {
		depth++;
		for (BlockItem item : block.items()) {
			if (item instanceof Statement stmt) {
				stmt.accept(this);
			} else if (item instanceof Declaration decl) {
				declaration(decl);
			} else {
				line("<" + item.getClass().getSimpleName() + ">\n");
			}
		}
		depth--;
	}

	private void declaration(Declaration decl) {
		if (decl instanceof FunctionDeclaration fn) {
			String params = fn.getParameters().stream().map(Label::toString).collect(Collectors.joining(", "));
			line((fn.hasBody() ? "Function " : "Prototype ") + fn.getName() + "(" + params + ")\n");
			if (fn.getBody() != null) block(fn.getBody());
		} else if (decl instanceof VariableDeclaration var) {
			line("Var " + var.getName());
			if (var.getInitializer() != null) {
				out.append(" = ");
				initializer(var.getInitializer());
			}
			out.append('\n');
		} else {
			line("<" + decl.getClass().getSimpleName() + " " + decl.getName() + ">\n");
		}
	}

	private void initializer(Initializer init) {
		if (init instanceof SingleInitializer single) {
			single.expression().accept(this);
		} else if (init instanceof CompoundInitializer compound) {
			out.append('{');
			List<Initializer> elements = compound.elements();
			for (int i = 0; i < elements.size(); i++) {
				if (i > 0) out.append(", ");
				initializer(elements.get(i));
			}
			out.append('}');
		} else {
			out.append('<').append(init.getClass().getSimpleName()).append('>');
		}
	}

	private void optional(@Nullable Expression expr) {
		if (expr != null) expr.accept(this);
	}

	@Override
	public void visitReturn(ReturnStmt stmt) {
		lineWith("Return[" + label(stmt.getLabel()) + "]", stmt.getExpression(), "");
	}

	@Override
	public void visitExpression(ExpressionStmt stmt) {
		lineWith("Expr", stmt.getExpression(), "");
	}

	@Override
	public void visitIf(IfStmt stmt) {
		lineWith("If", stmt.getCondition(), "");
		child(stmt.getThen());
		if (stmt.getOtherwise() != null) {
			line("Else\n");
			child(stmt.getOtherwise());
		}
	}

	@Override
	public void visitGoto(GotoStmt stmt) {
		line("Goto[" + label(stmt.getLabel()) + "]\n");
	}

	@Override
	public void visitLabeled(LabeledStmt stmt) {
		line("Labeled[" + label(stmt.getLabel()) + "]\n");
		child(stmt.getStatement());
	}

	@Override
	public void visitCompound(CompoundStmt stmt) {
		line("Compound\n");
		block(stmt.getBlock());
	}

	@Override
	public void visitBreak(BreakStmt stmt) {
		line("Break[" + label(stmt.getLabel()) + "]\n");
	}

	@Override
	public void visitContinue(ContinueStmt stmt) {
		line("Continue[" + label(stmt.getLabel()) + "]\n");
	}

	@Override
	public void visitWhile(WhileStmt stmt) {
		lineWith("While[" + label(stmt.getLabel()) + "]", stmt.getCondition(), "");
		child(stmt.getBody());
	}

	@Override
	public void visitDoWhile(DoWhileStmt stmt) {
		lineWith("DoWhile[" + label(stmt.getLabel()) + "]", stmt.getCondition(), "");
		child(stmt.getBody());
	}

	@Override
	public void visitFor(ForStmt stmt) {
		line("For[" + label(stmt.getLabel()) + "](");
		ForInit init = stmt.getInit();
		if (init instanceof ForInit.Declared declared) {
			VariableDeclaration var = declared.declaration();
			out.append("var ").append(var.getName());
			if (var.getInitializer() != null) {
				out.append(" = ");
				initializer(var.getInitializer());
			}
		} else if (init instanceof ForInit.Expr expr) {
			optional(expr.expression());
		}
		out.append("; ");
		optional(stmt.getCondition());
		out.append("; ");
		optional(stmt.getUpdate());
		out.append(")\n");
		child(stmt.getBody());
	}

	@Override
	public void visitSwitch(SwitchStmt stmt) {
		CaseList cases = stmt.getCases();
		lineWith("Switch[" + label(stmt.getLabel()) + "]", stmt.getExpression(), cases == null ? "" : " cases=" + cases);
		child(stmt.getBody());
	}

	@Override
	public void visitCase(CaseStmt stmt) {
		lineWith("Case[" + label(stmt.getLabel()) + "]", stmt.getExpression(), "");
		child(stmt.getStatement());
	}

	@Override
	public void visitDefault(DefaultStmt stmt) {
		line("Default[" + label(stmt.getLabel()) + "]\n");
		child(stmt.getStatement());
	}

	@Override
	public void visitNull(NullStmt stmt) {
		line("Null\n");
	}

	@Override
	public void visitIntLiteral(IntLiteralExpr expr) {
		out.append(expr.value());
	}

	@Override
	public void visitFloatLiteral(FloatLiteralExpr expr) {
		out.append(expr.value());
	}

	@Override
	public void visitStringLiteral(StringLiteralExpr expr) {
		out.append('"').append(expr.value().replace("\\", "\\\\").replace("\"", "\\\"")).append('"');
	}

	@Override
	public void visitVar(VarExpr expr) {
		out.append(expr.name());
	}

	@Override
	public void visitUnary(UnaryExpr expr) {
		out.append('(').append(expr.op().getSymbol());
		expr.operand().accept(this);
		out.append(')');
	}

	@Override
	public void visitBinary(BinaryExpr expr) {
		out.append('(');
		expr.left().accept(this);
		out.append(' ').append(expr.op().getSymbol()).append(' ');
		expr.right().accept(this);
		out.append(')');
	}

	@Override
	public void visitAssign(AssignExpr expr) {
		out.append('(');
		expr.target().accept(this);
		out.append(' ');
		if (expr.op() != null) out.append(expr.op().getSymbol());
		out.append("= ");
		expr.value().accept(this);
		out.append(')');
	}

	@Override
	public void visitPostAssign(PostAssignExpr expr) {
		out.append('(');
		expr.target().accept(this);
		out.append(expr.increment() ? "++" : "--").append(')');
	}

	@Override
	public void visitConditional(ConditionalExpr expr) {
		out.append('(');
		expr.condition().accept(this);
		out.append(" ? ");
		expr.ifTrue().accept(this);
		out.append(" : ");
		expr.ifFalse().accept(this);
		out.append(')');
	}

	@Override
	public void visitCast(CastExpr expr) {
		out.append("((").append(expr.targetType()).append(") ");
		expr.operand().accept(this);
		out.append(')');
	}

	@Override
	public void visitCall(CallExpr expr) {
		out.append(expr.function()).append('(');
		List<Expression> args = expr.arguments();
		for (int i = 0; i < args.size(); i++) {
			if (i > 0) out.append(", ");
			args.get(i).accept(this);
		}
		out.append(')');
	}

	@Override
	public void visitAddressOf(AddressOfExpr expr) {
		out.append('&');
		expr.operand().accept(this);
	}

	@Override
	public void visitDereference(DereferenceExpr expr) {
		out.append('*');
		expr.operand().accept(this);
	}

	@Override
	public void visitSubscript(SubscriptExpr expr) {
		expr.array().accept(this);
		out.append('[');
		expr.index().accept(this);
		out.append(']');
	}

	@Override
	public void visitSizeOf(SizeOfExpr expr) {
		out.append("sizeof(");
		expr.operand().accept(this);
		out.append(')');
	}

	@Override
	public void visitSizeOfType(SizeOfTypeExpr expr) {
		out.append("sizeof(").append(expr.type()).append(')');
	}

	@Override
	public void visitMember(MemberExpr expr) {
		expr.operand().accept(this);
		out.append(expr.arrow() ? "->" : ".").append(expr.member());
	}

	@Override
	public void visitStatementExpr(StatementExpr expr) {
		// nested statements are printed flat on one line, separated by semicolons
		TreePrinter nested = new TreePrinter();
		nested.depth = -1;
		nested.block(expr.block());
		String inner = nested.out.toString().strip().replace("\n", "; ");
		out.append("({ ").append(inner).append(" })");
	}
}
