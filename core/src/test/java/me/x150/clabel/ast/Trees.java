package me.x150.clabel.ast;

import me.x150.clabel.ast.expr.*;
import me.x150.clabel.ast.init.SingleInitializer;
import me.x150.clabel.ast.stmt.*;
import me.x150.clabel.label.Label;

import java.util.List;

/**
 * Terse constructors for building trees in tests. Nodes carry no source location unless built with {@link #at}.
 */
public final class Trees {
	private Trees() {
	}

	public static Label l(String text) {
		return Label.of(text);
	}

	public static SourceLocation at(int line, int column) {
		return new SourceLocation(line, column);
	}

	public static IntLiteralExpr lit(long value) {
		return new IntLiteralExpr(null, value);
	}

	public static VarExpr var(String name) {
		return new VarExpr(null, l(name));
	}

	public static BinaryExpr binary(BinaryOp op, Expression left, Expression right) {
		return new BinaryExpr(null, op, left, right);
	}

	public static AssignExpr assign(String name, Expression value) {
		return new AssignExpr(null, null, var(name), value);
	}

	public static StatementExpr stmtExpr(BlockItem... items) {
		return new StatementExpr(null, Block.of(items));
	}

	public static WhileStmt whileLoop(Expression condition, Statement body) {
		return new WhileStmt(null, condition, body);
	}

	public static DoWhileStmt doWhile(Statement body, Expression condition) {
		return new DoWhileStmt(null, body, condition);
	}

	public static ForStmt forLoop(ForInit init, Expression condition, Expression update, Statement body) {
		return new ForStmt(null, init, condition, update, body);
	}

	public static SwitchStmt switchOn(Expression expression, Statement body) {
		return new SwitchStmt(null, expression, body);
	}

	public static CaseStmt caseOf(long value, Statement statement) {
		return new CaseStmt(null, lit(value), statement);
	}

	public static DefaultStmt defaultCase(Statement statement) {
		return new DefaultStmt(null, statement);
	}

	public static BreakStmt brk() {
		return new BreakStmt(null);
	}

	public static ContinueStmt cont() {
		return new ContinueStmt(null);
	}

	public static GotoStmt jump(String label) {
		return new GotoStmt(null, l(label));
	}

	public static LabeledStmt labeled(String label, Statement statement) {
		return new LabeledStmt(null, l(label), statement);
	}

	public static ReturnStmt ret(Expression expression) {
		return new ReturnStmt(null, expression);
	}

	public static ExpressionStmt exprStmt(Expression expression) {
		return new ExpressionStmt(null, expression);
	}

	public static IfStmt ifThen(Expression condition, Statement then, Statement otherwise) {
		return new IfStmt(null, condition, then, otherwise);
	}

	public static CompoundStmt compound(BlockItem... items) {
		return new CompoundStmt(null, Block.of(items));
	}

	public static NullStmt nul() {
		return new NullStmt(null);
	}

	public static VariableDeclaration local(String name, Expression value) {
		return new VariableDeclaration(null, l(name), new SingleInitializer(value));
	}

	public static FunctionDeclaration function(String name, BlockItem... items) {
		return new FunctionDeclaration(null, l(name), List.of(), Block.of(items));
	}

	public static FunctionDeclaration prototype(String name) {
		return new FunctionDeclaration(null, l(name), List.of(), null);
	}

	public static Program program(Declaration... declarations) {
		return new Program(List.of(declarations));
	}
}
