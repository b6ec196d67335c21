package me.x150.clabel.pass;

import me.x150.clabel.ast.expr.IntLiteralExpr;
import me.x150.clabel.ast.stmt.*;
import me.x150.clabel.exc.LabelingFailure;
import me.x150.clabel.label.Label;
import me.x150.clabel.label.LabelContext;

import static me.x150.clabel.exc.LabelingFailure.Kind.*;

/**
 * Gives every loop, switch and goto target of a function a fresh label, and points each break,
 * continue, case, default and return at the label it belongs to. Goto targets are recorded in the
 * function's label table for {@link GotoResolver}.
 */
public class LoopLabeler implements LabelPass {
	public static final String DEFAULT_SUFFIX = ".default";

	/**
	 * Suffix appended to a switch label to name one of its cases. Negative values are spelled with
	 * an {@code m} prefix so that no label contains a minus sign and no two values collide.
	 */
	public static String caseSuffix(long value) {
		String digits = Long.toString(value);
		return value < 0 ? ".case.m" + digits.substring(1) : ".case." + digits;
	}

	@Override
	public void run(FunctionScope scope) throws LabelingFailure {
		new Walker(scope).walkBody();
	}

	private static final class Walker extends TreeWalker {
		private LabelContext context = LabelContext.EMPTY;

		Walker(FunctionScope scope) {
			super(scope);
		}

		private Label fresh(String kind) {
			return scope.context().labels().freshLabel(scope.name(), kind);
		}

		/**
		 * Labels the loop and makes it the innermost breakable construct.
		 *
		 * @return the context to restore once every part of the loop has been walked
		 */
		private LabelContext enterLoop(LoopStatement loop) {
			Label label = fresh(loop.kind());
			loop.setLabel(label);
			LabelContext saved = context;
			context = context.enterLoop(label);
			return saved;
		}

		// loop parts are walked in source order

		@Override
		public void visitWhile(WhileStmt stmt) throws LabelingFailure {
			LabelContext saved = enterLoop(stmt);
			walkExpression(stmt.getCondition());
			walk(stmt.getBody());
			context = saved;
		}

		@Override
		public void visitDoWhile(DoWhileStmt stmt) throws LabelingFailure {
			LabelContext saved = enterLoop(stmt);
			walk(stmt.getBody());
			walkExpression(stmt.getCondition());
			context = saved;
		}

		@Override
		public void visitFor(ForStmt stmt) throws LabelingFailure {
			// the init clause runs once before the loop, so it sees the enclosing context
			walkForInit(stmt.getInit());
			LabelContext saved = enterLoop(stmt);
			walkExpression(stmt.getCondition());
			walkExpression(stmt.getUpdate());
			walk(stmt.getBody());
			context = saved;
		}

		@Override
		public void visitSwitch(SwitchStmt stmt) throws LabelingFailure {
			Label label = fresh("switch");
			stmt.setLabel(label);

			LabelContext saved = context;
			context = context.enterSwitch(label);
			walkExpression(stmt.getExpression());
			walk(stmt.getBody());
			context = saved;
		}

		@Override
		public void visitBreak(BreakStmt stmt) throws LabelingFailure {
			Label target = context.breakTarget();
			if (target == null) throw fail(SCOPE_VIOLATION, "break statement outside loop/switch", stmt);
			stmt.setLabel(target);
		}

		@Override
		public void visitContinue(ContinueStmt stmt) throws LabelingFailure {
			Label target = context.continueTarget();
			if (target == null) throw fail(SCOPE_VIOLATION, "continue statement outside loop", stmt);
			stmt.setLabel(target);
		}

		@Override
		public void visitCase(CaseStmt stmt) throws LabelingFailure {
			Label switchLabel = context.switchLabel();
			if (switchLabel == null) throw fail(SCOPE_VIOLATION, "case statement outside switch", stmt);
			if (!(stmt.getExpression() instanceof IntLiteralExpr literal)) {
				throw fail(NON_CONSTANT_CASE, "case statement with non-constant expression", stmt);
			}
			stmt.setLabel(switchLabel.derive(scope.context().arena(), caseSuffix(literal.value())));
			walk(stmt.getStatement());
		}

		@Override
		public void visitDefault(DefaultStmt stmt) throws LabelingFailure {
			Label switchLabel = context.switchLabel();
			if (switchLabel == null) throw fail(SCOPE_VIOLATION, "default statement outside switch", stmt);
			stmt.setLabel(switchLabel.derive(scope.context().arena(), DEFAULT_SUFFIX));
			walk(stmt.getStatement());
		}

		@Override
		public void visitLabeled(LabeledStmt stmt) throws LabelingFailure {
			Label written = stmt.getLabel();
			if (scope.gotoLabels().contains(written)) {
				throw fail(DUPLICATE_DEFINITION, "multiple definitions for goto label " + written, stmt);
			}
			Label unique = fresh("goto");
			scope.gotoLabels().insert(written, unique);
			stmt.setLabel(unique);
			walk(stmt.getStatement());
		}

		@Override
		public void visitReturn(ReturnStmt stmt) throws LabelingFailure {
			stmt.setLabel(scope.name());
			walkExpression(stmt.getExpression());
		}

		@Override
		public void visitGoto(GotoStmt stmt) {
			// resolved once every target of the function is known
		}

		@Override
		public void visitExpression(ExpressionStmt stmt) throws LabelingFailure {
			walkExpression(stmt.getExpression());
		}

		@Override
		public void visitIf(IfStmt stmt) throws LabelingFailure {
			walkExpression(stmt.getCondition());
			walk(stmt.getThen());
			walk(stmt.getOtherwise());
		}

		@Override
		public void visitCompound(CompoundStmt stmt) throws LabelingFailure {
			walkBlock(stmt.getBlock());
		}

		@Override
		public void visitNull(NullStmt stmt) {
		}
	}
}
