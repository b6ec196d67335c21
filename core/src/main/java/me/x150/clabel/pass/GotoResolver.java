package me.x150.clabel.pass;

import me.x150.clabel.ast.stmt.*;
import me.x150.clabel.exc.LabelingFailure;
import me.x150.clabel.label.Label;

import static me.x150.clabel.exc.LabelingFailure.Kind.UNRESOLVED_REFERENCE;

/**
 * Rewrites every goto's target to the unique label {@link LoopLabeler} recorded for it. Runs as a
 * separate walk because a goto may jump forward to a label defined later in the body.
 */
public class GotoResolver implements LabelPass {
	@Override
	public void run(FunctionScope scope) throws LabelingFailure {
		new Walker(scope).walkBody();
	}

	private static final class Walker extends TreeWalker {
		Walker(FunctionScope scope) {
			super(scope);
		}

		@Override
		public void visitGoto(GotoStmt stmt) throws LabelingFailure {
			Label written = stmt.getLabel();
			Label resolved = scope.gotoLabels().get(written);
			if (resolved == null) throw fail(UNRESOLVED_REFERENCE, "label " + written + " has no definition", stmt);
			stmt.setLabel(resolved);
		}

		@Override
		public void visitReturn(ReturnStmt stmt) throws LabelingFailure {
			walkExpression(stmt.getExpression());
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
		public void visitLabeled(LabeledStmt stmt) throws LabelingFailure {
			walk(stmt.getStatement());
		}

		@Override
		public void visitCompound(CompoundStmt stmt) throws LabelingFailure {
			walkBlock(stmt.getBlock());
		}

		@Override
		public void visitBreak(BreakStmt stmt) {
		}

		@Override
		public void visitContinue(ContinueStmt stmt) {
		}

		@Override
		public void visitWhile(WhileStmt stmt) throws LabelingFailure {
			walkExpression(stmt.getCondition());
			walk(stmt.getBody());
		}

		@Override
		public void visitDoWhile(DoWhileStmt stmt) throws LabelingFailure {
			walk(stmt.getBody());
			walkExpression(stmt.getCondition());
		}

		@Override
		public void visitFor(ForStmt stmt) throws LabelingFailure {
			walkForInit(stmt.getInit());
			walkExpression(stmt.getCondition());
			walkExpression(stmt.getUpdate());
			walk(stmt.getBody());
		}

		@Override
		public void visitSwitch(SwitchStmt stmt) throws LabelingFailure {
			walkExpression(stmt.getExpression());
			walk(stmt.getBody());
		}

		@Override
		public void visitCase(CaseStmt stmt) throws LabelingFailure {
			walk(stmt.getStatement());
		}

		@Override
		public void visitDefault(DefaultStmt stmt) throws LabelingFailure {
			walk(stmt.getStatement());
		}

		@Override
		public void visitNull(NullStmt stmt) {
		}
	}
}
