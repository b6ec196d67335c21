package me.x150.clabel.pass;

import it.unimi.dsi.fastutil.longs.LongOpenHashSet;
import me.x150.clabel.ast.CaseEntry;
import me.x150.clabel.ast.CaseList;
import me.x150.clabel.ast.expr.IntLiteralExpr;
import me.x150.clabel.ast.stmt.*;
import me.x150.clabel.exc.LabelingFailure;
import org.jetbrains.annotations.Nullable;

import static me.x150.clabel.exc.LabelingFailure.Kind.*;

/**
 * Attaches to every switch the {@link CaseList} of its case values and default marker, rejecting
 * repeats. Nested switches collect independently; cases of an inner switch never reach the outer one.
 */
public class CaseCollector implements LabelPass {
	@Override
	public void run(FunctionScope scope) throws LabelingFailure {
		new Walker(scope).walkBody();
	}

	/**
	 * Cases seen so far in one switch. The value set mirrors the list for constant-time duplicate checks.
	 */
	private static final class CaseSet {
		final LongOpenHashSet values = new LongOpenHashSet();
		CaseList cases = CaseList.EMPTY;
		boolean sawDefault;
	}

	private static final class Walker extends TreeWalker {
		private @Nullable CaseSet current;

		Walker(FunctionScope scope) {
			super(scope);
		}

		@Override
		public void visitSwitch(SwitchStmt stmt) throws LabelingFailure {
			CaseSet saved = current;
			CaseSet mine = new CaseSet();
			current = mine;
			walkExpression(stmt.getExpression());
			walk(stmt.getBody());
			current = saved;
			stmt.setCases(mine.cases);
		}

		@Override
		public void visitCase(CaseStmt stmt) throws LabelingFailure {
			CaseSet set = current;
			if (set == null) throw fail(SCOPE_VIOLATION, "case statement outside switch", stmt);
			if (!(stmt.getExpression() instanceof IntLiteralExpr literal)) {
				throw fail(NON_CONSTANT_CASE, "case statement with non-constant expression", stmt);
			}
			long value = literal.value();
			if (!set.values.add(value)) throw fail(DUPLICATE_DEFINITION, "duplicate case " + value, stmt);
			set.cases = set.cases.prepend(CaseEntry.of(value));
			walk(stmt.getStatement());
		}

		@Override
		public void visitDefault(DefaultStmt stmt) throws LabelingFailure {
			CaseSet set = current;
			if (set == null) throw fail(SCOPE_VIOLATION, "default statement outside switch", stmt);
			if (set.sawDefault) throw fail(DUPLICATE_DEFINITION, "duplicate default case", stmt);
			set.sawDefault = true;
			set.cases = set.cases.prepend(CaseEntry.DEFAULT);
			walk(stmt.getStatement());
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
		public void visitGoto(GotoStmt stmt) {
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
		public void visitNull(NullStmt stmt) {
		}
	}
}
