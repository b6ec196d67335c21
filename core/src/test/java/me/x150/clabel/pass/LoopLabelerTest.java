package me.x150.clabel.pass;

import me.x150.clabel.ast.FunctionDeclaration;
import me.x150.clabel.ast.expr.BinaryOp;
import me.x150.clabel.ast.stmt.*;
import me.x150.clabel.conf.Context;
import me.x150.clabel.exc.LabelingFailure;
import me.x150.clabel.label.Label;
import me.x150.clabel.label.LabelTable;
import org.junit.jupiter.api.Test;

import static me.x150.clabel.ast.Trees.*;
import static org.junit.jupiter.api.Assertions.*;

class LoopLabelerTest {

	private static FunctionScope scope(FunctionDeclaration fn) {
		return new FunctionScope(fn, new LabelTable(16), Context.create());
	}

	private static void label(FunctionDeclaration fn) throws LabelingFailure {
		new LoopLabeler().run(scope(fn));
	}

	@Test
	public void testWhileBreakContinue() throws LabelingFailure {
		BreakStmt brk = brk();
		ContinueStmt cont = cont();
		WhileStmt loop = whileLoop(var("x"), compound(brk, cont));
		label(function("main", loop));

		assertEquals("main.while.0", loop.getLabel().toString());
		assertSame(loop.getLabel(), brk.getLabel());
		assertSame(loop.getLabel(), cont.getLabel());
	}

	@Test
	public void testBreakInSwitchInsideLoop() throws LabelingFailure {
		BreakStmt inSwitch = brk();
		ContinueStmt contInSwitch = cont();
		BreakStmt afterSwitch = brk();
		SwitchStmt sw = switchOn(var("x"), compound(caseOf(1, inSwitch), caseOf(2, contInSwitch)));
		WhileStmt loop = whileLoop(var("y"), compound(sw, afterSwitch));
		label(function("f", loop));

		assertEquals(sw.getLabel(), inSwitch.getLabel());
		assertEquals(loop.getLabel(), contInSwitch.getLabel());
		// leaving the switch restores the loop as break target
		assertEquals(loop.getLabel(), afterSwitch.getLabel());
	}

	@Test
	public void testBreakInLoopInsideSwitch() throws LabelingFailure {
		BreakStmt inLoop = brk();
		BreakStmt inSwitch = brk();
		ForStmt loop = forLoop(new ForInit.Expr(null), null, null, inLoop);
		SwitchStmt sw = switchOn(var("x"), compound(caseOf(0, loop), inSwitch));
		label(function("f", sw));

		assertEquals(loop.getLabel(), inLoop.getLabel());
		assertEquals(sw.getLabel(), inSwitch.getLabel());
	}

	@Test
	public void testContinueInsideSwitchWithoutLoopFails() {
		FunctionDeclaration fn = function("f", switchOn(var("x"), compound(caseOf(1, cont()))));
		LabelingFailure e = assertThrows(LabelingFailure.class, () -> label(fn));
		assertEquals(LabelingFailure.Kind.SCOPE_VIOLATION, e.getKind());
		assertEquals("continue statement outside loop", e.getDiagnostic());
	}

	@Test
	public void testBreakOutsideFails() {
		BreakStmt brk = new BreakStmt(at(3, 5));
		LabelingFailure e = assertThrows(LabelingFailure.class, () -> label(function("f", brk)));
		assertEquals("break statement outside loop/switch", e.getDiagnostic());
		assertEquals("break statement outside loop/switch at 3:5", e.getMessage());
	}

	@Test
	public void testCaseAndDefaultLabels() throws LabelingFailure {
		CaseStmt one = caseOf(1, nul());
		CaseStmt minus = caseOf(-4, nul());
		DefaultStmt def = defaultCase(nul());
		SwitchStmt sw = switchOn(var("x"), compound(one, minus, def));
		label(function("g", sw));

		assertEquals("g.switch.0", sw.getLabel().toString());
		assertEquals("g.switch.0.case.1", one.getLabel().toString());
		assertEquals("g.switch.0.case.m4", minus.getLabel().toString());
		assertEquals("g.switch.0.default", def.getLabel().toString());
		assertFalse(minus.getLabel().contains('-'));
	}

	@Test
	public void testCaseSuffix() {
		assertEquals(".case.0", LoopLabeler.caseSuffix(0));
		assertEquals(".case.m1", LoopLabeler.caseSuffix(-1));
		assertEquals(".case.m9223372036854775808", LoopLabeler.caseSuffix(Long.MIN_VALUE));
		assertNotEquals(LoopLabeler.caseSuffix(-1), LoopLabeler.caseSuffix(1));
	}

	@Test
	public void testCaseOutsideSwitchFails() {
		LabelingFailure e = assertThrows(LabelingFailure.class, () -> label(function("f", caseOf(1, nul()))));
		assertEquals("case statement outside switch", e.getDiagnostic());
		e = assertThrows(LabelingFailure.class, () -> label(function("f", whileLoop(var("x"), defaultCase(nul())))));
		assertEquals("default statement outside switch", e.getDiagnostic());
	}

	@Test
	public void testNonConstantCaseFails() {
		CaseStmt bad = new CaseStmt(null, binary(BinaryOp.ADD, lit(1), var("y")), nul());
		LabelingFailure e = assertThrows(LabelingFailure.class, () -> label(function("f", switchOn(var("x"), bad))));
		assertEquals(LabelingFailure.Kind.NON_CONSTANT_CASE, e.getKind());
		assertEquals("case statement with non-constant expression", e.getDiagnostic());
	}

	@Test
	public void testGotoTargetsRecorded() throws LabelingFailure {
		LabeledStmt target = labeled("out", nul());
		FunctionScope scope = scope(function("f", target));
		new LoopLabeler().run(scope);

		Label unique = scope.gotoLabels().get(l("out"));
		assertNotNull(unique);
		assertEquals("f.goto.0", unique.toString());
		assertEquals(unique, target.getLabel());
	}

	@Test
	public void testDuplicateGotoLabelFailsAtSecond() {
		LabeledStmt first = new LabeledStmt(at(1, 1), l("foo"), nul());
		LabeledStmt second = new LabeledStmt(at(5, 1), l("foo"), nul());
		LabelingFailure e = assertThrows(LabelingFailure.class, () -> label(function("f", first, second)));
		assertEquals(LabelingFailure.Kind.DUPLICATE_DEFINITION, e.getKind());
		assertEquals("multiple definitions for goto label foo", e.getDiagnostic());
		assertEquals(at(5, 1), e.getLocation());
	}

	@Test
	public void testReturnTargetsFunction() throws LabelingFailure {
		ReturnStmt ret = ret(lit(0));
		label(function("compute", whileLoop(lit(1), ret)));
		assertEquals(l("compute"), ret.getLabel());
	}

	@Test
	public void testForInitSeesEnclosingContext() throws LabelingFailure {
		// break hidden in the init clause belongs to the outer loop, the one in the condition to the for
		BreakStmt inInit = brk();
		BreakStmt inCondition = brk();
		ForStmt inner = forLoop(new ForInit.Expr(stmtExpr(inInit)), stmtExpr(inCondition, exprStmt(lit(1))), null, nul());
		WhileStmt outer = whileLoop(lit(1), inner);
		label(function("f", outer));

		assertEquals(outer.getLabel(), inInit.getLabel());
		assertEquals(inner.getLabel(), inCondition.getLabel());
	}

	@Test
	public void testLoopsInsideStatementExpressionsAndInitializers() throws LabelingFailure {
		BreakStmt brk = brk();
		DoWhileStmt loop = doWhile(brk, lit(0));
		label(function("f", local("v", stmtExpr(loop))));
		assertEquals("f.do_while.0", loop.getLabel().toString());
		assertEquals(loop.getLabel(), brk.getLabel());
	}

	@Test
	public void testSiblingIfBranchesDoNotLeak() throws LabelingFailure {
		BreakStmt thenBreak = brk();
		BreakStmt elseBreak = brk();
		BreakStmt afterIf = brk();
		SwitchStmt thenSwitch = switchOn(var("a"), compound(caseOf(1, thenBreak)));
		WhileStmt elseLoop = whileLoop(var("b"), elseBreak);
		WhileStmt outer = whileLoop(lit(1), compound(ifThen(var("c"), thenSwitch, elseLoop), afterIf));
		label(function("f", outer));

		assertEquals(thenSwitch.getLabel(), thenBreak.getLabel());
		assertEquals(elseLoop.getLabel(), elseBreak.getLabel());
		assertEquals(outer.getLabel(), afterIf.getLabel());
	}

	@Test
	public void testDeeplyNestedMixedConstructs() throws LabelingFailure {
		// alternate loops and switches; every break must hit its own innermost construct
		int depth = 12;
		BreakStmt[] breaks = new BreakStmt[depth];
		ContinueStmt[] continues = new ContinueStmt[depth];
		Statement[] constructs = new Statement[depth];
		Statement inner = nul();
		for (int i = depth - 1; i >= 0; i--) {
			breaks[i] = brk();
			continues[i] = cont();
			if (i % 2 == 0) {
				constructs[i] = whileLoop(var("c"), compound(inner, continues[i], breaks[i]));
			} else {
				constructs[i] = switchOn(var("s"), compound(caseOf(i, inner), continues[i], breaks[i]));
			}
			inner = constructs[i];
		}
		label(function("f", inner));

		for (int i = 0; i < depth; i++) {
			Label own = constructs[i] instanceof LoopStatement loop ? loop.getLabel() : ((SwitchStmt) constructs[i]).getLabel();
			assertEquals(own, breaks[i].getLabel(), "break at depth " + i);
			Label enclosingLoop = ((LoopStatement) constructs[i % 2 == 0 ? i : i - 1]).getLabel();
			assertEquals(enclosingLoop, continues[i].getLabel(), "continue at depth " + i);
		}
	}

	@Test
	public void testDoWhileDuplicateLabelReportedInCondition() {
		// do { foo: ; } while (({ foo: 0; }));
		LabeledStmt inBody = new LabeledStmt(at(1, 6), l("foo"), nul());
		LabeledStmt inCondition = new LabeledStmt(at(1, 25), l("foo"), exprStmt(lit(0)));
		FunctionDeclaration fn = function("f", doWhile(inBody, stmtExpr(inCondition)));
		LabelingFailure e = assertThrows(LabelingFailure.class, () -> label(fn));
		assertEquals(LabelingFailure.Kind.DUPLICATE_DEFINITION, e.getKind());
		assertEquals(at(1, 25), e.getLocation());
	}

	@Test
	public void testForDuplicateLabelReportedInBody() {
		// for (;; ({ foo: 0; })) { foo: ; }
		LabeledStmt inUpdate = new LabeledStmt(at(1, 11), l("foo"), exprStmt(lit(0)));
		LabeledStmt inBody = new LabeledStmt(at(1, 26), l("foo"), nul());
		FunctionDeclaration fn = function("f", forLoop(new ForInit.Expr(null), null, stmtExpr(inUpdate), inBody));
		LabelingFailure e = assertThrows(LabelingFailure.class, () -> label(fn));
		assertEquals(at(1, 26), e.getLocation());
	}

	@Test
	public void testLoopPartsLabeledInSourceOrder() throws LabelingFailure {
		WhileStmt inUpdate = whileLoop(lit(0), nul());
		WhileStmt inBody = whileLoop(lit(0), nul());
		ForStmt loop = forLoop(new ForInit.Expr(null), null, stmtExpr(inUpdate), inBody);
		label(function("f", loop));
		assertEquals("f.for.0", loop.getLabel().toString());
		assertEquals("f.while.1", inUpdate.getLabel().toString());
		assertEquals("f.while.2", inBody.getLabel().toString());
	}
}
