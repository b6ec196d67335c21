package me.x150.clabel;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import me.x150.clabel.ast.FunctionDeclaration;
import me.x150.clabel.ast.Program;
import me.x150.clabel.ast.TreePrinter;
import me.x150.clabel.conf.Context;
import me.x150.clabel.exc.ArenaExhaustedException;
import me.x150.clabel.exc.LabelingFailure;
import me.x150.clabel.label.LabelTable;
import me.x150.clabel.mem.Arena;
import me.x150.clabel.pass.*;

import java.util.Iterator;

/**
 * Runs the labeling passes over every function definition of a program, in program order.
 * Each function gets its own goto label table; the arena and label generator of the
 * {@link Context} are shared by all of them. The first failing function aborts the run.
 */
@Log4j2
@RequiredArgsConstructor
public class LabelResolver {
	private static final LabelPass[] passes = new LabelPass[]{
			new LoopLabeler(),
			new GotoResolver(),
			new CaseCollector()
	};

	private final Context context;
	@Getter
	private int functionsLabeled;

	public void resolve(Program program) throws LabelingFailure {
		int before = context.labels().generated();
		Iterator<FunctionDeclaration> functions = program.functionsWithBody().iterator();
		while (functions.hasNext()) {
			resolve(functions.next());
		}
		Arena arena = context.arena();
		log.info("Labeled {} functions, synthesized {} labels; arena holds {} bytes in {} blocks",
				functionsLabeled, context.labels().generated() - before, arena.getBytesAllocated(), arena.getBlockCount());
	}

	/**
	 * Labels one function. Prototypes are skipped.
	 */
	public void resolve(FunctionDeclaration function) throws LabelingFailure {
		if (!function.hasBody()) return;
		try (LabelTable gotoLabels = new LabelTable(context.settings().labelTableBuckets)) {
			FunctionScope scope = new FunctionScope(function, gotoLabels, context);
			for (LabelPass pass : passes) {
				log.debug("Running pass {} on {}", pass.getClass().getSimpleName(), function.getName());
				pass.run(scope);
			}
		} catch (LabelingFailure | ArenaExhaustedException e) {
			log.error("Labeling of {} failed: {}", function.getName(), e.getMessage());
			throw e;
		}
		functionsLabeled++;
		if (context.settings().dumpLabeledTrees) {
			log.info("Labeled tree of {}:\n{}", function.getName(), TreePrinter.print(function));
		}
	}
}
