package me.x150.clabel.exc;

import lombok.Getter;
import me.x150.clabel.ast.SourceLocation;
import org.jetbrains.annotations.Nullable;

@Getter
public class LabelingFailure extends CompilationFailure {
	private final Kind kind;
	private final String diagnostic;
	private final @Nullable SourceLocation location;

	public LabelingFailure(Kind kind, String diagnostic, @Nullable SourceLocation location) {
		super(location == null ? diagnostic : diagnostic + " at " + location);
		this.kind = kind;
		this.diagnostic = diagnostic;
		this.location = location;
	}

	public static LabelingFailure malformed(String what, Object node) {
		return new LabelingFailure(Kind.MALFORMED_TREE, "unknown " + what + " kind " + node.getClass().getName(), null);
	}

	public enum Kind {
		/**
		 * break outside any loop/switch, continue outside any loop, case/default outside a switch
		 */
		SCOPE_VIOLATION,
		NON_CONSTANT_CASE,
		/**
		 * goto label defined twice, case value or default repeated within one switch
		 */
		DUPLICATE_DEFINITION,
		UNRESOLVED_REFERENCE,
		/**
		 * a node kind no traversal knows about reached a pass; always an upstream defect
		 */
		MALFORMED_TREE
	}
}
