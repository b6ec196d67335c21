package me.x150.clabel.ast.stmt;

import lombok.Getter;
import lombok.Setter;
import me.x150.clabel.ast.SourceLocation;
import me.x150.clabel.label.Label;
import org.jetbrains.annotations.Nullable;

/**
 * {@code label: statement}. Like {@link GotoStmt}, the label is rewritten in place to its synthesized form.
 */
@Getter
public class LabeledStmt extends Statement {
	@Setter
	private Label label;
	private final Statement statement;

	public LabeledStmt(@Nullable SourceLocation location, Label label, Statement statement) {
		super(location);
		this.label = label;
		this.statement = statement;
	}

	@Override
	public <X extends Exception> void accept(StatementVisitor<X> visitor) throws X {
		visitor.visitLabeled(this);
	}
}
