package me.x150.clabel.ast.stmt;

import lombok.Getter;
import lombok.Setter;
import me.x150.clabel.ast.SourceLocation;
import me.x150.clabel.label.Label;
import org.jetbrains.annotations.Nullable;

/**
 * {@code goto label;}. The label holds the name as written until goto resolution replaces it
 * with the synthesized label of the target statement.
 */
@Getter
@Setter
public class GotoStmt extends Statement {
	private Label label;

	public GotoStmt(@Nullable SourceLocation location, Label label) {
		super(location);
		this.label = label;
	}

	@Override
	public <X extends Exception> void accept(StatementVisitor<X> visitor) throws X {
		visitor.visitGoto(this);
	}
}
