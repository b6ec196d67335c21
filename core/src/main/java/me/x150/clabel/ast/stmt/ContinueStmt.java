package me.x150.clabel.ast.stmt;

import lombok.Getter;
import lombok.Setter;
import me.x150.clabel.ast.SourceLocation;
import me.x150.clabel.label.Label;
import org.jetbrains.annotations.Nullable;

@Getter
@Setter
public class ContinueStmt extends Statement {
	private @Nullable Label label;

	public ContinueStmt(@Nullable SourceLocation location) {
		super(location);
	}

	@Override
	public <X extends Exception> void accept(StatementVisitor<X> visitor) throws X {
		visitor.visitContinue(this);
	}
}
