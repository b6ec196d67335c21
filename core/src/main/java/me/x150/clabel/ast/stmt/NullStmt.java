package me.x150.clabel.ast.stmt;

import me.x150.clabel.ast.SourceLocation;
import org.jetbrains.annotations.Nullable;

public class NullStmt extends Statement {
	public NullStmt(@Nullable SourceLocation location) {
		super(location);
	}

	@Override
	public <X extends Exception> void accept(StatementVisitor<X> visitor) throws X {
		visitor.visitNull(this);
	}
}
