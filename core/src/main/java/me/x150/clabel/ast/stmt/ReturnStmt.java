package me.x150.clabel.ast.stmt;

import lombok.Getter;
import lombok.Setter;
import me.x150.clabel.ast.SourceLocation;
import me.x150.clabel.ast.expr.Expression;
import me.x150.clabel.label.Label;
import org.jetbrains.annotations.Nullable;

@Getter
public class ReturnStmt extends Statement {
	private final @Nullable Expression expression;
	/**
	 * name of the enclosing function; code generation jumps to its epilogue
	 */
	@Setter
	private @Nullable Label label;

	public ReturnStmt(@Nullable SourceLocation location, @Nullable Expression expression) {
		super(location);
		this.expression = expression;
	}

	@Override
	public <X extends Exception> void accept(StatementVisitor<X> visitor) throws X {
		visitor.visitReturn(this);
	}
}
