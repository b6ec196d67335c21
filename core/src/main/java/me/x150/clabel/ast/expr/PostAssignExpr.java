package me.x150.clabel.ast.expr;

import me.x150.clabel.ast.SourceLocation;
import org.jetbrains.annotations.Nullable;

/**
 * {@code target++} or {@code target--}.
 */
public record PostAssignExpr(@Nullable SourceLocation location, Expression target, boolean increment) implements Expression {
	@Override
	public <X extends Exception> void accept(ExpressionVisitor<X> visitor) throws X {
		visitor.visitPostAssign(this);
	}
}
