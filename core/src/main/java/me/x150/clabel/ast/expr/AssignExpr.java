package me.x150.clabel.ast.expr;

import me.x150.clabel.ast.SourceLocation;
import org.jetbrains.annotations.Nullable;

/**
 * {@code target = value}, or {@code target op= value} when {@link #op()} is set.
 */
public record AssignExpr(@Nullable SourceLocation location, @Nullable BinaryOp op, Expression target, Expression value) implements Expression {
	@Override
	public <X extends Exception> void accept(ExpressionVisitor<X> visitor) throws X {
		visitor.visitAssign(this);
	}
}
