package me.x150.clabel.ast.expr;

import me.x150.clabel.ast.SourceLocation;
import org.jetbrains.annotations.Nullable;

public record CastExpr(@Nullable SourceLocation location, String targetType, Expression operand) implements Expression {
	@Override
	public <X extends Exception> void accept(ExpressionVisitor<X> visitor) throws X {
		visitor.visitCast(this);
	}
}
