package me.x150.clabel.ast.expr;

import me.x150.clabel.ast.SourceLocation;
import org.jetbrains.annotations.Nullable;

public record BinaryExpr(@Nullable SourceLocation location, BinaryOp op, Expression left, Expression right) implements Expression {
	@Override
	public <X extends Exception> void accept(ExpressionVisitor<X> visitor) throws X {
		visitor.visitBinary(this);
	}
}
