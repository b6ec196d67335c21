package me.x150.clabel.ast.expr;

import me.x150.clabel.ast.SourceLocation;
import org.jetbrains.annotations.Nullable;

public record ConditionalExpr(@Nullable SourceLocation location, Expression condition, Expression ifTrue, Expression ifFalse) implements Expression {
	@Override
	public <X extends Exception> void accept(ExpressionVisitor<X> visitor) throws X {
		visitor.visitConditional(this);
	}
}
