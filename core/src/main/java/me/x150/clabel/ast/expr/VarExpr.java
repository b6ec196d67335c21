package me.x150.clabel.ast.expr;

import me.x150.clabel.ast.SourceLocation;
import me.x150.clabel.label.Label;
import org.jetbrains.annotations.Nullable;

public record VarExpr(@Nullable SourceLocation location, Label name) implements Expression {
	@Override
	public <X extends Exception> void accept(ExpressionVisitor<X> visitor) throws X {
		visitor.visitVar(this);
	}
}
