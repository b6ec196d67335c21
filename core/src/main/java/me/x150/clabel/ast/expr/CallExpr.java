package me.x150.clabel.ast.expr;

import me.x150.clabel.ast.SourceLocation;
import me.x150.clabel.label.Label;
import org.jetbrains.annotations.Nullable;

import java.util.List;

public record CallExpr(@Nullable SourceLocation location, Label function, List<Expression> arguments) implements Expression {
	@Override
	public <X extends Exception> void accept(ExpressionVisitor<X> visitor) throws X {
		visitor.visitCall(this);
	}
}
