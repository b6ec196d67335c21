package me.x150.clabel.ast.expr;

import me.x150.clabel.ast.SourceLocation;
import org.jetbrains.annotations.Nullable;

public record AddressOfExpr(@Nullable SourceLocation location, Expression operand) implements Expression {
	@Override
	public <X extends Exception> void accept(ExpressionVisitor<X> visitor) throws X {
		visitor.visitAddressOf(this);
	}
}
