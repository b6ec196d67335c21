package me.x150.clabel.ast.expr;

import me.x150.clabel.ast.SourceLocation;
import org.jetbrains.annotations.Nullable;

public interface Expression {
	@Nullable SourceLocation location();

	<X extends Exception> void accept(ExpressionVisitor<X> visitor) throws X;
}
