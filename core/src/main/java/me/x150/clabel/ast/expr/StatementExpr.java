package me.x150.clabel.ast.expr;

import me.x150.clabel.ast.Block;
import me.x150.clabel.ast.SourceLocation;
import org.jetbrains.annotations.Nullable;

/**
 * GNU statement expression {@code ({ ... })}. The block may hold loops, switches and goto targets of its own.
 */
public record StatementExpr(@Nullable SourceLocation location, Block block) implements Expression {
	@Override
	public <X extends Exception> void accept(ExpressionVisitor<X> visitor) throws X {
		visitor.visitStatementExpr(this);
	}
}
