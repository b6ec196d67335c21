package me.x150.clabel.ast.expr;

import me.x150.clabel.ast.SourceLocation;
import me.x150.clabel.label.Label;
import org.jetbrains.annotations.Nullable;

/**
 * {@code operand.member}, or {@code operand->member} when {@link #arrow()} is set.
 */
public record MemberExpr(@Nullable SourceLocation location, Expression operand, Label member, boolean arrow) implements Expression {
	@Override
	public <X extends Exception> void accept(ExpressionVisitor<X> visitor) throws X {
		visitor.visitMember(this);
	}
}
