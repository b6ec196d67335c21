package me.x150.clabel.ast.stmt;

import lombok.Getter;
import me.x150.clabel.ast.SourceLocation;
import me.x150.clabel.ast.expr.Expression;
import org.jetbrains.annotations.Nullable;

@Getter
public class ExpressionStmt extends Statement {
	private final Expression expression;

	public ExpressionStmt(@Nullable SourceLocation location, Expression expression) {
		super(location);
		this.expression = expression;
	}

	@Override
	public <X extends Exception> void accept(StatementVisitor<X> visitor) throws X {
		visitor.visitExpression(this);
	}
}
