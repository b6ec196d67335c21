package me.x150.clabel.ast.stmt;

import lombok.Getter;
import lombok.Setter;
import me.x150.clabel.ast.SourceLocation;
import me.x150.clabel.ast.expr.Expression;
import me.x150.clabel.label.Label;
import org.jetbrains.annotations.Nullable;

@Getter
public class CaseStmt extends Statement {
	private final Expression expression;
	private final Statement statement;
	@Setter
	private @Nullable Label label;

	public CaseStmt(@Nullable SourceLocation location, Expression expression, Statement statement) {
		super(location);
		this.expression = expression;
		this.statement = statement;
	}

	@Override
	public <X extends Exception> void accept(StatementVisitor<X> visitor) throws X {
		visitor.visitCase(this);
	}
}
