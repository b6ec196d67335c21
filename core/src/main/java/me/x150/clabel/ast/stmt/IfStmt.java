package me.x150.clabel.ast.stmt;

import lombok.Getter;
import me.x150.clabel.ast.SourceLocation;
import me.x150.clabel.ast.expr.Expression;
import org.jetbrains.annotations.Nullable;

@Getter
public class IfStmt extends Statement {
	private final Expression condition;
	private final Statement then;
	private final @Nullable Statement otherwise;

	public IfStmt(@Nullable SourceLocation location, Expression condition, Statement then, @Nullable Statement otherwise) {
		super(location);
		this.condition = condition;
		this.then = then;
		this.otherwise = otherwise;
	}

	@Override
	public <X extends Exception> void accept(StatementVisitor<X> visitor) throws X {
		visitor.visitIf(this);
	}
}
