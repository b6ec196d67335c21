package me.x150.clabel.ast.stmt;

import lombok.Getter;
import me.x150.clabel.ast.SourceLocation;
import me.x150.clabel.ast.expr.Expression;
import org.jetbrains.annotations.Nullable;

@Getter
public class WhileStmt extends LoopStatement {
	private final Expression condition;

	public WhileStmt(@Nullable SourceLocation location, Expression condition, Statement body) {
		super(location, body);
		this.condition = condition;
	}

	@Override
	public String kind() {
		return "while";
	}

	@Override
	public <X extends Exception> void accept(StatementVisitor<X> visitor) throws X {
		visitor.visitWhile(this);
	}
}
