package me.x150.clabel.ast.stmt;

import lombok.Getter;
import me.x150.clabel.ast.SourceLocation;
import me.x150.clabel.ast.expr.Expression;
import org.jetbrains.annotations.Nullable;

@Getter
public class DoWhileStmt extends LoopStatement {
	private final Expression condition;

	public DoWhileStmt(@Nullable SourceLocation location, Statement body, Expression condition) {
		super(location, body);
		this.condition = condition;
	}

	@Override
	public String kind() {
		return "do_while";
	}

	@Override
	public <X extends Exception> void accept(StatementVisitor<X> visitor) throws X {
		visitor.visitDoWhile(this);
	}
}
