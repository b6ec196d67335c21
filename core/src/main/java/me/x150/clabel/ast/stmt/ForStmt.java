package me.x150.clabel.ast.stmt;

import lombok.Getter;
import me.x150.clabel.ast.SourceLocation;
import me.x150.clabel.ast.expr.Expression;
import org.jetbrains.annotations.Nullable;

@Getter
public class ForStmt extends LoopStatement {
	private final ForInit init;
	private final @Nullable Expression condition;
	private final @Nullable Expression update;

	public ForStmt(@Nullable SourceLocation location, ForInit init, @Nullable Expression condition, @Nullable Expression update, Statement body) {
		super(location, body);
		this.init = init;
		this.condition = condition;
		this.update = update;
	}

	@Override
	public String kind() {
		return "for";
	}

	@Override
	public <X extends Exception> void accept(StatementVisitor<X> visitor) throws X {
		visitor.visitFor(this);
	}
}
