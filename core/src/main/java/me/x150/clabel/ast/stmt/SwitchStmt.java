package me.x150.clabel.ast.stmt;

import lombok.Getter;
import lombok.Setter;
import me.x150.clabel.ast.CaseList;
import me.x150.clabel.ast.SourceLocation;
import me.x150.clabel.ast.expr.Expression;
import me.x150.clabel.label.Label;
import org.jetbrains.annotations.Nullable;

@Getter
public class SwitchStmt extends Statement {
	private final Expression expression;
	private final Statement body;
	@Setter
	private @Nullable Label label;
	/**
	 * null until case collection has run
	 */
	@Setter
	private @Nullable CaseList cases;

	public SwitchStmt(@Nullable SourceLocation location, Expression expression, Statement body) {
		super(location);
		this.expression = expression;
		this.body = body;
	}

	@Override
	public <X extends Exception> void accept(StatementVisitor<X> visitor) throws X {
		visitor.visitSwitch(this);
	}
}
