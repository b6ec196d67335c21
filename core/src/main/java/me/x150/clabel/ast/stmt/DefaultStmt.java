package me.x150.clabel.ast.stmt;

import lombok.Getter;
import lombok.Setter;
import me.x150.clabel.ast.SourceLocation;
import me.x150.clabel.label.Label;
import org.jetbrains.annotations.Nullable;

@Getter
public class DefaultStmt extends Statement {
	private final Statement statement;
	@Setter
	private @Nullable Label label;

	public DefaultStmt(@Nullable SourceLocation location, Statement statement) {
		super(location);
		this.statement = statement;
	}

	@Override
	public <X extends Exception> void accept(StatementVisitor<X> visitor) throws X {
		visitor.visitDefault(this);
	}
}
