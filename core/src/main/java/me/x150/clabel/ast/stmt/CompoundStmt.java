package me.x150.clabel.ast.stmt;

import lombok.Getter;
import me.x150.clabel.ast.Block;
import me.x150.clabel.ast.SourceLocation;
import org.jetbrains.annotations.Nullable;

@Getter
public class CompoundStmt extends Statement {
	private final Block block;

	public CompoundStmt(@Nullable SourceLocation location, Block block) {
		super(location);
		this.block = block;
	}

	@Override
	public <X extends Exception> void accept(StatementVisitor<X> visitor) throws X {
		visitor.visitCompound(this);
	}
}
