package me.x150.clabel.ast.stmt;

import lombok.Getter;
import me.x150.clabel.ast.BlockItem;
import me.x150.clabel.ast.SourceLocation;
import org.jetbrains.annotations.Nullable;

@Getter
public abstract class Statement implements BlockItem {
	private final @Nullable SourceLocation location;

	protected Statement(@Nullable SourceLocation location) {
		this.location = location;
	}

	public abstract <X extends Exception> void accept(StatementVisitor<X> visitor) throws X;
}
