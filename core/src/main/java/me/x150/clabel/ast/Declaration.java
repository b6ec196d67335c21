package me.x150.clabel.ast;

import lombok.Getter;
import me.x150.clabel.label.Label;
import org.jetbrains.annotations.Nullable;

@Getter
public abstract class Declaration implements BlockItem {
	private final @Nullable SourceLocation location;
	private final Label name;

	protected Declaration(@Nullable SourceLocation location, Label name) {
		this.location = location;
		this.name = name;
	}
}
