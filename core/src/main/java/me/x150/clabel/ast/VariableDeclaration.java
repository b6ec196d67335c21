package me.x150.clabel.ast;

import lombok.Getter;
import me.x150.clabel.ast.init.Initializer;
import me.x150.clabel.label.Label;
import org.jetbrains.annotations.Nullable;

@Getter
public class VariableDeclaration extends Declaration {
	private final @Nullable Initializer initializer;

	public VariableDeclaration(@Nullable SourceLocation location, Label name, @Nullable Initializer initializer) {
		super(location, name);
		this.initializer = initializer;
	}
}
