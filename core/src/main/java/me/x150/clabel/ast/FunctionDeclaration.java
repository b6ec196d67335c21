package me.x150.clabel.ast;

import lombok.Getter;
import me.x150.clabel.label.Label;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * A function definition, or a prototype when {@link #getBody()} is null. Prototypes are never labeled.
 */
@Getter
public class FunctionDeclaration extends Declaration {
	private final List<Label> parameters;
	private final @Nullable Block body;

	public FunctionDeclaration(@Nullable SourceLocation location, Label name, List<Label> parameters, @Nullable Block body) {
		super(location, name);
		this.parameters = parameters;
		this.body = body;
	}

	public boolean hasBody() {
		return body != null;
	}
}
