package me.x150.clabel.ast;

import java.util.List;
import java.util.stream.Stream;

public record Program(List<Declaration> declarations) {
	public Stream<FunctionDeclaration> functionsWithBody() {
		return declarations.stream()
				.filter(FunctionDeclaration.class::isInstance)
				.map(FunctionDeclaration.class::cast)
				.filter(FunctionDeclaration::hasBody);
	}
}
