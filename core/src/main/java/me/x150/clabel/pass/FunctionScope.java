package me.x150.clabel.pass;

import me.x150.clabel.ast.Block;
import me.x150.clabel.ast.FunctionDeclaration;
import me.x150.clabel.conf.Context;
import me.x150.clabel.label.Label;
import me.x150.clabel.label.LabelTable;

import java.util.Objects;

/**
 * Everything the passes over one function body share: the function, its goto label table and the
 * compilation-wide context. The table lives exactly as long as this scope.
 */
public record FunctionScope(FunctionDeclaration function, LabelTable gotoLabels, Context context) {
	public Label name() {
		return function.getName();
	}

	public Block body() {
		return Objects.requireNonNull(function.getBody(), "function has no body");
	}
}
