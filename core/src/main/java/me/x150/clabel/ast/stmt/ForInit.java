package me.x150.clabel.ast.stmt;

import me.x150.clabel.ast.VariableDeclaration;
import me.x150.clabel.ast.expr.Expression;
import org.jetbrains.annotations.Nullable;

/**
 * First clause of a for loop: a declaration or an optional expression.
 */
public interface ForInit {
	record Declared(VariableDeclaration declaration) implements ForInit {
	}

	record Expr(@Nullable Expression expression) implements ForInit {
	}
}
