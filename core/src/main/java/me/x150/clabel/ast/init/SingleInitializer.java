package me.x150.clabel.ast.init;

import me.x150.clabel.ast.expr.Expression;

public record SingleInitializer(Expression expression) implements Initializer {
}
