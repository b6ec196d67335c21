package me.x150.clabel.ast.expr;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum UnaryOp {
	NEGATE("-"),
	COMPLEMENT("~"),
	NOT("!"),
	PRE_INCREMENT("++"),
	PRE_DECREMENT("--");

	private final String symbol;
}
