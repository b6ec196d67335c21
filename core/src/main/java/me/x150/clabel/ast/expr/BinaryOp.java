package me.x150.clabel.ast.expr;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum BinaryOp {
	ADD("+"),
	SUB("-"),
	MUL("*"),
	DIV("/"),
	MOD("%"),
	BIT_AND("&"),
	BIT_OR("|"),
	BIT_XOR("^"),
	SHL("<<"),
	SHR(">>"),
	LOGICAL_AND("&&"),
	LOGICAL_OR("||"),
	EQ("=="),
	NE("!="),
	LT("<"),
	LE("<="),
	GT(">"),
	GE(">=");

	private final String symbol;
}
