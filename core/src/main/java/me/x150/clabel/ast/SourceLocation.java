package me.x150.clabel.ast;

/**
 * 1-based line and column of a node in the C source file.
 */
public record SourceLocation(int line, int column) {
	@Override
	public String toString() {
		return line + ":" + column;
	}
}
