package me.x150.clabel.ast;

/**
 * One entry of a switch's {@link CaseList}: an integer case value or the default marker.
 */
public sealed interface CaseEntry permits CaseEntry.IntCase, CaseEntry.DefaultCase {
	DefaultCase DEFAULT = new DefaultCase();

	static IntCase of(long value) {
		return new IntCase(value);
	}

	record IntCase(long value) implements CaseEntry {
		@Override
		public String toString() {
			return "IntCase " + value;
		}
	}

	record DefaultCase() implements CaseEntry {
		@Override
		public String toString() {
			return "DefaultCase";
		}
	}
}
