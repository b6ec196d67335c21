package me.x150.clabel.label;

public interface LabelGenerator {
	/**
	 * @param seed name the label is scoped to, usually the enclosing function
	 * @param kind category of the labeled construct ("while", "switch", "goto", ...)
	 * @return a label no other call on this generator has returned
	 */
	Label freshLabel(Label seed, String kind);

	/**
	 * @return how many labels this generator has handed out so far
	 */
	int generated();
}
