package me.x150.clabel.label;

import org.jetbrains.annotations.Nullable;

/**
 * Nearest enclosing loop and switch during label assignment. Instances are immutable; entering a
 * construct yields a new context and the caller keeps the old one to restore on the way out.
 *
 * @param loopLabel   innermost enclosing loop, survives entering a switch
 * @param switchLabel innermost enclosing switch, survives entering a loop
 * @param nearest     which of the two is the innermost breakable construct, null outside both
 */
public record LabelContext(@Nullable Label loopLabel, @Nullable Label switchLabel, @Nullable Breakable nearest) {
	public static final LabelContext EMPTY = new LabelContext(null, null, null);

	public LabelContext enterLoop(Label label) {
		return new LabelContext(label, switchLabel, Breakable.LOOP);
	}

	public LabelContext enterSwitch(Label label) {
		return new LabelContext(loopLabel, label, Breakable.SWITCH);
	}

	public @Nullable Label breakTarget() {
		if (nearest == null) return null;
		return switch (nearest) {
			case LOOP -> loopLabel;
			case SWITCH -> switchLabel;
		};
	}

	public @Nullable Label continueTarget() {
		return loopLabel;
	}

	public enum Breakable {
		LOOP,
		SWITCH
	}
}
