package me.x150.clabel.ast.stmt;

import lombok.Getter;
import lombok.Setter;
import me.x150.clabel.ast.SourceLocation;
import me.x150.clabel.label.Label;
import org.jetbrains.annotations.Nullable;

/**
 * Common shape of while, do-while and for: a body plus the label that break and continue jump relative to.
 */
@Getter
public abstract class LoopStatement extends Statement {
	private final Statement body;
	@Setter
	private @Nullable Label label;

	protected LoopStatement(@Nullable SourceLocation location, Statement body) {
		super(location);
		this.body = body;
	}

	/**
	 * @return the kind tag synthesized labels of this loop carry
	 */
	public abstract String kind();
}
