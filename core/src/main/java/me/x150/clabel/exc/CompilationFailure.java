package me.x150.clabel.exc;

/**
 * Aborts compilation of the current translation unit. The process itself keeps running.
 */
public class CompilationFailure extends Exception {
	public CompilationFailure(String message) {
		super(message);
	}

	public CompilationFailure(String message, Throwable cause) {
		super(message, cause);
	}
}
