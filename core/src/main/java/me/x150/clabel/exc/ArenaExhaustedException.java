package me.x150.clabel.exc;

public class ArenaExhaustedException extends RuntimeException {
	public ArenaExhaustedException(long requested, long inUse, long limit) {
		super(String.format("Arena exhausted: requested %d bytes with %d of %d in use", requested, inUse, limit));
	}
}
