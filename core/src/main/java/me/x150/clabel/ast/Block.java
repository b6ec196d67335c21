package me.x150.clabel.ast;

import java.util.List;

public record Block(List<BlockItem> items) {
	public static Block of(BlockItem... items) {
		return new Block(List.of(items));
	}
}
