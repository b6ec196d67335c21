package me.x150.clabel.ast;

/**
 * Anything that can appear directly inside a block: a statement or a local declaration.
 */
public interface BlockItem {
}
