package me.x150.clabel.ast.init;

public interface Initializer {
}
