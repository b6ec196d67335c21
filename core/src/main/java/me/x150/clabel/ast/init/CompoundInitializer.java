package me.x150.clabel.ast.init;

import java.util.List;

/**
 * Brace-enclosed aggregate initializer; elements may nest further compound initializers.
 */
public record CompoundInitializer(List<Initializer> elements) implements Initializer {
}
