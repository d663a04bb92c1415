package com.ebdgraph.core.generator;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Looks up {@link DiagramGenerator} implementations registered through {@link ServiceLoader}.
 */
public final class DiagramGenerators {

    private DiagramGenerators() {
    }

    /**
     * Returns all registered generators, ordered by id.
     *
     * @return generators
     */
    public static List<DiagramGenerator> all() {
        List<DiagramGenerator> generators = new ArrayList<>();
        ServiceLoader.load(DiagramGenerator.class).forEach(generators::add);
        generators.sort(Comparator.comparing(DiagramGenerator::getId));
        return generators;
    }

    /**
     * Finds the generator with the given id.
     *
     * @param id generator id, case-insensitive
     * @return generator, or empty if none is registered under that id
     */
    public static Optional<DiagramGenerator> byId(String id) {
        return all().stream().filter(generator -> generator.getId().equalsIgnoreCase(id)).findFirst();
    }
}
