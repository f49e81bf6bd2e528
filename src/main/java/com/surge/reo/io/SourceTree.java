package com.surge.reo.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * The {@code *.sodg} files under a directory, each with the package it is
 * mounted under: {@code a/b/foo.sodg} belongs to package {@code a.b}.
 */
public final class SourceTree {
    public static final String EXTENSION = ".sodg";

    /**
     * One source file.
     *
     * @param file the file
     * @param pkg  package segments, empty for files at the top of the tree
     */
    public record Unit(Path file, List<String> pkg) {
        public String packageName() {
            return String.join(".", pkg);
        }
    }

    private final Path home;

    public SourceTree(Path home) {
        this.home = home;
    }

    /** All units, sorted by relative path. */
    public List<Unit> units() throws IOException {
        try (Stream<Path> files = Files.walk(home)) {
            List<Path> found = files
                    .filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(EXTENSION))
                    .sorted()
                    .collect(Collectors.toList());
            List<Unit> units = new ArrayList<>(found.size());
            for (Path file : found) {
                Path rel = home.relativize(file).getParent();
                List<String> pkg = new ArrayList<>();
                if (rel != null) {
                    for (Path part : rel)
                        pkg.add(part.toString());
                }
                units.add(new Unit(file, Collections.unmodifiableList(pkg)));
            }
            return units;
        }
    }

    /** The most recent modification time among the sources, or 0 when there are none. */
    public long lastModified() throws IOException {
        long latest = 0;
        for (Unit u : units())
            latest = Math.max(latest, Files.getLastModifiedTime(u.file()).toMillis());
        return latest;
    }
}
