package dev.ossaudit.manifest;

/** One {@code [[package]]} table of a lock file. */
public record DependencyEntry(String name, String version) {

    @Override
    public String toString() {
        return name + "@" + version;
    }
}
