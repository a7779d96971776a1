package com.defold.prefab;

import org.apache.commons.lang3.StringUtils;

import java.util.Objects;

/**
 * A reference to a library exported from a {@link Module}.
 *
 * A reference is either an arbitrary link flag expected to work with the sysroot ({@code -lfoo}), another module
 * of the same package ({@code :foo}) or a module of a package this package depends on ({@code //bar:baz}).
 */
public abstract class LibraryReference {

    private LibraryReference() {
    }

    /**
     * Classifies and parses a reference as found in the {@code export_libraries} of a module.json.
     *
     * @param reference The string form of the reference
     * @return The parsed reference
     * @throws IllegalArgumentException The reference is empty or is a malformed local or external reference
     */
    public static LibraryReference parse(String reference) {
        if (reference == null) {
            throw new IllegalArgumentException("Library reference must not be null");
        }
        if (reference.startsWith("//")) {
            return External.fromString(reference);
        }
        if (reference.startsWith(":")) {
            return Local.fromString(reference);
        }
        return Literal.fromString(reference);
    }

    /**
     * A link flag used as-is, e.g. {@code -lfoo}.
     */
    public static final class Literal extends LibraryReference {
        private final String arg;

        public Literal(String arg) {
            this.arg = arg;
        }

        static Literal fromString(String reference) {
            if (reference.isEmpty()) {
                throw new IllegalArgumentException("Literal library reference must not be empty");
            }
            return new Literal(reference);
        }

        public String getArg() {
            return arg;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Literal && arg.equals(((Literal) o).arg);
        }

        @Override
        public int hashCode() {
            return arg.hashCode();
        }

        @Override
        public String toString() {
            return arg;
        }
    }

    /**
     * A module of the same package, e.g. {@code :foo}.
     */
    public static final class Local extends LibraryReference {
        private final String name;

        public Local(String name) {
            this.name = name;
        }

        static Local fromString(String reference) {
            if (StringUtils.countMatches(reference, ':') != 1) {
                throw new IllegalArgumentException(String.format("Expected exactly one : in local library reference: %s", reference));
            }
            String name = reference.substring(1);
            if (name.isEmpty()) {
                throw new IllegalArgumentException(String.format("Local library reference does not name a module: %s", reference));
            }
            return new Local(name);
        }

        public String getName() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Local && name.equals(((Local) o).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }

        @Override
        public String toString() {
            return ":" + name;
        }
    }

    /**
     * A module of another package, e.g. {@code //bar:baz}.
     */
    public static final class External extends LibraryReference {
        private final String pkg;
        private final String module;

        public External(String pkg, String module) {
            this.pkg = pkg;
            this.module = module;
        }

        static External fromString(String reference) {
            if (StringUtils.countMatches(reference, ':') != 1) {
                throw new IllegalArgumentException(String.format("Expected exactly one : in external library reference: %s", reference));
            }
            String body = reference.substring(2);
            if (body.contains("/")) {
                throw new IllegalArgumentException(String.format("Expected no / after leading // in external library reference: %s", reference));
            }
            String pkg = StringUtils.substringBefore(body, ":");
            String module = StringUtils.substringAfter(body, ":");
            if (pkg.isEmpty() || module.isEmpty()) {
                throw new IllegalArgumentException(String.format("External library reference must name a package and a module: %s", reference));
            }
            return new External(pkg, module);
        }

        public String getPackage() {
            return pkg;
        }

        public String getModule() {
            return module;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof External)) {
                return false;
            }
            External other = (External) o;
            return pkg.equals(other.pkg) && module.equals(other.module);
        }

        @Override
        public int hashCode() {
            return Objects.hash(pkg, module);
        }

        @Override
        public String toString() {
            return String.format("//%s:%s", pkg, module);
        }
    }
}
