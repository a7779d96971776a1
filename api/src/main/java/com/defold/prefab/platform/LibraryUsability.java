package com.defold.prefab.platform;

/**
 * The outcome of checking one library against a user's requirements. An incompatible library is an expected
 * result, not an error.
 */
public abstract class LibraryUsability {

    private LibraryUsability() {
    }

    public abstract boolean isCompatible();

    public static final class CompatibleLibrary extends LibraryUsability {
        public static final CompatibleLibrary INSTANCE = new CompatibleLibrary();

        private CompatibleLibrary() {
        }

        @Override
        public boolean isCompatible() {
            return true;
        }

        @Override
        public String toString() {
            return "CompatibleLibrary";
        }
    }

    public static final class IncompatibleLibrary extends LibraryUsability {
        private final String reason;

        public IncompatibleLibrary(String reason) {
            this.reason = reason;
        }

        /**
         * @return A human readable explanation of why the library cannot be used
         */
        public String getReason() {
            return reason;
        }

        @Override
        public boolean isCompatible() {
            return false;
        }

        @Override
        public String toString() {
            return String.format("IncompatibleLibrary(%s)", reason);
        }
    }
}
