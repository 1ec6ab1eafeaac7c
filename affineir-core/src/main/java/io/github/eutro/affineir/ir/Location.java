package io.github.eutro.affineir.ir;

import java.util.Objects;

/**
 * Where an operation came from, attached to operations and to the diagnostics about them.
 */
public abstract class Location {
    private static final Location UNKNOWN = new Location() {
        @Override
        public boolean equals(Object o) {
            return o == this;
        }

        @Override
        public int hashCode() {
            return 0;
        }

        @Override
        public String toString() {
            return "loc(unknown)";
        }
    };

    private Location() {
    }

    public static Location unknown() {
        return UNKNOWN;
    }

    public static Location fileLineCol(String file, int line, int column) {
        return new FileLineCol(file, line, column);
    }

    public boolean isUnknown() {
        return this == UNKNOWN;
    }

    public static final class FileLineCol extends Location {
        private final String file;
        private final int line;
        private final int column;

        private FileLineCol(String file, int line, int column) {
            this.file = Objects.requireNonNull(file);
            this.line = line;
            this.column = column;
        }

        public String getFile() {
            return file;
        }

        public int getLine() {
            return line;
        }

        public int getColumn() {
            return column;
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof FileLineCol)) return false;
            FileLineCol that = (FileLineCol) o;
            return line == that.line && column == that.column && file.equals(that.file);
        }

        @Override
        public int hashCode() {
            return (file.hashCode() * 31 + line) * 31 + column;
        }

        @Override
        public String toString() {
            return file + ":" + line + ":" + column;
        }
    }
}
