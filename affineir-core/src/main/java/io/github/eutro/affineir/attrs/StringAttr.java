package io.github.eutro.affineir.attrs;

public final class StringAttr extends Attribute {
    private final String value;

    private StringAttr(String value) {
        this.value = value;
    }

    public static StringAttr get(String value) {
        return new StringAttr(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof StringAttr && ((StringAttr) o).value.equals(value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    /**
     * Quote a string the way the textual form expects it.
     *
     * @param value The string.
     * @return The quoted string.
     */
    public static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"':
                case '\\':
                    sb.append('\\').append(c);
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                case '\t':
                    sb.append("\\t");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.append('"').toString();
    }

    @Override
    public String toString() {
        return quote(value);
    }
}
