package com.dependforce.dependency;

import java.util.*;

/**
 * SMO-style URN identifying a database object, e.g.
 * {@code Server[@Name='SQL01']/Database[@Name='Sales']/Table[@Name='Orders' and @Schema='dbo']}.
 *
 * Equality is based on the canonical URN text.
 */
public final class Urn implements ObjectIdentity {

    private static final String SERVER = "Server";
    private static final String DATABASE = "Database";

    private final String value;
    private final List<Segment> segments;

    private Urn(String value, List<Segment> segments) {
        this.value = value;
        this.segments = Collections.unmodifiableList(segments);
    }

    /**
     * One path element of a URN: a type plus its key attributes.
     */
    public static class Segment {
        private final String type;
        private final Map<String, String> attributes;

        public Segment(String type, Map<String, String> attributes) {
            this.type = type;
            this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }

        public String getType() { return type; }
        public String getAttribute(String name) { return attributes.get(name); }

        @Override
        public String toString() {
            if (attributes.isEmpty()) {
                return type;
            }
            StringBuilder sb = new StringBuilder(type).append('[');
            boolean first = true;
            for (Map.Entry<String, String> attr : attributes.entrySet()) {
                if (!first) {
                    sb.append(" and ");
                }
                sb.append('@').append(attr.getKey()).append("='")
                  .append(attr.getValue().replace("'", "''")).append('\'');
                first = false;
            }
            return sb.append(']').toString();
        }
    }

    /**
     * Parses URN text.
     *
     * @throws IllegalArgumentException if the text is blank or malformed
     */
    public static Urn parse(String text) {
        if (text == null || text.trim().isEmpty()) {
            throw new IllegalArgumentException("URN is empty");
        }
        List<Segment> segments = new ArrayList<>();
        String input = text.trim();
        int pos = 0;
        while (pos < input.length()) {
            int start = pos;
            while (pos < input.length() && input.charAt(pos) != '[' && input.charAt(pos) != '/') {
                pos++;
            }
            String type = input.substring(start, pos).trim();
            if (type.isEmpty()) {
                throw new IllegalArgumentException("Missing segment type at position " + start + " in URN: " + text);
            }
            Map<String, String> attributes = new LinkedHashMap<>();
            if (pos < input.length() && input.charAt(pos) == '[') {
                pos = parseAttributes(input, pos + 1, attributes);
            }
            segments.add(new Segment(type, attributes));
            if (pos < input.length()) {
                if (input.charAt(pos) != '/') {
                    throw new IllegalArgumentException("Expected '/' at position " + pos + " in URN: " + text);
                }
                pos++;
                if (pos == input.length()) {
                    throw new IllegalArgumentException("URN ends with '/': " + text);
                }
            }
        }
        return new Urn(render(segments), segments);
    }

    // Returns the position just after the closing ']'
    private static int parseAttributes(String input, int pos, Map<String, String> attributes) {
        while (true) {
            pos = skipSpaces(input, pos);
            if (pos >= input.length()) {
                throw new IllegalArgumentException("Unterminated attribute list in URN: " + input);
            }
            if (input.charAt(pos) == ']') {
                return pos + 1;
            }
            if (!attributes.isEmpty()) {
                if (!input.regionMatches(true, pos, "and", 0, 3)) {
                    throw new IllegalArgumentException("Expected 'and' at position " + pos + " in URN: " + input);
                }
                pos = skipSpaces(input, pos + 3);
            }
            if (pos >= input.length() || input.charAt(pos) != '@') {
                throw new IllegalArgumentException("Expected '@' at position " + pos + " in URN: " + input);
            }
            int nameStart = ++pos;
            while (pos < input.length() && input.charAt(pos) != '=' && !Character.isWhitespace(input.charAt(pos))) {
                pos++;
            }
            String name = input.substring(nameStart, pos);
            pos = skipSpaces(input, pos);
            if (pos >= input.length() || input.charAt(pos) != '=') {
                throw new IllegalArgumentException("Expected '=' after @" + name + " in URN: " + input);
            }
            pos = skipSpaces(input, pos + 1);
            if (pos >= input.length() || input.charAt(pos) != '\'') {
                throw new IllegalArgumentException("Expected quoted value for @" + name + " in URN: " + input);
            }
            pos++;
            StringBuilder value = new StringBuilder();
            while (true) {
                if (pos >= input.length()) {
                    throw new IllegalArgumentException("Unterminated value for @" + name + " in URN: " + input);
                }
                char c = input.charAt(pos);
                if (c == '\'') {
                    if (pos + 1 < input.length() && input.charAt(pos + 1) == '\'') {
                        value.append('\'');
                        pos += 2;
                        continue;
                    }
                    pos++;
                    break;
                }
                value.append(c);
                pos++;
            }
            attributes.put(name, value.toString());
        }
    }

    private static int skipSpaces(String input, int pos) {
        while (pos < input.length() && Character.isWhitespace(input.charAt(pos))) {
            pos++;
        }
        return pos;
    }

    private static String render(List<Segment> segments) {
        StringBuilder sb = new StringBuilder();
        for (Segment segment : segments) {
            if (sb.length() > 0) {
                sb.append('/');
            }
            sb.append(segment);
        }
        return sb.toString();
    }

    /**
     * Builds the URN of a schema-scoped object.
     */
    public static Urn of(String server, String database, String type, String schema, String name) {
        List<Segment> segments = new ArrayList<>();
        segments.add(new Segment(SERVER, Map.of("Name", server)));
        segments.add(new Segment(DATABASE, Map.of("Name", database)));
        Map<String, String> attrs = new LinkedHashMap<>();
        attrs.put("Name", name);
        if (schema != null) {
            attrs.put("Schema", schema);
        }
        segments.add(new Segment(type, attrs));
        return new Urn(render(segments), segments);
    }

    /**
     * Returns the URN text as an Urn, parsing it unless it already is one.
     */
    public static Urn from(ObjectIdentity identity) {
        if (identity instanceof Urn) {
            return (Urn) identity;
        }
        return parse(identity.getUrn());
    }

    @Override
    public String getUrn() {
        return value;
    }

    public List<Segment> getSegments() {
        return segments;
    }

    public Segment getLeaf() {
        return segments.get(segments.size() - 1);
    }

    /** Object type of the leaf segment, e.g. Table or StoredProcedure */
    public String getType() {
        return getLeaf().getType();
    }

    public String getName() {
        return getLeaf().getAttribute("Name");
    }

    public String getSchema() {
        return getLeaf().getAttribute("Schema");
    }

    /**
     * @return the owning server name, or null if the URN has no Server segment
     */
    public String getServer() {
        return findSegmentAttribute(SERVER);
    }

    public String getDatabase() {
        return findSegmentAttribute(DATABASE);
    }

    private String findSegmentAttribute(String type) {
        for (Segment segment : segments) {
            if (segment.getType().equalsIgnoreCase(type)) {
                return segment.getAttribute("Name");
            }
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Urn)) return false;
        return value.equals(((Urn) o).value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
