package com.druidio.query.definitions;

import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;
import java.util.Objects;

/**
 * Match rule of a search query or a search filter.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = SearchQuerySpec.InsensitiveContains.class, name = "insensitive_contains"),
    @JsonSubTypes.Type(value = SearchQuerySpec.Contains.class, name = "contains"),
    @JsonSubTypes.Type(value = SearchQuerySpec.Fragment.class, name = "fragment"),
    @JsonSubTypes.Type(value = SearchQuerySpec.Regex.class, name = "regex")
})
public interface SearchQuerySpec {

    static SearchQuerySpec insensitiveContains(String value) {
        return new InsensitiveContains(value);
    }

    static SearchQuerySpec contains(String value, boolean caseSensitive) {
        return new Contains(value, caseSensitive);
    }

    static SearchQuerySpec fragment(List<String> values, boolean caseSensitive) {
        return new Fragment(values, caseSensitive);
    }

    static SearchQuerySpec regex(String pattern) {
        return new Regex(pattern);
    }

    final class InsensitiveContains implements SearchQuerySpec {
        @JsonProperty("value")
        private final String value;

        @JsonCreator
        public InsensitiveContains(@JsonProperty("value") String value) {
            this.value = Objects.requireNonNull(value, "value");
        }

        public String getValue() {
            return value;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof InsensitiveContains && value.equals(((InsensitiveContains) o).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }
    }

    final class Contains implements SearchQuerySpec {
        @JsonProperty("value")
        private final String value;
        @JsonProperty("caseSensitive")
        private final boolean caseSensitive;

        @JsonCreator
        public Contains(@JsonProperty("value") String value,
                        @JsonProperty("caseSensitive") boolean caseSensitive) {
            this.value = Objects.requireNonNull(value, "value");
            this.caseSensitive = caseSensitive;
        }

        public String getValue() {
            return value;
        }

        public boolean isCaseSensitive() {
            return caseSensitive;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Contains that = (Contains) o;
            return caseSensitive == that.caseSensitive && value.equals(that.value);
        }

        @Override
        public int hashCode() {
            return Objects.hash(value, caseSensitive);
        }
    }

    /**
     * Matches when every fragment is contained in the value.
     */
    final class Fragment implements SearchQuerySpec {
        @JsonProperty("values")
        private final List<String> values;
        @JsonProperty("caseSensitive")
        private final boolean caseSensitive;

        @JsonCreator
        public Fragment(@JsonProperty("values") List<String> values,
                        @JsonProperty("caseSensitive") boolean caseSensitive) {
            this.values = NullToEmpty.list(values);
            this.caseSensitive = caseSensitive;
        }

        public List<String> getValues() {
            return values;
        }

        public boolean isCaseSensitive() {
            return caseSensitive;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Fragment that = (Fragment) o;
            return caseSensitive == that.caseSensitive && values.equals(that.values);
        }

        @Override
        public int hashCode() {
            return Objects.hash(values, caseSensitive);
        }
    }

    final class Regex implements SearchQuerySpec {
        @JsonProperty("pattern")
        private final String pattern;

        @JsonCreator
        public Regex(@JsonProperty("pattern") String pattern) {
            this.pattern = Objects.requireNonNull(pattern, "pattern");
        }

        public String getPattern() {
            return pattern;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Regex && pattern.equals(((Regex) o).pattern);
        }

        @Override
        public int hashCode() {
            return pattern.hashCode();
        }
    }
}
