package com.druidio.query;

import com.druidio.serialization.NullToEmpty;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Input of a query.
 *
 * {@link QueryDataSource} and {@link Join} make the model recursive: a query can
 * read from another query, and a join reads from two data sources.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
    @JsonSubTypes.Type(value = DataSource.Table.class, name = "table"),
    @JsonSubTypes.Type(value = DataSource.Lookup.class, name = "lookup"),
    @JsonSubTypes.Type(value = DataSource.Union.class, name = "union"),
    @JsonSubTypes.Type(value = DataSource.Inline.class, name = "inline"),
    @JsonSubTypes.Type(value = DataSource.QueryDataSource.class, name = "query"),
    @JsonSubTypes.Type(value = DataSource.Join.class, name = "join")
})
public interface DataSource {

    static DataSource table(String name) {
        return new Table(name);
    }

    static DataSource lookup(String name) {
        return new Lookup(name);
    }

    static DataSource union(String... dataSources) {
        return new Union(Arrays.asList(dataSources));
    }

    static DataSource inline(List<String> columnNames, List<List<String>> rows) {
        return new Inline(columnNames, rows);
    }

    static DataSource query(Query query) {
        return new QueryDataSource(query);
    }

    static JoinBuilder join(JoinType joinType) {
        return JoinBuilder.of(joinType);
    }

    final class Table implements DataSource {
        @JsonProperty("name")
        private final String name;

        @JsonCreator
        public Table(@JsonProperty("name") String name) {
            this.name = Objects.requireNonNull(name, "name");
        }

        public String getName() {
            return name;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Table && name.equals(((Table) o).name);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Table.class, name);
        }

        @Override
        public String toString() {
            return "table:" + name;
        }
    }

    final class Lookup implements DataSource {
        @JsonProperty("lookup")
        private final String lookup;

        @JsonCreator
        public Lookup(@JsonProperty("lookup") String lookup) {
            this.lookup = Objects.requireNonNull(lookup, "lookup");
        }

        public String getLookup() {
            return lookup;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Lookup && lookup.equals(((Lookup) o).lookup);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Lookup.class, lookup);
        }

        @Override
        public String toString() {
            return "lookup:" + lookup;
        }
    }

    final class Union implements DataSource {
        @JsonProperty("dataSources")
        private final List<String> dataSources;

        @JsonCreator
        public Union(@JsonProperty("dataSources") List<String> dataSources) {
            this.dataSources = NullToEmpty.list(dataSources);
        }

        public List<String> getDataSources() {
            return dataSources;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof Union && dataSources.equals(((Union) o).dataSources);
        }

        @Override
        public int hashCode() {
            return Objects.hash(Union.class, dataSources);
        }

        @Override
        public String toString() {
            return "union:" + dataSources;
        }
    }

    /**
     * Rows embedded in the query itself, one list of values per row in {@code columnNames} order.
     */
    final class Inline implements DataSource {
        @JsonProperty("columnNames")
        private final List<String> columnNames;
        @JsonProperty("rows")
        private final List<List<String>> rows;

        @JsonCreator
        public Inline(@JsonProperty("columnNames") List<String> columnNames,
                      @JsonProperty("rows") List<List<String>> rows) {
            this.columnNames = NullToEmpty.list(columnNames);
            this.rows = NullToEmpty.nestedList(rows);
        }

        public List<String> getColumnNames() {
            return columnNames;
        }

        public List<List<String>> getRows() {
            return rows;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Inline that = (Inline) o;
            return columnNames.equals(that.columnNames) && rows.equals(that.rows);
        }

        @Override
        public int hashCode() {
            return Objects.hash(columnNames, rows);
        }

        @Override
        public String toString() {
            return "inline:" + columnNames + "x" + rows.size();
        }
    }

    final class QueryDataSource implements DataSource {
        @JsonProperty("query")
        private final Query query;

        @JsonCreator
        public QueryDataSource(@JsonProperty("query") Query query) {
            this.query = Objects.requireNonNull(query, "query");
        }

        public Query getQuery() {
            return query;
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof QueryDataSource && query.equals(((QueryDataSource) o).query);
        }

        @Override
        public int hashCode() {
            return Objects.hash(QueryDataSource.class, query);
        }

        @Override
        public String toString() {
            return "query:" + query.getClass().getSimpleName();
        }
    }

    /**
     * Join of two data sources.
     *
     * The broker only accepts a lookup, query or inline data source on the right
     * hand side. That is not checked here; callers build joins through
     * {@link JoinBuilder} and are responsible for the right hand side.
     */
    final class Join implements DataSource {
        @JsonProperty("left")
        private final DataSource left;
        @JsonProperty("right")
        private final DataSource right;
        @JsonProperty("rightPrefix")
        private final String rightPrefix;
        @JsonProperty("condition")
        private final String condition;
        @JsonProperty("joinType")
        private final JoinType joinType;

        @JsonCreator
        public Join(@JsonProperty("left") DataSource left,
                    @JsonProperty("right") DataSource right,
                    @JsonProperty("rightPrefix") String rightPrefix,
                    @JsonProperty("condition") String condition,
                    @JsonProperty("joinType") JoinType joinType) {
            this.left = Objects.requireNonNull(left, "left");
            this.right = Objects.requireNonNull(right, "right");
            this.rightPrefix = Objects.requireNonNull(rightPrefix, "rightPrefix");
            this.condition = Objects.requireNonNull(condition, "condition");
            this.joinType = joinType == null ? JoinType.INNER : joinType;
        }

        public DataSource getLeft() {
            return left;
        }

        public DataSource getRight() {
            return right;
        }

        public String getRightPrefix() {
            return rightPrefix;
        }

        public String getCondition() {
            return condition;
        }

        public JoinType getJoinType() {
            return joinType;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            Join that = (Join) o;
            return left.equals(that.left) && right.equals(that.right) && rightPrefix.equals(that.rightPrefix)
                && condition.equals(that.condition) && joinType == that.joinType;
        }

        @Override
        public int hashCode() {
            return Objects.hash(left, right, rightPrefix, condition, joinType);
        }

        @Override
        public String toString() {
            return "join:" + joinType + "(" + left + ", " + right + " as " + rightPrefix + " on " + condition + ")";
        }
    }
}
