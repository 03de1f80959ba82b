package com.druidio.query;

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable builder for {@link DataSource.Join}. Every setter returns a new builder,
 * so a partially configured builder can be shared and branched.
 */
public final class JoinBuilder {

    private final JoinType joinType;
    private final DataSource left;
    private final DataSource right;
    private final String rightPrefix;
    private final String condition;

    private JoinBuilder(JoinType joinType, DataSource left, DataSource right, String rightPrefix, String condition) {
        this.joinType = joinType;
        this.left = left;
        this.right = right;
        this.rightPrefix = rightPrefix;
        this.condition = condition;
    }

    public static JoinBuilder of(JoinType joinType) {
        return new JoinBuilder(joinType == null ? JoinType.INNER : joinType, null, null, null, null);
    }

    public JoinBuilder left(DataSource left) {
        return new JoinBuilder(joinType, left, right, rightPrefix, condition);
    }

    /**
     * Sets the right hand side together with the prefix its columns are renamed with.
     */
    public JoinBuilder right(DataSource right, String rightPrefix) {
        return new JoinBuilder(joinType, left, right, rightPrefix, condition);
    }

    public JoinBuilder condition(String condition) {
        return new JoinBuilder(joinType, left, right, rightPrefix, condition);
    }

    /**
     * @throws IllegalStateException naming every required field that was never set
     */
    public DataSource.Join build() {
        List<String> missing = new ArrayList<>();
        if (left == null) missing.add("left");
        if (right == null) missing.add("right");
        if (rightPrefix == null) missing.add("rightPrefix");
        if (condition == null) missing.add("condition");
        if (!missing.isEmpty()) {
            throw new IllegalStateException("Join is missing required fields: " + String.join(", ", missing));
        }
        return new DataSource.Join(left, right, rightPrefix, condition, joinType);
    }
}
