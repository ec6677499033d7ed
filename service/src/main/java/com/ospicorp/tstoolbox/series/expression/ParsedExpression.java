package com.ospicorp.tstoolbox.series.expression;

import java.util.SortedSet;

/**
 * @param columns zero-based positions referenced through numbered placeholders
 * @param implicitColumn whether the bare variable is used
 */
public record ParsedExpression(
    String source,
    Expression root,
    ExpressionShape shape,
    SortedSet<Integer> columns,
    boolean implicitColumn
) {}
