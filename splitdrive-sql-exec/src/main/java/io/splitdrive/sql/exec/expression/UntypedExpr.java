package io.splitdrive.sql.exec.expression;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Parsed but not yet bound expression. {@code tree} is the select list entry of DuckDB's
 * {@code json_serialize_sql} output.
 */
public record UntypedExpr(String text, JsonNode tree, String alias) {

    static final String CLASS_FIELD = "class";
    static final String COLUMN_REF_CLASS = "COLUMN_REF";
    static final String COLUMN_NAMES_FIELD = "column_names";

    /**
     * Names of the columns referenced anywhere in the expression, in first-seen order.
     */
    public List<String> references() {
        var result = new LinkedHashSet<String>();
        Deque<JsonNode> stack = new ArrayDeque<>();
        stack.push(tree);
        while (!stack.isEmpty()) {
            var node = stack.pop();
            if (node.isObject() && COLUMN_REF_CLASS.equals(node.path(CLASS_FIELD).asText())) {
                var names = node.path(COLUMN_NAMES_FIELD);
                if (names.size() > 0) {
                    result.add(names.get(names.size() - 1).asText());
                }
                continue;
            }
            var children = new ArrayList<JsonNode>();
            node.elements().forEachRemaining(children::add);
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return List.copyOf(result);
    }

    /**
     * True when the expression is nothing but a column reference.
     */
    public boolean isColumnReference() {
        return COLUMN_REF_CLASS.equals(tree.path(CLASS_FIELD).asText());
    }
}
