/**
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *     http://www.apache.org/licenses/LICENSE-2.0
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.dbmsampler.mysql.obfuscation;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Default obfuscator: replaces string, numeric and hex literals with {@code ?},
 * strips comments and collapses whitespace.
 *
 * <p>Plans are walked as JSON. Condition strings embedded in the plan are
 * obfuscated like SQL; normalization additionally drops cost and cardinality
 * estimates, which change between executions of the same plan shape.
 */
@ApplicationScoped
public class LiteralSqlObfuscator implements SqlObfuscator {

    private static final Set<String> PLAN_SQL_KEYS = Set.of(
            "attached_condition",
            "index_condition",
            "having_condition",
            "ref",
            "message");

    private static final Set<String> PLAN_VOLATILE_KEYS = Set.of(
            "cost_info",
            "rows_examined_per_scan",
            "rows_produced_per_join",
            "filtered",
            "query_cost",
            "read_cost",
            "eval_cost",
            "prefix_cost",
            "sort_cost",
            "data_read_per_join");

    private final ObjectMapper objectMapper;

    @Inject
    public LiteralSqlObfuscator(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public String obfuscateSql(String sql) {
        if (sql == null) {
            throw new ObfuscationException("Cannot obfuscate null SQL text");
        }
        StringBuilder out = new StringBuilder(sql.length());
        int i = 0;
        int length = sql.length();
        while (i < length) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                i = skipQuoted(sql, i, c);
                out.append('?');
            } else if (c == '`') {
                int end = sql.indexOf('`', i + 1);
                if (end < 0) {
                    throw new ObfuscationException("Unterminated quoted identifier at offset " + i);
                }
                out.append(sql, i, end + 1);
                i = end + 1;
            } else if (c == '-' && startsWith(sql, i, "-- ")) {
                i = skipLineComment(sql, i);
            } else if (c == '#') {
                i = skipLineComment(sql, i);
            } else if (c == '/' && startsWith(sql, i, "/*")) {
                int end = sql.indexOf("*/", i + 2);
                if (end < 0) {
                    throw new ObfuscationException("Unterminated comment at offset " + i);
                }
                i = end + 2;
                appendSpace(out);
            } else if (isHexLiteralStart(sql, i)) {
                i = skipHexLiteral(sql, i);
                out.append('?');
            } else if (Character.isDigit(c) && !isIdentifierPart(sql, i - 1)) {
                i = skipNumber(sql, i);
                out.append('?');
            } else if (Character.isWhitespace(c)) {
                appendSpace(out);
                i++;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString().trim();
    }

    @Override
    public String obfuscateExecPlan(String plan, boolean normalize) {
        if (plan == null) {
            throw new ObfuscationException("Cannot obfuscate null execution plan");
        }
        try {
            JsonNode root = objectMapper.readTree(plan);
            return objectMapper.writeValueAsString(walk(root, normalize));
        } catch (JsonProcessingException e) {
            throw new ObfuscationException("Execution plan is not valid JSON", e);
        }
    }

    private JsonNode walk(JsonNode node, boolean normalize) {
        if (node instanceof ObjectNode object) {
            List<String> toRemove = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                String key = field.getKey();
                JsonNode value = field.getValue();
                if (normalize && PLAN_VOLATILE_KEYS.contains(key)) {
                    toRemove.add(key);
                } else if (PLAN_SQL_KEYS.contains(key) && value.isTextual()) {
                    field.setValue(TextNode.valueOf(obfuscateSql(value.asText())));
                } else if (PLAN_SQL_KEYS.contains(key) && value.isArray()) {
                    ArrayNode array = (ArrayNode) value;
                    for (int i = 0; i < array.size(); i++) {
                        if (array.get(i).isTextual()) {
                            array.set(i, TextNode.valueOf(obfuscateSql(array.get(i).asText())));
                        }
                    }
                } else {
                    walk(value, normalize);
                }
            }
            object.remove(toRemove);
        } else if (node instanceof ArrayNode array) {
            for (JsonNode element : array) {
                walk(element, normalize);
            }
        }
        return node;
    }

    private static int skipQuoted(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            char c = sql.charAt(i);
            if (c == '\\') {
                i += 2;
            } else if (c == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                } else {
                    return i + 1;
                }
            } else {
                i++;
            }
        }
        throw new ObfuscationException("Unterminated string literal at offset " + start);
    }

    private static int skipLineComment(String sql, int start) {
        int end = sql.indexOf('\n', start);
        return end < 0 ? sql.length() : end;
    }

    private static boolean isHexLiteralStart(String sql, int i) {
        if (isIdentifierPart(sql, i - 1)) {
            return false;
        }
        char c = sql.charAt(i);
        if (c == '0' && i + 1 < sql.length() && (sql.charAt(i + 1) == 'x' || sql.charAt(i + 1) == 'X')) {
            return true;
        }
        return (c == 'x' || c == 'X') && i + 1 < sql.length() && sql.charAt(i + 1) == '\'';
    }

    private static int skipHexLiteral(String sql, int start) {
        if (sql.charAt(start) == '0') {
            int i = start + 2;
            while (i < sql.length() && Character.digit(sql.charAt(i), 16) >= 0) {
                i++;
            }
            return i;
        }
        return skipQuoted(sql, start + 1, '\'');
    }

    private static int skipNumber(String sql, int start) {
        int i = start;
        while (i < sql.length() && (Character.isDigit(sql.charAt(i)) || sql.charAt(i) == '.')) {
            i++;
        }
        if (i < sql.length() && (sql.charAt(i) == 'e' || sql.charAt(i) == 'E')) {
            int j = i + 1;
            if (j < sql.length() && (sql.charAt(j) == '+' || sql.charAt(j) == '-')) {
                j++;
            }
            if (j < sql.length() && Character.isDigit(sql.charAt(j))) {
                i = j;
                while (i < sql.length() && Character.isDigit(sql.charAt(i))) {
                    i++;
                }
            }
        }
        return i;
    }

    private static boolean isIdentifierPart(String sql, int i) {
        if (i < 0) {
            return false;
        }
        char c = sql.charAt(i);
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '.';
    }

    private static boolean startsWith(String sql, int i, String prefix) {
        return sql.startsWith(prefix, i);
    }

    private static void appendSpace(StringBuilder out) {
        if (out.length() > 0 && out.charAt(out.length() - 1) != ' ') {
            out.append(' ');
        }
    }
}
