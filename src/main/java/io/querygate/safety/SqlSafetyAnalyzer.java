package io.querygate.safety;

import io.querygate.model.SqlVerdict;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Static safety checks over a single SQL statement. Works on the token stream from
 * {@link SqlScanner}; there is no syntax tree, so well-formed input is rewritten faithfully and
 * input that defeats the heuristics is rejected or left unchanged.
 *
 * <p>Checks run in a fixed order and the first blocking one wins: statement count, statement
 * verb, keywords hidden in comments, lexical well-formedness, join depth, subquery depth. An
 * allowed statement may then be rewritten with a row LIMIT and with date filters on partitioned
 * tables.
 */
public final class SqlSafetyAnalyzer {
    static final Set<String> MUTATING_KEYWORDS = Set.of(
            "CREATE", "DROP", "ALTER", "INSERT", "UPDATE", "DELETE", "TRUNCATE", "MERGE", "GRANT", "REVOKE"
    );
    private static final Pattern MUTATING_IN_TEXT = Pattern.compile(
            "\\b(create|drop|alter|insert|update|delete|truncate|merge|grant|revoke)\\b",
            Pattern.CASE_INSENSITIVE
    );
    private static final Set<String> AGGREGATES = Set.of(
            "COUNT", "SUM", "AVG", "MIN", "MAX", "ANY_VALUE", "ARRAY_AGG", "STRING_AGG", "COUNT_IF",
            "APPROX_COUNT_DISTINCT"
    );
    private static final Set<String> SET_OPERATORS = Set.of("UNION", "EXCEPT", "INTERSECT");
    private static final Set<String> WHERE_TERMINATORS = Set.of(
            "GROUP", "HAVING", "QUALIFY", "WINDOW", "ORDER", "LIMIT"
    );
    private static final Set<String> NOT_AN_ALIAS = Set.of(
            "WHERE", "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "OUTER", "CROSS", "NATURAL", "ON", "USING",
            "GROUP", "HAVING", "QUALIFY", "WINDOW", "ORDER", "LIMIT", "UNION", "EXCEPT", "INTERSECT",
            "FOR", "TABLESAMPLE", "UNNEST", "LATERAL", "WITH", "OFFSET", "FETCH"
    );

    private final SafetyRules rules;

    public SqlSafetyAnalyzer(SafetyRules rules) {
        this.rules = rules == null ? SafetyRules.defaults() : rules;
    }

    public SafetyRules rules() {
        return rules;
    }

    public SqlVerdict evaluate(String sql) {
        SqlScanner.Scan scan = SqlScanner.scan(sql);
        String rejection = screen(scan);
        if (rejection == null && scan.hasBackslashInLiteral()) {
            // without backslash escapes the literal may end early and expose the rest as code
            rejection = screen(SqlScanner.scan(sql, false));
        }
        if (rejection != null) {
            return SqlVerdict.reject(rejection);
        }
        List<SqlToken> code = scan.codeTokens();
        int terminator = terminatorIndex(code);
        List<SqlToken> statement = terminator >= 0 ? code.subList(0, terminator) : code;

        if (scan.unterminatedString()) {
            return SqlVerdict.reject("Malformed SQL: unterminated string literal");
        }
        if (scan.unterminatedComment()) {
            return SqlVerdict.reject("Malformed SQL: unterminated comment");
        }
        Structure structure = Structure.build(statement);
        if (structure == null) {
            return SqlVerdict.reject("Malformed SQL: unbalanced parentheses");
        }

        if (structure.maxJoins() > rules.maxJoinDepth()) {
            return SqlVerdict.reject("Join depth exceeds max (" + rules.maxJoinDepth() + ")");
        }
        if (structure.maxSubqueryDepth() > rules.maxSubqueryDepth()) {
            return SqlVerdict.reject("Subquery nesting exceeds max (" + rules.maxSubqueryDepth() + ")");
        }

        List<String> notes = new ArrayList<>();
        List<Insertion> insertions = new ArrayList<>();
        int statementEnd = statement.get(statement.size() - 1).end();

        if (needsLimit(structure)) {
            insertions.add(new Insertion(statementEnd, 1, " LIMIT " + rules.defaultLimit()));
            notes.add("LIMIT auto-added");
        }
        for (String table : addPartitionFilters(structure, insertions)) {
            notes.add("Partition filter auto-added on " + table);
        }

        if (insertions.isEmpty()) {
            return SqlVerdict.allow(List.of(), null);
        }
        // a trailing terminator and anything after it is dropped from the rewrite
        String base = terminator >= 0 ? scan.text().substring(0, statementEnd) : scan.text();
        return SqlVerdict.allow(notes, apply(base, insertions));
    }

    /** Statement count, statement verb and comment checks; returns the first rejection or null. */
    private static String screen(SqlScanner.Scan scan) {
        List<SqlToken> code = scan.codeTokens();
        if (code.isEmpty()) {
            return "Empty SQL";
        }
        int terminator = terminatorIndex(code);
        if (terminator >= 0) {
            if (terminator < code.size() - 1) {
                return "Multiple statements not allowed";
            }
            SqlToken last = scan.tokens().get(scan.tokens().size() - 1);
            if (last.isComment()) {
                return "Multiple statements not allowed";
            }
        }
        List<SqlToken> statement = terminator >= 0 ? code.subList(0, terminator) : code;
        if (statement.isEmpty()) {
            return "Empty SQL";
        }

        if (!startsWithQuery(statement)) {
            return "Only SELECT queries are allowed";
        }
        for (SqlToken token : statement) {
            if (token.kind() == SqlToken.Kind.WORD && MUTATING_KEYWORDS.contains(token.upper())) {
                return "Blocked operation: " + token.upper();
            }
        }

        for (SqlToken comment : scan.comments()) {
            if (MUTATING_IN_TEXT.matcher(comment.text()).find()) {
                return "Dangerous SQL found in comments";
            }
        }
        return null;
    }

    private static int terminatorIndex(List<SqlToken> code) {
        for (int i = 0; i < code.size(); i++) {
            if (code.get(i).isSymbol(';')) {
                return i;
            }
        }
        return -1;
    }

    private static boolean startsWithQuery(List<SqlToken> statement) {
        for (SqlToken token : statement) {
            if (token.isSymbol('(')) {
                continue;
            }
            return token.isWord("SELECT") || token.isWord("WITH");
        }
        return false;
    }

    private static boolean needsLimit(Structure structure) {
        List<SqlToken> direct = structure.directTokens(0);
        boolean inProjection = false;
        boolean seenSelect = false;
        for (int i = 0; i < direct.size(); i++) {
            SqlToken token = direct.get(i);
            if (token.isWord("LIMIT")) {
                return false;
            }
            if (token.isWord("GROUP") && i + 1 < direct.size() && direct.get(i + 1).isWord("BY")) {
                return false;
            }
            if (token.isWord("SELECT") && !seenSelect) {
                seenSelect = true;
                inProjection = true;
                continue;
            }
            if (token.isWord("FROM")) {
                inProjection = false;
            }
            if (inProjection && token.kind() == SqlToken.Kind.WORD && AGGREGATES.contains(token.upper())
                    && i + 1 < direct.size() && direct.get(i + 1).isSymbol('(')) {
                return false;
            }
        }
        return true;
    }

    private List<String> addPartitionFilters(Structure structure, List<Insertion> insertions) {
        List<String> tables = new ArrayList<>();
        for (Structure.Frame scope : structure.scopes()) {
            List<Integer> direct = structure.directIndexes(scope.id());
            for (List<Integer> block : splitOnSetOperators(structure, direct)) {
                Map<String, String> filters = new LinkedHashMap<>();
                for (TableRef ref : tableRefs(structure, block)) {
                    if (!whereMentions(structure, block, ref.column())) {
                        String qualified = ref.alias() == null ? ref.column() : ref.alias() + "." + ref.column();
                        filters.putIfAbsent(qualified, ref.table());
                    }
                }
                if (filters.isEmpty()) {
                    continue;
                }
                StringBuilder predicate = new StringBuilder();
                for (String column : filters.keySet()) {
                    if (predicate.length() > 0) {
                        predicate.append(" AND ");
                    }
                    predicate.append(column)
                            .append(" >= DATE_SUB(CURRENT_DATE(), INTERVAL ")
                            .append(rules.partitionLookbackDays())
                            .append(" DAY)");
                }
                addWhere(structure, block, predicate.toString(), insertions);
                for (String table : filters.values()) {
                    if (!tables.contains(table)) {
                        tables.add(table);
                    }
                }
            }
        }
        return tables;
    }

    private static List<List<Integer>> splitOnSetOperators(Structure structure, List<Integer> direct) {
        List<List<Integer>> blocks = new ArrayList<>();
        List<Integer> current = new ArrayList<>();
        for (Integer index : direct) {
            SqlToken token = structure.token(index);
            if (token.kind() == SqlToken.Kind.WORD && SET_OPERATORS.contains(token.upper())) {
                if (!current.isEmpty()) {
                    blocks.add(current);
                }
                current = new ArrayList<>();
                continue;
            }
            current.add(index);
        }
        if (!current.isEmpty()) {
            blocks.add(current);
        }
        return blocks;
    }

    private List<TableRef> tableRefs(Structure structure, List<Integer> block) {
        List<TableRef> refs = new ArrayList<>();
        for (int b = 0; b < block.size(); b++) {
            SqlToken token = structure.token(block.get(b));
            if (!token.isWord("FROM") && !token.isWord("JOIN")) {
                continue;
            }
            int pos = b + 1;
            while (pos < block.size()) {
                StringBuilder name = new StringBuilder();
                int cursor = pos;
                while (cursor < block.size() && structure.token(block.get(cursor)).isIdentifier()) {
                    name.append(structure.token(block.get(cursor)).identifier());
                    if (cursor + 1 < block.size() && structure.token(block.get(cursor + 1)).isSymbol('.')) {
                        name.append('.');
                        cursor += 2;
                        continue;
                    }
                    cursor++;
                    break;
                }
                if (name.length() == 0) {
                    break;
                }
                String alias = null;
                if (cursor < block.size() && structure.token(block.get(cursor)).isWord("AS")) {
                    cursor++;
                }
                if (cursor < block.size()) {
                    SqlToken candidate = structure.token(block.get(cursor));
                    if (candidate.isIdentifier()
                            && !(candidate.kind() == SqlToken.Kind.WORD && NOT_AN_ALIAS.contains(candidate.upper()))) {
                        alias = candidate.text();
                        cursor++;
                    }
                }
                Map.Entry<String, String> partition = rules.partitionFor(name.toString());
                if (partition != null) {
                    refs.add(new TableRef(partition.getKey(), partition.getValue(), alias));
                }
                if (token.isWord("FROM") && cursor < block.size() && structure.token(block.get(cursor)).isSymbol(',')) {
                    pos = cursor + 1;
                    continue;
                }
                break;
            }
        }
        return refs;
    }

    private static boolean whereMentions(Structure structure, List<Integer> block, String column) {
        int[] clause = whereClause(structure, block);
        if (clause == null) {
            return false;
        }
        String wanted = column.toLowerCase(Locale.ROOT);
        for (int i = clause[0]; i <= clause[1]; i++) {
            SqlToken token = structure.token(i);
            if (!token.isIdentifier()) {
                continue;
            }
            String identifier = token.identifier();
            int dot = identifier.lastIndexOf('.');
            if (identifier.equals(wanted) || (dot >= 0 && identifier.substring(dot + 1).equals(wanted))) {
                return true;
            }
        }
        return false;
    }

    /** Token index range {first, last} of the WHERE condition in a block, or null without WHERE. */
    private static int[] whereClause(Structure structure, List<Integer> block) {
        for (int b = 0; b < block.size(); b++) {
            if (!structure.token(block.get(b)).isWord("WHERE")) {
                continue;
            }
            if (b + 1 >= block.size()) {
                return null;
            }
            int last = block.get(block.size() - 1);
            for (int e = b + 1; e < block.size(); e++) {
                SqlToken token = structure.token(block.get(e));
                if (token.kind() == SqlToken.Kind.WORD && WHERE_TERMINATORS.contains(token.upper())) {
                    last = block.get(e) - 1;
                    break;
                }
            }
            return new int[]{block.get(b + 1), last};
        }
        return null;
    }

    private static void addWhere(Structure structure, List<Integer> block, String predicate, List<Insertion> insertions) {
        int[] clause = whereClause(structure, block);
        if (clause != null) {
            insertions.add(new Insertion(structure.token(clause[0]).start(), 0, "("));
            insertions.add(new Insertion(structure.token(clause[1]).end(), 0, ") AND " + predicate));
            return;
        }
        for (Integer index : block) {
            SqlToken token = structure.token(index);
            if (token.kind() == SqlToken.Kind.WORD && WHERE_TERMINATORS.contains(token.upper())) {
                insertions.add(new Insertion(token.start(), 0, "WHERE " + predicate + " "));
                return;
            }
        }
        int lastIndex = structure.lastIndexOfBlock(block);
        insertions.add(new Insertion(structure.token(lastIndex).end(), 0, " WHERE " + predicate));
    }

    private static String apply(String text, List<Insertion> insertions) {
        List<Insertion> ordered = new ArrayList<>(insertions);
        ordered.sort(Comparator.comparingInt(Insertion::offset).thenComparingInt(Insertion::order));
        StringBuilder out = new StringBuilder(text.length() + 64);
        int cursor = 0;
        for (Insertion insertion : ordered) {
            out.append(text, cursor, insertion.offset());
            out.append(insertion.text());
            cursor = insertion.offset();
        }
        out.append(text.substring(cursor));
        return out.toString();
    }

    private record Insertion(int offset, int order, String text) {
    }

    private record TableRef(String table, String column, String alias) {
    }

    /**
     * Parenthesis structure of one statement. Frame 0 is the statement itself; every parenthesis
     * opens a frame, and frames whose first token is SELECT or WITH are query scopes.
     */
    static final class Structure {
        private final List<SqlToken> tokens;
        private final int[] frameOf;
        private final List<Frame> frames;
        private final int maxSubqueryDepth;

        private Structure(List<SqlToken> tokens, int[] frameOf, List<Frame> frames, int maxSubqueryDepth) {
            this.tokens = tokens;
            this.frameOf = frameOf;
            this.frames = frames;
            this.maxSubqueryDepth = maxSubqueryDepth;
        }

        static Structure build(List<SqlToken> tokens) {
            int[] frameOf = new int[tokens.size()];
            List<Frame> frames = new ArrayList<>();
            frames.add(new Frame(0, -1, tokens.size(), true, 0));
            Deque<Frame> open = new ArrayDeque<>();
            open.push(frames.get(0));
            int maxDepth = 0;
            for (int i = 0; i < tokens.size(); i++) {
                SqlToken token = tokens.get(i);
                Frame current = open.peek();
                frameOf[i] = current.id();
                if (token.isSymbol('(')) {
                    boolean query = i + 1 < tokens.size()
                            && (tokens.get(i + 1).isWord("SELECT") || tokens.get(i + 1).isWord("WITH"));
                    boolean cteBody = query && i > 0 && tokens.get(i - 1).isWord("AS");
                    int nesting = current.nesting() + (query && !cteBody ? 1 : 0);
                    maxDepth = Math.max(maxDepth, nesting);
                    Frame frame = new Frame(frames.size(), i, -1, query, nesting);
                    frames.add(frame);
                    open.push(frame);
                } else if (token.isSymbol(')')) {
                    if (open.size() <= 1) {
                        return null;
                    }
                    Frame closed = open.pop();
                    frames.set(closed.id(), closed.closedAt(i));
                    frameOf[i] = open.peek().id();
                }
            }
            if (open.size() != 1) {
                return null;
            }
            return new Structure(tokens, frameOf, frames, maxDepth);
        }

        SqlToken token(int index) {
            return tokens.get(index);
        }

        List<Frame> scopes() {
            List<Frame> out = new ArrayList<>();
            for (Frame frame : frames) {
                if (frame.query()) {
                    out.add(frame);
                }
            }
            return out;
        }

        List<Integer> directIndexes(int frameId) {
            List<Integer> out = new ArrayList<>();
            for (int i = 0; i < tokens.size(); i++) {
                if (frameOf[i] == frameId && !isFrameBoundary(i, frameId)) {
                    out.add(i);
                }
            }
            return out;
        }

        List<SqlToken> directTokens(int frameId) {
            List<SqlToken> out = new ArrayList<>();
            for (Integer index : directIndexes(frameId)) {
                out.add(tokens.get(index));
            }
            return out;
        }

        /** Last token index that belongs to the block, including tokens nested below it. */
        int lastIndexOfBlock(List<Integer> block) {
            int last = block.get(block.size() - 1);
            int frameId = frameOf[last];
            int limit = frames.get(frameId).closeIndex();
            int end = last;
            for (int i = last + 1; i < limit && i < tokens.size(); i++) {
                if (frameOf[i] == frameId && tokens.get(i).kind() == SqlToken.Kind.WORD
                        && SET_OPERATORS.contains(tokens.get(i).upper())) {
                    break;
                }
                end = i;
            }
            return end;
        }

        int maxJoins() {
            int max = 0;
            for (Frame scope : scopes()) {
                int joins = 0;
                for (SqlToken token : directTokens(scope.id())) {
                    if (token.isWord("JOIN")) {
                        joins++;
                    }
                }
                max = Math.max(max, joins);
            }
            return max;
        }

        int maxSubqueryDepth() {
            return maxSubqueryDepth;
        }

        private boolean isFrameBoundary(int index, int frameId) {
            Frame frame = frames.get(frameId);
            return index == frame.openIndex() || index == frame.closeIndex();
        }

        record Frame(int id, int openIndex, int closeIndex, boolean query, int nesting) {
            Frame closedAt(int index) {
                return new Frame(id, openIndex, index, query, nesting);
            }
        }
    }
}
