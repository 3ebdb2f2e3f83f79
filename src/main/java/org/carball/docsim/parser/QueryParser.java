package org.carball.docsim.parser;

import lombok.extern.slf4j.Slf4j;
import org.carball.docsim.model.query.FilterPredicate;
import org.carball.docsim.model.query.JoinPredicate;
import org.carball.docsim.model.query.ParsedQuery;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Recursive-descent parser for the query subset the simulator plans:
 * <pre>
 * SELECT fields FROM coll [alias]
 *   [JOIN coll [alias] ON a.f = b.g]
 *   [WHERE field = literal (AND field = literal)*]
 *   [GROUP BY fields]
 * </pre>
 * Only equality predicates are accepted. Nothing beyond this grammar is.
 */
@Slf4j
public final class QueryParser {

    private static final Set<String> RESERVED = Set.of(
            "SELECT", "FROM", "JOIN", "ON", "WHERE", "AND", "GROUP", "BY", "AS"
    );

    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.\\d*|\\.\\d+|\\d+)([eE][-+]?\\d+)?");

    private final String sql;
    private final List<Token> tokens;
    private int position;

    private QueryParser(String sql) {
        this.sql = sql;
        this.tokens = QueryLexer.tokenize(sql);
        this.position = 0;
    }

    public static ParsedQuery parse(String sql) {
        if (sql == null || sql.isBlank()) {
            throw new QueryParseException("Unsupported query: empty text");
        }
        ParsedQuery parsed = new QueryParser(sql).parseQuery();
        log.debug("Parsed query '{}' -> {}", sql, parsed);
        return parsed;
    }

    private ParsedQuery parseQuery() {
        if (!peek().isKeyword("SELECT")) {
            throw error("expected SELECT ... FROM ...");
        }
        position++;
        List<SelectItem> select = parseSelectList();
        expectKeyword("FROM");
        Source from = parseSource();

        Source joined = null;
        FieldRef joinLeft = null;
        FieldRef joinRight = null;
        if (acceptKeyword("JOIN")) {
            joined = parseSource();
            expectKeyword("ON");
            joinLeft = parseFieldRef();
            expect(TokenType.EQUALS);
            joinRight = parseFieldRef();
        }

        List<Condition> conditions = new ArrayList<>();
        if (acceptKeyword("WHERE")) {
            do {
                conditions.add(parseCondition());
            } while (acceptKeyword("AND"));
        }

        List<FieldRef> groupBy = new ArrayList<>();
        if (acceptKeyword("GROUP")) {
            expectKeyword("BY");
            do {
                groupBy.add(parseFieldRef());
            } while (accept(TokenType.COMMA));
        }

        accept(TokenType.SEMICOLON);
        if (peek().type() != TokenType.EOF) {
            throw error("unexpected " + peek());
        }

        if (joined != null && !groupBy.isEmpty()) {
            throw new UnsupportedQueryException("GROUP BY cannot be combined with JOIN: " + sql);
        }

        Map<String, String> aliases = buildAliases(from, joined);
        JoinPredicate join = joined == null ? null : resolveJoin(joinLeft, joinRight, from, joined, aliases);

        List<String> selectFields = new ArrayList<>();
        for (SelectItem item : select) {
            selectFields.add(item.ref() == null ? item.label() : normalize(item.ref(), aliases));
        }

        List<FilterPredicate> filters = new ArrayList<>();
        for (Condition condition : conditions) {
            ResolvedField field = resolve(condition.ref(), aliases);
            filters.add(new FilterPredicate(field.collection(), field.path(), condition.value()));
        }

        List<String> groupingKeys = new ArrayList<>();
        for (FieldRef ref : groupBy) {
            groupingKeys.add(normalize(ref, aliases));
        }

        return new ParsedQuery(selectFields, aliases, join, filters, groupingKeys);
    }

    // Grammar productions

    private List<SelectItem> parseSelectList() {
        if (accept(TokenType.STAR)) {
            return List.of();
        }
        List<SelectItem> items = new ArrayList<>();
        do {
            items.add(parseSelectItem());
        } while (accept(TokenType.COMMA));
        return items;
    }

    private SelectItem parseSelectItem() {
        if (peek().isIdentifier() && peekAhead(1).type() == TokenType.LEFT_PAREN) {
            Token function = next();
            expect(TokenType.LEFT_PAREN);
            String argument = accept(TokenType.STAR) ? "*" : parseFieldRef().path();
            expect(TokenType.RIGHT_PAREN);
            String label = function.text() + "(" + argument + ")";
            if (acceptKeyword("AS")) {
                label = expectIdentifier().text();
            }
            return new SelectItem(null, label);
        }
        return new SelectItem(parseFieldRef(), null);
    }

    private Source parseSource() {
        Token collection = expectName();
        String alias = null;
        if (peek().isIdentifier() && !isReserved(peek())) {
            alias = next().text();
        }
        return new Source(collection.text(), alias);
    }

    private Condition parseCondition() {
        FieldRef ref = parseFieldRef();
        expect(TokenType.EQUALS);
        return new Condition(ref, parseLiteral());
    }

    private FieldRef parseFieldRef() {
        List<String> segments = new ArrayList<>();
        segments.add(expectIdentifier().text());
        while (accept(TokenType.DOT)) {
            segments.add(expectIdentifier().text());
        }
        return new FieldRef(segments);
    }

    /**
     * A quoted string, or the raw text up to the next AND / GROUP / end,
     * typed as integer, then decimal, then left as-is.
     */
    private Object parseLiteral() {
        if (peek().type() == TokenType.STRING) {
            return next().text();
        }
        Token first = peek();
        Token last = null;
        while (!atLiteralEnd()) {
            last = next();
        }
        if (last == null) {
            throw error("expected a literal value but found " + first);
        }
        String raw = sql.substring(first.start(), last.end()).trim();
        if (INTEGER.matcher(raw).matches()) {
            try {
                return Long.parseLong(raw);
            } catch (NumberFormatException e) {
                log.debug("Integer literal {} out of range, reading it as a decimal", raw);
            }
        }
        if (DECIMAL.matcher(raw).matches()) {
            return Double.parseDouble(raw);
        }
        return raw;
    }

    private boolean atLiteralEnd() {
        Token token = peek();
        return token.type() == TokenType.EOF
                || token.type() == TokenType.SEMICOLON
                || token.isKeyword("AND")
                || token.isKeyword("GROUP");
    }

    // Name resolution

    private Map<String, String> buildAliases(Source from, Source joined) {
        Map<String, String> aliases = new LinkedHashMap<>();
        aliases.put("", from.collection());
        aliases.put(from.collection(), from.collection());
        if (from.alias() != null) {
            aliases.put(from.alias(), from.collection());
        }
        if (joined != null) {
            if (joined.collection().equals(from.collection())) {
                throw new UnsupportedQueryException("Self joins are not supported: " + sql);
            }
            aliases.put(joined.collection(), joined.collection());
            if (joined.alias() != null) {
                aliases.put(joined.alias(), joined.collection());
            }
        }
        return aliases;
    }

    private JoinPredicate resolveJoin(FieldRef first, FieldRef second, Source from, Source joined,
                                      Map<String, String> aliases) {
        ResolvedField a = resolveQualified(first, aliases);
        ResolvedField b = resolveQualified(second, aliases);

        if (a.collection().equals(from.collection()) && b.collection().equals(joined.collection())) {
            return new JoinPredicate(a.collection(), a.path(), b.collection(), b.path());
        }
        if (a.collection().equals(joined.collection()) && b.collection().equals(from.collection())) {
            return new JoinPredicate(b.collection(), b.path(), a.collection(), a.path());
        }
        throw new QueryParseException("Join condition must compare " + from.collection()
                + " with " + joined.collection() + ": " + sql);
    }

    private ResolvedField resolveQualified(FieldRef ref, Map<String, String> aliases) {
        if (ref.segments().size() < 2 || !aliases.containsKey(ref.first())) {
            throw new QueryParseException("Join field '" + ref.path() + "' must be qualified by a collection or alias: " + sql);
        }
        return new ResolvedField(aliases.get(ref.first()), ref.rest());
    }

    /**
     * A reference whose first segment names a known alias or collection is
     * qualified; anything else is a path on the FROM collection.
     */
    private static ResolvedField resolve(FieldRef ref, Map<String, String> aliases) {
        if (ref.segments().size() > 1 && aliases.containsKey(ref.first())) {
            return new ResolvedField(aliases.get(ref.first()), ref.rest());
        }
        return new ResolvedField(aliases.get(""), ref.path());
    }

    private static String normalize(FieldRef ref, Map<String, String> aliases) {
        if (ref.segments().size() > 1 && aliases.containsKey(ref.first())) {
            return aliases.get(ref.first()) + "." + ref.rest();
        }
        return ref.path();
    }

    // Token helpers

    private Token peek() {
        return tokens.get(position);
    }

    private Token peekAhead(int offset) {
        return tokens.get(Math.min(position + offset, tokens.size() - 1));
    }

    private Token next() {
        Token token = tokens.get(position);
        if (token.type() != TokenType.EOF) {
            position++;
        }
        return token;
    }

    private boolean accept(TokenType type) {
        if (peek().type() == type) {
            position++;
            return true;
        }
        return false;
    }

    private boolean acceptKeyword(String keyword) {
        if (peek().isKeyword(keyword)) {
            position++;
            return true;
        }
        return false;
    }

    private void expect(TokenType type) {
        if (!accept(type)) {
            throw error("expected " + type + " but found " + peek());
        }
    }

    private void expectKeyword(String keyword) {
        if (!acceptKeyword(keyword)) {
            throw error("expected " + keyword + " but found " + peek());
        }
    }

    private Token expectIdentifier() {
        if (!peek().isIdentifier()) {
            throw error("expected an identifier but found " + peek());
        }
        return next();
    }

    private Token expectName() {
        Token token = expectIdentifier();
        if (isReserved(token)) {
            throw error("expected a collection name but found keyword " + token);
        }
        return token;
    }

    private static boolean isReserved(Token token) {
        return RESERVED.contains(token.text().toUpperCase());
    }

    private QueryParseException error(String detail) {
        return new QueryParseException("Unsupported query (" + detail + " at position "
                + peek().start() + "): " + sql);
    }

    private record Source(String collection, String alias) {}

    private record SelectItem(FieldRef ref, String label) {}

    private record Condition(FieldRef ref, Object value) {}

    private record ResolvedField(String collection, String path) {}

    private record FieldRef(List<String> segments) {

        String first() {
            return segments.get(0);
        }

        String rest() {
            return String.join(".", segments.subList(1, segments.size()));
        }

        String path() {
            return String.join(".", segments);
        }
    }
}
