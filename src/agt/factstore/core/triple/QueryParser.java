package factstore.core.triple;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the textual query format into triples.
 * <p>
 * A query is a list of clauses separated by {@code " . "}; each clause holds exactly
 * three tokens. A token is either a quoted span ({@code "..."} or {@code '...'}) or a
 * run of non-whitespace characters. A leading {@code ?} marks a variable, e.g.
 * {@code ?a likes ?b . ?b likes cake}.
 */
public final class QueryParser {

    /** Literal separator between the clauses of a conjunctive query */
    public static final String CLAUSE_SEPARATOR = " . ";

    private static final Pattern SEPARATOR = Pattern.compile(Pattern.quote(CLAUSE_SEPARATOR));
    private static final Pattern TOKEN = Pattern.compile("([\"'][^\"']+[\"']|[^\\s\"]+)");

    private QueryParser() {}

    /**
     * Parse a query into its clauses, in input order.
     *
     * @param query Query text
     * @return One triple per clause
     * @throws TripleFormatException if the query is blank or a clause is malformed
     */
    public static List<Triple> parse(String query) {
        Objects.requireNonNull(query, "Query cannot be null");
        if (query.isBlank()) {
            throw new TripleFormatException("Query must be a non-empty string");
        }

        String[] clauses = SEPARATOR.split(query.toLowerCase(Locale.ROOT), -1);
        List<Triple> triples = new ArrayList<>(clauses.length);
        for (String clause : clauses) {
            triples.add(parseClause(clause.trim()));
        }
        return Collections.unmodifiableList(triples);
    }

    /**
     * Parse a single clause of exactly three tokens.
     */
    public static Triple parseClause(String clause) {
        Objects.requireNonNull(clause, "Clause cannot be null");

        List<String> tokens = new ArrayList<>(3);
        Matcher matcher = TOKEN.matcher(clause);
        while (matcher.find()) {
            tokens.add(matcher.group());
        }

        if (tokens.size() != 3) {
            throw new TripleFormatException(
                "Malformed query, expected 3 tokens but found " + tokens.size() + ": '" + clause + "'");
        }
        return new Triple(tokens.get(0), tokens.get(1), tokens.get(2));
    }
}
