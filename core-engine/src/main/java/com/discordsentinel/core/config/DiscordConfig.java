package com.discordsentinel.core.config;

import com.discordsentinel.core.model.DiscordQuery;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The set of discord queries to run against a series.
 *
 * <p>
 * Bound by SnakeYAML from a document of the form:
 * </p>
 *
 * <pre>
 * queries:
 *   - name: sensor_discord
 *     discordLength: 100
 *     wordSize: 4
 *     alphabetSize: 3
 *     mode: heuristic
 *     seed: 42
 * </pre>
 *
 * <p>
 * Query names are keys: {@link #validate()} rejects duplicates and
 * {@link #query(String)} looks a query up by name.
 * </p>
 *
 * @since 1.0.0
 */
public class DiscordConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private List<DiscordQuery> queries = new ArrayList<>();

    /**
     * @return the queries in file order, unmodifiable
     */
    public List<DiscordQuery> getQueries() {
        return Collections.unmodifiableList(queries);
    }

    /**
     * @param queries the queries; {@code null} clears them
     */
    public void setQueries(List<DiscordQuery> queries) {
        this.queries = queries != null ? new ArrayList<>(queries) : new ArrayList<>();
    }

    /**
     * @param name query name
     * @return the query with that name, if any
     */
    public Optional<DiscordQuery> query(String name) {
        Objects.requireNonNull(name, "Query name must not be null");
        return queries.stream()
                .filter(q -> q != null && name.equals(q.getName()))
                .findFirst();
    }

    /**
     * Check every query's parameters and that names are unique.
     *
     * @throws IllegalStateException naming every invalid or repeated query
     */
    public void validate() {
        List<String> problems = new ArrayList<>();
        Set<String> seen = new HashSet<>();

        for (int i = 0; i < queries.size(); i++) {
            DiscordQuery query = queries.get(i);
            if (query == null) {
                problems.add("queries[" + i + "] is empty");
                continue;
            }
            try {
                query.validate();
            } catch (IllegalArgumentException e) {
                problems.add(e.getMessage());
            }
            if (query.getName() != null && !seen.add(query.getName())) {
                problems.add("Duplicate query name: '" + query.getName() + "'");
            }
        }

        if (!problems.isEmpty()) {
            throw new IllegalStateException(problems.size()
                    + " problem(s) in discord configuration:\n  - "
                    + String.join("\n  - ", problems));
        }
    }

    @Override
    public String toString() {
        return "DiscordConfig{queries=" + queries + '}';
    }
}
