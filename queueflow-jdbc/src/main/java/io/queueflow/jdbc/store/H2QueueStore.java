package io.queueflow.jdbc.store;

import java.util.List;

/**
 * H2 queue store. Uses the default UPDATE-subquery-then-SELECT claim strategy.
 */
public final class H2QueueStore extends AbstractJdbcQueueStore {

    public H2QueueStore() {
        super();
    }

    public H2QueueStore(String tablePrefix) {
        super(tablePrefix);
    }

    @Override
    public AbstractJdbcQueueStore withTablePrefix(String tablePrefix) {
        return new H2QueueStore(tablePrefix);
    }

    @Override
    public String name() {
        return "h2";
    }

    @Override
    public List<String> jdbcUrlPrefixes() {
        return List.of("jdbc:h2:");
    }
}
