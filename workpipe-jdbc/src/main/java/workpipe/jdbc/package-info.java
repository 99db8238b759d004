/**
 * JDBC persistence for work queues and rate-limit state.
 *
 * <p>{@link workpipe.jdbc.JdbcWorkQueue} stores the backlog in {@code work_item} and claims
 * in {@code work_claim}; dialect-specific SQL lives in {@link workpipe.jdbc.store}.
 * {@link workpipe.jdbc.ratelimit.JdbcRateLimitBackend} shares throttling state between
 * processes. DDL for H2, MySQL and PostgreSQL ships under {@code schema/} on the classpath.
 */
package workpipe.jdbc;
