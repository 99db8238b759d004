/**
 * Database-backed rate-limit state shared by every worker process.
 */
package workpipe.jdbc.ratelimit;
