/**
 * Spring Boot auto-configuration for workpipe.
 *
 * <p>Add {@code workpipe-spring-boot-starter} next to a {@link javax.sql.DataSource} to get a
 * {@link workpipe.jdbc.JdbcWorkQueue}, a {@link workpipe.ratelimit.RateLimiter} and, when
 * {@link workpipe.pipeline.PipelineStage} beans exist, a {@link workpipe.pipeline.PipelineRunner}.
 * Settings bind from {@code workpipe.*}; see {@link workpipe.spring.boot.WorkPipeProperties}.
 */
package workpipe.spring.boot;
