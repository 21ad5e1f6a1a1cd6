/**
 * Spring Boot auto-configuration: JDBC stores, rate limiter, scheduler, delivery worker
 * and optional trigger, bound to {@code dailymsg.*} properties.
 */
package dailymsg.spring.boot;
