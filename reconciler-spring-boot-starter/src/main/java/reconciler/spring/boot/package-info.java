/**
 * Spring Boot auto-configuration for the schedule reconciler, bound from {@code reconciler.*}.
 */
package reconciler.spring.boot;
