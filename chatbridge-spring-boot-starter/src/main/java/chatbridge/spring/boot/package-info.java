/**
 * Spring Boot auto-configuration for the chat bridge.
 */
package chatbridge.spring.boot;
