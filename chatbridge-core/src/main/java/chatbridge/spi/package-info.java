/**
 * Service provider interfaces: persistence, outbound delivery, and the host
 * collaborators (tags, categories, visibility, excerpts).
 */
package chatbridge.spi;
