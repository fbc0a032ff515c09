/**
 * In-memory implementations of the persistence SPI.
 */
package chatbridge.store;
