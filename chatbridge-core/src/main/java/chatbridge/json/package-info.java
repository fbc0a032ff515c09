/**
 * Jackson codecs for the persisted and wire JSON formats.
 */
package chatbridge.json;
