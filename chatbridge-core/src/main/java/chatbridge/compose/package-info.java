/**
 * Chat message composition.
 */
package chatbridge.compose;
