/**
 * Rule matching: from a post event to the set of channels to notify.
 */
package chatbridge.match;
