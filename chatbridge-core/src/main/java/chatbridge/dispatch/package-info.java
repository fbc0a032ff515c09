/**
 * Per-channel delivery with conversation coalescing.
 *
 * @see chatbridge.dispatch.NotificationDispatcher
 */
package chatbridge.dispatch;
