/**
 * Forum-to-chat notification bridge.
 *
 * <p>{@link chatbridge.ChatBridge} is the entry point. Collaborators supplied by the
 * host forum and the chat transport are defined in {@link chatbridge.spi}.
 */
package chatbridge;
