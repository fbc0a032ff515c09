/**
 * Slack transports for the bridge: {@link chatbridge.slack.SlackApiDelivery} (bot token,
 * supports edits) and {@link chatbridge.slack.SlackWebhookDelivery} (incoming webhook,
 * post only).
 */
package chatbridge.slack;
