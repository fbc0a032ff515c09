/**
 * Value types shared by the rule engine, matcher, composer and dispatcher.
 *
 * <p>All types are immutable. Collections passed to constructors are copied.
 */
package chatbridge.model;
