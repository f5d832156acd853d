/**
 * Subscription bookkeeping and batch registration.
 *
 * @see io.castbus.registry.SubscriptionRegistry
 * @see io.castbus.registry.EventHandlers
 */
package io.castbus.registry;
