/**
 * Subscription lifecycle coordination.
 *
 * @see io.chatsub.coordinator.SubscriptionCoordinator
 * @see io.chatsub.coordinator.SubscriptionContext
 */
package io.chatsub.coordinator;
