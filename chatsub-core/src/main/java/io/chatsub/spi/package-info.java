/**
 * Service Provider Interfaces (SPI) the coordinator consumes.
 *
 * <p>Integrators implement these to plug in the chat service's identifier lookup,
 * subscription transport, token refresh, subscription verification and metrics.
 * Only {@link io.chatsub.spi.AccountCredentials} is required; every other capability
 * is optional and its absence is treated as "feature not enabled".
 *
 * @see io.chatsub.spi.ChannelResolver
 * @see io.chatsub.spi.SubscriptionSubmitter
 * @see io.chatsub.spi.TokenRefresher
 * @see io.chatsub.spi.SubscriptionVerifier
 * @see io.chatsub.spi.AccountCredentials
 * @see io.chatsub.spi.MetricsExporter
 */
package io.chatsub.spi;
