/**
 * Root API for chatsub: subscription lifecycle management for one chat account.
 *
 * <h2>Core Design</h2>
 * <p>A backend joins chat channels by resolving each channel name to an identifier and
 * asking the chat service to deliver that channel's messages. Both calls may fail
 * transiently. The {@linkplain io.chatsub.coordinator.SubscriptionCoordinator coordinator}
 * subscribes the primary channel on startup, joins and leaves channels on demand, and after
 * a reconnect resubscribes every {@linkplain io.chatsub.ChannelSet joined channel} through
 * the {@linkplain io.chatsub.retry.RetryEngine retry engine}, tolerating per-channel failures.
 *
 * <p>Channels are {@linkplain io.chatsub.Channel normalized} (leading {@code #} stripped,
 * lowercased) before storage or comparison.
 *
 * <h2>Module Layout</h2>
 * <ul>
 *   <li><b>chatsub-core</b>: model, retry engine, coordinator, session, SPI (zero external deps)</li>
 *   <li><b>chatsub-micrometer</b>: optional {@linkplain io.chatsub.micrometer Micrometer metrics
 *       bridge}</li>
 *   <li><b>chatsub-spring-boot-starter</b>: Spring Boot
 *       {@linkplain io.chatsub.spring.boot auto-configuration}</li>
 * </ul>
 *
 * <h2>Quick Start</h2>
 * <pre>{@code
 * var context = SubscriptionContext.builder()
 *     .credentials(AccountCredentials.of(token, clientId, userId, "mybot"))
 *     .primaryChannel("#mychannel")
 *     .resolver(helixResolver)
 *     .submitter(eventSubSubmitter)
 *     .build();
 *
 * try (ChatSession session = ChatSession.builder()
 *     .coordinator(new SubscriptionCoordinator(context))
 *     .build()) {
 *     session.markConnected();
 *     session.start(helixResolver.resolve(List.of("mychannel"), token, clientId)).join();
 *     session.join("otherchannel").join();
 * }
 * }</pre>
 *
 * @see io.chatsub.Channel
 * @see io.chatsub.ChannelSet
 * @see io.chatsub.ConnectionState
 * @see io.chatsub.SubscriptionOutcome
 */
package io.chatsub;
