/**
 * Spring Boot auto-configuration for chat subscription management.
 *
 * <p>{@link io.chatsub.spring.boot.ChatSubAutoConfiguration} wires a
 * {@link io.chatsub.session.ChatSession} and its
 * {@link io.chatsub.coordinator.SubscriptionCoordinator} from {@code chatsub.*} application
 * properties and the SPI beans the application provides.
 *
 * @see io.chatsub.spring.boot.ChatSubAutoConfiguration
 * @see io.chatsub.spring.boot.ChatSubProperties
 */
package io.chatsub.spring.boot;
