/**
 * Connection-state owner that serializes coordinator operations on one thread.
 */
package io.chatsub.session;
