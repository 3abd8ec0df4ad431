/**
 * Immutable values exchanged with the broker.
 */
package io.queueflow.model;
