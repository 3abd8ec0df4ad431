/**
 * Typed task registry keyed by task id.
 *
 * @see io.queueflow.registry.DefaultTaskRegistry
 */
package io.queueflow.registry;
