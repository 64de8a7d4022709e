/**
 * Micrometer bridge for {@link io.syncevents.spi.DispatchMetrics}.
 */
package io.syncevents.micrometer;
