/**
 * Service provider interfaces: room lookup and metrics export.
 */
package io.syncevents.spi;
