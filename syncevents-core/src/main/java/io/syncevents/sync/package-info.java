/**
 * Immutable model of one sync round and the reader that builds it from a
 * response body.
 */
package io.syncevents.sync;
