/**
 * Room handles and the default in-memory room directory.
 */
package io.syncevents.room;
