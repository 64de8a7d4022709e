/**
 * Handler callbacks and the registry that maps event tags to them.
 */
package io.syncevents.handler;
