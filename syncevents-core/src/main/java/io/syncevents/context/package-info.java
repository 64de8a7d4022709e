/**
 * Handler contexts and the shapes that select them.
 */
package io.syncevents.context;
